package ca.gc.cra.funnel.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class FileModeTest {

  @Test
  void parsesAliases() {
    assertEquals(FileMode.APPEND, FileMode.fromString(null));
    assertEquals(FileMode.APPEND, FileMode.fromString("a"));
    assertEquals(FileMode.TRUNCATE, FileMode.fromString(" Overwrite "));
    assertEquals(FileMode.TRUNCATE, FileMode.fromString("w"));
  }

  @Test
  void rejectsUnknownMode() {
    assertThrows(IllegalArgumentException.class, () -> FileMode.fromString("rotate"));
  }
}
