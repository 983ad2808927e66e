package ca.gc.cra.funnel.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.funnel.logging.FileMode;
import ch.qos.logback.classic.Level;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SinkOptionsTest {
  @TempDir Path tempDir;

  @Test
  void defaultsWriteToConsoleAtInfo() {
    SinkOptions options = SinkOptions.defaults();

    assertNull(options.file());
    assertEquals(FileMode.APPEND, options.mode());
    assertEquals(Level.INFO, options.level());
    assertEquals("FUNNEL", options.name());
    assertTrue(options.effectiveConsole());
  }

  @Test
  void fileAloneTurnsConsoleOff() {
    SinkOptions options = SinkOptions.toFile(Path.of("build.log"));

    assertFalse(options.effectiveConsole());
    assertTrue(options.withConsole(true).effectiveConsole());
  }

  @Test
  void noDestinationFailsValidation() {
    SinkOptions options = SinkOptions.defaults().withConsole(false);

    assertThrows(InvalidConfigurationException.class, options::validate);
  }

  @Test
  void validateReturnsTheSameOptions() {
    SinkOptions options = SinkOptions.defaults();

    assertSame(options, options.validate());
  }

  @Test
  void fromMapParsesSinkSection() {
    SinkOptions options = SinkOptions.fromMap(Map.of(
        "file", "out/run.log",
        "mode", "w",
        "level", "debug",
        "console", "yes",
        "name", "runner"));

    assertEquals(Path.of("out/run.log"), options.file());
    assertEquals(FileMode.TRUNCATE, options.mode());
    assertEquals(Level.DEBUG, options.level());
    assertTrue(options.effectiveConsole());
    assertEquals("runner", options.name());
  }

  @Test
  void fromMapRejectsUnknownValues() {
    assertThrows(InvalidConfigurationException.class, () -> SinkOptions.fromMap(Map.of("level", "LOUD")));
    assertThrows(InvalidConfigurationException.class, () -> SinkOptions.fromMap(Map.of("mode", "rotate")));
    assertThrows(InvalidConfigurationException.class, () -> SinkOptions.fromMap(Map.of("console", "sometimes")));
  }

  @Test
  void blankNameIsRejected() {
    assertThrows(InvalidConfigurationException.class, () -> SinkOptions.defaults().withName("  "));
  }

  @Test
  void loadReadsTheSinkSection() throws IOException {
    Path yaml = tempDir.resolve("funnel.yaml");
    Files.writeString(yaml, """
        aggregator:
          channel:
            capacity: 512
        sink:
          file: build.log
          mode: truncate
          level: debug
          name: BUILD
        """);

    SinkOptions options = SinkOptions.load(yaml);

    assertEquals(Path.of("build.log"), options.file());
    assertEquals(FileMode.TRUNCATE, options.mode());
    assertEquals(Level.DEBUG, options.level());
    assertEquals("BUILD", options.name());
    assertFalse(options.effectiveConsole());
  }

  @Test
  void loadedSectionWithoutDestinationFailsValidation() throws IOException {
    Path yaml = tempDir.resolve("funnel.yaml");
    Files.writeString(yaml, """
        sink:
          console: false
        """);

    SinkOptions options = SinkOptions.load(yaml);

    assertEquals(Boolean.FALSE, options.console());
    assertThrows(InvalidConfigurationException.class, options::validate);
  }

  @Test
  void missingFileLoadsDefaults() throws IOException {
    assertEquals(SinkOptions.defaults(), SinkOptions.load(tempDir.resolve("absent.yaml")));
  }

  @Test
  void unparsableLoadedValueIsReported() throws IOException {
    Path yaml = tempDir.resolve("funnel.yaml");
    Files.writeString(yaml, """
        sink:
          level: chatty
        """);

    assertThrows(InvalidConfigurationException.class, () -> SinkOptions.load(yaml));
  }
}
