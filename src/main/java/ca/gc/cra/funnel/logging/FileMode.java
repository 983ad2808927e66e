package ca.gc.cra.funnel.logging;

import java.util.Locale;

/**
 * How a file sink treats an existing log file.
 *
 * @since FUNNEL 0.1
 */
public enum FileMode {
  /** Keep existing content and write after it. */
  APPEND,
  /** Discard existing content when the sink opens the file. */
  TRUNCATE;

  /**
   * Parses a mode name; accepts {@code append}/{@code a} and {@code truncate}/{@code overwrite}/{@code w}.
   *
   * @param raw mode text; {@code null} or blank yields {@link #APPEND}
   * @return parsed mode
   * @throws IllegalArgumentException when the text names no mode
   */
  public static FileMode fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return APPEND;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "append", "a" -> APPEND;
      case "truncate", "overwrite", "w" -> TRUNCATE;
      default -> throw new IllegalArgumentException("Unknown file mode: " + raw);
    };
  }
}
