package ca.gc.cra.funnel.config;

import ca.gc.cra.funnel.logging.FileMode;
import ch.qos.logback.classic.Level;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Destinations and level for a sink built by {@code Aggregator.forDestinations}.
 * <p><strong>Console rule:</strong> when {@code console} is left unset the sink writes to the console only if no
 * file is given; with a file, console output must be requested explicitly.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param file optional log file; {@code null} for none
 * @param mode how an existing file is treated; {@code null} defaults to {@link FileMode#APPEND}
 * @param level sink level; {@code null} defaults to {@code INFO}
 * @param console explicit console flag, or {@code null} to apply the console rule
 * @param name sink logger name; {@code null} defaults to {@value #DEFAULT_NAME}
 * @since FUNNEL 0.1
 */
public record SinkOptions(Path file, FileMode mode, Level level, Boolean console, String name) {
  public static final String DEFAULT_NAME = "FUNNEL";

  public SinkOptions {
    mode = Objects.requireNonNullElse(mode, FileMode.APPEND);
    level = Objects.requireNonNullElse(level, Level.INFO);
    name = name == null ? DEFAULT_NAME : name.trim();
    if (name.isEmpty()) {
      throw new InvalidConfigurationException("Sink name must not be blank");
    }
  }

  /**
   * Returns options with every field at its default: console only, {@code INFO}, named {@value #DEFAULT_NAME}.
   *
   * @return default options
   */
  public static SinkOptions defaults() {
    return new SinkOptions(null, null, null, null, null);
  }

  /**
   * Returns options writing to {@code file} only.
   *
   * @param file log file
   * @return options
   */
  public static SinkOptions toFile(Path file) {
    return defaults().withFile(Objects.requireNonNull(file, "file"));
  }

  /**
   * Loads the {@code sink} section of a YAML file.
   *
   * @param yaml YAML file; a missing file yields {@link #defaults()}
   * @return options; not yet checked by {@link #validate()}
   * @throws IOException when the file exists but cannot be read
   * @throws InvalidConfigurationException when a value cannot be parsed
   */
  public static SinkOptions load(Path yaml) throws IOException {
    return fromMap(YamlConfigLoader.load(yaml, YamlConfigLoader.SINK_SECTION).orElse(Map.of()));
  }

  /**
   * Reads options from flat keys {@code file}, {@code mode}, {@code level}, {@code console} and {@code name}
   * (YAML section {@code sink}).
   *
   * @param values flat configuration map
   * @return options; not yet checked by {@link #validate()}
   * @throws InvalidConfigurationException when a value cannot be parsed
   */
  public static SinkOptions fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    Path file = null;
    String rawFile = values.get("file");
    if (rawFile != null && !rawFile.isBlank()) {
      try {
        file = Path.of(rawFile.trim());
      } catch (InvalidPathException ex) {
        throw new InvalidConfigurationException("Invalid sink file: " + rawFile, ex);
      }
    }
    FileMode mode;
    try {
      mode = FileMode.fromString(values.get("mode"));
    } catch (IllegalArgumentException ex) {
      throw new InvalidConfigurationException(ex.getMessage(), ex);
    }
    Level level = parseLevel(values.get("level"));
    Boolean console = parseConsole(values.get("console"));
    String name = values.get("name");
    return new SinkOptions(file, mode, level, console, name == null || name.isBlank() ? null : name);
  }

  public SinkOptions withFile(Path newFile) {
    return new SinkOptions(newFile, mode, level, console, name);
  }

  public SinkOptions withMode(FileMode newMode) {
    return new SinkOptions(file, newMode, level, console, name);
  }

  public SinkOptions withLevel(Level newLevel) {
    return new SinkOptions(file, mode, newLevel, console, name);
  }

  public SinkOptions withConsole(Boolean newConsole) {
    return new SinkOptions(file, mode, level, newConsole, name);
  }

  public SinkOptions withName(String newName) {
    return new SinkOptions(file, mode, level, console, newName);
  }

  /**
   * Resolves the console flag, applying the console rule when it was left unset.
   *
   * @return {@code true} when the sink writes to the console
   */
  public boolean effectiveConsole() {
    return console == null ? file == null : console;
  }

  /**
   * Checks that the options name at least one destination.
   *
   * @return these options
   * @throws InvalidConfigurationException when there is no file and console output is disabled
   */
  public SinkOptions validate() {
    if (file == null && !effectiveConsole()) {
      throw new InvalidConfigurationException(
          "Sink '" + name + "' has no destination: give a file or enable console output");
    }
    return this;
  }

  private static Level parseLevel(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    Level parsed = Level.toLevel(raw.trim(), null);
    if (parsed == null) {
      throw new InvalidConfigurationException("Unknown sink level: " + raw);
    }
    return parsed;
  }

  private static Boolean parseConsole(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on" -> Boolean.TRUE;
      case "false", "no", "off" -> Boolean.FALSE;
      default -> throw new InvalidConfigurationException("console must be true or false (was " + raw + ")");
    };
  }
}
