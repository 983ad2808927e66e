package ca.gc.cra.funnel.config;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads FUNNEL settings from a YAML document and flattens one section, layered over {@code common}, into
 * dotted keys.
 *
 * <pre>
 * common:
 *   drain.grace.ms: 500
 * aggregator:
 *   channel:
 *     capacity: 4096
 * sink:
 *   file: build/app.log
 *   level: DEBUG
 * </pre>
 *
 * <p>Loading section {@code aggregator} from the document above yields
 * {@code {drain.grace.ms=500, channel.capacity=4096}}.</p>
 */
public final class YamlConfigLoader {
  public static final String COMMON_SECTION = "common";
  public static final String AGGREGATOR_SECTION = "aggregator";
  public static final String SINK_SECTION = "sink";

  private YamlConfigLoader() {}

  /**
   * Loads {@code section} from the YAML file at {@code path}.
   *
   * @param path YAML file
   * @param section section name, matched case-insensitively
   * @return flattened keys, or empty when the file does not exist
   * @throws IOException when the file exists but cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or uses unsupported structures
   */
  public static Optional<Map<String, String>> load(Path path, String section) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(section, "section");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, section, path.toString()));
    }
  }

  /**
   * Parses {@code section} from in-memory YAML text.
   *
   * @param yaml YAML document
   * @param section section name
   * @return flattened keys; empty for an empty document
   * @throws IllegalArgumentException when the YAML is malformed or uses unsupported structures
   */
  public static Map<String, String> parse(String yaml, String section) {
    Objects.requireNonNull(yaml, "yaml");
    return parse(new StringReader(yaml), Objects.requireNonNull(section, "section"), "<inline>");
  }

  private static Map<String, String> parse(Reader reader, String section, String source) {
    String wanted = section.trim().toLowerCase(Locale.ROOT);
    Object document;
    try {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + source, ex);
    }
    if (document == null) {
      return Map.of();
    }
    Map<String, Object> root = asMap(document, "root");
    Map<String, String> flattened = new LinkedHashMap<>();
    Object common = findSection(root, COMMON_SECTION);
    if (common != null) {
      flatten(asMap(common, COMMON_SECTION), "", flattened);
    }
    if (!COMMON_SECTION.equals(wanted)) {
      Object requested = findSection(root, wanted);
      if (requested != null) {
        flatten(asMap(requested, wanted), "", flattened);
      }
    }
    return Map.copyOf(flattened);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key " + entry.getKey());
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String name) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey().trim();
      if (key.isEmpty()) {
        throw new IllegalArgumentException("YAML contains a blank key under '" + prefix + "'");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported for key " + composite);
      } else {
        target.put(composite, value == null ? "" : value.toString());
      }
    }
  }
}
