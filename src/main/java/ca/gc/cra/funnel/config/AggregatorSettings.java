package ca.gc.cra.funnel.config;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * <strong>What:</strong> Tuning knobs shared by every aggregation session.
 * <p><strong>Why:</strong> Channel capacity and bridge drain time trade memory and shutdown latency against
 * dropped records; operators adjust them without code changes.</p>
 * <p><strong>Role:</strong> Immutable configuration aggregate consumed by {@code Aggregator} and the worker
 * bootstrap.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * <p>Keys (YAML section {@code aggregator}, or system properties with a {@code funnel.} prefix):</p>
 * <ul>
 *   <li>{@code channel.capacity}: undelivered records a session holds before dropping (default 65536)</li>
 *   <li>{@code drain.grace.ms}: time connected workers get to finish streaming on stop (default 2000)</li>
 *   <li>{@code bridge.host}: loopback address the worker bridge binds (default 127.0.0.1)</li>
 *   <li>{@code consumer.daemon}: whether consumer threads are daemons (default true)</li>
 *   <li>{@code metrics.exporter}: {@code none} or {@code otlp} (default none)</li>
 * </ul>
 *
 * @param channelCapacity maximum undelivered records per session
 * @param drainGrace bridge drain time on stop
 * @param bridgeHost loopback bind address
 * @param consumerDaemon daemon flag for consumer threads
 * @param metricsExporter metrics exporter name
 * @since FUNNEL 0.1
 */
public record AggregatorSettings(
    int channelCapacity,
    Duration drainGrace,
    String bridgeHost,
    boolean consumerDaemon,
    String metricsExporter) {

  public static final int DEFAULT_CHANNEL_CAPACITY = 65_536;
  public static final Duration DEFAULT_DRAIN_GRACE = Duration.ofSeconds(2);
  public static final String DEFAULT_BRIDGE_HOST = "127.0.0.1";
  public static final String SYSTEM_PROPERTY_PREFIX = "funnel.";

  static final String KEY_CHANNEL_CAPACITY = "channel.capacity";
  static final String KEY_DRAIN_GRACE_MS = "drain.grace.ms";
  static final String KEY_BRIDGE_HOST = "bridge.host";
  static final String KEY_CONSUMER_DAEMON = "consumer.daemon";
  static final String KEY_METRICS_EXPORTER = "metrics.exporter";

  public AggregatorSettings {
    if (channelCapacity <= 0) {
      throw new IllegalArgumentException("channel.capacity must be positive (was " + channelCapacity + ")");
    }
    Objects.requireNonNull(drainGrace, "drainGrace");
    if (drainGrace.isNegative()) {
      throw new IllegalArgumentException("drain.grace.ms must not be negative");
    }
    bridgeHost = requireLoopback(Objects.requireNonNull(bridgeHost, "bridgeHost").trim());
    metricsExporter = normalizeExporter(metricsExporter);
  }

  /**
   * Returns the built-in defaults.
   *
   * @return default settings
   */
  public static AggregatorSettings defaults() {
    return new AggregatorSettings(DEFAULT_CHANNEL_CAPACITY, DEFAULT_DRAIN_GRACE, DEFAULT_BRIDGE_HOST, true, "none");
  }

  /**
   * Builds settings from flat key/value pairs; missing keys keep their defaults.
   *
   * @param values flat configuration map (see class documentation for keys)
   * @return validated settings
   * @throws IllegalArgumentException when a value cannot be parsed or is out of range
   */
  public static AggregatorSettings fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    AggregatorSettings defaults = defaults();
    int capacity = parseInt(values.get(KEY_CHANNEL_CAPACITY), defaults.channelCapacity(), KEY_CHANNEL_CAPACITY);
    long graceMs = parseLong(values.get(KEY_DRAIN_GRACE_MS), defaults.drainGrace().toMillis(), KEY_DRAIN_GRACE_MS);
    String host = blankToDefault(values.get(KEY_BRIDGE_HOST), defaults.bridgeHost());
    boolean daemon = parseBoolean(values.get(KEY_CONSUMER_DAEMON), defaults.consumerDaemon(), KEY_CONSUMER_DAEMON);
    String exporter = blankToDefault(values.get(KEY_METRICS_EXPORTER), defaults.metricsExporter());
    return new AggregatorSettings(capacity, Duration.ofMillis(graceMs), host, daemon, exporter);
  }

  /**
   * Builds settings from JVM system properties prefixed with {@code funnel.}.
   *
   * @return validated settings
   */
  public static AggregatorSettings fromSystemProperties() {
    return fromMap(prefixed(System.getProperties()));
  }

  /**
   * Loads the {@code aggregator} section of a YAML file; system properties override file values.
   *
   * @param yaml YAML file; a missing file yields system properties over defaults
   * @return validated settings
   * @throws IOException when the file exists but cannot be read
   */
  public static AggregatorSettings load(Path yaml) throws IOException {
    Map<String, String> merged = new LinkedHashMap<>(
        YamlConfigLoader.load(yaml, YamlConfigLoader.AGGREGATOR_SECTION).orElse(Map.of()));
    merged.putAll(prefixed(System.getProperties()));
    return fromMap(merged);
  }

  /**
   * Exports these settings as system-property style pairs so a worker JVM resolves the same values.
   *
   * @return {@code -Dfunnel.*} JVM options
   */
  public Map<String, String> toSystemProperties() {
    Map<String, String> props = new LinkedHashMap<>();
    props.put(SYSTEM_PROPERTY_PREFIX + KEY_CHANNEL_CAPACITY, Integer.toString(channelCapacity));
    props.put(SYSTEM_PROPERTY_PREFIX + KEY_DRAIN_GRACE_MS, Long.toString(drainGrace.toMillis()));
    props.put(SYSTEM_PROPERTY_PREFIX + KEY_BRIDGE_HOST, bridgeHost);
    props.put(SYSTEM_PROPERTY_PREFIX + KEY_CONSUMER_DAEMON, Boolean.toString(consumerDaemon));
    props.put(SYSTEM_PROPERTY_PREFIX + KEY_METRICS_EXPORTER, metricsExporter);
    return props;
  }

  public boolean metricsEnabled() {
    return !"none".equals(metricsExporter);
  }

  static Map<String, String> prefixed(Properties properties) {
    Map<String, String> values = new LinkedHashMap<>();
    for (String name : properties.stringPropertyNames()) {
      if (name.startsWith(SYSTEM_PROPERTY_PREFIX)) {
        values.put(name.substring(SYSTEM_PROPERTY_PREFIX.length()), properties.getProperty(name));
      }
    }
    return values;
  }

  private static String requireLoopback(String host) {
    if (host.isEmpty()) {
      throw new IllegalArgumentException("bridge.host must not be blank");
    }
    try {
      if (!InetAddress.getByName(host).isLoopbackAddress()) {
        throw new IllegalArgumentException("bridge.host must be a loopback address (was " + host + ")");
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("bridge.host cannot be resolved: " + host, ex);
    }
    return host;
  }

  private static String normalizeExporter(String raw) {
    String value = raw == null || raw.isBlank() ? "none" : raw.trim().toLowerCase(Locale.ROOT);
    if (!value.equals("none") && !value.equals("otlp")) {
      throw new IllegalArgumentException("metrics.exporter must be none or otlp (was " + raw + ")");
    }
    return value;
  }

  private static int parseInt(String raw, int fallback, String key) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw + ")", ex);
    }
  }

  private static long parseLong(String raw, long fallback, String key) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw + ")", ex);
    }
  }

  private static boolean parseBoolean(String raw, boolean fallback, String key) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String value = raw.trim().toLowerCase(Locale.ROOT);
    return switch (value) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was " + raw + ")");
    };
  }

  private static String blankToDefault(String raw, String fallback) {
    return raw == null || raw.isBlank() ? fallback : raw.trim();
  }
}
