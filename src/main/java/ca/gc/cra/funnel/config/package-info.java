/**
 * Configuration for aggregation sessions and convenience sinks.
 * <p><strong>Role:</strong> Bootstrap layer; values come from YAML ({@code common}, {@code aggregator} and
 * {@code sink} sections), {@code funnel.*} system properties, or code.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 */
package ca.gc.cra.funnel.config;
