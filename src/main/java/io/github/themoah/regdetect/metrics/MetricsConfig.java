package io.github.themoah.regdetect.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics configuration loaded from environment variables.
 *
 * @param enabled whether alerting metrics are recorded
 * @param reporterType registry backend, "prometheus" or "simple"
 * @param jvmMetricsEnabled whether JVM metrics are bound to the registry
 */
public record MetricsConfig(
  boolean enabled,
  String reporterType,
  boolean jvmMetricsEnabled
) {
  private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

  private static final boolean DEFAULT_ENABLED = true;
  private static final String DEFAULT_REPORTER_TYPE = "prometheus";
  private static final boolean DEFAULT_JVM_METRICS_ENABLED = false;

  /**
   * Loads configuration from environment variables with defaults.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>METRICS_ENABLED - Record alerting metrics (default: true)</li>
   *   <li>METRICS_REPORTER - Registry backend: prometheus or simple (default: prometheus)</li>
   *   <li>METRICS_JVM_ENABLED - Bind JVM memory, GC, thread and CPU metrics (default: false)</li>
   * </ul>
   */
  public static MetricsConfig fromEnvironment() {
    boolean enabled = getEnvBoolean("METRICS_ENABLED", DEFAULT_ENABLED);
    String reporter = System.getenv("METRICS_REPORTER");
    if (reporter == null || reporter.isBlank()) {
      reporter = DEFAULT_REPORTER_TYPE;
    }
    boolean jvm = getEnvBoolean("METRICS_JVM_ENABLED", DEFAULT_JVM_METRICS_ENABLED);

    log.info("MetricsConfig loaded: enabled={}, reporter={}, jvmMetrics={}", enabled, reporter, jvm);
    return new MetricsConfig(enabled, reporter, jvm);
  }

  public boolean isEnabled() {
    return enabled;
  }

  private static boolean getEnvBoolean(String name, boolean defaultValue) {
    String value = System.getenv(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
      return Boolean.parseBoolean(value);
    }
    log.warn("Invalid boolean for {}: {}, using default: {}", name, value, defaultValue);
    return defaultValue;
  }
}
