package io.github.themoah.regdetect.config;

import io.github.themoah.regdetect.alerting.DetectionAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application configuration loaded from environment variables.
 *
 * @param httpPort HTTP server port
 * @param alertingIntervalMs interval between alerting cycles in milliseconds
 * @param seriesDataDir directory of JSON series files to load at startup, or null for an empty store
 * @param detectionAlgorithm how the alerting job proposes change points
 */
public record AppConfig(
  int httpPort,
  long alertingIntervalMs,
  String seriesDataDir,
  DetectionAlgorithm detectionAlgorithm
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  private static final int DEFAULT_HTTP_PORT = 8888;
  private static final long DEFAULT_ALERTING_INTERVAL_MS = 60_000L;
  private static final DetectionAlgorithm DEFAULT_DETECTION_ALGORITHM = DetectionAlgorithm.SEGMENT;

  /**
   * Loads configuration from environment variables with defaults.
   *
   * @return AppConfig instance
   */
  public static AppConfig fromEnvironment() {
    int port = getEnvInt("HTTP_PORT", DEFAULT_HTTP_PORT);
    long interval = getEnvLong("ALERTING_INTERVAL_MS", DEFAULT_ALERTING_INTERVAL_MS);
    String dataDir = System.getenv("SERIES_DATA_DIR");
    if (dataDir != null && dataDir.isBlank()) {
      dataDir = null;
    }
    DetectionAlgorithm algorithm = getEnvAlgorithm("DETECTION_ALGORITHM", DEFAULT_DETECTION_ALGORITHM);

    log.info("AppConfig loaded: httpPort={}, alertingIntervalMs={}, seriesDataDir={}, detectionAlgorithm={}",
      port, interval, dataDir, algorithm.getValue());
    return new AppConfig(port, interval, dataDir, algorithm);
  }

  private static DetectionAlgorithm getEnvAlgorithm(String name, DetectionAlgorithm defaultValue) {
    String value = System.getenv(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    DetectionAlgorithm algorithm = DetectionAlgorithm.fromString(value);
    if (algorithm == null) {
      log.warn("Invalid detection algorithm for {}: {}, using default: {}", name, value, defaultValue.getValue());
      return defaultValue;
    }
    return algorithm;
  }

  private static int getEnvInt(String name, int defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Integer.parseInt(value);
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  private static long getEnvLong(String name, long defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Long.parseLong(value);
      } catch (NumberFormatException e) {
        log.warn("Invalid long for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }
}
