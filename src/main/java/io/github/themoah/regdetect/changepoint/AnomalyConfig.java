package io.github.themoah.regdetect.changepoint;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thresholds for change-point detection.
 *
 * @param maxWindowSize only the last N points are eligible for change points (0 = whole series)
 * @param minSegmentSize minimum points on each side of a change point (default 6)
 * @param maxSegmentSize maximum points on each side used for statistics (0 = twice minSegmentSize)
 * @param multipleOfStdDev minimum mean shift in pooled standard deviations (default 2.5)
 * @param minRelativeChange minimum |shift| / |mean before|; a shift passing either this or
 *     {@code minAbsoluteChange} is kept (default 0.01)
 * @param minAbsoluteChange minimum |shift| in the metric's units; the only magnitude check when
 *     the mean before is 0 (default 0)
 * @param minSteppiness minimum fit of a step function to the two segments, in [0, 1];
 *     0 disables the check (default 0)
 */
public record AnomalyConfig(
  int maxWindowSize,
  int minSegmentSize,
  int maxSegmentSize,
  double multipleOfStdDev,
  double minRelativeChange,
  double minAbsoluteChange,
  double minSteppiness
) {

  private static final Logger log = LoggerFactory.getLogger(AnomalyConfig.class);

  public static final String MAX_WINDOW_SIZE = "max_window_size";
  public static final String MIN_SEGMENT_SIZE = "min_segment_size";
  public static final String MAX_SEGMENT_SIZE = "max_segment_size";
  public static final String MULTIPLE_OF_STD_DEV = "multiple_of_std_dev";
  public static final String MIN_RELATIVE_CHANGE = "min_relative_change";
  public static final String MIN_ABSOLUTE_CHANGE = "min_absolute_change";
  public static final String MIN_STEPPINESS = "min_steppiness";

  private static final int DEFAULT_MAX_WINDOW_SIZE = 0;
  private static final int DEFAULT_MIN_SEGMENT_SIZE = 6;
  private static final int DEFAULT_MAX_SEGMENT_SIZE = 0;
  private static final double DEFAULT_MULTIPLE_OF_STD_DEV = 2.5;
  private static final double DEFAULT_MIN_RELATIVE_CHANGE = 0.01;
  private static final double DEFAULT_MIN_ABSOLUTE_CHANGE = 0.0;
  private static final double DEFAULT_MIN_STEPPINESS = 0.0;

  /**
   * Returns the built-in defaults.
   */
  public static AnomalyConfig defaults() {
    return new AnomalyConfig(
      DEFAULT_MAX_WINDOW_SIZE,
      DEFAULT_MIN_SEGMENT_SIZE,
      DEFAULT_MAX_SEGMENT_SIZE,
      DEFAULT_MULTIPLE_OF_STD_DEV,
      DEFAULT_MIN_RELATIVE_CHANGE,
      DEFAULT_MIN_ABSOLUTE_CHANGE,
      DEFAULT_MIN_STEPPINESS
    );
  }

  /**
   * Loads process-wide defaults from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>ANOMALY_MAX_WINDOW_SIZE - Points eligible for change points, 0 for all (default: 0)</li>
   *   <li>ANOMALY_MIN_SEGMENT_SIZE - Minimum points on each side of a change (default: 6)</li>
   *   <li>ANOMALY_MAX_SEGMENT_SIZE - Maximum points on each side, 0 for twice the minimum (default: 0)</li>
   *   <li>ANOMALY_MULTIPLE_OF_STD_DEV - Minimum shift in pooled standard deviations (default: 2.5)</li>
   *   <li>ANOMALY_MIN_RELATIVE_CHANGE - Minimum relative shift (default: 0.01)</li>
   *   <li>ANOMALY_MIN_ABSOLUTE_CHANGE - Minimum absolute shift (default: 0)</li>
   *   <li>ANOMALY_MIN_STEPPINESS - Minimum step-function fit, 0 to disable (default: 0)</li>
   * </ul>
   */
  public static AnomalyConfig fromEnvironment() {
    AnomalyConfig config = new AnomalyConfig(
      parseInt("ANOMALY_MAX_WINDOW_SIZE", DEFAULT_MAX_WINDOW_SIZE),
      parseInt("ANOMALY_MIN_SEGMENT_SIZE", DEFAULT_MIN_SEGMENT_SIZE),
      parseInt("ANOMALY_MAX_SEGMENT_SIZE", DEFAULT_MAX_SEGMENT_SIZE),
      parseDouble("ANOMALY_MULTIPLE_OF_STD_DEV", DEFAULT_MULTIPLE_OF_STD_DEV),
      parseDouble("ANOMALY_MIN_RELATIVE_CHANGE", DEFAULT_MIN_RELATIVE_CHANGE),
      parseDouble("ANOMALY_MIN_ABSOLUTE_CHANGE", DEFAULT_MIN_ABSOLUTE_CHANGE),
      parseDouble("ANOMALY_MIN_STEPPINESS", DEFAULT_MIN_STEPPINESS)
    );
    log.info("Anomaly config defaults: {}", config);
    return config;
  }

  /**
   * Builds a config from a key/value mapping on top of the built-in defaults.
   *
   * @see #withOverrides(Map)
   */
  public static AnomalyConfig fromMap(Map<String, ?> values) {
    return defaults().withOverrides(values);
  }

  /**
   * Returns a copy of this config with the recognized keys of {@code overrides} applied.
   * Unrecognized keys are ignored.
   *
   * @throws InvalidConfigException if a recognized key has a non-numeric value
   */
  public AnomalyConfig withOverrides(Map<String, ?> overrides) {
    if (overrides == null || overrides.isEmpty()) {
      return this;
    }
    int window = maxWindowSize;
    int minSegment = minSegmentSize;
    int maxSegment = maxSegmentSize;
    double stdDevs = multipleOfStdDev;
    double relative = minRelativeChange;
    double absolute = minAbsoluteChange;
    double steppiness = minSteppiness;

    for (Map.Entry<String, ?> entry : overrides.entrySet()) {
      String key = entry.getKey();
      Object value = entry.getValue();
      switch (key) {
        case MAX_WINDOW_SIZE -> window = toInt(key, value);
        case MIN_SEGMENT_SIZE -> minSegment = toInt(key, value);
        case MAX_SEGMENT_SIZE -> maxSegment = toInt(key, value);
        case MULTIPLE_OF_STD_DEV -> stdDevs = toDouble(key, value);
        case MIN_RELATIVE_CHANGE -> relative = toDouble(key, value);
        case MIN_ABSOLUTE_CHANGE -> absolute = toDouble(key, value);
        case MIN_STEPPINESS -> steppiness = toDouble(key, value);
        default -> log.debug("Ignoring unrecognized anomaly config key: {}", key);
      }
    }
    return new AnomalyConfig(window, minSegment, maxSegment, stdDevs, relative, absolute, steppiness);
  }

  /**
   * Checks every value is in range.
   *
   * @return this config
   * @throws InvalidConfigException if any value is out of range
   */
  public AnomalyConfig validate() {
    if (minSegmentSize < 1) {
      throw new InvalidConfigException(MIN_SEGMENT_SIZE + " must be at least 1, got " + minSegmentSize);
    }
    if (maxWindowSize < 0) {
      throw new InvalidConfigException(MAX_WINDOW_SIZE + " must not be negative, got " + maxWindowSize);
    }
    if (maxSegmentSize != 0 && maxSegmentSize < minSegmentSize) {
      throw new InvalidConfigException(MAX_SEGMENT_SIZE + " (" + maxSegmentSize
        + ") must be 0 or at least " + MIN_SEGMENT_SIZE + " (" + minSegmentSize + ")");
    }
    requireNonNegative(MULTIPLE_OF_STD_DEV, multipleOfStdDev);
    requireNonNegative(MIN_RELATIVE_CHANGE, minRelativeChange);
    requireNonNegative(MIN_ABSOLUTE_CHANGE, minAbsoluteChange);
    requireNonNegative(MIN_STEPPINESS, minSteppiness);
    return this;
  }

  /**
   * Maximum segment size with the "twice the minimum" default resolved.
   */
  public int effectiveMaxSegmentSize() {
    return maxSegmentSize == 0 ? 2 * minSegmentSize : maxSegmentSize;
  }

  private static void requireNonNegative(String key, double value) {
    if (Double.isNaN(value) || value < 0) {
      throw new InvalidConfigException(key + " must not be negative, got " + value);
    }
  }

  private static int toInt(String key, Object value) {
    if (value instanceof Number number) {
      double d = number.doubleValue();
      if (d != Math.rint(d)) {
        throw new InvalidConfigException(key + " must be an integer, got " + value);
      }
      return number.intValue();
    }
    if (value instanceof String text) {
      try {
        return Integer.parseInt(text.trim());
      } catch (NumberFormatException e) {
        throw new InvalidConfigException(key + " must be an integer, got '" + text + "'");
      }
    }
    throw new InvalidConfigException(key + " must be an integer, got " + value);
  }

  private static double toDouble(String key, Object value) {
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof String text) {
      try {
        return Double.parseDouble(text.trim());
      } catch (NumberFormatException e) {
        throw new InvalidConfigException(key + " must be a number, got '" + text + "'");
      }
    }
    throw new InvalidConfigException(key + " must be a number, got " + value);
  }

  private static double parseDouble(String envVar, double defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }

  private static int parseInt(String envVar, int defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }
}
