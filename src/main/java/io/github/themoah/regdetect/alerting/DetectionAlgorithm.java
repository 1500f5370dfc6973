package io.github.themoah.regdetect.alerting;

/**
 * How the alerting job proposes change points.
 */
public enum DetectionAlgorithm {
  /** Every split inside the window is a candidate. */
  SEGMENT("segment"),
  /** Candidates come from E-Divisive clustering and are then checked like segment candidates. */
  CLUSTERING("clustering");

  private final String value;

  DetectionAlgorithm(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * Parses an algorithm name, case-insensitively.
   *
   * @return the algorithm, or null if the name is not recognized
   */
  public static DetectionAlgorithm fromString(String value) {
    if (value == null) {
      return null;
    }
    for (DetectionAlgorithm algorithm : values()) {
      if (algorithm.value.equalsIgnoreCase(value.trim())) {
        return algorithm;
      }
    }
    return null;
  }
}
