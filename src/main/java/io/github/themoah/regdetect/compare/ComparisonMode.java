package io.github.themoah.regdetect.compare;

/**
 * Kind of samples being compared; selects the high-threshold table.
 */
public enum ComparisonMode {
  /** Pass/fail samples, e.g. failure indicators; magnitude is a failure-rate delta in [0, 1]. */
  FUNCTIONAL("functional"),
  /** Continuous measurements; magnitude is a multiple of the interquartile range. */
  PERFORMANCE("performance");

  private final String value;

  ComparisonMode(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * Parses a mode name, case-insensitively.
   *
   * @throws InvalidModeException if the name is null or unrecognized
   */
  public static ComparisonMode fromString(String mode) {
    if (mode != null) {
      for (ComparisonMode candidate : values()) {
        if (candidate.value.equalsIgnoreCase(mode.trim())) {
          return candidate;
        }
      }
    }
    throw new InvalidModeException(mode);
  }
}
