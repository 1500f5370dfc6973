package io.github.themoah.regdetect.model;

/**
 * Outcome of comparing two samples of measurements.
 */
public enum ComparisonVerdict {
  /** The samples (probably) come from the same distribution. */
  SAME("same"),
  /** The samples (very likely) come from different distributions. */
  DIFFERENT("different"),
  /** More data is needed to decide. */
  UNKNOWN("unknown"),
  /** Some measurements have not been collected yet; never produced by the comparator itself. */
  PENDING("pending");

  private final String value;

  ComparisonVerdict(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
