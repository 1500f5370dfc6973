package io.github.themoah.regdetect.model;

/**
 * A comparison verdict together with the numbers that produced it.
 *
 * @param verdict the verdict
 * @param pValue combined p-value, NaN when no test was run
 * @param lowThreshold p-value at or below which samples are DIFFERENT, NaN when no test was run
 * @param highThreshold p-value above which samples are SAME, NaN when no test was run
 */
public record ComparisonResult(
  ComparisonVerdict verdict,
  double pValue,
  double lowThreshold,
  double highThreshold
) {

  /**
   * Result for a comparison that could not run a test at all.
   */
  public static ComparisonResult unknown() {
    return new ComparisonResult(ComparisonVerdict.UNKNOWN, Double.NaN, Double.NaN, Double.NaN);
  }
}
