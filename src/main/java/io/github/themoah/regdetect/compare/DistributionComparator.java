package io.github.themoah.regdetect.compare;

import io.github.themoah.regdetect.model.ComparisonResult;
import io.github.themoah.regdetect.model.ComparisonVerdict;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Decides whether two samples come from the same distribution.
 *
 * <p>Both a Kolmogorov-Smirnov test (sensitive to changes in shape or spread)
 * and a Mann-Whitney U test (sensitive to changes in location) are run, and the
 * smaller p-value is compared against {@link Thresholds}:
 * <ul>
 *   <li>p &lt;= low threshold: {@link ComparisonVerdict#DIFFERENT}</li>
 *   <li>p &lt;= high threshold: {@link ComparisonVerdict#UNKNOWN}, more attempts are needed</li>
 *   <li>otherwise: {@link ComparisonVerdict#SAME}</li>
 * </ul>
 *
 * <p>Stateless; all methods are static and safe to call from any thread.
 */
public final class DistributionComparator {

  private DistributionComparator() {}

  /**
   * Compares two samples.
   *
   * @param a first sample
   * @param b second sample
   * @param attemptCount average number of attempts behind each sample
   * @param mode comparison mode name, {@code "functional"} or {@code "performance"}
   * @param magnitude smallest difference worth detecting
   * @return the verdict; {@link ComparisonResult#unknown()} if either sample is empty
   * @throws InvalidModeException if the mode name is not recognized
   */
  public static <T extends Comparable<? super T>> ComparisonResult compare(
      List<T> a, List<T> b, int attemptCount, String mode, double magnitude
  ) {
    return compare(a, b, attemptCount, ComparisonMode.fromString(mode), magnitude);
  }

  /**
   * Compares two samples.
   *
   * @see #compare(List, List, int, String, double)
   */
  public static <T extends Comparable<? super T>> ComparisonResult compare(
      List<T> a, List<T> b, int attemptCount, ComparisonMode mode, double magnitude
  ) {
    if (a.isEmpty() || b.isEmpty()) {
      return ComparisonResult.unknown();
    }
    double pValue = comparisonPValue(a, b);
    double high = Thresholds.highThreshold(mode, magnitude, attemptCount);
    return new ComparisonResult(verdict(pValue, high), pValue, Thresholds.LOW_THRESHOLD, high);
  }

  /**
   * Compares two samples of measurements.
   *
   * @see #compare(List, List, int, ComparisonMode, double)
   */
  public static ComparisonResult compare(
      double[] a, double[] b, int attemptCount, ComparisonMode mode, double magnitude
  ) {
    return compare(boxed(a), boxed(b), attemptCount, mode, magnitude);
  }

  /**
   * The smaller of the Kolmogorov-Smirnov and Mann-Whitney U p-values.
   *
   * @throws IllegalArgumentException if either sample is empty
   */
  public static <T extends Comparable<? super T>> double comparisonPValue(List<T> a, List<T> b) {
    double ks = KolmogorovSmirnov.pValue(a, b);
    double mwu = MannWhitneyU.pValue(a, b);
    return Math.min(ks, mwu);
  }

  private static ComparisonVerdict verdict(double pValue, double highThreshold) {
    if (pValue <= Thresholds.LOW_THRESHOLD) {
      return ComparisonVerdict.DIFFERENT;
    }
    if (pValue <= highThreshold) {
      return ComparisonVerdict.UNKNOWN;
    }
    return ComparisonVerdict.SAME;
  }

  private static List<Double> boxed(double[] values) {
    return Arrays.stream(values).boxed().collect(Collectors.toList());
  }
}
