package io.github.themoah.regdetect.compare;

import io.github.themoah.regdetect.model.Attempt;
import io.github.themoah.regdetect.model.ComparisonResult;
import io.github.themoah.regdetect.model.ComparisonVerdict;
import io.github.themoah.regdetect.stats.StatisticalUtils;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Compares the attempts run at two changes during a bisection.
 *
 * <p>Failure indicators are always compared. In performance mode the mean
 * result value of each attempt is compared too. A DIFFERENT verdict from either
 * comparison wins, then UNKNOWN, then SAME. A comparison with nothing on one
 * side is skipped; when every comparison is skipped the verdict is SAME.
 */
public class AttemptComparator {

  static final double DEFAULT_FUNCTIONAL_MAGNITUDE = 0.5;
  static final double PERFORMANCE_FAILURE_MAGNITUDE = 1.0;
  static final double DEFAULT_PERFORMANCE_MAGNITUDE = 1.0;
  static final double ZERO_IQR_MAGNITUDE = 1000.0;

  private final ComparisonMode mode;
  private final Double comparisonMagnitude;

  /**
   * @param mode how result values are compared
   * @param comparisonMagnitude expected size of the difference in the metric's units
   *     (performance) or as a failure-rate delta (functional); null to use the default
   */
  public AttemptComparator(ComparisonMode mode, Double comparisonMagnitude) {
    this.mode = mode;
    this.comparisonMagnitude = comparisonMagnitude;
  }

  /**
   * Compares the attempts of two changes.
   *
   * @return PENDING if any attempt has not completed yet, else the combined verdict
   */
  public ComparisonVerdict compare(List<Attempt> attemptsA, List<Attempt> attemptsB) {
    boolean pending = attemptsA.stream().anyMatch(a -> !a.completed())
      || attemptsB.stream().anyMatch(a -> !a.completed());
    if (pending) {
      return ComparisonVerdict.PENDING;
    }

    int attemptCount = (attemptsA.size() + attemptsB.size()) / 2;
    boolean anyUnknown = false;

    List<Integer> failuresA = failureIndicators(attemptsA);
    List<Integer> failuresB = failureIndicators(attemptsB);
    if (!failuresA.isEmpty() && !failuresB.isEmpty()) {
      ComparisonResult failures = DistributionComparator.compare(
        failuresA, failuresB, attemptCount, ComparisonMode.FUNCTIONAL, failureMagnitude());
      if (failures.verdict() == ComparisonVerdict.DIFFERENT) {
        return ComparisonVerdict.DIFFERENT;
      }
      anyUnknown = failures.verdict() == ComparisonVerdict.UNKNOWN;
    }

    if (mode == ComparisonMode.PERFORMANCE) {
      double[] valuesA = resultMeans(attemptsA);
      double[] valuesB = resultMeans(attemptsB);
      if (valuesA.length > 0 && valuesB.length > 0) {
        ComparisonResult results = DistributionComparator.compare(
          valuesA, valuesB, attemptCount, ComparisonMode.PERFORMANCE,
          performanceMagnitude(valuesA, valuesB));
        if (results.verdict() == ComparisonVerdict.DIFFERENT) {
          return ComparisonVerdict.DIFFERENT;
        }
        anyUnknown |= results.verdict() == ComparisonVerdict.UNKNOWN;
      }
    }

    return anyUnknown ? ComparisonVerdict.UNKNOWN : ComparisonVerdict.SAME;
  }

  private double failureMagnitude() {
    if (mode == ComparisonMode.PERFORMANCE) {
      return PERFORMANCE_FAILURE_MAGNITUDE;
    }
    return comparisonMagnitude != null ? comparisonMagnitude : DEFAULT_FUNCTIONAL_MAGNITUDE;
  }

  // Expresses the configured magnitude in units of the wider interquartile range.
  private double performanceMagnitude(double[] valuesA, double[] valuesB) {
    if (comparisonMagnitude == null) {
      return DEFAULT_PERFORMANCE_MAGNITUDE;
    }
    double maxIqr = Math.max(iqrOrZero(valuesA), iqrOrZero(valuesB));
    if (maxIqr == 0.0) {
      return ZERO_IQR_MAGNITUDE;
    }
    return Math.abs(comparisonMagnitude / maxIqr);
  }

  private static double iqrOrZero(double[] values) {
    return values.length == 0 ? 0.0 : StatisticalUtils.iqr(values);
  }

  private static List<Integer> failureIndicators(List<Attempt> attempts) {
    return attempts.stream()
      .map(a -> a.failed() ? 1 : 0)
      .collect(Collectors.toList());
  }

  // Attempts without result values are left out.
  private static double[] resultMeans(List<Attempt> attempts) {
    return attempts.stream()
      .filter(a -> !a.resultValues().isEmpty())
      .mapToDouble(a -> a.resultValues().stream().mapToDouble(Double::doubleValue).average().orElse(0.0))
      .toArray();
  }
}
