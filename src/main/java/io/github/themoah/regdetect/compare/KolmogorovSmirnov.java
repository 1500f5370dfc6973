package io.github.themoah.regdetect.compare;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;
import org.apache.commons.math3.stat.inference.KolmogorovSmirnovTest;

/**
 * Two-sample Kolmogorov-Smirnov test over any ordered values.
 *
 * <p>The p-value uses the asymptotic Kolmogorov distribution with the
 * small-sample correction {@code (en + 0.12 + 0.11 / en) * D}, where
 * {@code en = sqrt(n * m / (n + m))}.
 */
public final class KolmogorovSmirnov {

  private static final double KS_SUM_TOLERANCE = 1e-20;
  private static final int KS_SUM_MAX_ITERATIONS = 100_000;
  private static final double MIN_LAMBDA = 0.2;

  private static final KolmogorovSmirnovTest KS = new KolmogorovSmirnovTest();

  private KolmogorovSmirnov() {}

  /**
   * Largest absolute difference between the two empirical distribution functions.
   *
   * @throws IllegalArgumentException if either sample is empty
   */
  public static <T extends Comparable<? super T>> double statistic(List<T> a, List<T> b) {
    requireNonEmpty(a, b);
    List<T> sortedA = sorted(a);
    List<T> sortedB = sorted(b);
    TreeSet<T> distinct = new TreeSet<>(sortedA);
    distinct.addAll(sortedB);

    double n = sortedA.size();
    double m = sortedB.size();
    int i = 0;
    int j = 0;
    double maxDiff = 0.0;
    for (T value : distinct) {
      while (i < sortedA.size() && sortedA.get(i).compareTo(value) <= 0) {
        i++;
      }
      while (j < sortedB.size() && sortedB.get(j).compareTo(value) <= 0) {
        j++;
      }
      maxDiff = Math.max(maxDiff, Math.abs(i / n - j / m));
    }
    return maxDiff;
  }

  /**
   * Two-sided p-value that both samples come from the same distribution.
   *
   * @throws IllegalArgumentException if either sample is empty
   */
  public static <T extends Comparable<? super T>> double pValue(List<T> a, List<T> b) {
    double d = statistic(a, b);
    if (d == 0.0) {
      return 1.0;
    }
    double n = a.size();
    double m = b.size();
    double en = Math.sqrt(n * m / (n + m));
    double lambda = (en + 0.12 + 0.11 / en) * d;
    if (lambda < MIN_LAMBDA) {
      return 1.0;
    }
    double p = 1.0 - KS.ksSum(lambda, KS_SUM_TOLERANCE, KS_SUM_MAX_ITERATIONS);
    return Math.max(0.0, Math.min(1.0, p));
  }

  private static <T extends Comparable<? super T>> List<T> sorted(List<T> values) {
    List<T> copy = new ArrayList<>(values);
    Collections.sort(copy);
    return copy;
  }

  private static void requireNonEmpty(List<?> a, List<?> b) {
    if (a.isEmpty() || b.isEmpty()) {
      throw new IllegalArgumentException("Both samples must be non-empty");
    }
  }
}
