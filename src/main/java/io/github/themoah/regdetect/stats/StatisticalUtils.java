package io.github.themoah.regdetect.stats;

import java.util.Arrays;

/**
 * Utility methods for the descriptive statistics used by change-point detection
 * and sample comparison.
 */
public final class StatisticalUtils {

  private StatisticalUtils() {}

  /**
   * Calculates the arithmetic mean of {@code values[from, to)}.
   *
   * @throws InsufficientDataException if the range is empty
   */
  public static double mean(double[] values, int from, int to) {
    requireNonEmpty(from, to, "mean");
    double sum = 0.0;
    for (int i = from; i < to; i++) {
      sum += values[i];
    }
    return sum / (to - from);
  }

  public static double mean(double[] values) {
    return mean(values, 0, values.length);
  }

  /**
   * Calculates the sample standard deviation (divide by n-1) of {@code values[from, to)}.
   * A single value has a standard deviation of 0.
   *
   * @throws InsufficientDataException if the range is empty
   */
  public static double sampleStdDev(double[] values, int from, int to) {
    return Math.sqrt(sampleVariance(values, from, to));
  }

  public static double sampleStdDev(double[] values) {
    return sampleStdDev(values, 0, values.length);
  }

  /**
   * Calculates the sample variance (divide by n-1) of {@code values[from, to)}.
   *
   * @throws InsufficientDataException if the range is empty
   */
  public static double sampleVariance(double[] values, int from, int to) {
    int n = to - from;
    double mean = mean(values, from, to);
    if (n == 1) {
      return 0.0;
    }
    return sumSquaredDiffs(values, from, to, mean) / (n - 1);
  }

  /**
   * Sum of squared differences between {@code values[from, to)} and {@code center}.
   */
  public static double sumSquaredDiffs(double[] values, int from, int to, double center) {
    double sum = 0.0;
    for (int i = from; i < to; i++) {
      double diff = values[i] - center;
      sum += diff * diff;
    }
    return sum;
  }

  /**
   * Calculates the median of {@code values[from, to)}; the mean of the two middle
   * values for an even count.
   *
   * @throws InsufficientDataException if the range is empty
   */
  public static double median(double[] values, int from, int to) {
    requireNonEmpty(from, to, "median");
    double[] sorted = Arrays.copyOfRange(values, from, to);
    Arrays.sort(sorted);
    int n = sorted.length;
    if (n % 2 == 1) {
      return sorted[n / 2];
    }
    return (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
  }

  public static double median(double[] values) {
    return median(values, 0, values.length);
  }

  /**
   * Calculates a percentile using linear interpolation between the closest ranks,
   * where the k-th smallest of n values sits at percentile (k - 0.5) / n.
   *
   * @param values the values, in any order
   * @param percentile a fraction in [0, 1]
   * @return the interpolated percentile
   * @throws InsufficientDataException if values is empty
   */
  public static double percentile(double[] values, double percentile) {
    requireNonEmpty(0, values.length, "percentile");
    double[] sorted = values.clone();
    Arrays.sort(sorted);
    int n = sorted.length;

    double position = percentile * n;
    if (position <= 0.5) {
      return sorted[0];
    }
    if (position >= n - 0.5) {
      return sorted[n - 1];
    }
    int floorIndex = (int) Math.floor(position - 0.5);
    double fromFloor = position - 0.5 - floorIndex;
    return sorted[floorIndex] * (1 - fromFloor) + sorted[floorIndex + 1] * fromFloor;
  }

  /**
   * Interquartile range: 75th minus 25th percentile.
   *
   * @throws InsufficientDataException if values is empty
   */
  public static double iqr(double[] values) {
    return percentile(values, 0.75) - percentile(values, 0.25);
  }

  private static void requireNonEmpty(int from, int to, String operation) {
    if (to <= from) {
      throw new InsufficientDataException("Cannot compute " + operation + " of an empty sequence");
    }
  }
}
