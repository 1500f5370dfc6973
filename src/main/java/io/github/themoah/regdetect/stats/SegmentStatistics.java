package io.github.themoah.regdetect.stats;

/**
 * Descriptive statistics for a contiguous run of values.
 *
 * @param count number of values
 * @param mean arithmetic mean
 * @param median median
 * @param stdDev sample standard deviation, 0 for a single value
 */
public record SegmentStatistics(
  int count,
  double mean,
  double median,
  double stdDev
) {

  /**
   * Computes statistics for {@code values[from, to)}.
   *
   * @throws InsufficientDataException if the range is empty
   */
  public static SegmentStatistics of(double[] values, int from, int to) {
    if (to <= from) {
      throw new InsufficientDataException("Segment [" + from + ", " + to + ") is empty");
    }
    return new SegmentStatistics(
      to - from,
      StatisticalUtils.mean(values, from, to),
      StatisticalUtils.median(values, from, to),
      StatisticalUtils.sampleStdDev(values, from, to)
    );
  }

  public static SegmentStatistics of(double[] values) {
    return of(values, 0, values.length);
  }

  public double variance() {
    return stdDev * stdDev;
  }

  /**
   * Pooled sample standard deviation of two segments, weighting each variance
   * by its degrees of freedom. Two single-value segments pool to 0.
   */
  public static double pooledStdDev(SegmentStatistics a, SegmentStatistics b) {
    int dof = a.count + b.count - 2;
    if (dof <= 0) {
      return 0.0;
    }
    double pooledVariance = ((a.count - 1) * a.variance() + (b.count - 1) * b.variance()) / dof;
    return Math.sqrt(pooledVariance);
  }
}
