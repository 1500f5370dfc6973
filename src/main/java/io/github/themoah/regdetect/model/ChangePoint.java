package io.github.themoah.regdetect.model;

/**
 * A statistically significant level shift found in a series.
 *
 * @param xValue revision of the first point after the shift
 * @param medianBefore median of the segment before the shift
 * @param medianAfter median of the segment after the shift
 * @param meanBefore mean of the segment before the shift
 * @param meanAfter mean of the segment after the shift
 * @param stdDevBefore sample standard deviation of the segment before the shift
 * @param stdDevAfter sample standard deviation of the segment after the shift
 * @param sizeBefore number of points in the segment before the shift
 * @param sizeAfter number of points in the segment after the shift
 * @param windowEnd revision (x value) of the last point of the examined window,
 *     not the index bound of the search window
 * @param tStatistic Welch t statistic of (before, after)
 * @param degreesOfFreedom Welch-Satterthwaite degrees of freedom
 * @param pValue two-tailed p-value of the t-test
 */
public record ChangePoint(
  long xValue,
  double medianBefore,
  double medianAfter,
  double meanBefore,
  double meanAfter,
  double stdDevBefore,
  double stdDevAfter,
  int sizeBefore,
  int sizeAfter,
  long windowEnd,
  double tStatistic,
  double degreesOfFreedom,
  double pValue
) {

  /**
   * Absolute difference between the segment means.
   */
  public double absoluteChange() {
    return Math.abs(meanAfter - meanBefore);
  }

  /**
   * Relative difference between the segment means, or infinity when the mean before is 0.
   */
  public double relativeChange() {
    if (meanBefore == 0.0) {
      return Double.POSITIVE_INFINITY;
    }
    return Math.abs((meanAfter - meanBefore) / meanBefore);
  }
}
