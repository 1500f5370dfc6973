package io.github.themoah.regdetect.model;

/**
 * An alert raised for a change point on a monitored series.
 *
 * @param testPath path of the series the anomaly was found on
 * @param startRevision first revision that may contain the culprit
 * @param endRevision revision of the first point after the shift
 * @param medianBefore median of the segment before the shift
 * @param medianAfter median of the segment after the shift
 * @param segmentSizeBefore points in the segment before the shift
 * @param segmentSizeAfter points in the segment after the shift
 * @param windowEndRevision last revision of the examined window
 * @param stdDevBefore standard deviation of the segment before the shift
 * @param tStatistic Welch t statistic
 * @param degreesOfFreedom degrees of freedom of the t-test
 * @param pValue p-value of the t-test
 * @param improvement whether the shift moves the metric in its improvement direction
 * @param refTestPath path of the reference build series, or null
 */
public record Anomaly(
  String testPath,
  long startRevision,
  long endRevision,
  double medianBefore,
  double medianAfter,
  int segmentSizeBefore,
  int segmentSizeAfter,
  long windowEndRevision,
  double stdDevBefore,
  double tStatistic,
  double degreesOfFreedom,
  double pValue,
  boolean improvement,
  String refTestPath
) {

  public boolean isRegression() {
    return !improvement;
  }

  /**
   * Percentage change from the median before to the median after, or infinity
   * when the median before is 0.
   */
  public double percentChanged() {
    if (medianBefore == 0.0) {
      return Double.POSITIVE_INFINITY;
    }
    return 100.0 * Math.abs(medianAfter - medianBefore) / Math.abs(medianBefore);
  }
}
