package io.github.themoah.regdetect.compare;

/**
 * Significance thresholds for {@link DistributionComparator}.
 *
 * <p>A p-value at or below {@link #LOW_THRESHOLD} means the samples are different.
 * A p-value above the high threshold means they are the same; in between, more
 * data is needed. The high threshold is looked up by magnitude (rows, in steps of
 * 0.1 from 0.1 to 1.0) and attempt count (columns, 1 to 20). Each entry is the
 * 99th percentile of the combined p-value over simulated samples that do differ
 * by that magnitude, so a real difference of at least that size stays at or below
 * the high threshold in 99 of 100 comparisons. Entries never increase with more
 * attempts or a larger magnitude.
 */
public final class Thresholds {

  public static final double LOW_THRESHOLD = 0.01;

  static final int MAX_ATTEMPT_COUNT = 20;
  static final int MAGNITUDE_STEPS = 10;

  private static final double[][] FUNCTIONAL = {
    // magnitude 0.1
    {1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000},
    // magnitude 0.2
    {1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000},
    // magnitude 0.3
    {1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 0.177, 0.176, 0.175, 0.174, 0.173, 0.172, 0.082},
    // magnitude 0.4
    {1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 0.185, 0.182, 0.180, 0.083, 0.083, 0.083, 0.082, 0.082, 0.040, 0.040, 0.040},
    // magnitude 0.5
    {1.000, 1.000, 1.000, 1.000, 1.000, 1.000, 0.196, 0.191, 0.188, 0.185, 0.084, 0.083, 0.083, 0.040, 0.040, 0.040, 0.020, 0.020, 0.010, 0.010},
    // magnitude 0.6
    {1.000, 1.000, 1.000, 1.000, 1.000, 0.203, 0.196, 0.085, 0.085, 0.084, 0.039, 0.039, 0.019, 0.019, 0.019, 0.010, 0.010, 0.010, 0.010, 0.010},
    // magnitude 0.7
    {1.000, 1.000, 1.000, 0.227, 0.212, 0.203, 0.086, 0.085, 0.038, 0.038, 0.018, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010},
    // magnitude 0.8
    {1.000, 1.000, 0.253, 0.227, 0.089, 0.087, 0.037, 0.016, 0.016, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010},
    // magnitude 0.9
    {1.000, 1.000, 0.253, 0.091, 0.034, 0.034, 0.014, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010},
    // magnitude 1.0
    {0.290, 0.097, 0.024, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010, 0.010},
  };

  private static final double[][] PERFORMANCE = {
    // magnitude 0.1
    {0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290},
    // magnitude 0.2
    {0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290},
    // magnitude 0.3
    {0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290},
    // magnitude 0.4
    {0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290},
    // magnitude 0.5
    {0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290},
    // magnitude 0.6
    {0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290},
    // magnitude 0.7
    {0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.254},
    // magnitude 0.8
    {0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.267, 0.243, 0.243, 0.210, 0.183, 0.162},
    // magnitude 0.9
    {0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.273, 0.270, 0.253, 0.241, 0.150, 0.150, 0.101, 0.101, 0.095},
    // magnitude 1.0
    {0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.290, 0.261, 0.256, 0.218, 0.178, 0.131, 0.100, 0.100, 0.065, 0.049, 0.049, 0.034},
  };

  private Thresholds() {}

  /**
   * High threshold for the given comparison.
   *
   * @param mode selects the table
   * @param magnitude expected size of the difference; clamped to [0.1, 1.0]
   * @param attemptCount samples per side; clamped to [1, 20]
   */
  public static double highThreshold(ComparisonMode mode, double magnitude, int attemptCount) {
    double[][] table = mode == ComparisonMode.FUNCTIONAL ? FUNCTIONAL : PERFORMANCE;
    return table[magnitudeIndex(magnitude)][attemptIndex(attemptCount)];
  }

  static int magnitudeIndex(double magnitude) {
    if (Double.isNaN(magnitude)) {
      return 0;
    }
    int index = (int) Math.floor(magnitude * MAGNITUDE_STEPS + 1e-9) - 1;
    return Math.max(0, Math.min(MAGNITUDE_STEPS - 1, index));
  }

  static int attemptIndex(int attemptCount) {
    return Math.max(1, Math.min(MAX_ATTEMPT_COUNT, attemptCount)) - 1;
  }
}
