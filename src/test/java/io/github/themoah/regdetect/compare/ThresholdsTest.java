package io.github.themoah.regdetect.compare;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Pins the high-threshold tables to known values.
 */
public class ThresholdsTest {

  @Test
  void highThreshold_functional_goldenValues() {
    assertEquals(1.0, Thresholds.highThreshold(ComparisonMode.FUNCTIONAL, 0.1, 1));
    assertEquals(1.0, Thresholds.highThreshold(ComparisonMode.FUNCTIONAL, 0.1, 20));
    assertEquals(0.177, Thresholds.highThreshold(ComparisonMode.FUNCTIONAL, 0.3, 14));
    assertEquals(0.082, Thresholds.highThreshold(ComparisonMode.FUNCTIONAL, 0.3, 20));
    assertEquals(0.185, Thresholds.highThreshold(ComparisonMode.FUNCTIONAL, 0.5, 10));
    assertEquals(0.010, Thresholds.highThreshold(ComparisonMode.FUNCTIONAL, 0.5, 20));
    assertEquals(0.253, Thresholds.highThreshold(ComparisonMode.FUNCTIONAL, 0.8, 3));
    assertEquals(0.290, Thresholds.highThreshold(ComparisonMode.FUNCTIONAL, 1.0, 1));
    assertEquals(0.010, Thresholds.highThreshold(ComparisonMode.FUNCTIONAL, 1.0, 4));
  }

  @Test
  void highThreshold_performance_goldenValues() {
    assertEquals(0.290, Thresholds.highThreshold(ComparisonMode.PERFORMANCE, 0.2, 20));
    assertEquals(0.254, Thresholds.highThreshold(ComparisonMode.PERFORMANCE, 0.7, 20));
    assertEquals(0.162, Thresholds.highThreshold(ComparisonMode.PERFORMANCE, 0.8, 20));
    assertEquals(0.273, Thresholds.highThreshold(ComparisonMode.PERFORMANCE, 0.9, 12));
    assertEquals(0.261, Thresholds.highThreshold(ComparisonMode.PERFORMANCE, 1.0, 10));
    assertEquals(0.034, Thresholds.highThreshold(ComparisonMode.PERFORMANCE, 1.0, 20));
  }

  @Test
  void highThreshold_clampsMagnitudeAndAttempts() {
    assertEquals(Thresholds.highThreshold(ComparisonMode.PERFORMANCE, 1.0, 20),
      Thresholds.highThreshold(ComparisonMode.PERFORMANCE, 1000.0, 50));
    assertEquals(Thresholds.highThreshold(ComparisonMode.FUNCTIONAL, 0.1, 1),
      Thresholds.highThreshold(ComparisonMode.FUNCTIONAL, 0.0, 0));
    assertEquals(Thresholds.highThreshold(ComparisonMode.FUNCTIONAL, 0.1, 5),
      Thresholds.highThreshold(ComparisonMode.FUNCTIONAL, Double.NaN, 5));
  }

  @Test
  void magnitudeIndex_bucketsByTenths() {
    assertEquals(0, Thresholds.magnitudeIndex(0.15));
    assertEquals(2, Thresholds.magnitudeIndex(0.3));
    assertEquals(6, Thresholds.magnitudeIndex(0.7));
    assertEquals(9, Thresholds.magnitudeIndex(1.0));
  }

  @Test
  void highThreshold_neverIncreases_andNeverDropsBelowLowThreshold() {
    for (ComparisonMode mode : ComparisonMode.values()) {
      for (int m = 1; m <= 10; m++) {
        for (int n = 1; n <= 20; n++) {
          double value = Thresholds.highThreshold(mode, m / 10.0, n);
          assertTrue(value >= Thresholds.LOW_THRESHOLD);
          if (n > 1) {
            assertTrue(value <= Thresholds.highThreshold(mode, m / 10.0, n - 1),
              mode + " grows with attempts at magnitude " + m / 10.0 + ", n " + n);
          }
          if (m > 1) {
            assertTrue(value <= Thresholds.highThreshold(mode, (m - 1) / 10.0, n),
              mode + " grows with magnitude at magnitude " + m / 10.0 + ", n " + n);
          }
        }
      }
    }
  }
}
