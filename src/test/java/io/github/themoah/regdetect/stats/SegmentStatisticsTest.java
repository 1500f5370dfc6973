package io.github.themoah.regdetect.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for SegmentStatistics.
 */
public class SegmentStatisticsTest {

  private static final double DELTA = 1e-9;

  @Test
  void of_computesCountMeanMedianAndStdDev() {
    SegmentStatistics stats = SegmentStatistics.of(new double[] {1, 2, 3, 4, 10});

    assertEquals(5, stats.count());
    assertEquals(4.0, stats.mean(), DELTA);
    assertEquals(3.0, stats.median(), DELTA);
    assertEquals(Math.sqrt(50.0 / 4.0), stats.stdDev(), DELTA);
    assertEquals(12.5, stats.variance(), DELTA);
  }

  @Test
  void of_range_usesOnlyThatSlice() {
    double[] values = {100, 1, 2, 3, 100};

    SegmentStatistics stats = SegmentStatistics.of(values, 1, 4);

    assertEquals(3, stats.count());
    assertEquals(2.0, stats.mean(), DELTA);
    assertEquals(1.0, stats.stdDev(), DELTA);
  }

  @Test
  void of_singleValue_hasZeroStdDev() {
    SegmentStatistics stats = SegmentStatistics.of(new double[] {5});

    assertEquals(1, stats.count());
    assertEquals(0.0, stats.stdDev(), DELTA);
  }

  @Test
  void of_emptyRange_throwsInsufficientData() {
    assertThrows(InsufficientDataException.class, () -> SegmentStatistics.of(new double[] {1, 2}, 1, 1));
    assertThrows(InsufficientDataException.class, () -> SegmentStatistics.of(new double[0]));
  }

  @Test
  void pooledStdDev_weightsByDegreesOfFreedom() {
    // variance 1 with 3 dof, variance 4 with 1 dof: (3 * 1 + 1 * 4) / 4
    SegmentStatistics a = new SegmentStatistics(4, 0, 0, 1.0);
    SegmentStatistics b = new SegmentStatistics(2, 0, 0, 2.0);

    assertEquals(Math.sqrt(7.0 / 4.0), SegmentStatistics.pooledStdDev(a, b), DELTA);
  }

  @Test
  void pooledStdDev_twoSingleValues_isZero() {
    SegmentStatistics a = SegmentStatistics.of(new double[] {1});
    SegmentStatistics b = SegmentStatistics.of(new double[] {9});

    assertEquals(0.0, SegmentStatistics.pooledStdDev(a, b), DELTA);
  }
}
