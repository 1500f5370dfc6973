package io.github.themoah.regdetect.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for WelchTTest.
 */
public class WelchTTestTest {

  private static final double DELTA = 1e-9;

  @Test
  void test_equalVariances_matchesReferenceValues() {
    SegmentStatistics a = SegmentStatistics.of(new double[] {1, 2, 3, 4, 5});
    SegmentStatistics b = SegmentStatistics.of(new double[] {6, 7, 8, 9, 10});

    WelchTTest.Result result = WelchTTest.test(a, b);

    assertEquals(-5.0, result.tStatistic(), DELTA);
    assertEquals(8.0, result.degreesOfFreedom(), DELTA);
    assertEquals(0.0010528, result.pValue(), 1e-6);
  }

  @Test
  void test_isSymmetricUpToSign() {
    SegmentStatistics a = SegmentStatistics.of(new double[] {10, 12, 11, 13, 9});
    SegmentStatistics b = SegmentStatistics.of(new double[] {14, 18, 15, 20, 16, 17});

    WelchTTest.Result ab = WelchTTest.test(a, b);
    WelchTTest.Result ba = WelchTTest.test(b, a);

    assertEquals(-ab.tStatistic(), ba.tStatistic(), DELTA);
    assertEquals(ab.degreesOfFreedom(), ba.degreesOfFreedom(), DELTA);
    assertEquals(ab.pValue(), ba.pValue(), DELTA);
  }

  @Test
  void test_zeroVariance_equalMeans_isNotSignificant() {
    SegmentStatistics a = SegmentStatistics.of(new double[] {4, 4, 4});
    SegmentStatistics b = SegmentStatistics.of(new double[] {4, 4, 4, 4});

    WelchTTest.Result result = WelchTTest.test(a, b);

    assertEquals(0.0, result.tStatistic());
    assertEquals(1.0, result.pValue());
    assertEquals(5.0, result.degreesOfFreedom(), DELTA);
  }

  @Test
  void test_zeroVariance_differentMeans_isMaximallySignificant() {
    SegmentStatistics a = SegmentStatistics.of(new double[] {10, 10, 10});
    SegmentStatistics b = SegmentStatistics.of(new double[] {20, 20, 20});

    WelchTTest.Result result = WelchTTest.test(a, b);

    assertEquals(Double.NEGATIVE_INFINITY, result.tStatistic());
    assertEquals(0.0, result.pValue());
  }

  @Test
  void test_pValue_isAProbability() {
    SegmentStatistics a = SegmentStatistics.of(new double[] {1, 1.1, 0.9, 1.05});
    SegmentStatistics b = SegmentStatistics.of(new double[] {1.02, 0.98, 1.01});

    WelchTTest.Result result = WelchTTest.test(a, b);

    assertTrue(result.pValue() > 0.5 && result.pValue() <= 1.0);
  }
}
