package io.github.themoah.regdetect.changepoint;

import io.github.themoah.regdetect.model.ChangePoint;
import io.github.themoah.regdetect.model.DataPoint;
import io.github.themoah.regdetect.stats.SegmentStatistics;
import io.github.themoah.regdetect.stats.StatisticalUtils;
import io.github.themoah.regdetect.stats.WelchTTest;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Finds statistically significant level shifts in a series.
 *
 * <p>Every split index inside the window with enough points on both sides is a
 * potential change point. A split becomes a candidate when the segment means
 * differ by at least {@code multipleOfStdDev} pooled standard deviations and, when
 * {@code minSteppiness} is set, the two segments fit a step function well enough.
 * Overlapping candidates are resolved greedily, largest mean shift first. A selected
 * split is kept when its absolute change or its relative change passes its threshold.
 *
 * <p>Detection is a pure function of the series and config; instances hold no
 * mutable state and can be shared between threads.
 */
public class ChangePointDetector {

  private static final Comparator<Candidate> SELECTION_ORDER =
    Comparator.comparingDouble(Candidate::absoluteChange).reversed()
      .thenComparingDouble(c -> c.tTest().pValue())
      .thenComparingInt(Candidate::index);

  private final AnomalyConfig config;

  /**
   * @throws InvalidConfigException if the config has out-of-range values
   */
  public ChangePointDetector(AnomalyConfig config) {
    this.config = config.validate();
  }

  /**
   * Finds change points in a series.
   *
   * @param series points ordered by strictly increasing revision
   * @return change points ordered by revision; empty when the series is too short
   */
  public List<ChangePoint> findChangePoints(List<DataPoint> series) {
    int n = series.size();
    int minSegment = config.minSegmentSize();
    if (n < 2 * minSegment) {
      return List.of();
    }
    int first = Math.max(windowStart(n), minSegment);
    int last = n - minSegment;
    return findChangePointsAt(series, IntStream.rangeClosed(first, last).toArray());
  }

  /**
   * Evaluates only the given split indices, applying the same segment-size,
   * significance, overlap and magnitude rules as {@link #findChangePoints(List)}.
   * Indices outside the window or without enough points on either side are skipped.
   *
   * @param series points ordered by strictly increasing revision
   * @param splitIndices indices of the first point after each proposed shift
   * @return change points ordered by revision
   */
  public List<ChangePoint> findChangePointsAt(List<DataPoint> series, int[] splitIndices) {
    int n = series.size();
    int minSegment = config.minSegmentSize();
    if (n < 2 * minSegment) {
      return List.of();
    }
    double[] values = series.stream().mapToDouble(DataPoint::value).toArray();
    int windowStart = windowStart(n);

    List<Candidate> candidates = new ArrayList<>();
    for (int index : splitIndices) {
      if (index < Math.max(windowStart, minSegment) || index > n - minSegment) {
        continue;
      }
      Candidate candidate = evaluateSplit(values, index);
      if (candidate != null) {
        candidates.add(candidate);
      }
    }

    long windowEnd = series.get(n - 1).revision();
    return selectNonOverlapping(candidates).stream()
      .filter(this::passesMagnitudeThresholds)
      .sorted(Comparator.comparingInt(Candidate::index))
      .map(c -> toChangePoint(series, c, windowEnd))
      .collect(Collectors.toList());
  }

  public AnomalyConfig config() {
    return config;
  }

  private int windowStart(int n) {
    return config.maxWindowSize() > 0 ? Math.max(0, n - config.maxWindowSize()) : 0;
  }

  private Candidate evaluateSplit(double[] values, int index) {
    int maxSegment = config.effectiveMaxSegmentSize();
    int from = Math.max(0, index - maxSegment);
    int to = Math.min(values.length, index + maxSegment);

    SegmentStatistics before = SegmentStatistics.of(values, from, index);
    SegmentStatistics after = SegmentStatistics.of(values, index, to);
    double absoluteChange = Math.abs(after.mean() - before.mean());
    if (absoluteChange == 0.0) {
      return null;
    }

    double pooledStdDev = SegmentStatistics.pooledStdDev(before, after);
    if (absoluteChange < config.multipleOfStdDev() * pooledStdDev) {
      return null;
    }
    if (steppiness(values, from, index, to, before, after) < config.minSteppiness()) {
      return null;
    }
    return new Candidate(index, from, to, before, after, absoluteChange, WelchTTest.test(before, after));
  }

  /**
   * How well a step at {@code split} explains {@code values[from, to)}: one minus the
   * ratio of the residual sum of squares around the two segment means to the residual
   * sum of squares around the overall mean. A flat range scores 0.
   */
  static double steppiness(
      double[] values, int from, int split, int to,
      SegmentStatistics before, SegmentStatistics after
  ) {
    double overallMean = StatisticalUtils.mean(values, from, to);
    double flatResiduals = StatisticalUtils.sumSquaredDiffs(values, from, to, overallMean);
    if (flatResiduals == 0.0) {
      return 0.0;
    }
    double stepResiduals = StatisticalUtils.sumSquaredDiffs(values, from, split, before.mean())
      + StatisticalUtils.sumSquaredDiffs(values, split, to, after.mean());
    return Math.max(0.0, 1.0 - stepResiduals / flatResiduals);
  }

  private static List<Candidate> selectNonOverlapping(List<Candidate> candidates) {
    List<Candidate> sorted = new ArrayList<>(candidates);
    sorted.sort(SELECTION_ORDER);

    List<Candidate> accepted = new ArrayList<>();
    for (Candidate candidate : sorted) {
      boolean overlaps = accepted.stream().anyMatch(candidate::overlaps);
      if (!overlaps) {
        accepted.add(candidate);
      }
    }
    return accepted;
  }

  // Either the absolute or the relative change must be large enough; the relative
  // change is undefined when the mean before is 0.
  private boolean passesMagnitudeThresholds(Candidate candidate) {
    double change = candidate.absoluteChange();
    if (change >= config.minAbsoluteChange()) {
      return true;
    }
    double meanBefore = candidate.before().mean();
    return meanBefore != 0.0 && change / Math.abs(meanBefore) >= config.minRelativeChange();
  }

  private static ChangePoint toChangePoint(List<DataPoint> series, Candidate c, long windowEnd) {
    return new ChangePoint(
      series.get(c.index()).revision(),
      c.before().median(),
      c.after().median(),
      c.before().mean(),
      c.after().mean(),
      c.before().stdDev(),
      c.after().stdDev(),
      c.before().count(),
      c.after().count(),
      windowEnd,
      c.tTest().tStatistic(),
      c.tTest().degreesOfFreedom(),
      c.tTest().pValue()
    );
  }

  /**
   * A split that passed the significance checks. Segments cover [from, index) and [index, to).
   */
  private record Candidate(
    int index,
    int from,
    int to,
    SegmentStatistics before,
    SegmentStatistics after,
    double absoluteChange,
    WelchTTest.Result tTest
  ) {
    boolean overlaps(Candidate other) {
      return from < other.to && other.from < to;
    }
  }
}
