package io.github.themoah.regdetect.alerting;

import io.github.themoah.regdetect.changepoint.ChangePointDetector;
import io.github.themoah.regdetect.changepoint.clustering.ClusteringChangeDetector;
import io.github.themoah.regdetect.model.Anomaly;
import io.github.themoah.regdetect.model.ChangePoint;
import io.github.themoah.regdetect.model.DataPoint;
import io.github.themoah.regdetect.model.MonitoredSeries;
import io.github.themoah.regdetect.stats.InsufficientDataException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the change points found on a series into anomalies.
 *
 * <p>Change points at or before the series' cursor were already alerted on and are
 * dropped, as are change points that also show up at the same revision of the
 * series' reference build, since those come from the environment rather than the
 * change under test.
 *
 * <p>Stateless apart from its settings; safe to call from several worker threads.
 */
public class AnomalyProcessor {

  private static final Logger log = LoggerFactory.getLogger(AnomalyProcessor.class);

  /** Cursor of a series that has never raised an anomaly. */
  public static final long NO_CURSOR = Long.MIN_VALUE;

  /** Points analyzed per series when the series sets no window size. */
  public static final int DEFAULT_NUM_POINTS = 50;

  private final DetectionAlgorithm algorithm;
  private final long randomSeed;

  public AnomalyProcessor(DetectionAlgorithm algorithm) {
    this(algorithm, 0L);
  }

  /**
   * @param algorithm how candidate change points are proposed
   * @param randomSeed seed for the clustering permutation tests
   */
  public AnomalyProcessor(DetectionAlgorithm algorithm, long randomSeed) {
    this.algorithm = algorithm;
    this.randomSeed = randomSeed;
  }

  /**
   * Finds new anomalies on a series.
   *
   * @param series the series and its detection settings
   * @param points points to analyze, ordered by revision
   * @param refPoints points of the reference build series, empty if there is none
   * @param cursor end revision of the newest earlier anomaly, or {@link #NO_CURSOR}
   * @return new anomalies and the advanced cursor
   * @throws io.github.themoah.regdetect.changepoint.InvalidConfigException if the
   *     series' config is invalid
   */
  public ProcessResult processSeries(
      MonitoredSeries series,
      List<DataPoint> points,
      List<DataPoint> refPoints,
      long cursor
  ) {
    ChangePointDetector detector = new ChangePointDetector(series.anomalyConfig());

    List<ChangePoint> changePoints = findChangePoints(detector, points).stream()
      .filter(cp -> cp.xValue() > cursor)
      .collect(Collectors.toList());

    if (!changePoints.isEmpty() && !refPoints.isEmpty()) {
      Set<Long> refRevisions = findChangePoints(detector, refPoints).stream()
        .map(ChangePoint::xValue)
        .collect(Collectors.toSet());
      int before = changePoints.size();
      changePoints.removeIf(cp -> refRevisions.contains(cp.xValue()));
      if (changePoints.size() < before) {
        log.debug("Dropped {} change points on {} also found in {}",
          before - changePoints.size(), series.testPath(), series.refTestPath());
      }
    }

    List<Anomaly> anomalies = new ArrayList<>(changePoints.size());
    long newCursor = cursor;
    for (ChangePoint cp : changePoints) {
      Anomaly anomaly = toAnomaly(series, cp, points);
      anomalies.add(anomaly);
      newCursor = Math.max(newCursor, anomaly.endRevision());
    }

    log.debug("Created {} anomalies on {}", anomalies.size(), series.testPath());
    return new ProcessResult(anomalies, newCursor);
  }

  public DetectionAlgorithm algorithm() {
    return algorithm;
  }

  private List<ChangePoint> findChangePoints(ChangePointDetector detector, List<DataPoint> points) {
    if (algorithm == DetectionAlgorithm.SEGMENT) {
      return detector.findChangePoints(points);
    }
    double[] values = points.stream().mapToDouble(DataPoint::value).toArray();
    List<Integer> splits;
    try {
      splits = new ClusteringChangeDetector(new Random(randomSeed)).clusterAndFindSplit(values);
    } catch (InsufficientDataException e) {
      log.debug("No clustering candidates: {}", e.getMessage());
      return List.of();
    }
    return detector.findChangePointsAt(points, splits.stream().mapToInt(Integer::intValue).toArray());
  }

  private static Anomaly toAnomaly(MonitoredSeries series, ChangePoint cp, List<DataPoint> points) {
    long endRevision = cp.xValue();
    return new Anomaly(
      series.testPath(),
      previousRevision(endRevision, points) + 1,
      endRevision,
      cp.medianBefore(),
      cp.medianAfter(),
      cp.sizeBefore(),
      cp.sizeAfter(),
      cp.windowEnd(),
      cp.stdDevBefore(),
      cp.tStatistic(),
      cp.degreesOfFreedom(),
      cp.pValue(),
      series.improvementDirection().isImprovement(cp.medianBefore(), cp.medianAfter()),
      series.hasRefSeries() ? series.refTestPath() : null
    );
  }

  // Change points never sit at index 0, so a previous point always exists.
  private static long previousRevision(long revision, List<DataPoint> points) {
    long previous = revision - 1;
    for (DataPoint point : points) {
      if (point.revision() >= revision) {
        break;
      }
      previous = point.revision();
    }
    return previous;
  }
}
