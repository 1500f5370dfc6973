package io.github.themoah.regdetect.alerting;

import io.github.themoah.regdetect.model.Anomaly;
import io.github.themoah.regdetect.model.DataPoint;
import io.github.themoah.regdetect.model.MonitoredSeries;
import io.vertx.core.Future;
import java.util.List;

/**
 * Storage the alerting job reads series from and writes anomalies to.
 */
public interface SeriesStore {

  /**
   * Lists every known series, monitored or not.
   */
  Future<List<MonitoredSeries>> listMonitoredSeries();

  /**
   * Returns the newest points of a series with a revision strictly greater than
   * {@code afterRevision}, ordered by increasing revision.
   *
   * @param testPath series path
   * @param afterRevision exclusive lower bound; {@link AnomalyProcessor#NO_CURSOR} for all points
   * @param limit maximum number of points returned
   * @return the points; empty for an unknown series
   */
  Future<List<DataPoint>> getPoints(String testPath, long afterRevision, int limit);

  /**
   * End revision of the newest anomaly raised on a series, or
   * {@link AnomalyProcessor#NO_CURSOR} if there is none.
   */
  Future<Long> getCursor(String testPath);

  /**
   * Stores new anomalies and the series' cursor in one step.
   */
  Future<Void> saveAnomalies(String testPath, List<Anomaly> anomalies, long cursor);

  /**
   * All anomalies stored for a series, ordered by end revision.
   */
  Future<List<Anomaly>> getAnomalies(String testPath);
}
