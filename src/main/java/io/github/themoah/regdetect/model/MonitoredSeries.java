package io.github.themoah.regdetect.model;

import io.github.themoah.regdetect.changepoint.AnomalyConfig;

/**
 * A series the alerting job watches, with its per-series detection settings.
 *
 * @param testPath unique path of the series
 * @param improvementDirection which way the metric improves
 * @param refTestPath path of the matching reference build series, or null
 * @param anomalyConfig detector thresholds for this series
 * @param monitored whether alerting runs on this series (reference series usually are not)
 */
public record MonitoredSeries(
  String testPath,
  ImprovementDirection improvementDirection,
  String refTestPath,
  AnomalyConfig anomalyConfig,
  boolean monitored
) {

  public boolean hasRefSeries() {
    return refTestPath != null && !refTestPath.isBlank();
  }
}
