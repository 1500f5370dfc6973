package io.github.themoah.regdetect.alerting;

import io.github.themoah.regdetect.model.Anomaly;
import java.util.List;

/**
 * Outcome of processing one series.
 *
 * @param anomalies new anomalies, ordered by revision
 * @param cursor end revision of the newest anomaly ever raised on the series,
 *     or {@link AnomalyProcessor#NO_CURSOR}
 */
public record ProcessResult(List<Anomaly> anomalies, long cursor) {

  public ProcessResult {
    anomalies = List.copyOf(anomalies);
  }
}
