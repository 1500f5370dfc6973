package io.github.themoah.regdetect.metrics;

import io.github.themoah.regdetect.model.Anomaly;
import io.vertx.core.Future;
import java.util.List;
import java.util.Set;

/**
 * Interface for reporting alerting activity to external systems.
 */
public interface MetricsReporter {

  /**
   * Reports a successfully processed series.
   *
   * @param testPath series path
   * @param anomalies anomalies raised in this cycle
   * @param cursor the series' cursor after processing
   * @param activeKeys set to populate with active gauge keys (can be null)
   */
  void reportSeriesProcessed(String testPath, List<Anomaly> anomalies, long cursor, Set<String> activeKeys);

  /**
   * Reports a series whose processing failed.
   */
  void reportSeriesFailed(String testPath);

  /**
   * Reports a finished alerting cycle.
   *
   * @param durationMs wall-clock duration of the cycle
   * @param seriesCount number of monitored series processed
   */
  void reportCycle(long durationMs, int seriesCount);

  /**
   * Removes gauges of series that were not reported for two cycles in a row.
   *
   * @param activeKeys gauge keys updated in the current cycle
   */
  default void cleanupStaleGauges(Set<String> activeKeys) {
    // Default no-op implementation for reporters without per-series gauges
  }

  /**
   * Starts the reporter.
   *
   * @return Future that completes when started
   */
  Future<Void> start();

  /**
   * Closes the reporter and releases resources.
   *
   * @return Future that completes when closed
   */
  Future<Void> close();

  /**
   * A reporter that records nothing, used when metrics are disabled.
   */
  static MetricsReporter noop() {
    return new MetricsReporter() {
      @Override
      public void reportSeriesProcessed(String testPath, List<Anomaly> anomalies, long cursor, Set<String> activeKeys) {
      }

      @Override
      public void reportSeriesFailed(String testPath) {
      }

      @Override
      public void reportCycle(long durationMs, int seriesCount) {
      }

      @Override
      public Future<Void> start() {
        return Future.succeededFuture();
      }

      @Override
      public Future<Void> close() {
        return Future.succeededFuture();
      }
    };
  }
}
