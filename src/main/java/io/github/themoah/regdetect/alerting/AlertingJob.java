package io.github.themoah.regdetect.alerting;

import io.github.themoah.regdetect.metrics.MetricsReporter;
import io.github.themoah.regdetect.model.DataPoint;
import io.github.themoah.regdetect.model.MonitoredSeries;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically runs anomaly detection over every monitored series.
 *
 * <p>Each cycle fetches the points after each series' cursor, runs detection on
 * worker threads for all series in parallel, and stores the new anomalies. A
 * series that fails is logged and skipped; the rest of the cycle carries on.
 * A cycle that is still running when the timer fires again is not overlapped.
 */
public class AlertingJob {

  private static final Logger log = LoggerFactory.getLogger(AlertingJob.class);

  private final Vertx vertx;
  private final SeriesStore store;
  private final AnomalyProcessor processor;
  private final MetricsReporter reporter;
  private final long intervalMs;

  private final AtomicBoolean cycleRunning = new AtomicBoolean(false);
  private final AtomicLong lastSuccessfulCycleMs = new AtomicLong(0L);

  private Long timerId;

  /**
   * Summary of one alerting cycle.
   *
   * @param seriesProcessed monitored series processed successfully
   * @param seriesFailed monitored series whose processing failed
   * @param anomaliesCreated anomalies raised across all series
   */
  public record CycleResult(int seriesProcessed, int seriesFailed, int anomaliesCreated) {

    static CycleResult skipped() {
      return new CycleResult(0, 0, 0);
    }
  }

  private record SeriesOutcome(boolean succeeded, int anomalies) {}

  public AlertingJob(
    Vertx vertx,
    SeriesStore store,
    AnomalyProcessor processor,
    MetricsReporter reporter,
    long intervalMs
  ) {
    this.vertx = vertx;
    this.store = store;
    this.processor = processor;
    this.reporter = reporter;
    this.intervalMs = intervalMs;
  }

  /**
   * Starts the job: runs a first cycle, then one every interval.
   */
  public Future<Void> start() {
    log.info("Starting alerting job with interval: {}ms, algorithm: {}",
      intervalMs, processor.algorithm().getValue());

    return reporter.start()
      .compose(v -> runCycle())
      .onComplete(ar -> {
        timerId = vertx.setPeriodic(intervalMs, id -> runCycle());
        log.info("Alerting job started, timer ID: {}", timerId);
      })
      .mapEmpty();
  }

  /**
   * Stops the job.
   */
  public Future<Void> stop() {
    log.info("Stopping alerting job");
    if (timerId != null) {
      vertx.cancelTimer(timerId);
      timerId = null;
    }
    return reporter.close();
  }

  /**
   * True once a cycle has completed, even if some series in it failed.
   */
  public boolean isReady() {
    return lastSuccessfulCycleMs.get() > 0;
  }

  /**
   * Wall-clock time the last completed cycle finished, or 0 if none has.
   */
  public long lastSuccessfulCycleMs() {
    return lastSuccessfulCycleMs.get();
  }

  /**
   * Runs one alerting cycle now, unless one is already running.
   *
   * @return the cycle summary; fails only if the series could not be listed
   */
  public Future<CycleResult> runCycle() {
    if (!cycleRunning.compareAndSet(false, true)) {
      log.warn("Previous alerting cycle still running, skipping");
      return Future.succeededFuture(CycleResult.skipped());
    }
    long startedMs = System.currentTimeMillis();
    log.debug("Starting alerting cycle");

    return store.listMonitoredSeries()
      .compose(all -> {
        List<MonitoredSeries> monitored = all.stream()
          .filter(MonitoredSeries::monitored)
          .collect(Collectors.toList());
        log.debug("Found {} series, {} monitored", all.size(), monitored.size());

        Set<String> activeKeys = ConcurrentHashMap.newKeySet();
        List<Future<SeriesOutcome>> outcomes = monitored.stream()
          .map(series -> processOne(series, activeKeys))
          .collect(Collectors.toList());

        return Future.all(outcomes).map(composite -> {
          int processed = 0;
          int failed = 0;
          int anomalies = 0;
          for (int i = 0; i < composite.size(); i++) {
            SeriesOutcome outcome = composite.resultAt(i);
            if (outcome.succeeded()) {
              processed++;
              anomalies += outcome.anomalies();
            } else {
              failed++;
            }
          }
          reporter.cleanupStaleGauges(new HashSet<>(activeKeys));
          return new CycleResult(processed, failed, anomalies);
        });
      })
      .onSuccess(result -> {
        long now = System.currentTimeMillis();
        lastSuccessfulCycleMs.set(now);
        reporter.reportCycle(now - startedMs, result.seriesProcessed() + result.seriesFailed());
        if (result.anomaliesCreated() > 0 || result.seriesFailed() > 0) {
          log.info("Alerting cycle finished: {} series processed, {} failed, {} anomalies created",
            result.seriesProcessed(), result.seriesFailed(), result.anomaliesCreated());
        } else {
          log.debug("Alerting cycle finished: {} series processed, no anomalies", result.seriesProcessed());
        }
      })
      .onFailure(err -> log.error("Alerting cycle failed", err))
      .onComplete(ar -> cycleRunning.set(false));
  }

  // Never fails: a failing series is reported and counted.
  private Future<SeriesOutcome> processOne(MonitoredSeries series, Set<String> activeKeys) {
    String testPath = series.testPath();
    int limit = series.anomalyConfig().maxWindowSize() > 0
      ? series.anomalyConfig().maxWindowSize()
      : AnomalyProcessor.DEFAULT_NUM_POINTS;

    return store.getCursor(testPath)
      .compose(cursor -> {
        Future<List<DataPoint>> points = store.getPoints(testPath, cursor, limit);
        Future<List<DataPoint>> refPoints = series.hasRefSeries()
          ? store.getPoints(series.refTestPath(), cursor, limit)
          : Future.succeededFuture(List.of());

        return Future.all(points, refPoints)
          .compose(composite -> vertx.executeBlocking(() -> processor.processSeries(
            series, composite.resultAt(0), composite.resultAt(1), cursor), false));
      })
      .compose(result -> store.saveAnomalies(testPath, result.anomalies(), result.cursor())
        .map(v -> result))
      .map(result -> {
        reporter.reportSeriesProcessed(testPath, result.anomalies(), result.cursor(), activeKeys);
        return new SeriesOutcome(true, result.anomalies().size());
      })
      .recover(err -> {
        log.warn("Failed to process series {}: {}", testPath, err.getMessage());
        reporter.reportSeriesFailed(testPath);
        return Future.succeededFuture(new SeriesOutcome(false, 0));
      });
  }
}
