package io.github.themoah.regdetect.metrics;

import io.github.themoah.regdetect.alerting.AnomalyProcessor;
import io.github.themoah.regdetect.model.Anomaly;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.vertx.core.Future;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports metrics using Micrometer MeterRegistry.
 * Works with any Micrometer-supported backend.
 */
public class MicrometerReporter implements MetricsReporter {

  private static final Logger log = LoggerFactory.getLogger(MicrometerReporter.class);

  static final String ANOMALIES_DETECTED = "regdetect.anomalies.detected";
  static final String SERIES_PROCESSED = "regdetect.series.processed";
  static final String SERIES_FAILED = "regdetect.series.failed";
  static final String CYCLE_DURATION = "regdetect.alerting.cycle.duration";
  static final String SERIES_CURSOR = "regdetect.series.cursor";

  private final MeterRegistry registry;
  private final Map<String, TrackedGauge> gauges = new ConcurrentHashMap<>();
  private final Set<String> markedForDeletion = ConcurrentHashMap.newKeySet();

  private record TrackedGauge(AtomicLong value, Gauge gauge) {}

  public MicrometerReporter(MeterRegistry registry) {
    this.registry = registry;
  }

  @Override
  public void reportSeriesProcessed(String testPath, List<Anomaly> anomalies, long cursor, Set<String> activeKeys) {
    Tags seriesTags = Tags.of("test_path", testPath);
    Counter.builder(SERIES_PROCESSED).tags(seriesTags).register(registry).increment();

    long regressions = anomalies.stream().filter(Anomaly::isRegression).count();
    long improvements = anomalies.size() - regressions;
    if (regressions > 0) {
      anomalyCounter(testPath, "regression").increment(regressions);
    }
    if (improvements > 0) {
      anomalyCounter(testPath, "improvement").increment(improvements);
    }

    // No gauge until the series has raised its first anomaly
    if (cursor != AnomalyProcessor.NO_CURSOR) {
      trackKey(activeKeys, recordGauge(SERIES_CURSOR, seriesTags, cursor));
    }
  }

  @Override
  public void reportSeriesFailed(String testPath) {
    Counter.builder(SERIES_FAILED)
      .tags(Tags.of("test_path", testPath))
      .register(registry)
      .increment();
  }

  @Override
  public void reportCycle(long durationMs, int seriesCount) {
    Timer.builder(CYCLE_DURATION)
      .register(registry)
      .record(Duration.ofMillis(durationMs));
    log.debug("Reported alerting cycle: {} series in {}ms", seriesCount, durationMs);
  }

  @Override
  public Future<Void> start() {
    log.info("MicrometerReporter started");
    return Future.succeededFuture();
  }

  @Override
  public Future<Void> close() {
    log.info("Closing MicrometerReporter");
    if (registry != null) {
      registry.close();
    }
    return Future.succeededFuture();
  }

  private Counter anomalyCounter(String testPath, String kind) {
    return Counter.builder(ANOMALIES_DETECTED)
      .tags(Tags.of("test_path", testPath, "kind", kind))
      .register(registry);
  }

  private void trackKey(Set<String> activeKeys, String key) {
    if (activeKeys != null) {
      activeKeys.add(key);
    }
  }

  private String recordGauge(String name, Tags tags, long value) {
    String key = name + tags.toString();
    TrackedGauge tracked = gauges.computeIfAbsent(key, k -> {
      AtomicLong newValue = new AtomicLong(value);
      Gauge gauge = Gauge.builder(name, newValue, AtomicLong::get)
        .tags(tags)
        .register(registry);
      return new TrackedGauge(newValue, gauge);
    });
    tracked.value().set(value);
    return key;
  }

  /**
   * Two-phase cleanup for stale gauges.
   * Phase 1: Mark missing gauges for deletion
   * Phase 2: Delete gauges that were marked AND still missing
   *
   * @param activeKeys set of gauge keys that were updated in the current cycle
   */
  @Override
  public void cleanupStaleGauges(Set<String> activeKeys) {
    Set<String> toDelete = new HashSet<>(markedForDeletion);
    toDelete.removeAll(activeKeys);

    for (String key : toDelete) {
      removeGauge(key);
      markedForDeletion.remove(key);
    }
    if (!toDelete.isEmpty()) {
      log.info("Cleaned up {} stale series gauges", toDelete.size());
    }

    Set<String> missing = new HashSet<>(gauges.keySet());
    missing.removeAll(activeKeys);
    markedForDeletion.retainAll(missing);
    for (String key : missing) {
      if (markedForDeletion.add(key)) {
        log.debug("Marked gauge for deletion: {}", key);
      }
    }
  }

  private void removeGauge(String key) {
    TrackedGauge tracked = gauges.remove(key);
    if (tracked != null) {
      registry.remove(tracked.gauge());
      log.debug("Removed stale gauge: {}", key);
    }
  }
}
