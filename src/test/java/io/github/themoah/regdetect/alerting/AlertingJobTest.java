package io.github.themoah.regdetect.alerting;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.regdetect.changepoint.AnomalyConfig;
import io.github.themoah.regdetect.metrics.MetricsReporter;
import io.github.themoah.regdetect.model.Anomaly;
import io.github.themoah.regdetect.model.DataPoint;
import io.github.themoah.regdetect.model.ImprovementDirection;
import io.github.themoah.regdetect.model.MonitoredSeries;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for AlertingJob.
 */
@ExtendWith(VertxExtension.class)
public class AlertingJobTest {

  private static final String PATH = "suite/metric";
  private static final String REF_PATH = "suite/metric_ref";
  private static final AnomalyConfig WIDE_WINDOW =
    AnomalyConfig.defaults().withOverrides(Map.of(AnomalyConfig.MAX_WINDOW_SIZE, 100));

  @Test
  void runCycle_storesAnomaliesAndAdvancesCursor(Vertx vertx, VertxTestContext ctx) throws Exception {
    InMemorySeriesStore store = new InMemorySeriesStore();
    store.putSeries(series(PATH, null, true), AnomalyProcessorTest.levels(10, 20, 5));
    RecordingReporter reporter = new RecordingReporter();
    AlertingJob job = job(vertx, store, reporter);

    assertFalse(job.isReady());

    job.runCycle()
      .compose(first -> {
        ctx.verify(() -> {
          assertEquals(new AlertingJob.CycleResult(1, 0, 2), first);
          assertTrue(job.isReady());
          assertTrue(job.lastSuccessfulCycleMs() > 0);
        });
        return store.getCursor(PATH);
      })
      .compose(cursor -> {
        ctx.verify(() -> assertEquals(1500L, cursor));
        return job.runCycle();
      })
      .compose(second -> {
        ctx.verify(() -> assertEquals(new AlertingJob.CycleResult(1, 0, 0), second));
        return store.getAnomalies(PATH);
      })
      .onComplete(ctx.succeeding(anomalies -> ctx.verify(() -> {
        assertEquals(2, anomalies.size());
        assertEquals(List.of(PATH, PATH), reporter.processed);
        assertEquals(2, reporter.cycles.size());
        assertEquals(Set.of(PATH), reporter.gaugeKeys);
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(10, TimeUnit.SECONDS));
  }

  @Test
  void runCycle_skipsUnmonitoredSeries_andUsesRefSeries(Vertx vertx, VertxTestContext ctx) throws Exception {
    InMemorySeriesStore store = new InMemorySeriesStore();
    store.putSeries(series(PATH, REF_PATH, true), AnomalyProcessorTest.levels(10, 20, 5));
    store.putSeries(series(REF_PATH, null, false), AnomalyProcessorTest.levels(10, 20, 20));
    RecordingReporter reporter = new RecordingReporter();

    job(vertx, store, reporter).runCycle()
      .compose(result -> {
        ctx.verify(() -> assertEquals(new AlertingJob.CycleResult(1, 0, 1), result));
        return store.getAnomalies(PATH);
      })
      .onComplete(ctx.succeeding(anomalies -> ctx.verify(() -> {
        assertEquals(1, anomalies.size());
        assertEquals(1500, anomalies.get(0).endRevision());
        assertEquals(REF_PATH, anomalies.get(0).refTestPath());
        assertEquals(List.of(PATH), reporter.processed);
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(10, TimeUnit.SECONDS));
  }

  @Test
  void runCycle_failingSeries_isCountedAndOthersContinue(Vertx vertx, VertxTestContext ctx) throws Exception {
    InMemorySeriesStore store = new InMemorySeriesStore() {
      @Override
      public Future<List<DataPoint>> getPoints(String testPath, long afterRevision, int limit) {
        if (testPath.equals("suite/broken")) {
          return Future.failedFuture(new IllegalStateException("storage unavailable"));
        }
        return super.getPoints(testPath, afterRevision, limit);
      }
    };
    store.putSeries(series("suite/broken", null, true), AnomalyProcessorTest.levels(10, 20, 5));
    store.putSeries(series(PATH, null, true), AnomalyProcessorTest.levels(10, 20, 5));
    RecordingReporter reporter = new RecordingReporter();
    AlertingJob job = job(vertx, store, reporter);

    job.runCycle().onComplete(ctx.succeeding(result -> ctx.verify(() -> {
      assertEquals(new AlertingJob.CycleResult(1, 1, 2), result);
      assertEquals(List.of("suite/broken"), reporter.failed);
      assertEquals(List.of(PATH), reporter.processed);
      assertTrue(job.isReady());
      ctx.completeNow();
    })));

    assertTrue(ctx.awaitCompletion(10, TimeUnit.SECONDS));
  }

  @Test
  void runCycle_listingFails_failsCycle(Vertx vertx, VertxTestContext ctx) throws Exception {
    InMemorySeriesStore store = new InMemorySeriesStore() {
      @Override
      public Future<List<MonitoredSeries>> listMonitoredSeries() {
        return Future.failedFuture(new IllegalStateException("storage unavailable"));
      }
    };
    AlertingJob job = job(vertx, store, new RecordingReporter());

    job.runCycle()
      .recover(err -> {
        ctx.verify(() -> assertFalse(job.isReady()));
        return job.runCycle();
      })
      .onComplete(ctx.failing(err -> ctx.verify(() -> {
        assertEquals("storage unavailable", err.getMessage());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(10, TimeUnit.SECONDS));
  }

  @Test
  void startAndStop(Vertx vertx, VertxTestContext ctx) throws Exception {
    InMemorySeriesStore store = new InMemorySeriesStore();
    store.putSeries(series(PATH, null, true), AnomalyProcessorTest.levels(10, 20, 5));
    RecordingReporter reporter = new RecordingReporter();
    AlertingJob job = job(vertx, store, reporter);

    job.start()
      .compose(v -> {
        ctx.verify(() -> assertTrue(job.isReady()));
        return job.stop();
      })
      .onComplete(ctx.succeeding(v -> ctx.verify(() -> {
        assertTrue(reporter.started);
        assertTrue(reporter.closed);
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(10, TimeUnit.SECONDS));
  }

  private static AlertingJob job(Vertx vertx, SeriesStore store, MetricsReporter reporter) {
    return new AlertingJob(vertx, store, new AnomalyProcessor(DetectionAlgorithm.SEGMENT), reporter, 60_000);
  }

  private static MonitoredSeries series(String path, String refPath, boolean monitored) {
    return new MonitoredSeries(path, ImprovementDirection.UP, refPath, WIDE_WINDOW, monitored);
  }

  private static final class RecordingReporter implements MetricsReporter {
    private final List<String> processed = new CopyOnWriteArrayList<>();
    private final List<String> failed = new CopyOnWriteArrayList<>();
    private final List<Long> cycles = new CopyOnWriteArrayList<>();
    private final Set<String> gaugeKeys = ConcurrentHashMap.newKeySet();
    private volatile boolean started;
    private volatile boolean closed;

    @Override
    public void reportSeriesProcessed(String testPath, List<Anomaly> anomalies, long cursor, Set<String> activeKeys) {
      processed.add(testPath);
      activeKeys.add(testPath);
    }

    @Override
    public void reportSeriesFailed(String testPath) {
      failed.add(testPath);
    }

    @Override
    public void reportCycle(long durationMs, int seriesCount) {
      cycles.add(durationMs);
    }

    @Override
    public void cleanupStaleGauges(Set<String> activeKeys) {
      gaugeKeys.addAll(activeKeys);
    }

    @Override
    public Future<Void> start() {
      started = true;
      return Future.succeededFuture();
    }

    @Override
    public Future<Void> close() {
      closed = true;
      return Future.succeededFuture();
    }
  }
}
