package io.github.themoah.regdetect.alerting;

import io.github.themoah.regdetect.changepoint.AnomalyConfig;
import io.github.themoah.regdetect.model.Anomaly;
import io.github.themoah.regdetect.model.DataPoint;
import io.github.themoah.regdetect.model.MonitoredSeries;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Series store kept in memory, optionally seeded from a directory of JSON series files.
 * Thread-safe.
 */
public class InMemorySeriesStore implements SeriesStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySeriesStore.class);

  private final Map<String, StoredSeries> seriesByPath = new ConcurrentHashMap<>();

  /**
   * Loads every {@code *.json} file in a directory.
   *
   * @param vertx used for non-blocking file access
   * @param directory directory to scan (not recursive)
   * @param defaultConfig thresholds the files' own settings override
   * @return the loaded store; fails if the directory or any file cannot be read
   */
  public static Future<InMemorySeriesStore> fromDirectory(
      Vertx vertx, String directory, AnomalyConfig defaultConfig
  ) {
    JsonSeriesCodec codec = new JsonSeriesCodec(defaultConfig);
    InMemorySeriesStore store = new InMemorySeriesStore();

    return vertx.fileSystem().readDir(directory, ".*\\.json")
      .compose(files -> {
        List<Future<Void>> loads = files.stream()
          .sorted()
          .map(file -> vertx.fileSystem().readFile(file)
            .map(buffer -> {
              JsonSeriesCodec.SeriesFile decoded = codec.decode(buffer.toString());
              store.putSeries(decoded.series(), decoded.points());
              log.debug("Loaded series {} with {} points from {}",
                decoded.series().testPath(), decoded.points().size(), file);
              return (Void) null;
            })
            .onFailure(err -> log.error("Failed to load series file {}: {}", file, err.getMessage())))
          .collect(Collectors.toList());
        return Future.all(loads);
      })
      .map(composite -> {
        log.info("Loaded {} series from {}", store.seriesByPath.size(), directory);
        return store;
      });
  }

  /**
   * Adds or replaces a series and its points. Existing anomalies and cursor are kept.
   */
  public void putSeries(MonitoredSeries series, List<DataPoint> points) {
    seriesByPath.compute(series.testPath(), (path, existing) -> {
      StoredSeries stored = existing != null ? existing : new StoredSeries();
      synchronized (stored) {
        stored.series = series;
        stored.points.clear();
        stored.points.addAll(points);
        stored.points.sort(Comparator.comparingLong(DataPoint::revision));
      }
      return stored;
    });
  }

  /**
   * Appends points to an existing series.
   *
   * @throws IllegalArgumentException if the series is unknown
   */
  public void appendPoints(String testPath, List<DataPoint> points) {
    StoredSeries stored = seriesByPath.get(testPath);
    if (stored == null) {
      throw new IllegalArgumentException("Unknown series: " + testPath);
    }
    synchronized (stored) {
      stored.points.addAll(points);
      stored.points.sort(Comparator.comparingLong(DataPoint::revision));
    }
  }

  @Override
  public Future<List<MonitoredSeries>> listMonitoredSeries() {
    List<MonitoredSeries> series = seriesByPath.values().stream()
      .map(stored -> {
        synchronized (stored) {
          return stored.series;
        }
      })
      .sorted(Comparator.comparing(MonitoredSeries::testPath))
      .collect(Collectors.toList());
    return Future.succeededFuture(series);
  }

  @Override
  public Future<List<DataPoint>> getPoints(String testPath, long afterRevision, int limit) {
    StoredSeries stored = seriesByPath.get(testPath);
    if (stored == null) {
      return Future.succeededFuture(List.of());
    }
    synchronized (stored) {
      List<DataPoint> after = stored.points.stream()
        .filter(p -> p.revision() > afterRevision)
        .collect(Collectors.toList());
      int from = Math.max(0, after.size() - limit);
      return Future.succeededFuture(List.copyOf(after.subList(from, after.size())));
    }
  }

  @Override
  public Future<Long> getCursor(String testPath) {
    StoredSeries stored = seriesByPath.get(testPath);
    if (stored == null) {
      return Future.succeededFuture(AnomalyProcessor.NO_CURSOR);
    }
    synchronized (stored) {
      return Future.succeededFuture(stored.cursor);
    }
  }

  @Override
  public Future<Void> saveAnomalies(String testPath, List<Anomaly> anomalies, long cursor) {
    StoredSeries stored = seriesByPath.get(testPath);
    if (stored == null) {
      return Future.failedFuture(new IllegalArgumentException("Unknown series: " + testPath));
    }
    synchronized (stored) {
      stored.anomalies.addAll(anomalies);
      stored.anomalies.sort(Comparator.comparingLong(Anomaly::endRevision));
      stored.cursor = Math.max(stored.cursor, cursor);
    }
    return Future.succeededFuture();
  }

  @Override
  public Future<List<Anomaly>> getAnomalies(String testPath) {
    StoredSeries stored = seriesByPath.get(testPath);
    if (stored == null) {
      return Future.succeededFuture(List.of());
    }
    synchronized (stored) {
      return Future.succeededFuture(List.copyOf(stored.anomalies));
    }
  }

  private static final class StoredSeries {
    private MonitoredSeries series;
    private final List<DataPoint> points = new ArrayList<>();
    private final List<Anomaly> anomalies = new ArrayList<>();
    private long cursor = AnomalyProcessor.NO_CURSOR;
  }
}
