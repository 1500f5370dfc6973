package io.github.themoah.regdetect;

import io.github.themoah.regdetect.alerting.AlertingJob;
import io.github.themoah.regdetect.alerting.AnomalyProcessor;
import io.github.themoah.regdetect.alerting.InMemorySeriesStore;
import io.github.themoah.regdetect.alerting.SeriesStore;
import io.github.themoah.regdetect.changepoint.AnomalyConfig;
import io.github.themoah.regdetect.config.AppConfig;
import io.github.themoah.regdetect.health.HealthCheckHandler;
import io.github.themoah.regdetect.metrics.MetricsConfig;
import io.github.themoah.regdetect.metrics.MetricsReporter;
import io.github.themoah.regdetect.metrics.MicrometerConfig;
import io.github.themoah.regdetect.metrics.MicrometerReporter;
import io.github.themoah.regdetect.metrics.PrometheusHandler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main verticle for regdetect - performance regression detection.
 * Loads the series store, starts the alerting job and the HTTP server.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);

  private AlertingJob alertingJob;
  private HttpServer httpServer;

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting regdetect MainVerticle");

    AppConfig appConfig = AppConfig.fromEnvironment();
    MetricsConfig metricsConfig = MetricsConfig.fromEnvironment();
    AnomalyConfig anomalyDefaults = AnomalyConfig.fromEnvironment().validate();

    Router router = Router.router(vertx);
    MetricsReporter reporter = createMetricsReporter(metricsConfig, router);
    AnomalyProcessor processor = new AnomalyProcessor(appConfig.detectionAlgorithm());

    loadSeriesStore(appConfig, anomalyDefaults)
      .compose(store -> {
        alertingJob = new AlertingJob(vertx, store, processor, reporter, appConfig.alertingIntervalMs());
        new HealthCheckHandler(alertingJob).registerRoutes(router);

        router.route().handler(ctx -> {
          ctx.response()
            .setStatusCode(404)
            .putHeader("content-type", "application/json")
            .end("{\"error\": \"Not Found\"}");
        });

        return alertingJob.start();
      })
      .compose(v -> startHttpServer(router, appConfig.httpPort()))
      .onSuccess(server -> {
        httpServer = server;
        log.info("regdetect started successfully on port {}", appConfig.httpPort());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start regdetect", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping regdetect MainVerticle");

    Future<Void> stopAlertingJob = (alertingJob != null)
      ? alertingJob.stop()
      : Future.succeededFuture();

    Future<Void> stopHttpServer = (httpServer != null)
      ? httpServer.close()
      : Future.succeededFuture();

    stopAlertingJob
      .compose(v -> stopHttpServer)
      .onSuccess(v -> {
        log.info("regdetect stopped successfully");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during regdetect shutdown", err);
        stopPromise.fail(err);
      });
  }

  private Future<HttpServer> startHttpServer(Router router, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port)
      .onSuccess(server -> log.info("HTTP server started on port {}", port))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }

  private Future<SeriesStore> loadSeriesStore(AppConfig config, AnomalyConfig anomalyDefaults) {
    if (config.seriesDataDir() == null) {
      log.info("No SERIES_DATA_DIR set, starting with an empty series store");
      return Future.succeededFuture(new InMemorySeriesStore());
    }
    return InMemorySeriesStore.fromDirectory(vertx, config.seriesDataDir(), anomalyDefaults)
      .map(store -> (SeriesStore) store);
  }

  private MetricsReporter createMetricsReporter(MetricsConfig config, Router router) {
    if (!config.isEnabled()) {
      log.info("Metrics reporting is disabled");
      return MetricsReporter.noop();
    }

    MeterRegistry registry = MicrometerConfig.createRegistry(config.reporterType());
    if (registry == null) {
      log.warn("Failed to create meter registry for type: {}", config.reporterType());
      return MetricsReporter.noop();
    }

    if (config.jvmMetricsEnabled()) {
      MicrometerConfig.bindJvmMetrics(registry);
      log.info("JVM metrics enabled");
    }

    if (registry instanceof PrometheusMeterRegistry prometheusRegistry) {
      new PrometheusHandler(prometheusRegistry).registerRoutes(router);
    }

    return new MicrometerReporter(registry);
  }
}
