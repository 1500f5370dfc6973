package io.github.themoah.regdetect.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.regdetect.alerting.AlertingJob;
import io.github.themoah.regdetect.alerting.AnomalyProcessor;
import io.github.themoah.regdetect.alerting.DetectionAlgorithm;
import io.github.themoah.regdetect.alerting.InMemorySeriesStore;
import io.github.themoah.regdetect.metrics.MetricsReporter;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Tests for the health check routes over HTTP.
 */
@ExtendWith(VertxExtension.class)
public class HealthCheckHandlerTest {

  private record Reply(int status, JsonObject body) {}

  @Test
  void readyz_turnsReadyAfterFirstCycle(Vertx vertx, VertxTestContext ctx) throws Exception {
    AlertingJob job = new AlertingJob(vertx, new InMemorySeriesStore(),
      new AnomalyProcessor(DetectionAlgorithm.SEGMENT), MetricsReporter.noop(), 60_000);
    Router router = Router.router(vertx);
    new HealthCheckHandler(job).registerRoutes(router);
    HttpClient client = vertx.createHttpClient();

    vertx.createHttpServer().requestHandler(router).listen(0)
      .compose(server -> {
        int port = server.actualPort();
        return get(client, port, "/healthz")
          .compose(liveness -> {
            ctx.verify(() -> {
              assertEquals(200, liveness.status());
              assertEquals("UP", liveness.body().getString("status"));
            });
            return get(client, port, "/readyz");
          })
          .compose(pending -> {
            ctx.verify(() -> {
              assertEquals(503, pending.status());
              assertEquals("pending", pending.body().getString("alerting"));
            });
            return job.runCycle().compose(result -> get(client, port, "/readyz"));
          });
      })
      .onComplete(ctx.succeeding(ready -> ctx.verify(() -> {
        assertEquals(200, ready.status());
        assertEquals("ready", ready.body().getString("alerting"));
        assertTrue(ready.body().getLong("lastCycleMs") > 0);
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(10, TimeUnit.SECONDS));
  }

  private static Future<Reply> get(HttpClient client, int port, String path) {
    return client.request(HttpMethod.GET, port, "localhost", path)
      .compose(request -> request.send())
      .compose(response -> response.body()
        .map(body -> new Reply(response.statusCode(), body.toJsonObject())));
  }
}
