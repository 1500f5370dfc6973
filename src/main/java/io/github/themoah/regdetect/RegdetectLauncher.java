package io.github.themoah.regdetect;

import io.github.themoah.regdetect.config.VertxConfig;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the regression detection service. Creates Vert.x with the
 * worker pool sized for series evaluation and deploys {@link MainVerticle},
 * which starts the alerting job, the metrics endpoint and the health checks.
 */
public class RegdetectLauncher {

  private static final Logger log = LoggerFactory.getLogger(RegdetectLauncher.class);

  public static void main(String[] args) {
    VertxOptions vertxOptions = VertxConfig.createVertxOptions();
    Vertx vertx = Vertx.vertx(vertxOptions);

    DeploymentOptions deploymentOptions = VertxConfig.createDeploymentOptions();

    vertx.deployVerticle(new MainVerticle(), deploymentOptions)
      .onSuccess(id -> log.info("MainVerticle deployed with ID: {}", id))
      .onFailure(err -> {
        log.error("Failed to deploy MainVerticle", err);
        vertx.close();
        System.exit(1);
      });
  }
}
