package io.github.themoah.feedrace;

import io.github.themoah.feedrace.config.VertxConfig;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point. Deploys {@link MainVerticle} and exits once the race completes.
 * Exit status is 0 after a completed race and 1 if startup fails.
 */
public class FeedRaceLauncher {

  private static final Logger log = LoggerFactory.getLogger(FeedRaceLauncher.class);

  public static void main(String[] args) {
    VertxOptions vertxOptions = VertxConfig.createVertxOptions();
    Vertx vertx = Vertx.vertx(vertxOptions);

    DeploymentOptions deploymentOptions = VertxConfig.createDeploymentOptions();

    MainVerticle main = new MainVerticle(snapshot -> {
      log.info("Race finished after {} slots, shutting down", snapshot.trackedSlots());
      vertx.close().onComplete(ar -> System.exit(0));
    });

    vertx.deployVerticle(main, deploymentOptions)
      .onSuccess(id -> log.info("MainVerticle deployed with ID: {}", id))
      .onFailure(err -> {
        log.error("Failed to deploy MainVerticle", err);
        vertx.close();
        System.exit(1);
      });
  }
}
