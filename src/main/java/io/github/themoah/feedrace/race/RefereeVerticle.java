package io.github.themoah.feedrace.race;

import io.github.themoah.feedrace.model.SlotReport;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single owner of the {@link Referee}.
 *
 * <p>All slot reports and snapshot requests are handled on this verticle's
 * context, one at a time, so race state needs no locking.
 */
public class RefereeVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(RefereeVerticle.class);

  private final Referee referee;
  private final RaceEventChannel channel;

  private boolean completionAnnounced;
  private long droppedReports;

  public RefereeVerticle(Referee referee, RaceEventChannel channel) {
    this.referee = referee;
    this.channel = channel;
  }

  @Override
  public void start(Promise<Void> startPromise) {
    Promise<Void> reports = Promise.promise();
    Promise<Void> snapshots = Promise.promise();
    channel.consumeReports(this::handleReport).completionHandler(reports);
    channel.serveSnapshots(referee::snapshot).completionHandler(snapshots);

    Future.all(reports.future(), snapshots.future())
      .onSuccess(v -> {
        log.info("Referee started, consuming slot reports on {}", RaceEventChannel.SLOT_REPORT_ADDRESS);
        startPromise.complete();
      })
      .onFailure(startPromise::fail);
  }

  private void handleReport(SlotReport report) {
    boolean accepted = referee.report(report.slot(), report.stream(), report.timestampNanos());
    if (accepted) {
      return;
    }

    droppedReports++;
    if (referee.isComplete() && !completionAnnounced) {
      completionAnnounced = true;
      log.info("Race complete! Maximum slots reached ({})", referee.size());
      channel.announceComplete(referee.snapshot());
    } else {
      log.debug("Dropped {} reports for unseen slots since completion", droppedReports);
    }
  }
}
