package io.b2mash.possync.sync;

import io.b2mash.possync.config.PosSyncProperties;
import io.b2mash.possync.syncjob.SyncError;
import io.b2mash.possync.syncjob.SyncErrorCode;
import io.b2mash.possync.syncjob.SyncJobStatus;
import io.b2mash.possync.syncjob.SyncJobStore;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Releases PROCESSING jobs whose worker stopped sending heartbeats. The failure counts as an
 * attempt, so a job that keeps crashing its worker eventually fails for good.
 */
@Component
@ConditionalOnProperty(name = "possync.worker.enabled", havingValue = "true", matchIfMissing = true)
public class StaleJobReaper {

  private static final Logger log = LoggerFactory.getLogger(StaleJobReaper.class);

  private final SyncJobStore jobStore;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;
  private final Duration staleAfter;

  public StaleJobReaper(
      SyncJobStore jobStore,
      ApplicationEventPublisher eventPublisher,
      Clock clock,
      PosSyncProperties properties) {
    this.jobStore = jobStore;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
    this.staleAfter = properties.sync().staleAfter();
  }

  @Scheduled(fixedDelayString = "${possync.sync.reaper-interval:60000}")
  public void reapStaleJobs() {
    var now = clock.instant();
    var cutoff = now.minus(staleAfter);
    var stale = jobStore.findStale(cutoff);
    int released = 0;
    for (var job : stale) {
      try {
        var error =
            SyncError.of(
                SyncErrorCode.STALE_JOB,
                "No heartbeat since " + job.getHeartbeatAt() + "; worker presumed dead",
                now);
        var reaped = jobStore.failIfStale(job.getJobId(), job.getClaimToken(), cutoff, error);
        if (reaped.isEmpty()) {
          continue;
        }
        released++;
        var updated = reaped.get();
        if (updated.getStatus() == SyncJobStatus.FAILED) {
          long durationMs =
              job.getStartedAt() != null
                  ? Duration.between(job.getStartedAt(), now).toMillis()
                  : 0L;
          eventPublisher.publishEvent(SyncFinishedEvent.failed(updated, durationMs));
        }
      } catch (Exception e) {
        log.error("Failed to reap stale sync job {}", job.getJobId(), e);
      }
    }
    if (released > 0) {
      log.info("Stale job reaper released {} sync job(s)", released);
    }
  }
}
