package io.b2mash.possync.syncjob;

import io.b2mash.possync.config.PosSyncProperties;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Nightly purge of terminal jobs past the retention period. */
@Component
@ConditionalOnProperty(name = "possync.worker.enabled", havingValue = "true", matchIfMissing = true)
public class SyncJobCleanup {

  private static final Logger log = LoggerFactory.getLogger(SyncJobCleanup.class);

  private final SyncJobStore jobStore;
  private final Clock clock;
  private final Duration retention;

  public SyncJobCleanup(SyncJobStore jobStore, Clock clock, PosSyncProperties properties) {
    this.jobStore = jobStore;
    this.clock = clock;
    this.retention = Duration.ofDays(properties.sync().retentionDays());
  }

  @Scheduled(cron = "${possync.sync.cleanup-cron:0 30 3 * * *}")
  public int purgeExpiredJobs() {
    var cutoff = clock.instant().minus(retention);
    try {
      return jobStore.purgeTerminalBefore(cutoff);
    } catch (Exception e) {
      log.error("Failed to purge sync jobs completed before {}", cutoff, e);
      return 0;
    }
  }
}
