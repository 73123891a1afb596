package io.b2mash.possync.sync;

import io.b2mash.possync.config.PosSyncProperties;
import io.b2mash.possync.syncjob.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Polls the queue and hands due jobs to the orchestrator, up to a batch per poll. Several
 * processes may run workers; the atomic claim keeps each job on one of them.
 */
@Component
@ConditionalOnProperty(name = "possync.worker.enabled", havingValue = "true", matchIfMissing = true)
public class SyncWorker {

  private static final Logger log = LoggerFactory.getLogger(SyncWorker.class);

  private final JobQueue jobQueue;
  private final SyncOrchestrator orchestrator;
  private final int batchSize;

  public SyncWorker(
      JobQueue jobQueue, SyncOrchestrator orchestrator, PosSyncProperties properties) {
    this.jobQueue = jobQueue;
    this.orchestrator = orchestrator;
    this.batchSize = properties.worker().batchSize();
  }

  @Scheduled(
      fixedDelayString = "${possync.worker.poll-interval:5000}",
      initialDelayString = "${possync.worker.initial-delay:10000}")
  public void poll() {
    int processed = 0;
    for (int i = 0; i < batchSize; i++) {
      String jobId;
      try {
        var next = jobQueue.dequeue();
        if (next.isEmpty()) {
          break;
        }
        jobId = next.get();
      } catch (Exception e) {
        log.error("Failed to poll the sync job queue", e);
        return;
      }
      if (orchestrator.process(jobId)) {
        processed++;
      }
    }
    if (processed > 0) {
      log.info("Sync worker processed {} job(s)", processed);
    }
  }
}
