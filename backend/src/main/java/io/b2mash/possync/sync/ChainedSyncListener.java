package io.b2mash.possync.sync;

import io.b2mash.possync.syncjob.SyncAlreadyInProgressException;
import io.b2mash.possync.syncjob.SyncTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * After a full sync succeeds, queues an incremental one for the orders placed while the full
 * sync was running.
 */
@Component
@ConditionalOnProperty(
    name = "possync.sync.chain-after-full-sync",
    havingValue = "true",
    matchIfMissing = true)
public class ChainedSyncListener {

  private static final Logger log = LoggerFactory.getLogger(ChainedSyncListener.class);

  private final SyncRequestService syncRequestService;

  public ChainedSyncListener(SyncRequestService syncRequestService) {
    this.syncRequestService = syncRequestService;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onSyncFinished(SyncFinishedEvent event) {
    if (!event.success() || !event.fullSync()) {
      return;
    }
    try {
      var queued =
          syncRequestService.enqueueSync(event.restaurantId(), SyncTrigger.CHAINED, null);
      log.info("Full sync {} finished; queued follow-up sync {}", event.jobId(), queued.jobId());
    } catch (SyncAlreadyInProgressException e) {
      log.debug("Follow-up sync not needed, job {} already active", e.getJobId());
    } catch (Exception e) {
      log.warn("Could not queue follow-up sync after {}", event.jobId(), e);
    }
  }
}
