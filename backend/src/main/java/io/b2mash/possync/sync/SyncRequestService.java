package io.b2mash.possync.sync;

import io.b2mash.possync.config.PosSyncProperties;
import io.b2mash.possync.credential.CredentialVault;
import io.b2mash.possync.restaurant.PosConnectionService;
import io.b2mash.possync.restaurant.RestaurantInactiveException;
import io.b2mash.possync.syncjob.JobQueue;
import io.b2mash.possync.syncjob.SyncAlreadyInProgressException;
import io.b2mash.possync.syncjob.SyncJobSpec;
import io.b2mash.possync.syncjob.SyncJobStore;
import io.b2mash.possync.syncjob.SyncTrigger;
import io.b2mash.possync.syncjob.SyncWindow;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Producer side of the pipeline. Every trigger (login, manual, scheduled, chained) creates its
 * job here, so the one-active-job-per-restaurant rule holds for all of them.
 */
@Service
public class SyncRequestService {

  private static final Logger log = LoggerFactory.getLogger(SyncRequestService.class);

  private final PosConnectionService posConnectionService;
  private final CredentialVault credentialVault;
  private final SyncJobStore jobStore;
  private final JobQueue jobQueue;
  private final SyncWindowCalculator windowCalculator;
  private final int maxAttempts;

  @Autowired
  public SyncRequestService(
      PosConnectionService posConnectionService,
      CredentialVault credentialVault,
      SyncJobStore jobStore,
      JobQueue jobQueue,
      SyncWindowCalculator windowCalculator,
      PosSyncProperties properties) {
    this(
        posConnectionService,
        credentialVault,
        jobStore,
        jobQueue,
        windowCalculator,
        properties.sync().maxAttempts());
  }

  SyncRequestService(
      PosConnectionService posConnectionService,
      CredentialVault credentialVault,
      SyncJobStore jobStore,
      JobQueue jobQueue,
      SyncWindowCalculator windowCalculator,
      int maxAttempts) {
    this.posConnectionService = posConnectionService;
    this.credentialVault = credentialVault;
    this.jobStore = jobStore;
    this.jobQueue = jobQueue;
    this.windowCalculator = windowCalculator;
    this.maxAttempts = maxAttempts;
  }

  /**
   * Creates and enqueues a sync job for the restaurant.
   *
   * @throws SyncAlreadyInProgressException carrying the active job's id
   * @throws io.b2mash.possync.credential.MissingCredentialFieldsException if the POS connection
   *     is incomplete
   */
  public SyncEnqueueResult enqueueSync(
      UUID restaurantId, SyncTrigger trigger, String notificationEmail) {
    var restaurant = posConnectionService.getRestaurant(restaurantId);
    if (!restaurant.isActive()) {
      throw new RestaurantInactiveException(restaurantId);
    }
    // Fails fast with the field-specific error before any job exists
    credentialVault.decryptCredentialSet(restaurant.storedCredentials());

    var active = jobQueue.activeJobsFor(restaurantId);
    if (!active.isEmpty()) {
      throw new SyncAlreadyInProgressException(restaurantId, active.get(0));
    }

    var window = windowCalculator.windowFor(restaurant.getLastSyncAt());
    var spec =
        new SyncJobSpec(
            restaurantId, restaurant.getPosType(), trigger, window, notificationEmail, maxAttempts);
    String jobId;
    try {
      jobId = jobStore.create(spec).getJobId();
    } catch (DataIntegrityViolationException e) {
      // Lost the race against a concurrent producer; the partial unique index decided
      var winner = jobQueue.activeJobsFor(restaurantId);
      if (winner.isEmpty()) {
        throw e;
      }
      throw new SyncAlreadyInProgressException(restaurantId, winner.get(0));
    }
    jobQueue.enqueue(jobId);
    log.info(
        "Queued {} sync {} for restaurant {} ({} to {})",
        window.syncType(),
        jobId,
        restaurantId,
        window.startDate(),
        window.endDate());
    return new SyncEnqueueResult(jobId, window);
  }

  public record SyncEnqueueResult(String jobId, SyncWindow window) {}
}
