package io.b2mash.possync.sync;

import io.b2mash.possync.config.PosSyncProperties;
import io.b2mash.possync.restaurant.RestaurantRepository;
import io.b2mash.possync.syncjob.SyncAlreadyInProgressException;
import io.b2mash.possync.syncjob.SyncTrigger;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Queues incremental syncs for connected restaurants that have not synced recently. */
@Component
@ConditionalOnProperty(name = "possync.worker.enabled", havingValue = "true", matchIfMissing = true)
public class ScheduledSyncTrigger {

  private static final Logger log = LoggerFactory.getLogger(ScheduledSyncTrigger.class);

  private final RestaurantRepository restaurantRepository;
  private final SyncRequestService syncRequestService;
  private final Clock clock;
  private final Duration interval;

  public ScheduledSyncTrigger(
      RestaurantRepository restaurantRepository,
      SyncRequestService syncRequestService,
      Clock clock,
      PosSyncProperties properties) {
    this.restaurantRepository = restaurantRepository;
    this.syncRequestService = syncRequestService;
    this.clock = clock;
    this.interval = properties.sync().scheduledInterval();
  }

  @Scheduled(cron = "${possync.sync.scheduled-cron:0 0 * * * *}")
  public void enqueueDueSyncs() {
    var due = restaurantRepository.findDueForScheduledSync(clock.instant().minus(interval));
    int queued = 0;
    for (var restaurant : due) {
      try {
        syncRequestService.enqueueSync(restaurant.getId(), SyncTrigger.SCHEDULED, null);
        queued++;
      } catch (SyncAlreadyInProgressException e) {
        log.debug("Restaurant {} already has sync {} running", restaurant.getId(), e.getJobId());
      } catch (Exception e) {
        log.error("Failed to queue scheduled sync for restaurant {}", restaurant.getId(), e);
      }
    }
    log.info("Scheduled sync trigger queued {} of {} due restaurant(s)", queued, due.size());
  }
}
