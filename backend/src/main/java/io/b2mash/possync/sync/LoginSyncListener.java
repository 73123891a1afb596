package io.b2mash.possync.sync;

import io.b2mash.possync.credential.MissingCredentialFieldsException;
import io.b2mash.possync.restaurant.RestaurantLoginEvent;
import io.b2mash.possync.syncjob.SyncAlreadyInProgressException;
import io.b2mash.possync.syncjob.SyncTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Starts a background sync when a restaurant user logs in. Login itself never fails on it. */
@Component
public class LoginSyncListener {

  private static final Logger log = LoggerFactory.getLogger(LoginSyncListener.class);

  private final SyncRequestService syncRequestService;

  public LoginSyncListener(SyncRequestService syncRequestService) {
    this.syncRequestService = syncRequestService;
  }

  @EventListener
  public void onLogin(RestaurantLoginEvent event) {
    try {
      var queued = syncRequestService.enqueueSync(event.restaurantId(), SyncTrigger.LOGIN, null);
      log.info("Login by {} queued sync {}", event.userEmail(), queued.jobId());
    } catch (SyncAlreadyInProgressException e) {
      log.debug("Login sync skipped, job {} already active", e.getJobId());
    } catch (MissingCredentialFieldsException e) {
      log.debug(
          "Login sync skipped for restaurant {}: POS not connected (missing {})",
          event.restaurantId(),
          e.getMissingFields());
    } catch (Exception e) {
      log.warn("Could not queue login sync for restaurant {}", event.restaurantId(), e);
    }
  }
}
