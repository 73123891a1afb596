package io.b2mash.possync.sync;

import io.b2mash.possync.syncjob.SyncTrigger;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotNull;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SyncController {

  private static final Logger log = LoggerFactory.getLogger(SyncController.class);

  private final SyncRequestService syncRequestService;
  private final SyncStatusService syncStatusService;
  private final Clock clock;

  public SyncController(
      SyncRequestService syncRequestService, SyncStatusService syncStatusService, Clock clock) {
    this.syncRequestService = syncRequestService;
    this.syncStatusService = syncStatusService;
    this.clock = clock;
  }

  @PostMapping("/api/pos/sync")
  public ResponseEntity<ManualSyncResponse> requestSync(
      @Valid @RequestBody ManualSyncRequest request) {
    var queued =
        syncRequestService.enqueueSync(
            request.restaurantId(), SyncTrigger.MANUAL, request.notificationEmail());
    var window = queued.window();
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(
            new ManualSyncResponse(
                queued.jobId(),
                window.syncType(),
                window.startDate(),
                window.endDate(),
                "Sync queued"));
  }

  /** Never fails: storage trouble is reported inside the view. */
  @GetMapping("/api/sync-status/{restaurantId}")
  public ResponseEntity<SyncProgressView> getStatus(@PathVariable UUID restaurantId) {
    try {
      return ResponseEntity.ok(syncStatusService.getStatus(restaurantId));
    } catch (Exception e) {
      log.error("Failed to load sync status for restaurant {}", restaurantId, e);
      return ResponseEntity.ok(SyncProgressView.unavailable(clock.instant()));
    }
  }

  // --- DTOs ---

  public record ManualSyncRequest(
      @NotNull(message = "restaurantId is required") UUID restaurantId,
      @Email(message = "notificationEmail must be a valid email") String notificationEmail) {}

  public record ManualSyncResponse(
      String jobId, String syncType, Instant startDate, Instant endDate, String message) {}
}
