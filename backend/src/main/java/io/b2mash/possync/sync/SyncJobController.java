package io.b2mash.possync.sync;

import io.b2mash.possync.syncjob.JobQueue;
import io.b2mash.possync.syncjob.SyncError;
import io.b2mash.possync.syncjob.SyncJob;
import io.b2mash.possync.syncjob.SyncJobStore;
import io.b2mash.possync.syncjob.SyncProgress;
import io.b2mash.possync.syncjob.SyncResult;
import io.b2mash.possync.syncjob.SyncWindow;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SyncJobController {

  private static final int MAX_LIMIT = 100;

  private final SyncJobStore jobStore;
  private final JobQueue jobQueue;

  public SyncJobController(SyncJobStore jobStore, JobQueue jobQueue) {
    this.jobStore = jobStore;
    this.jobQueue = jobQueue;
  }

  @GetMapping("/api/sync-jobs/{jobId}")
  public ResponseEntity<SyncJobResponse> getJob(@PathVariable String jobId) {
    var job = jobStore.getByJobId(jobId);
    var position = jobQueue.positionOf(jobId);
    return ResponseEntity.ok(
        SyncJobResponse.from(job, new QueueState(position.isPresent(), position.orElse(null))));
  }

  @GetMapping("/api/restaurants/{restaurantId}/sync-jobs")
  public ResponseEntity<List<SyncJobResponse>> listJobs(
      @PathVariable UUID restaurantId, @RequestParam(defaultValue = "10") int limit) {
    var jobs = jobStore.recentForRestaurant(restaurantId, Math.min(limit, MAX_LIMIT));
    return ResponseEntity.ok(jobs.stream().map(job -> SyncJobResponse.from(job, null)).toList());
  }

  @PostMapping("/api/sync-jobs/{jobId}/cancel")
  public ResponseEntity<SyncJobResponse> cancel(@PathVariable String jobId) {
    return ResponseEntity.ok(SyncJobResponse.from(jobStore.cancel(jobId), null));
  }

  // --- DTOs ---

  public record QueueState(boolean queued, Integer queuePosition) {}

  public record SyncJobResponse(
      String jobId,
      UUID restaurantId,
      String posType,
      String status,
      String trigger,
      SyncWindow window,
      SyncProgress progress,
      SyncResult result,
      SyncError error,
      int attempts,
      int maxAttempts,
      Instant createdAt,
      Instant startedAt,
      Instant completedAt,
      boolean notificationSent,
      QueueState queueState) {

    public static SyncJobResponse from(SyncJob job, QueueState queueState) {
      return new SyncJobResponse(
          job.getJobId(),
          job.getRestaurantId(),
          job.getPosType().name(),
          job.getStatus().name().toLowerCase(),
          job.getTrigger().name().toLowerCase(),
          job.getWindow(),
          job.getProgress(),
          job.getResult(),
          job.getError(),
          job.getAttempts(),
          job.getMaxAttempts(),
          job.getCreatedAt(),
          job.getStartedAt(),
          job.getCompletedAt(),
          job.isNotificationSent(),
          queueState);
    }
  }
}
