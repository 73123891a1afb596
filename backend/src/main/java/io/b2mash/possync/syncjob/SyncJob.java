package io.b2mash.possync.syncjob;

import io.b2mash.possync.restaurant.PosType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Durable record of one POS sync. Created PENDING, moved to PROCESSING only by {@link
 * #claim}, and finished as COMPLETED or FAILED. A terminal job is immutable apart from the
 * notification flag.
 */
@Entity
@Table(name = "sync_jobs")
public class SyncJob {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "job_id", nullable = false, unique = true, length = 100)
  private String jobId;

  @Column(name = "restaurant_id", nullable = false)
  private UUID restaurantId;

  @Enumerated(EnumType.STRING)
  @Column(name = "pos_type", nullable = false, length = 20)
  private PosType posType;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private SyncJobStatus status;

  @Enumerated(EnumType.STRING)
  @Column(name = "trigger_type", nullable = false, length = 20)
  private SyncTrigger trigger;

  @Column(name = "window_start")
  private Instant windowStart;

  @Column(name = "window_end")
  private Instant windowEnd;

  @Column(name = "full_sync", nullable = false)
  private boolean fullSync;

  @Column(name = "current_page")
  private Integer currentPage;

  @Column(name = "total_pages")
  private Integer totalPages;

  @Column(name = "orders_processed", nullable = false)
  private int ordersProcessed;

  @Column(name = "estimated_total")
  private Long estimatedTotal;

  @Column(name = "orders_imported")
  private Integer ordersImported;

  @Column(name = "orders_failed")
  private Integer ordersFailed;

  @Column(name = "skipped_duplicates")
  private Integer skippedDuplicates;

  @Column(name = "result_total_pages")
  private Integer resultTotalPages;

  @Column(name = "duration_ms")
  private Long durationMs;

  @Column(name = "error_message", columnDefinition = "TEXT")
  private String errorMessage;

  @Enumerated(EnumType.STRING)
  @Column(name = "error_code", length = 40)
  private SyncErrorCode errorCode;

  @Column(name = "error_at")
  private Instant errorAt;

  @Column(name = "attempts", nullable = false)
  private int attempts;

  @Column(name = "max_attempts", nullable = false)
  private int maxAttempts;

  @Column(name = "claim_token")
  private UUID claimToken;

  @Column(name = "started_at")
  private Instant startedAt;

  @Column(name = "heartbeat_at")
  private Instant heartbeatAt;

  @Column(name = "available_at", nullable = false)
  private Instant availableAt;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "notification_email", length = 320)
  private String notificationEmail;

  @Column(name = "notification_sent", nullable = false)
  private boolean notificationSent;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Version private Long version;

  protected SyncJob() {}

  public SyncJob(String jobId, SyncJobSpec spec, Instant now) {
    if (spec.maxAttempts() < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    this.jobId = jobId;
    this.restaurantId = spec.restaurantId();
    this.posType = spec.posType();
    this.trigger = spec.trigger();
    this.notificationEmail = spec.notificationEmail();
    this.maxAttempts = spec.maxAttempts();
    this.status = SyncJobStatus.PENDING;
    if (spec.window() != null) {
      applyWindow(spec.window());
    }
    this.availableAt = now;
    this.createdAt = now;
    this.updatedAt = now;
  }

  /**
   * Moves a pending job to PROCESSING under a fresh claim token. Progress from an earlier attempt
   * is reset.
   *
   * @throws AlreadyClaimedException if the job is not pending
   */
  public void claim(UUID token, Instant now) {
    if (status != SyncJobStatus.PENDING) {
      throw new AlreadyClaimedException(jobId, status);
    }
    this.status = SyncJobStatus.PROCESSING;
    this.claimToken = token;
    this.startedAt = now;
    this.heartbeatAt = now;
    this.currentPage = null;
    this.totalPages = null;
    this.ordersProcessed = 0;
    this.estimatedTotal = null;
    this.updatedAt = now;
  }

  public void recordWindow(SyncWindow window, Instant now) {
    requireProcessing();
    applyWindow(window);
    this.updatedAt = now;
  }

  /** Records progress and refreshes the heartbeat. */
  public void recordProgress(SyncProgress progress, Instant now) {
    requireProcessing();
    this.currentPage = progress.currentPage();
    this.totalPages = progress.totalPages();
    this.ordersProcessed = progress.ordersProcessed();
    this.estimatedTotal = progress.estimatedTotal();
    this.heartbeatAt = now;
    this.updatedAt = now;
  }

  public void complete(SyncResult result, Instant now) {
    requireProcessing();
    this.status = SyncJobStatus.COMPLETED;
    this.ordersImported = result.ordersImported();
    this.ordersFailed = result.ordersFailed();
    this.skippedDuplicates = result.skippedDuplicates();
    this.resultTotalPages = result.totalPages();
    this.durationMs = result.durationMs();
    this.claimToken = null;
    this.completedAt = now;
    this.updatedAt = now;
  }

  /**
   * Records a failed attempt. A retryable error with attempts left sends the job back to PENDING,
   * claimable again after {@code retryDelay * attempts}; anything else is terminal.
   *
   * @return true if the job is now terminally FAILED
   */
  public boolean recordFailure(SyncError error, Duration retryDelay, Instant now) {
    if (status.isTerminal()) {
      throw new IllegalStateException("Sync job " + jobId + " is already " + status);
    }
    this.attempts++;
    this.errorMessage = error.message();
    this.errorCode = error.code();
    this.errorAt = error.timestamp();
    this.claimToken = null;
    this.heartbeatAt = null;
    this.updatedAt = now;
    if (error.retryable() && attempts < maxAttempts) {
      this.status = SyncJobStatus.PENDING;
      this.availableAt = now.plus(retryDelay.multipliedBy(attempts));
      return false;
    }
    this.status = SyncJobStatus.FAILED;
    this.completedAt = now;
    return true;
  }

  /** Terminates a job that has not been picked up yet. */
  public void cancel(Instant now) {
    if (status != SyncJobStatus.PENDING) {
      throw new JobNotCancellableException(jobId, status);
    }
    this.status = SyncJobStatus.FAILED;
    this.errorMessage = "Cancelled before processing";
    this.errorCode = SyncErrorCode.CANCELLED;
    this.errorAt = now;
    this.completedAt = now;
    this.updatedAt = now;
  }

  public void markNotificationSent(Instant now) {
    this.notificationSent = true;
    this.updatedAt = now;
  }

  public boolean isClaimedBy(UUID token) {
    return status == SyncJobStatus.PROCESSING && claimToken != null && claimToken.equals(token);
  }

  private void requireProcessing() {
    if (status != SyncJobStatus.PROCESSING) {
      throw new IllegalStateException(
          "Sync job " + jobId + " is " + status + ", expected PROCESSING");
    }
  }

  private void applyWindow(SyncWindow window) {
    this.windowStart = window.startDate();
    this.windowEnd = window.endDate();
    this.fullSync = window.fullSync();
  }

  public SyncProgress getProgress() {
    return new SyncProgress(currentPage, totalPages, ordersProcessed, estimatedTotal);
  }

  /** Result of a completed job, null otherwise. */
  public SyncResult getResult() {
    if (status != SyncJobStatus.COMPLETED) {
      return null;
    }
    return new SyncResult(
        ordersImported,
        ordersFailed,
        skippedDuplicates,
        resultTotalPages,
        durationMs,
        windowStart,
        windowEnd);
  }

  /** Most recent error, kept across retries. Null if no attempt has failed. */
  public SyncError getError() {
    return errorCode == null ? null : new SyncError(errorMessage, errorCode, errorAt);
  }

  public SyncWindow getWindow() {
    return windowStart == null ? null : new SyncWindow(windowStart, windowEnd, fullSync);
  }

  public UUID getId() {
    return id;
  }

  public String getJobId() {
    return jobId;
  }

  public UUID getRestaurantId() {
    return restaurantId;
  }

  public PosType getPosType() {
    return posType;
  }

  public SyncJobStatus getStatus() {
    return status;
  }

  public SyncTrigger getTrigger() {
    return trigger;
  }

  public int getAttempts() {
    return attempts;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public UUID getClaimToken() {
    return claimToken;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Instant getHeartbeatAt() {
    return heartbeatAt;
  }

  public Instant getAvailableAt() {
    return availableAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public String getNotificationEmail() {
    return notificationEmail;
  }

  public boolean isNotificationSent() {
    return notificationSent;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Long getVersion() {
    return version;
  }
}
