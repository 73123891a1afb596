package io.b2mash.possync.syncjob;

import io.b2mash.possync.config.PosSyncProperties;
import io.b2mash.possync.exception.ResourceNotFoundException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable state machine of sync jobs. Every method runs in its own transaction, so each
 * transition is committed before the caller proceeds.
 */
@Service
public class SyncJobStore {

  private static final Logger log = LoggerFactory.getLogger(SyncJobStore.class);

  private final SyncJobRepository repository;
  private final Clock clock;
  private final Duration retryDelay;

  @Autowired
  public SyncJobStore(SyncJobRepository repository, Clock clock, PosSyncProperties properties) {
    this(repository, clock, properties.sync().retryDelay());
  }

  SyncJobStore(SyncJobRepository repository, Clock clock, Duration retryDelay) {
    this.repository = repository;
    this.clock = clock;
    this.retryDelay = retryDelay;
  }

  /**
   * Inserts a PENDING job. A second active job for the same restaurant violates the partial
   * unique index and surfaces as {@link org.springframework.dao.DataIntegrityViolationException}.
   */
  @Transactional
  public SyncJob create(SyncJobSpec spec) {
    Instant now = clock.instant();
    String jobId =
        "sync-"
            + spec.restaurantId()
            + "-"
            + now.toEpochMilli()
            + "-"
            + UUID.randomUUID().toString().substring(0, 8);
    var job = repository.saveAndFlush(new SyncJob(jobId, spec, now));
    log.info(
        "Created sync job {} for restaurant {} (trigger={}, type={})",
        jobId,
        spec.restaurantId(),
        spec.trigger(),
        spec.window() != null ? spec.window().syncType() : "unknown");
    return job;
  }

  /**
   * Atomically moves a PENDING job to PROCESSING. The returned job carries the claim token that
   * later transitions must present.
   *
   * @throws AlreadyClaimedException if the job is not pending
   */
  @Transactional
  public SyncJob claim(String jobId) {
    var job =
        repository
            .findByJobIdForUpdate(jobId)
            .orElseThrow(() -> new ResourceNotFoundException("SyncJob", jobId));
    job.claim(UUID.randomUUID(), clock.instant());
    log.info(
        "Claimed sync job {} for restaurant {} (attempt {} of {})",
        jobId,
        job.getRestaurantId(),
        job.getAttempts() + 1,
        job.getMaxAttempts());
    return repository.save(job);
  }

  @Transactional
  public void recordWindow(String jobId, UUID claimToken, SyncWindow window) {
    var job = loadOwned(jobId, claimToken);
    job.recordWindow(window, clock.instant());
    repository.save(job);
  }

  @Transactional
  public void updateProgress(String jobId, UUID claimToken, SyncProgress progress) {
    var job = loadOwned(jobId, claimToken);
    job.recordProgress(progress, clock.instant());
    repository.save(job);
  }

  @Transactional
  public SyncJob complete(String jobId, UUID claimToken, SyncResult result) {
    var job = loadOwned(jobId, claimToken);
    job.complete(result, clock.instant());
    log.info(
        "Completed sync job {}: imported={}, failed={}, duplicates={}, pages={}, durationMs={}",
        jobId,
        result.ordersImported(),
        result.ordersFailed(),
        result.skippedDuplicates(),
        result.totalPages(),
        result.durationMs());
    return repository.save(job);
  }

  /** Records a failed attempt on behalf of the worker holding {@code claimToken}. */
  @Transactional
  public SyncJob fail(String jobId, UUID claimToken, SyncError error) {
    return applyFailure(loadOwned(jobId, claimToken), error);
  }

  /**
   * Fails a PROCESSING job only if, under the row lock, it is still held by {@code claimToken}
   * and its heartbeat is still older than {@code cutoff}. Returns empty when the worker has
   * reported progress since the job was found stale.
   */
  @Transactional
  public Optional<SyncJob> failIfStale(
      String jobId, UUID claimToken, Instant cutoff, SyncError error) {
    var job =
        repository
            .findByJobIdForUpdate(jobId)
            .orElseThrow(() -> new ResourceNotFoundException("SyncJob", jobId));
    boolean stillStale =
        job.isClaimedBy(claimToken)
            && job.getHeartbeatAt() != null
            && job.getHeartbeatAt().isBefore(cutoff);
    if (!stillStale) {
      log.info("Sync job {} reported progress since it was found stale; leaving it", jobId);
      return Optional.empty();
    }
    return Optional.of(applyFailure(job, error));
  }

  /** Records a failed attempt regardless of who holds the job. */
  @Transactional
  public SyncJob fail(String jobId, SyncError error) {
    return applyFailure(getByJobId(jobId), error);
  }

  @Transactional
  public SyncJob cancel(String jobId) {
    var job = getByJobId(jobId);
    job.cancel(clock.instant());
    log.info("Cancelled sync job {} for restaurant {}", jobId, job.getRestaurantId());
    return repository.save(job);
  }

  @Transactional
  public void markNotificationSent(String jobId) {
    var job = getByJobId(jobId);
    job.markNotificationSent(clock.instant());
    repository.save(job);
  }

  @Transactional(readOnly = true)
  public Optional<SyncJob> findByJobId(String jobId) {
    return repository.findByJobId(jobId);
  }

  @Transactional(readOnly = true)
  public SyncJob getByJobId(String jobId) {
    return repository
        .findByJobId(jobId)
        .orElseThrow(() -> new ResourceNotFoundException("SyncJob", jobId));
  }

  @Transactional(readOnly = true)
  public List<SyncJob> findActiveFor(UUID restaurantId) {
    return repository.findByRestaurantIdAndStatusInOrderByCreatedAtAsc(
        restaurantId, SyncJobStatus.ACTIVE);
  }

  @Transactional(readOnly = true)
  public Optional<SyncJob> findLatestFor(UUID restaurantId) {
    return repository.findFirstByRestaurantIdOrderByCreatedAtDesc(restaurantId);
  }

  @Transactional(readOnly = true)
  public List<SyncJob> recentForRestaurant(UUID restaurantId, int limit) {
    return repository.findByRestaurantIdOrderByCreatedAtDesc(
        restaurantId, PageRequest.of(0, Math.max(1, limit)));
  }

  /** PROCESSING jobs whose heartbeat is older than {@code cutoff}. */
  @Transactional(readOnly = true)
  public List<SyncJob> findStale(Instant cutoff) {
    return repository.findByStatusAndHeartbeatAtBefore(SyncJobStatus.PROCESSING, cutoff);
  }

  @Transactional
  public int purgeTerminalBefore(Instant cutoff) {
    int deleted = repository.deleteTerminalBefore(SyncJobStatus.TERMINAL, cutoff);
    if (deleted > 0) {
      log.info("Purged {} terminal sync jobs completed before {}", deleted, cutoff);
    }
    return deleted;
  }

  private SyncJob applyFailure(SyncJob job, SyncError error) {
    boolean terminal = job.recordFailure(error, retryDelay, clock.instant());
    if (terminal) {
      log.error(
          "Sync job {} for restaurant {} failed permanently after {} attempt(s): "
              + "code={}, message={}",
          job.getJobId(),
          job.getRestaurantId(),
          job.getAttempts(),
          error.code(),
          error.message());
    } else {
      log.warn(
          "Sync job {} for restaurant {} failed attempt {} of {} (code={}); retry after {}",
          job.getJobId(),
          job.getRestaurantId(),
          job.getAttempts(),
          job.getMaxAttempts(),
          error.code(),
          job.getAvailableAt());
    }
    return repository.save(job);
  }

  private SyncJob loadOwned(String jobId, UUID claimToken) {
    var job = getByJobId(jobId);
    if (!job.isClaimedBy(claimToken)) {
      throw new JobOwnershipLostException(jobId);
    }
    return job;
  }
}
