package io.b2mash.possync.sync;

import io.b2mash.possync.config.PosSyncProperties;
import io.b2mash.possync.pos.PageCursor;
import io.b2mash.possync.pos.PosPage;
import io.b2mash.possync.pos.RemoteFetcher;
import io.b2mash.possync.restaurant.PosConnectionService;
import io.b2mash.possync.restaurant.RestaurantInactiveException;
import io.b2mash.possync.syncjob.AlreadyClaimedException;
import io.b2mash.possync.syncjob.JobOwnershipLostException;
import io.b2mash.possync.syncjob.SyncErrorCode;
import io.b2mash.possync.syncjob.SyncJob;
import io.b2mash.possync.syncjob.SyncJobStatus;
import io.b2mash.possync.syncjob.SyncJobStore;
import io.b2mash.possync.syncjob.SyncProgress;
import io.b2mash.possync.syncjob.SyncResult;
import io.b2mash.possync.transaction.ImportPipeline;
import io.b2mash.possync.transaction.ImportResult;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one claimed job to completion: window, authentication, then fetch/import/progress page by
 * page until the provider reports the last page.
 *
 * <p>Each provider call runs on a separate thread bounded by what is left of the job's time
 * budget. Any failure is classified and recorded through {@link SyncJobStore#fail}, which decides
 * between another attempt and terminal failure.
 */
@Service
public class SyncOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

  private final SyncJobStore jobStore;
  private final PosConnectionService posConnectionService;
  private final RemoteFetcher remoteFetcher;
  private final ImportPipeline importPipeline;
  private final SyncWindowCalculator windowCalculator;
  private final SyncFailureClassifier failureClassifier;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;
  private final Duration jobTimeout;
  private final ExecutorService providerExecutor;

  @Autowired
  public SyncOrchestrator(
      SyncJobStore jobStore,
      PosConnectionService posConnectionService,
      RemoteFetcher remoteFetcher,
      ImportPipeline importPipeline,
      SyncWindowCalculator windowCalculator,
      SyncFailureClassifier failureClassifier,
      ApplicationEventPublisher eventPublisher,
      Clock clock,
      PosSyncProperties properties) {
    this(
        jobStore,
        posConnectionService,
        remoteFetcher,
        importPipeline,
        windowCalculator,
        failureClassifier,
        eventPublisher,
        clock,
        properties.sync().jobTimeout());
  }

  SyncOrchestrator(
      SyncJobStore jobStore,
      PosConnectionService posConnectionService,
      RemoteFetcher remoteFetcher,
      ImportPipeline importPipeline,
      SyncWindowCalculator windowCalculator,
      SyncFailureClassifier failureClassifier,
      ApplicationEventPublisher eventPublisher,
      Clock clock,
      Duration jobTimeout) {
    this.jobStore = jobStore;
    this.posConnectionService = posConnectionService;
    this.remoteFetcher = remoteFetcher;
    this.importPipeline = importPipeline;
    this.windowCalculator = windowCalculator;
    this.failureClassifier = failureClassifier;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
    this.jobTimeout = jobTimeout;
    var threadFactory = new CustomizableThreadFactory("pos-fetch-");
    threadFactory.setDaemon(true);
    this.providerExecutor = Executors.newCachedThreadPool(threadFactory);
  }

  @PreDestroy
  void shutdown() {
    providerExecutor.shutdownNow();
  }

  /**
   * Claims and runs the job.
   *
   * @return false if another worker got the job first
   */
  public boolean process(String jobId) {
    SyncJob job;
    try {
      job = jobStore.claim(jobId);
    } catch (AlreadyClaimedException e) {
      log.debug("Skipping sync job {}: {}", jobId, e.getMessage());
      return false;
    }

    UUID claimToken = job.getClaimToken();
    Instant startedAt = clock.instant();
    try {
      run(job, claimToken, startedAt, startedAt.plus(jobTimeout));
    } catch (JobOwnershipLostException e) {
      log.warn("Abandoning sync job {}: {}", jobId, e.getMessage());
    } catch (Exception e) {
      handleFailure(job, claimToken, e, startedAt);
    }
    return true;
  }

  private void run(SyncJob job, UUID claimToken, Instant startedAt, Instant deadline) {
    String jobId = job.getJobId();
    UUID restaurantId = job.getRestaurantId();

    var restaurant = posConnectionService.getRestaurant(restaurantId);
    if (!restaurant.isActive()) {
      throw new RestaurantInactiveException(restaurantId);
    }
    var credentials = posConnectionService.loadCredentials(restaurantId);
    var window = windowCalculator.windowFor(restaurant.getLastSyncAt());
    jobStore.recordWindow(jobId, claimToken, window);

    String accessToken =
        withinDeadline(jobId, deadline, () -> remoteFetcher.authenticate(credentials));

    var cursor = PageCursor.firstPage();
    var totals = ImportResult.empty();
    int pages = 0;
    while (true) {
      var pageCursor = cursor;
      PosPage page =
          withinDeadline(
              jobId,
              deadline,
              () ->
                  remoteFetcher.fetchPage(
                      accessToken, credentials.locationGuid(), window, pageCursor));
      pages++;
      totals = totals.plus(importPipeline.importBatch(restaurantId, jobId, page.records()));
      Integer totalPages = page.done() ? Integer.valueOf(pages) : page.totalPages();
      jobStore.updateProgress(
          jobId,
          claimToken,
          new SyncProgress(pages, totalPages, totals.processed(), page.estimatedTotal()));
      log.debug(
          "Sync job {} page {}: fetched={}, cumulative processed={}",
          jobId,
          pages,
          page.records().size(),
          totals.processed());
      if (page.done()) {
        break;
      }
      cursor = page.nextCursor();
    }

    long durationMs = Duration.between(startedAt, clock.instant()).toMillis();
    var result =
        new SyncResult(
            totals.imported(),
            totals.failed(),
            totals.skippedDuplicates(),
            pages,
            durationMs,
            window.startDate(),
            window.endDate());
    posConnectionService.recordSuccessfulSync(restaurantId, window.endDate());
    var completed = jobStore.complete(jobId, claimToken, result);
    eventPublisher.publishEvent(SyncFinishedEvent.succeeded(completed, result, window.fullSync()));
  }

  private void handleFailure(SyncJob job, UUID claimToken, Exception failure, Instant startedAt) {
    var error = failureClassifier.classify(failure, clock.instant());
    if (error.code() == SyncErrorCode.STORAGE_ERROR
        || error.code() == SyncErrorCode.INTERNAL_ERROR) {
      log.error(
          "Sync job {} for restaurant {} failed on attempt {} with {}",
          job.getJobId(),
          job.getRestaurantId(),
          job.getAttempts() + 1,
          error.code(),
          failure);
    } else {
      log.warn(
          "Sync job {} for restaurant {} failed on attempt {} with {}: {}",
          job.getJobId(),
          job.getRestaurantId(),
          job.getAttempts() + 1,
          error.code(),
          error.message());
    }

    try {
      var updated = jobStore.fail(job.getJobId(), claimToken, error);
      if (updated.getStatus() == SyncJobStatus.FAILED) {
        long durationMs = Duration.between(startedAt, clock.instant()).toMillis();
        eventPublisher.publishEvent(SyncFinishedEvent.failed(updated, durationMs));
      }
    } catch (JobOwnershipLostException e) {
      log.warn("Not recording failure of sync job {}: {}", job.getJobId(), e.getMessage());
    } catch (RuntimeException e) {
      log.error(
          "Could not record failure of sync job {}; it stays PROCESSING until reaped",
          job.getJobId(),
          e);
    }
  }

  private <T> T withinDeadline(String jobId, Instant deadline, Callable<T> operation) {
    long remainingMillis = Duration.between(clock.instant(), deadline).toMillis();
    if (remainingMillis <= 0) {
      throw new SyncTimeoutException(
          "Sync job " + jobId + " exceeded its " + jobTimeout + " budget");
    }
    Future<T> future = providerExecutor.submit(operation);
    try {
      return future.get(remainingMillis, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new SyncTimeoutException(
          "Sync job " + jobId + " exceeded its " + jobTimeout + " budget");
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new SyncTimeoutException("Sync job " + jobId + " was interrupted");
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("Provider call failed for sync job " + jobId, e.getCause());
    }
  }
}
