package io.b2mash.possync.sync;

import io.b2mash.possync.syncjob.SyncJob;
import io.b2mash.possync.syncjob.SyncJobStatus;
import io.b2mash.possync.syncjob.SyncJobStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.springframework.stereotype.Service;

/** Read-only projection of a restaurant's current sync for polling clients. */
@Service
public class SyncStatusService {

  private final SyncJobStore jobStore;
  private final Clock clock;

  public SyncStatusService(SyncJobStore jobStore, Clock clock) {
    this.jobStore = jobStore;
    this.clock = clock;
  }

  public SyncProgressView getStatus(UUID restaurantId) {
    var active = jobStore.findActiveFor(restaurantId);
    if (!active.isEmpty()) {
      return project(active.get(active.size() - 1), clock.instant());
    }
    var lastFailure =
        jobStore
            .findLatestFor(restaurantId)
            .filter(job -> job.getStatus() == SyncJobStatus.FAILED)
            .map(SyncJob::getError)
            .orElse(null);
    return SyncProgressView.idle(lastFailure);
  }

  SyncProgressView project(SyncJob job, Instant now) {
    var progress = job.getProgress();
    int currentPage = progress.currentPage() != null ? progress.currentPage() : 0;
    int totalPages = progress.totalPages() != null ? progress.totalPages() : 0;
    double percent = totalPages > 0 ? Math.min(100.0, currentPage * 100.0 / totalPages) : 0;

    return new SyncProgressView(
        job.getStatus().name().toLowerCase(),
        job.getJobId(),
        currentPage,
        totalPages,
        percent,
        progress.ordersProcessed(),
        estimateSecondsRemaining(job, now),
        messageFor(job, currentPage, totalPages),
        SyncProgressView.ErrorView.of(job.getError()));
  }

  /**
   * Remaining pages (or remaining estimated orders) divided by the throughput observed since the
   * job started. Zero when nothing has been measured yet.
   */
  static long estimateSecondsRemaining(SyncJob job, Instant now) {
    var progress = job.getProgress();
    if (job.getStatus() != SyncJobStatus.PROCESSING
        || job.getStartedAt() == null
        || progress.currentPage() == null
        || progress.currentPage() == 0) {
      return 0;
    }
    double elapsedSeconds = Duration.between(job.getStartedAt(), now).toMillis() / 1000.0;
    if (elapsedSeconds <= 0) {
      return 0;
    }
    if (progress.totalPages() != null) {
      int remainingPages = Math.max(0, progress.totalPages() - progress.currentPage());
      return Math.round(remainingPages * (elapsedSeconds / progress.currentPage()));
    }
    if (progress.estimatedTotal() != null && progress.ordersProcessed() > 0) {
      long remainingOrders = Math.max(0, progress.estimatedTotal() - progress.ordersProcessed());
      return Math.round(remainingOrders / (progress.ordersProcessed() / elapsedSeconds));
    }
    return 0;
  }

  private static String messageFor(SyncJob job, int currentPage, int totalPages) {
    if (job.getStatus() == SyncJobStatus.PENDING) {
      if (job.getError() != null) {
        return "Retrying after error (attempt "
            + (job.getAttempts() + 1)
            + " of "
            + job.getMaxAttempts()
            + ")";
      }
      return "Waiting to start";
    }
    if (currentPage == 0) {
      return "Connecting to POS";
    }
    return totalPages > 0
        ? "Importing page " + currentPage + " of " + totalPages
        : "Importing page " + currentPage;
  }
}
