package io.b2mash.possync.syncjob;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Queue backed by the {@code sync_jobs} table: the PENDING rows are the queue. Ids enqueued in
 * this process are offered first through an in-memory hint queue; other processes find them on
 * their next poll.
 */
@Component
public class DatabaseJobQueue implements JobQueue {

  private static final Logger log = LoggerFactory.getLogger(DatabaseJobQueue.class);

  private final SyncJobRepository repository;
  private final Clock clock;
  private final ConcurrentLinkedQueue<String> hints = new ConcurrentLinkedQueue<>();

  public DatabaseJobQueue(SyncJobRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Override
  public void enqueue(String jobId) {
    hints.offer(jobId);
    log.debug("Enqueued sync job {}", jobId);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<String> dequeue() {
    Instant now = clock.instant();
    String hinted;
    while ((hinted = hints.poll()) != null) {
      var job = repository.findByJobId(hinted);
      if (job.isPresent() && isClaimable(job.get(), now)) {
        return Optional.of(hinted);
      }
    }
    return repository
        .findClaimableJobIds(SyncJobStatus.PENDING, now, PageRequest.of(0, 1))
        .stream()
        .findFirst();
  }

  @Override
  @Transactional(readOnly = true)
  public List<String> activeJobsFor(UUID restaurantId) {
    return repository
        .findByRestaurantIdAndStatusInOrderByCreatedAtAsc(restaurantId, SyncJobStatus.ACTIVE)
        .stream()
        .map(SyncJob::getJobId)
        .toList();
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Integer> positionOf(String jobId) {
    return repository
        .findByJobId(jobId)
        .filter(job -> job.getStatus() == SyncJobStatus.PENDING)
        .map(
            job ->
                (int) repository.countQueuedAhead(SyncJobStatus.PENDING, job.getCreatedAt()));
  }

  private static boolean isClaimable(SyncJob job, Instant now) {
    return job.getStatus() == SyncJobStatus.PENDING && !job.getAvailableAt().isAfter(now);
  }
}
