package io.b2mash.possync.syncjob;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Hands pending job ids to workers. Claiming is the worker's job, not the queue's. */
public interface JobQueue {

  /** Announces a freshly created job. */
  void enqueue(String jobId);

  /** Next claimable job id, oldest first, or empty when nothing is due. */
  Optional<String> dequeue();

  /** Ids of the restaurant's PENDING or PROCESSING jobs. */
  List<String> activeJobsFor(UUID restaurantId);

  /** Zero-based number of pending jobs ahead of this one, or empty if it is not queued. */
  Optional<Integer> positionOf(String jobId);
}
