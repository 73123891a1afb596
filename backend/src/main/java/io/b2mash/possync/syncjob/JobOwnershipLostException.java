package io.b2mash.possync.syncjob;

/**
 * The worker's claim on a job is no longer valid, typically because the stale-job reaper released
 * it. The worker must stop without touching the job.
 */
public class JobOwnershipLostException extends RuntimeException {

  public JobOwnershipLostException(String jobId) {
    super("Claim on sync job " + jobId + " is no longer held");
  }
}
