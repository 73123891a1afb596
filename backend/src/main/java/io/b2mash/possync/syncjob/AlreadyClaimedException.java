package io.b2mash.possync.syncjob;

/** Another worker claimed the job first, or it is no longer pending. */
public class AlreadyClaimedException extends RuntimeException {

  private final String jobId;
  private final SyncJobStatus status;

  public AlreadyClaimedException(String jobId, SyncJobStatus status) {
    super("Sync job " + jobId + " cannot be claimed in status " + status);
    this.jobId = jobId;
    this.status = status;
  }

  public String getJobId() {
    return jobId;
  }

  public SyncJobStatus getStatus() {
    return status;
  }
}
