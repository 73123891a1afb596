package io.b2mash.possync.syncjob;

/** Error taxonomy of job failures. Only retryable codes send a job back to PENDING. */
public enum SyncErrorCode {
  CONFIGURATION_ERROR(false),
  UPSTREAM_AUTH_ERROR(false),
  UPSTREAM_REQUEST_ERROR(false),
  TRANSIENT_NETWORK_ERROR(true),
  STORAGE_ERROR(false),
  TIMEOUT_ERROR(true),
  STALE_JOB(true),
  CANCELLED(false),
  INTERNAL_ERROR(true);

  private final boolean retryable;

  SyncErrorCode(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
