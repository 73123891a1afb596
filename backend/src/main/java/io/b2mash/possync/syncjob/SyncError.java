package io.b2mash.possync.syncjob;

import java.time.Instant;

public record SyncError(String message, SyncErrorCode code, Instant timestamp) {

  public static SyncError of(SyncErrorCode code, String message, Instant timestamp) {
    return new SyncError(message, code, timestamp);
  }

  public boolean retryable() {
    return code.isRetryable();
  }
}
