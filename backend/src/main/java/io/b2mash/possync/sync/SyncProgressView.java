package io.b2mash.possync.sync;

import io.b2mash.possync.syncjob.SyncError;
import io.b2mash.possync.syncjob.SyncErrorCode;
import java.time.Instant;

/**
 * What the dashboard polls. {@code status} is {@code pending}, {@code processing}, {@code idle}
 * or {@code error}; {@code estimatedTimeRemaining} is in seconds.
 */
public record SyncProgressView(
    String status,
    String jobId,
    int currentChunk,
    int totalChunks,
    double percentComplete,
    int transactionsImported,
    long estimatedTimeRemaining,
    String message,
    ErrorView error) {

  public static SyncProgressView idle(SyncError lastError) {
    return new SyncProgressView(
        "idle",
        null,
        0,
        0,
        0,
        0,
        0,
        lastError != null ? "Last sync failed" : "No sync in progress",
        ErrorView.of(lastError));
  }

  public static SyncProgressView unavailable(Instant now) {
    return new SyncProgressView(
        "error",
        null,
        0,
        0,
        0,
        0,
        0,
        "Sync status is temporarily unavailable",
        new ErrorView(
            "Sync status could not be loaded", SyncErrorCode.STORAGE_ERROR.name(), now));
  }

  public record ErrorView(String message, String code, Instant timestamp) {

    static ErrorView of(SyncError error) {
      return error == null
          ? null
          : new ErrorView(error.message(), error.code().name(), error.timestamp());
    }
  }
}
