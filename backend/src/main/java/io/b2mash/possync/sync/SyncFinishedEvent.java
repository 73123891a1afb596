package io.b2mash.possync.sync;

import io.b2mash.possync.syncjob.SyncJob;
import io.b2mash.possync.syncjob.SyncResult;
import java.util.UUID;

/** Published once per job when it reaches a terminal state. */
public record SyncFinishedEvent(
    UUID restaurantId,
    String jobId,
    int ordersImported,
    int ordersFailed,
    long durationMs,
    boolean success,
    String errorMessage,
    boolean fullSync) {

  public static SyncFinishedEvent succeeded(SyncJob job, SyncResult result, boolean fullSync) {
    return new SyncFinishedEvent(
        job.getRestaurantId(),
        job.getJobId(),
        result.ordersImported(),
        result.ordersFailed(),
        result.durationMs(),
        true,
        null,
        fullSync);
  }

  public static SyncFinishedEvent failed(SyncJob job, long durationMs) {
    var error = job.getError();
    return new SyncFinishedEvent(
        job.getRestaurantId(),
        job.getJobId(),
        0,
        0,
        durationMs,
        false,
        error != null ? error.message() : "Sync failed",
        job.getWindow() != null && job.getWindow().fullSync());
  }
}
