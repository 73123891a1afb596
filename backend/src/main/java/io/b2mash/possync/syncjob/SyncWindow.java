package io.b2mash.possync.syncjob;

import java.time.Instant;

/** Time range of orders a job fetches. {@code fullSync} marks the initial lookback sync. */
public record SyncWindow(Instant startDate, Instant endDate, boolean fullSync) {

  public String syncType() {
    return fullSync ? "full" : "incremental";
  }
}
