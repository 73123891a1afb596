package io.b2mash.possync.syncjob;

/**
 * Progress of a running job. {@code totalPages} and {@code estimatedTotal} stay null until the
 * provider reveals them.
 */
public record SyncProgress(
    Integer currentPage, Integer totalPages, int ordersProcessed, Long estimatedTotal) {

  public static SyncProgress notStarted() {
    return new SyncProgress(null, null, 0, null);
  }
}
