package io.b2mash.possync.syncjob;

import java.time.Instant;

public record SyncResult(
    int ordersImported,
    int ordersFailed,
    int skippedDuplicates,
    int totalPages,
    long durationMs,
    Instant startDate,
    Instant endDate) {}
