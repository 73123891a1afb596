package io.b2mash.possync.transaction;

public record BackfillResult(long scanned, long updated) {}
