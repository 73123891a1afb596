package io.b2mash.possync.syncjob;

/** What caused a sync job to be created. */
public enum SyncTrigger {
  LOGIN,
  MANUAL,
  SCHEDULED,
  /** Follow-up incremental sync after a full sync finished. */
  CHAINED
}
