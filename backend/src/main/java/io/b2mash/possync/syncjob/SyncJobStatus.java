package io.b2mash.possync.syncjob;

import java.util.EnumSet;
import java.util.Set;

public enum SyncJobStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED;

  public static final Set<SyncJobStatus> ACTIVE = EnumSet.of(PENDING, PROCESSING);
  public static final Set<SyncJobStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED);

  public boolean isTerminal() {
    return TERMINAL.contains(this);
  }
}
