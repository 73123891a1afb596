package io.b2mash.possync.sync;

import io.b2mash.possync.config.PosSyncProperties;
import io.b2mash.possync.syncjob.SyncWindow;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Picks the range of orders to fetch: everything since the last successful sync, or a fixed
 * lookback when the restaurant has never synced.
 */
@Component
public class SyncWindowCalculator {

  private final Clock clock;
  private final Duration lookback;

  @Autowired
  public SyncWindowCalculator(Clock clock, PosSyncProperties properties) {
    this(clock, properties.sync().lookbackDays());
  }

  SyncWindowCalculator(Clock clock, int lookbackDays) {
    this.clock = clock;
    this.lookback = Duration.ofDays(lookbackDays);
  }

  public SyncWindow windowFor(Instant lastSyncAt) {
    Instant now = clock.instant();
    if (lastSyncAt == null) {
      return new SyncWindow(now.minus(lookback), now, true);
    }
    // A watermark ahead of this clock yields an empty window rather than an inverted one
    Instant start = lastSyncAt.isAfter(now) ? now : lastSyncAt;
    return new SyncWindow(start, now, false);
  }
}
