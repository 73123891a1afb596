package io.b2mash.possync.pos;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.b2mash.possync.config.PosSyncProperties;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/** Hourly request budget per POS location, shared by all jobs in this process. */
@Service
public class PosRateLimiter {

  private final int hourlyLimit;
  private final Cache<String, AtomicInteger> locationCounters;

  @Autowired
  public PosRateLimiter(PosSyncProperties properties) {
    this(properties.toast().hourlyRequestLimit(), Ticker.systemTicker());
  }

  PosRateLimiter(int hourlyLimit, Ticker ticker) {
    this.hourlyLimit = hourlyLimit;
    this.locationCounters =
        Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofHours(1))
            .maximumSize(10_000)
            .ticker(ticker)
            .build();
  }

  public boolean tryAcquire(String locationGuid) {
    var counter = locationCounters.get("location:" + locationGuid, k -> new AtomicInteger(0));
    if (counter.incrementAndGet() > hourlyLimit) {
      counter.decrementAndGet();
      return false;
    }
    return true;
  }
}
