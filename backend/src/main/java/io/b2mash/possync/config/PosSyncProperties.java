package io.b2mash.possync.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tunables for the sync pipeline, bound from {@code possync.*}. The encryption key is injected
 * separately into {@link io.b2mash.possync.credential.CredentialVault}.
 */
@ConfigurationProperties(prefix = "possync")
public record PosSyncProperties(
    @DefaultValue Sync sync,
    @DefaultValue Worker worker,
    @DefaultValue Toast toast,
    @DefaultValue Notifications notifications) {

  public record Sync(
      @DefaultValue("30") int lookbackDays,
      @DefaultValue("3") int maxAttempts,
      @DefaultValue("PT30M") Duration jobTimeout,
      @DefaultValue("PT1M") Duration retryDelay,
      @DefaultValue("PT10M") Duration staleAfter,
      @DefaultValue("30") int retentionDays,
      @DefaultValue("PT6H") Duration scheduledInterval,
      @DefaultValue("true") boolean chainAfterFullSync) {}

  public record Worker(@DefaultValue("true") boolean enabled, @DefaultValue("5") int batchSize) {}

  public record Toast(
      @DefaultValue("https://ws-api.toasttab.com") String baseUrl,
      @DefaultValue("100") int pageSize,
      @DefaultValue("PT10S") Duration connectTimeout,
      @DefaultValue("PT30S") Duration readTimeout,
      @DefaultValue("3") int pageRetryAttempts,
      @DefaultValue("PT1S") Duration pageRetryInitialBackoff,
      @DefaultValue("PT10S") Duration pageRetryMaxBackoff,
      @DefaultValue("1000") int hourlyRequestLimit) {}

  public record Notifications(@DefaultValue("noreply@possync.local") String senderAddress) {}
}
