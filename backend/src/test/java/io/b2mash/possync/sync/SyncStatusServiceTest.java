package io.b2mash.possync.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import io.b2mash.possync.restaurant.PosType;
import io.b2mash.possync.syncjob.SyncError;
import io.b2mash.possync.syncjob.SyncErrorCode;
import io.b2mash.possync.syncjob.SyncJob;
import io.b2mash.possync.syncjob.SyncJobSpec;
import io.b2mash.possync.syncjob.SyncJobStore;
import io.b2mash.possync.syncjob.SyncProgress;
import io.b2mash.possync.syncjob.SyncResult;
import io.b2mash.possync.syncjob.SyncTrigger;
import io.b2mash.possync.syncjob.SyncWindow;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SyncStatusServiceTest {

  private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
  private static final UUID RESTAURANT_ID = UUID.randomUUID();

  @Mock private SyncJobStore jobStore;

  private SyncStatusService service;

  @BeforeEach
  void setUp() {
    service = new SyncStatusService(jobStore, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void getStatus_noJobs_isIdle() {
    when(jobStore.findActiveFor(RESTAURANT_ID)).thenReturn(List.of());
    when(jobStore.findLatestFor(RESTAURANT_ID)).thenReturn(Optional.empty());

    var view = service.getStatus(RESTAURANT_ID);

    assertThat(view.status()).isEqualTo("idle");
    assertThat(view.jobId()).isNull();
    assertThat(view.error()).isNull();
  }

  @Test
  void getStatus_lastJobFailed_idleViewCarriesError() {
    var failed = job();
    failed.claim(UUID.randomUUID(), NOW);
    failed.recordFailure(
        SyncError.of(SyncErrorCode.UPSTREAM_AUTH_ERROR, "Invalid Toast credentials", NOW),
        Duration.ofMinutes(1),
        NOW);
    when(jobStore.findActiveFor(RESTAURANT_ID)).thenReturn(List.of());
    when(jobStore.findLatestFor(RESTAURANT_ID)).thenReturn(Optional.of(failed));

    var view = service.getStatus(RESTAURANT_ID);

    assertThat(view.status()).isEqualTo("idle");
    assertThat(view.message()).isEqualTo("Last sync failed");
    assertThat(view.error().code()).isEqualTo("UPSTREAM_AUTH_ERROR");
    assertThat(view.error().message()).isEqualTo("Invalid Toast credentials");
  }

  @Test
  void getStatus_lastJobCompleted_isIdleWithoutError() {
    var completed = job();
    completed.claim(UUID.randomUUID(), NOW);
    completed.complete(new SyncResult(10, 0, 0, 1, 100L, NOW, NOW), NOW);
    when(jobStore.findActiveFor(RESTAURANT_ID)).thenReturn(List.of());
    when(jobStore.findLatestFor(RESTAURANT_ID)).thenReturn(Optional.of(completed));

    assertThat(service.getStatus(RESTAURANT_ID).error()).isNull();
  }

  @Test
  void getStatus_pendingJob_isWaitingToStart() {
    var pending = job();
    when(jobStore.findActiveFor(RESTAURANT_ID)).thenReturn(List.of(pending));

    var view = service.getStatus(RESTAURANT_ID);

    assertThat(view.status()).isEqualTo("pending");
    assertThat(view.jobId()).isEqualTo(pending.getJobId());
    assertThat(view.message()).isEqualTo("Waiting to start");
    assertThat(view.percentComplete()).isZero();
  }

  @Test
  void getStatus_pendingRetry_mentionsAttempt() {
    var retrying = job();
    retrying.claim(UUID.randomUUID(), NOW);
    retrying.recordFailure(
        SyncError.of(SyncErrorCode.TRANSIENT_NETWORK_ERROR, "HTTP 503", NOW),
        Duration.ofMinutes(1),
        NOW);
    when(jobStore.findActiveFor(RESTAURANT_ID)).thenReturn(List.of(retrying));

    var view = service.getStatus(RESTAURANT_ID);

    assertThat(view.message()).isEqualTo("Retrying after error (attempt 2 of 3)");
    assertThat(view.error().code()).isEqualTo("TRANSIENT_NETWORK_ERROR");
  }

  @Test
  void project_processingJob_reportsPercentAndEta() {
    var running = job();
    var startedAt = NOW.minusSeconds(20);
    running.claim(UUID.randomUUID(), startedAt);
    running.recordProgress(new SyncProgress(2, 5, 200, 500L), NOW);

    var view = service.project(running, NOW);

    assertThat(view.status()).isEqualTo("processing");
    assertThat(view.currentChunk()).isEqualTo(2);
    assertThat(view.totalChunks()).isEqualTo(5);
    assertThat(view.percentComplete()).isEqualTo(40.0);
    assertThat(view.transactionsImported()).isEqualTo(200);
    // 10s per page, 3 pages left
    assertThat(view.estimatedTimeRemaining()).isEqualTo(30);
    assertThat(view.message()).isEqualTo("Importing page 2 of 5");
  }

  @Test
  void project_processingBeforeFirstPage_isConnecting() {
    var running = job();
    running.claim(UUID.randomUUID(), NOW);

    var view = service.project(running, NOW);

    assertThat(view.message()).isEqualTo("Connecting to POS");
    assertThat(view.estimatedTimeRemaining()).isZero();
  }

  @Test
  void estimateSecondsRemaining_withoutPageCount_usesOrderThroughput() {
    var running = job();
    running.claim(UUID.randomUUID(), NOW.minusSeconds(10));
    running.recordProgress(new SyncProgress(1, null, 100, 300L), NOW);

    // 10 orders per second, 200 left
    assertThat(SyncStatusService.estimateSecondsRemaining(running, NOW)).isEqualTo(20);
  }

  private static SyncJob job() {
    var spec =
        new SyncJobSpec(
            RESTAURANT_ID,
            PosType.TOAST,
            SyncTrigger.MANUAL,
            new SyncWindow(NOW.minus(Duration.ofDays(30)), NOW, true),
            null,
            3);
    return new SyncJob("sync-" + RESTAURANT_ID + "-" + NOW.toEpochMilli(), spec, NOW);
  }
}
