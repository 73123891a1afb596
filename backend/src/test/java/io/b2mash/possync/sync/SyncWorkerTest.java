package io.b2mash.possync.sync;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.possync.config.PosSyncProperties;
import io.b2mash.possync.syncjob.JobQueue;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SyncWorkerTest {

  @Mock private JobQueue jobQueue;
  @Mock private SyncOrchestrator orchestrator;

  private SyncWorker worker;

  @BeforeEach
  void setUp() {
    var properties =
        new PosSyncProperties(null, new PosSyncProperties.Worker(true, 2), null, null);
    worker = new SyncWorker(jobQueue, orchestrator, properties);
  }

  @Test
  void poll_processesUpToBatchSize() {
    when(jobQueue.dequeue()).thenReturn(Optional.of("sync-1"), Optional.of("sync-2"));
    when(orchestrator.process(any())).thenReturn(true);

    worker.poll();

    verify(orchestrator).process("sync-1");
    verify(orchestrator).process("sync-2");
    verify(jobQueue, times(2)).dequeue();
  }

  @Test
  void poll_stopsWhenQueueIsEmpty() {
    when(jobQueue.dequeue()).thenReturn(Optional.empty());

    worker.poll();

    verify(orchestrator, never()).process(any());
  }

  @Test
  void poll_queueFailureIsContained() {
    when(jobQueue.dequeue()).thenThrow(new IllegalStateException("db down"));

    worker.poll();

    verify(orchestrator, never()).process(any());
  }
}
