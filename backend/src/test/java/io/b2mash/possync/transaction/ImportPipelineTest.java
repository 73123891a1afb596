package io.b2mash.possync.transaction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.possync.pos.PosOrder;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ImportPipelineTest {

  private static final UUID RESTAURANT_ID = UUID.randomUUID();
  private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

  @Mock private PosTransactionRepository repository;

  private ImportPipeline pipeline;

  @BeforeEach
  void setUp() {
    pipeline =
        new ImportPipeline(
            repository, new TransactionNormalizer(), Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void importBatch_hundredRecordsTenAlreadyStored_importsNinety() {
    var orders = IntStream.range(0, 100).mapToObj(i -> completeOrder("order-" + i)).toList();
    Set<String> existing = new HashSet<>();
    for (int i = 0; i < 10; i++) {
      existing.add("order-" + i);
    }
    when(repository.findExistingExternalIds(eq(RESTAURANT_ID), anyCollection()))
        .thenReturn(existing);

    var result = pipeline.importBatch(RESTAURANT_ID, "sync-1", orders);

    assertThat(result.imported()).isEqualTo(90);
    assertThat(result.skippedDuplicates()).isEqualTo(10);
    assertThat(result.failed()).isZero();
    assertThat(result.processed()).isEqualTo(100);

    var saved = captureSaved();
    assertThat(saved).hasSize(90);
    assertThat(saved)
        .extracting(PosTransaction::getExternalId)
        .doesNotContainAnyElementsOf(existing);
    assertThat(saved).allSatisfy(t -> assertThat(t.getSyncJobId()).isEqualTo("sync-1"));
  }

  @Test
  void importBatch_incompleteRecords_countedAsFailedWithoutAbortingBatch() {
    var orders = new ArrayList<PosOrder>();
    orders.add(completeOrder("ok-1"));
    orders.add(new PosOrder("broken", null, null, null, false, null, null, null, List.of()));
    orders.add(new PosOrder(null, null, null, null, false, null, null, null, null));
    orders.add(completeOrder("ok-2"));
    when(repository.findExistingExternalIds(eq(RESTAURANT_ID), anyCollection()))
        .thenReturn(Set.of());

    var result = pipeline.importBatch(RESTAURANT_ID, orders);

    assertThat(result).isEqualTo(new ImportResult(2, 0, 2));
    assertThat(captureSaved())
        .extracting(PosTransaction::getExternalId)
        .containsExactly("ok-1", "ok-2");
  }

  @Test
  void importBatch_repeatedGuidWithinBatch_storedOnce() {
    var orders = List.of(completeOrder("dup"), completeOrder("dup"), completeOrder("other"));
    when(repository.findExistingExternalIds(eq(RESTAURANT_ID), anyCollection()))
        .thenReturn(Set.of());

    var result = pipeline.importBatch(RESTAURANT_ID, orders);

    assertThat(result).isEqualTo(new ImportResult(2, 1, 0));
  }

  @Test
  void importBatch_allStored_savesNothingNew() {
    var orders = List.of(completeOrder("a"), completeOrder("b"));
    when(repository.findExistingExternalIds(eq(RESTAURANT_ID), anyCollection()))
        .thenReturn(Set.of("a", "b"));

    var result = pipeline.importBatch(RESTAURANT_ID, orders);

    assertThat(result).isEqualTo(new ImportResult(0, 2, 0));
    assertThat(captureSaved()).isEmpty();
  }

  @Test
  void importBatch_emptyBatch_touchesNothing() {
    assertThat(pipeline.importBatch(RESTAURANT_ID, List.of())).isEqualTo(ImportResult.empty());
    verifyNoInteractions(repository);
  }

  @Test
  void importBatch_onlyRecordsWithoutGuid_skipsLookup() {
    var orders = List.of(new PosOrder(null, null, null, null, false, null, null, null, null));

    var result = pipeline.importBatch(RESTAURANT_ID, orders);

    assertThat(result.failed()).isEqualTo(1);
    verify(repository, never()).findExistingExternalIds(eq(RESTAURANT_ID), anyCollection());
  }

  @SuppressWarnings("unchecked")
  private List<PosTransaction> captureSaved() {
    ArgumentCaptor<List<PosTransaction>> captor = ArgumentCaptor.forClass(List.class);
    verify(repository).saveAll(captor.capture());
    return captor.getValue();
  }

  private static PosOrder completeOrder(String guid) {
    var check =
        new PosOrder.Check(
            guid + "-check",
            new BigDecimal("1.00"),
            new BigDecimal("11.00"),
            false,
            "PAID",
            List.of(),
            List.of());
    return new PosOrder(
        guid,
        "20250228",
        "2025-02-28T18:30:00.000+0000",
        null,
        false,
        null,
        null,
        null,
        List.of(check));
  }
}
