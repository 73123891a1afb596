package io.b2mash.possync.transaction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.possync.pos.PosOrder;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;

@ExtendWith(MockitoExtension.class)
class DerivedFieldBackfillServiceTest {

  private static final UUID RESTAURANT_ID = UUID.randomUUID();
  private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
  private static final TransactionNormalizer NORMALIZER = new TransactionNormalizer();

  @Mock private PosTransactionRepository repository;
  @Mock private PlatformTransactionManager txManager;

  private DerivedFieldBackfillService service;

  @BeforeEach
  void setUp() {
    service =
        new DerivedFieldBackfillService(repository, Clock.fixed(NOW, ZoneOffset.UTC), txManager);
  }

  @Test
  void backfill_scansEveryTransactionAndReportsUnchangedRows() {
    var transactions = List.of(transaction("a"), transaction("b"));
    when(repository.findByRestaurantId(eq(RESTAURANT_ID), any(Pageable.class)))
        .thenReturn(new PageImpl<>(transactions, PageRequest.of(0, 500), 2));

    var result = service.backfill(RESTAURANT_ID);

    assertThat(result.scanned()).isEqualTo(2);
    assertThat(result.updated()).isZero();
  }

  @Test
  void backfill_commitsEachPageInItsOwnTransaction() {
    var size = DerivedFieldBackfillService.PAGE_SIZE;
    var first = PageRequest.of(0, size, Sort.by("id"));
    var second = first.next();
    var third = second.next();
    long total = 2L * size + 1;
    when(repository.findByRestaurantId(RESTAURANT_ID, first))
        .thenReturn(new PageImpl<>(transactions("p1-", size), first, total));
    when(repository.findByRestaurantId(RESTAURANT_ID, second))
        .thenReturn(new PageImpl<>(transactions("p2-", size), second, total));
    when(repository.findByRestaurantId(RESTAURANT_ID, third))
        .thenReturn(new PageImpl<>(List.of(transaction("last")), third, total));

    var result = service.backfill(RESTAURANT_ID);

    assertThat(result.scanned()).isEqualTo(total);
    verify(txManager, times(3)).getTransaction(any(TransactionDefinition.class));
    verify(txManager, times(3)).commit(any());
    verify(repository, times(3)).findByRestaurantId(eq(RESTAURANT_ID), any(Pageable.class));
  }

  @Test
  void backfill_noTransactions_runsSinglePage() {
    when(repository.findByRestaurantId(eq(RESTAURANT_ID), any(Pageable.class)))
        .thenReturn(Page.empty());

    var result = service.backfill(RESTAURANT_ID);

    assertThat(result.scanned()).isZero();
    verify(txManager).getTransaction(any(TransactionDefinition.class));
  }

  private static List<PosTransaction> transactions(String prefix, int count) {
    var transactions = new ArrayList<PosTransaction>();
    for (int i = 0; i < count; i++) {
      transactions.add(transaction(prefix + i));
    }
    return transactions;
  }

  private static PosTransaction transaction(String guid) {
    return NORMALIZER.normalize(RESTAURANT_ID, null, order(guid), NOW);
  }

  private static PosOrder order(String guid) {
    var check =
        new PosOrder.Check(
            guid, BigDecimal.ZERO, BigDecimal.TEN, false, "PAID", List.of(), List.of());
    return new PosOrder(
        guid,
        null,
        "2025-02-28T18:30:00.000+0000",
        null,
        false,
        null,
        null,
        null,
        List.of(check));
  }
}
