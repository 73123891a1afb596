package io.b2mash.possync.transaction;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Re-derives the UTC analytic fields of a restaurant's stored transactions. Each page is
 * committed in its own transaction, so only one page of entities is managed at a time.
 */
@Service
public class DerivedFieldBackfillService {

  private static final Logger log = LoggerFactory.getLogger(DerivedFieldBackfillService.class);
  static final int PAGE_SIZE = 500;

  private final PosTransactionRepository repository;
  private final Clock clock;
  private final TransactionTemplate txTemplate;

  public DerivedFieldBackfillService(
      PosTransactionRepository repository, Clock clock, PlatformTransactionManager txManager) {
    this.repository = repository;
    this.clock = clock;
    this.txTemplate = new TransactionTemplate(txManager);
    this.txTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  public BackfillResult backfill(UUID restaurantId) {
    long scanned = 0;
    long updated = 0;
    int pages = 0;
    var now = clock.instant();
    Pageable pageable = PageRequest.of(0, PAGE_SIZE, Sort.by("id"));
    while (pageable != null) {
      var current = pageable;
      var outcome = txTemplate.execute(tx -> backfillPage(restaurantId, current, now));
      pages++;
      scanned += outcome.scanned();
      updated += outcome.updated();
      pageable = outcome.next();
    }
    log.info(
        "Backfilled derived fields for restaurant {}: pages={}, scanned={}, updated={}",
        restaurantId,
        pages,
        scanned,
        updated);
    return new BackfillResult(scanned, updated);
  }

  private PageOutcome backfillPage(UUID restaurantId, Pageable pageable, Instant now) {
    var page = repository.findByRestaurantId(restaurantId, pageable);
    long updated = 0;
    for (PosTransaction transaction : page.getContent()) {
      if (transaction.refreshDerivedFields(now)) {
        updated++;
      }
    }
    return new PageOutcome(
        page.getNumberOfElements(), updated, page.hasNext() ? page.nextPageable() : null);
  }

  private record PageOutcome(long scanned, long updated, Pageable next) {}
}
