package io.b2mash.possync.transaction;

import io.b2mash.possync.pos.PosOrder;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Idempotent import of provider orders. The provider order GUID is the external id; orders
 * already stored for the restaurant, or repeated within the batch, are skipped untouched.
 * Incomplete orders are counted as failed and never abort the batch.
 */
@Service
public class ImportPipeline {

  private static final Logger log = LoggerFactory.getLogger(ImportPipeline.class);

  private final PosTransactionRepository repository;
  private final TransactionNormalizer normalizer;
  private final Clock clock;

  public ImportPipeline(
      PosTransactionRepository repository, TransactionNormalizer normalizer, Clock clock) {
    this.repository = repository;
    this.normalizer = normalizer;
    this.clock = clock;
  }

  @Transactional
  public ImportResult importBatch(UUID restaurantId, List<PosOrder> records) {
    return importBatch(restaurantId, null, records);
  }

  @Transactional
  public ImportResult importBatch(UUID restaurantId, String syncJobId, List<PosOrder> records) {
    if (records == null || records.isEmpty()) {
      return ImportResult.empty();
    }
    var externalIds =
        records.stream().map(PosOrder::guid).filter(Objects::nonNull).distinct().toList();
    Set<String> seen = new HashSet<>();
    if (!externalIds.isEmpty()) {
      seen.addAll(repository.findExistingExternalIds(restaurantId, externalIds));
    }

    Instant importedAt = clock.instant();
    var toSave = new ArrayList<PosTransaction>();
    int duplicates = 0;
    int failed = 0;
    for (PosOrder order : records) {
      if (order.guid() != null && seen.contains(order.guid())) {
        duplicates++;
        continue;
      }
      try {
        toSave.add(normalizer.normalize(restaurantId, syncJobId, order, importedAt));
        seen.add(order.guid());
      } catch (PartialRecordException e) {
        failed++;
        log.debug("Skipping incomplete order for restaurant {}: {}", restaurantId, e.getMessage());
      }
    }
    repository.saveAll(toSave);

    var result = new ImportResult(toSave.size(), duplicates, failed);
    if (failed > 0) {
      log.warn(
          "Batch for restaurant {} had {} incomplete order(s): imported={}, duplicates={}",
          restaurantId,
          failed,
          result.imported(),
          result.skippedDuplicates());
    }
    return result;
  }
}
