package io.b2mash.possync.transaction;

import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TransactionBackfillController {

  private final DerivedFieldBackfillService backfillService;

  public TransactionBackfillController(DerivedFieldBackfillService backfillService) {
    this.backfillService = backfillService;
  }

  @PostMapping("/api/restaurants/{restaurantId}/transactions/backfill")
  public ResponseEntity<BackfillResult> backfill(@PathVariable UUID restaurantId) {
    return ResponseEntity.ok(backfillService.backfill(restaurantId));
  }
}
