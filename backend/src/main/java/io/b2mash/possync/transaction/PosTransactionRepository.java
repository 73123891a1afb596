package io.b2mash.possync.transaction;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Set;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PosTransactionRepository extends JpaRepository<PosTransaction, UUID> {

  @Query(
      """
      SELECT t.externalId FROM PosTransaction t
      WHERE t.restaurantId = :restaurantId AND t.externalId IN :externalIds
      """)
  Set<String> findExistingExternalIds(
      @Param("restaurantId") UUID restaurantId,
      @Param("externalIds") Collection<String> externalIds);

  Page<PosTransaction> findByRestaurantId(UUID restaurantId, Pageable pageable);

  long countByRestaurantId(UUID restaurantId);

  @Query(
      """
      SELECT COALESCE(SUM(t.totalAmount), 0) FROM PosTransaction t
      WHERE t.restaurantId = :restaurantId
      """)
  BigDecimal sumTotalAmount(@Param("restaurantId") UUID restaurantId);
}
