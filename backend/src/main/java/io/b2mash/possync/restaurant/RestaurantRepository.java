package io.b2mash.possync.restaurant;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RestaurantRepository extends JpaRepository<Restaurant, UUID> {

  @Query(
      """
      SELECT r FROM Restaurant r
      WHERE r.active = true
        AND r.posType IS NOT NULL
        AND r.locationId IS NOT NULL
        AND (r.lastSyncAt IS NULL OR r.lastSyncAt < :cutoff)
      ORDER BY r.lastSyncAt ASC NULLS FIRST
      """)
  List<Restaurant> findDueForScheduledSync(@Param("cutoff") Instant cutoff);
}
