package io.b2mash.possync.syncjob;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SyncJobRepository extends JpaRepository<SyncJob, UUID> {

  Optional<SyncJob> findByJobId(String jobId);

  /** Row-locks the job so that concurrent claims serialize on the database. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT j FROM SyncJob j WHERE j.jobId = :jobId")
  Optional<SyncJob> findByJobIdForUpdate(@Param("jobId") String jobId);

  List<SyncJob> findByRestaurantIdAndStatusInOrderByCreatedAtAsc(
      UUID restaurantId, Collection<SyncJobStatus> statuses);

  Optional<SyncJob> findFirstByRestaurantIdOrderByCreatedAtDesc(UUID restaurantId);

  List<SyncJob> findByRestaurantIdOrderByCreatedAtDesc(UUID restaurantId, Pageable pageable);

  @Query(
      """
      SELECT j.jobId FROM SyncJob j
      WHERE j.status = :status AND j.availableAt <= :now
      ORDER BY j.createdAt ASC
      """)
  List<String> findClaimableJobIds(
      @Param("status") SyncJobStatus status, @Param("now") Instant now, Pageable pageable);

  @Query(
      """
      SELECT COUNT(j) FROM SyncJob j
      WHERE j.status = :status AND j.createdAt < :createdAt
      """)
  long countQueuedAhead(
      @Param("status") SyncJobStatus status, @Param("createdAt") Instant createdAt);

  List<SyncJob> findByStatusAndHeartbeatAtBefore(SyncJobStatus status, Instant cutoff);

  @Modifying
  @Query(
      """
      DELETE FROM SyncJob j
      WHERE j.status IN :statuses AND j.completedAt < :cutoff
      """)
  int deleteTerminalBefore(
      @Param("statuses") Collection<SyncJobStatus> statuses, @Param("cutoff") Instant cutoff);
}
