package io.b2mash.updatescheduler.history;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ScheduleHistoryRepository extends JpaRepository<ScheduleHistoryEntry, UUID> {

  Page<ScheduleHistoryEntry> findByOwnerIdOrderByExecutedAtDesc(UUID ownerId, Pageable pageable);

  Page<ScheduleHistoryEntry> findByOwnerIdAndScheduleIdOrderByExecutedAtDesc(
      UUID ownerId, UUID scheduleId, Pageable pageable);

  Page<ScheduleHistoryEntry> findByOwnerIdAndStatusOrderByExecutedAtDesc(
      UUID ownerId, ExecutionStatus status, Pageable pageable);

  Page<ScheduleHistoryEntry> findByOwnerIdAndScheduleIdAndStatusOrderByExecutedAtDesc(
      UUID ownerId, UUID scheduleId, ExecutionStatus status, Pageable pageable);

  List<ScheduleHistoryEntry> findByOwnerIdAndExecutedAtGreaterThanEqualOrderByExecutedAtAsc(
      UUID ownerId, Instant since);

  @Query(
      "SELECT e.status AS status, COUNT(e) AS count, AVG(e.executionTimeMs) AS averageTimeMs"
          + " FROM ScheduleHistoryEntry e"
          + " WHERE e.ownerId = :ownerId AND e.scheduleId = :scheduleId"
          + " GROUP BY e.status")
  List<StatusSummary> summarizeBySchedule(
      @Param("ownerId") UUID ownerId, @Param("scheduleId") UUID scheduleId);

  @Modifying
  @Query(
      "DELETE FROM ScheduleHistoryEntry e"
          + " WHERE e.ownerId = :ownerId AND e.scheduleId = :scheduleId")
  int deleteByOwnerIdAndScheduleId(
      @Param("ownerId") UUID ownerId, @Param("scheduleId") UUID scheduleId);

  @Modifying
  @Query("DELETE FROM ScheduleHistoryEntry e WHERE e.executedAt < :cutoff")
  int deleteByExecutedAtBefore(@Param("cutoff") Instant cutoff);
}
