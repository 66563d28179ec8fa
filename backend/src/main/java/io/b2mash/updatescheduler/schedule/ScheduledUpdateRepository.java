package io.b2mash.updatescheduler.schedule;

import io.b2mash.updatescheduler.update.UpdateType;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ScheduledUpdateRepository extends JpaRepository<ScheduledUpdate, UUID> {

  /** Due-query backed by the {@code (is_active, next_run)} index. */
  @Query(
      "SELECT s FROM ScheduledUpdate s WHERE s.active = true AND s.nextRun <= :now"
          + " ORDER BY s.nextRun ASC")
  List<ScheduledUpdate> findDue(@Param("now") Instant now);

  List<ScheduledUpdate> findByOwnerIdOrderByNextRunAsc(UUID ownerId);

  List<ScheduledUpdate> findByOwnerIdAndUpdateTypeOrderByNextRunAsc(
      UUID ownerId, UpdateType updateType);

  List<ScheduledUpdate> findByOwnerIdAndActiveOrderByNextRunAsc(UUID ownerId, boolean active);

  List<ScheduledUpdate> findByOwnerIdAndUpdateTypeAndActiveOrderByNextRunAsc(
      UUID ownerId, UpdateType updateType, boolean active);
}
