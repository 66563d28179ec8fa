package io.b2mash.updatescheduler.update;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DailyUpdateRepository extends JpaRepository<DailyUpdate, UUID> {

  List<DailyUpdate> findByOwnerIdAndCreatedAtBetweenOrderByCreatedAtAsc(
      UUID ownerId, Instant from, Instant to);

  List<DailyUpdate> findByOwnerIdAndCompanyIdAndCreatedAtBetweenOrderByCreatedAtAsc(
      UUID ownerId, UUID companyId, Instant from, Instant to);
}
