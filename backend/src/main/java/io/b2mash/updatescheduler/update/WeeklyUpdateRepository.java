package io.b2mash.updatescheduler.update;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface WeeklyUpdateRepository extends JpaRepository<WeeklyUpdate, UUID> {}
