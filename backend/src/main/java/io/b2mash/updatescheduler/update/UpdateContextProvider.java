package io.b2mash.updatescheduler.update;

import io.b2mash.updatescheduler.integration.content.ContentArtifact;
import io.b2mash.updatescheduler.integration.content.SupportingContextProvider;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class UpdateContextProvider implements SupportingContextProvider {

  private final DailyUpdateRepository dailyUpdateRepository;

  public UpdateContextProvider(DailyUpdateRepository dailyUpdateRepository) {
    this.dailyUpdateRepository = dailyUpdateRepository;
  }

  @Override
  @Transactional(readOnly = true)
  public List<ContentArtifact> findDailyArtifacts(
      UUID ownerId, UUID companyId, Instant from, Instant to) {
    var updates =
        companyId != null
            ? dailyUpdateRepository
                .findByOwnerIdAndCompanyIdAndCreatedAtBetweenOrderByCreatedAtAsc(
                    ownerId, companyId, from, to)
            : dailyUpdateRepository.findByOwnerIdAndCreatedAtBetweenOrderByCreatedAtAsc(
                ownerId, from, to);
    return updates.stream().map(UpdateArtifacts::fromDaily).toList();
  }
}
