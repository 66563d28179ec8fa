package io.b2mash.updatescheduler.update;

import io.b2mash.updatescheduler.integration.content.ContentArtifact;
import io.b2mash.updatescheduler.integration.content.ContentCreationException;
import io.b2mash.updatescheduler.integration.content.ContentProvider;
import io.b2mash.updatescheduler.integration.content.ContentRequest;
import io.b2mash.updatescheduler.integration.content.ReportingPeriod;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Default content provider: stores the schedule's template verbatim as a daily or weekly update.
 * Each artifact is committed in its own transaction so a later notification failure cannot roll it
 * back.
 */
@Component
public class UpdateContentProvider implements ContentProvider {

  private static final Logger log = LoggerFactory.getLogger(UpdateContentProvider.class);

  private final DailyUpdateRepository dailyUpdateRepository;
  private final WeeklyUpdateRepository weeklyUpdateRepository;

  public UpdateContentProvider(
      DailyUpdateRepository dailyUpdateRepository, WeeklyUpdateRepository weeklyUpdateRepository) {
    this.dailyUpdateRepository = dailyUpdateRepository;
    this.weeklyUpdateRepository = weeklyUpdateRepository;
  }

  @Override
  @Transactional
  public ContentArtifact createDailyArtifact(ContentRequest request) {
    try {
      var saved =
          dailyUpdateRepository.save(
              new DailyUpdate(
                  request.ownerId(),
                  request.companyId(),
                  request.template(),
                  request.tagIds(),
                  request.requestedAt()));
      log.info("Created daily update {} for schedule {}", saved.getId(), request.scheduleId());
      return UpdateArtifacts.fromDaily(saved);
    } catch (DataAccessException e) {
      throw new ContentCreationException("Failed to store daily update: " + e.getMessage(), e);
    }
  }

  @Override
  @Transactional
  public ContentArtifact createWeeklyArtifact(
      ContentRequest request, ReportingPeriod period, List<ContentArtifact> supportingArtifacts) {
    try {
      var saved =
          weeklyUpdateRepository.save(
              new WeeklyUpdate(
                  request.ownerId(),
                  request.companyId(),
                  request.template(),
                  request.tagIds(),
                  period.start(),
                  period.end(),
                  supportingArtifacts.stream().map(ContentArtifact::id).toList(),
                  request.requestedAt()));
      log.info(
          "Created weekly update {} for schedule {} from {} daily update(s)",
          saved.getId(),
          request.scheduleId(),
          supportingArtifacts.size());
      return UpdateArtifacts.fromWeekly(saved);
    } catch (DataAccessException e) {
      throw new ContentCreationException("Failed to store weekly update: " + e.getMessage(), e);
    }
  }
}
