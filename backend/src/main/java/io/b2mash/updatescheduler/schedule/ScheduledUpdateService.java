package io.b2mash.updatescheduler.schedule;

import io.b2mash.updatescheduler.exception.ForbiddenException;
import io.b2mash.updatescheduler.exception.ResourceNotFoundException;
import io.b2mash.updatescheduler.exception.ScheduleValidationException;
import io.b2mash.updatescheduler.schedule.dto.CreateScheduleRequest;
import io.b2mash.updatescheduler.schedule.dto.ScheduleResponse;
import io.b2mash.updatescheduler.schedule.dto.UpdateScheduleRequest;
import io.b2mash.updatescheduler.update.UpdateType;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ScheduledUpdateService {

  private static final Logger log = LoggerFactory.getLogger(ScheduledUpdateService.class);

  private final ScheduledUpdateRepository scheduleRepository;
  private final NextRunCalculator nextRunCalculator;
  private final CadenceValidator cadenceValidator;
  private final Clock clock;

  public ScheduledUpdateService(
      ScheduledUpdateRepository scheduleRepository,
      NextRunCalculator nextRunCalculator,
      CadenceValidator cadenceValidator,
      Clock clock) {
    this.scheduleRepository = scheduleRepository;
    this.nextRunCalculator = nextRunCalculator;
    this.cadenceValidator = cadenceValidator;
    this.clock = clock;
  }

  @Transactional
  public ScheduleResponse create(CreateScheduleRequest request, UUID ownerId) {
    if (request.updateType() == null) {
      throw new ScheduleValidationException("Update type is required");
    }
    String content = trimToNull(request.content());
    if (content == null) {
      throw new ScheduleValidationException("Content is required");
    }

    var cadence =
        new Cadence(
            request.scheduleType(),
            request.scheduledTime(),
            request.scheduledDate(),
            request.dayOfWeek(),
            request.dayOfMonth(),
            request.timezone() != null ? request.timezone() : Cadence.DEFAULT_TIMEZONE);
    cadenceValidator.validate(cadence);

    var schedule =
        new ScheduledUpdate(
            ownerId,
            request.updateType(),
            request.companyId(),
            request.tagIds(),
            content,
            cadence,
            cleanRecipients(request.recipients()),
            request.sendEmail());
    schedule.setNextRun(nextRunCalculator.computeNextRun(cadence, clock.instant()));
    schedule = scheduleRepository.save(schedule);

    log.info(
        "Created {} schedule {} for owner {}, next run {}",
        schedule.getScheduleType(),
        schedule.getId(),
        ownerId,
        schedule.getNextRun());
    return ScheduleResponse.from(schedule);
  }

  @Transactional
  public ScheduleResponse update(UUID id, UpdateScheduleRequest request, UUID ownerId) {
    var schedule = requireOwned(id, ownerId);

    String content = request.content() != null ? trimToNull(request.content()) : null;
    if (request.content() != null && content == null) {
      throw new ScheduleValidationException("Content must not be blank");
    }

    schedule.updateDetails(
        request.updateType() != null ? request.updateType() : schedule.getUpdateType(),
        request.companyId() != null ? request.companyId() : schedule.getCompanyId(),
        request.tagIds() != null ? request.tagIds() : schedule.getTagIds(),
        content != null ? content : schedule.getContent(),
        request.recipients() != null
            ? cleanRecipients(request.recipients())
            : schedule.getRecipients(),
        request.sendEmail() != null ? request.sendEmail() : schedule.isSendEmail());

    Instant now = clock.instant();
    if (request.touchesCadence()) {
      var current = schedule.getCadence();
      var merged =
          new Cadence(
              request.scheduleType() != null ? request.scheduleType() : current.type(),
              request.scheduledTime() != null
                  ? request.scheduledTime()
                  : current.scheduledTime(),
              request.scheduledDate() != null
                  ? request.scheduledDate()
                  : current.scheduledDate(),
              request.dayOfWeek() != null ? request.dayOfWeek() : current.dayOfWeek(),
              request.dayOfMonth() != null ? request.dayOfMonth() : current.dayOfMonth(),
              request.timezone() != null ? request.timezone() : current.timezone());
      cadenceValidator.validate(merged);
      schedule.updateCadence(merged);
      schedule.setNextRun(nextRunCalculator.computeNextRun(merged, now));
    }

    if (request.isActive() != null && request.isActive() != schedule.isActive()) {
      applyActive(schedule, request.isActive(), now);
    }

    schedule = scheduleRepository.save(schedule);
    log.info("Updated schedule {}", id);
    return ScheduleResponse.from(schedule);
  }

  /** Flips {@code active}; {@code nextRun} is recomputed only when a schedule is re-activated. */
  @Transactional
  public ScheduleResponse toggle(UUID id, UUID ownerId) {
    var schedule = requireOwned(id, ownerId);
    applyActive(schedule, !schedule.isActive(), clock.instant());
    schedule = scheduleRepository.save(schedule);
    log.info("Schedule {} is now {}", id, schedule.isActive() ? "active" : "inactive");
    return ScheduleResponse.from(schedule);
  }

  /** Deletes the definition. Its execution history is kept. */
  @Transactional
  public void delete(UUID id, UUID ownerId) {
    var schedule = requireOwned(id, ownerId);
    scheduleRepository.delete(schedule);
    log.info("Deleted schedule {}", id);
  }

  @Transactional(readOnly = true)
  public ScheduleResponse get(UUID id, UUID ownerId) {
    return ScheduleResponse.from(requireOwned(id, ownerId));
  }

  @Transactional(readOnly = true)
  public List<ScheduleResponse> list(UUID ownerId, UpdateType updateType, Boolean isActive) {
    List<ScheduledUpdate> schedules;
    if (updateType != null && isActive != null) {
      schedules =
          scheduleRepository.findByOwnerIdAndUpdateTypeAndActiveOrderByNextRunAsc(
              ownerId, updateType, isActive);
    } else if (updateType != null) {
      schedules =
          scheduleRepository.findByOwnerIdAndUpdateTypeOrderByNextRunAsc(ownerId, updateType);
    } else if (isActive != null) {
      schedules = scheduleRepository.findByOwnerIdAndActiveOrderByNextRunAsc(ownerId, isActive);
    } else {
      schedules = scheduleRepository.findByOwnerIdOrderByNextRunAsc(ownerId);
    }
    return schedules.stream().map(ScheduleResponse::from).toList();
  }

  @Transactional(readOnly = true)
  public List<ScheduledUpdate> findDue(Instant now) {
    return scheduleRepository.findDue(now);
  }

  /**
   * Advances a schedule after an execution attempt finished at {@code ranAt}: one-time schedules
   * are deactivated, recurring ones get their next run. Runs in its own transaction so a failure
   * here never rolls back content that was already created.
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public ScheduledUpdate recordRun(UUID scheduleId, Instant ranAt) {
    var schedule =
        scheduleRepository
            .findById(scheduleId)
            .orElseThrow(() -> new ResourceNotFoundException("ScheduledUpdate", scheduleId));

    schedule.recordRun(ranAt);
    if (schedule.getScheduleType().isRecurring()) {
      schedule.setNextRun(nextRunCalculator.computeNextRun(schedule, ranAt));
    } else {
      schedule.deactivate();
    }
    schedule = scheduleRepository.save(schedule);

    log.debug(
        "Advanced schedule {}: active={}, nextRun={}",
        scheduleId,
        schedule.isActive(),
        schedule.getNextRun());
    return schedule;
  }

  private void applyActive(ScheduledUpdate schedule, boolean active, Instant now) {
    if (active) {
      schedule.activate();
      schedule.setNextRun(nextRunCalculator.computeNextRun(schedule, now));
    } else {
      schedule.deactivate();
    }
  }

  private ScheduledUpdate requireOwned(UUID id, UUID ownerId) {
    var schedule =
        scheduleRepository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("ScheduledUpdate", id));
    if (!Objects.equals(schedule.getOwnerId(), ownerId)) {
      throw new ForbiddenException(
          "Access denied", "Not authorized to access scheduled update " + id);
    }
    return schedule;
  }

  private static List<String> cleanRecipients(List<String> recipients) {
    if (recipients == null) {
      return List.of();
    }
    return recipients.stream()
        .filter(Objects::nonNull)
        .map(String::trim)
        .filter(r -> !r.isEmpty())
        .toList();
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
