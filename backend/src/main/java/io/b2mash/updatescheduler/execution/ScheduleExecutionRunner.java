package io.b2mash.updatescheduler.execution;

import io.b2mash.updatescheduler.history.ExecutionStatus;
import io.b2mash.updatescheduler.history.ScheduleHistoryEntry;
import io.b2mash.updatescheduler.history.ScheduleHistoryRecorder;
import io.b2mash.updatescheduler.integration.content.ContentArtifact;
import io.b2mash.updatescheduler.integration.content.ContentProvider;
import io.b2mash.updatescheduler.integration.content.ContentRequest;
import io.b2mash.updatescheduler.integration.content.ReportingPeriod;
import io.b2mash.updatescheduler.integration.content.SupportingContextProvider;
import io.b2mash.updatescheduler.notification.ScheduledUpdateNotifier;
import io.b2mash.updatescheduler.owner.Owner;
import io.b2mash.updatescheduler.owner.OwnerRepository;
import io.b2mash.updatescheduler.schedule.ScheduledUpdate;
import io.b2mash.updatescheduler.schedule.ScheduledUpdateService;
import io.b2mash.updatescheduler.update.UpdateType;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;

/**
 * Executes one due schedule: produce content, notify recipients, advance the schedule, record
 * history. Never throws for a failed attempt; every attempt ends in exactly one history entry.
 *
 * <p>Content, schedule advance and history each commit in their own transaction, so a late failure
 * never undoes content that was already created.
 */
@Component
public class ScheduleExecutionRunner {

  private static final Logger log = LoggerFactory.getLogger(ScheduleExecutionRunner.class);

  static final Duration WEEKLY_LOOKBACK = Duration.ofDays(7);
  private static final int MAX_ERROR_DETAIL_LENGTH = 4000;

  private final OwnerRepository ownerRepository;
  private final ContentProvider contentProvider;
  private final SupportingContextProvider contextProvider;
  private final ScheduledUpdateNotifier notifier;
  private final ScheduledUpdateService scheduleService;
  private final ScheduleHistoryRecorder historyRecorder;
  private final Clock clock;

  public ScheduleExecutionRunner(
      OwnerRepository ownerRepository,
      ContentProvider contentProvider,
      SupportingContextProvider contextProvider,
      ScheduledUpdateNotifier notifier,
      ScheduledUpdateService scheduleService,
      ScheduleHistoryRecorder historyRecorder,
      Clock clock) {
    this.ownerRepository = ownerRepository;
    this.contentProvider = contentProvider;
    this.contextProvider = contextProvider;
    this.notifier = notifier;
    this.scheduleService = scheduleService;
    this.historyRecorder = historyRecorder;
    this.clock = clock;
  }

  public ExecutionOutcome execute(ScheduledUpdate schedule) {
    var attempt = new Attempt(clock.instant());
    log.info("Executing {} schedule {}", schedule.getScheduleType(), schedule.getId());
    try {
      try {
        produceAndDeliver(schedule, attempt);
      } catch (RuntimeException e) {
        log.error("Unexpected failure executing schedule {}", schedule.getId(), e);
        attempt.fail(e);
      }

      try {
        advance(schedule);
      } catch (RuntimeException e) {
        log.error("Failed to advance schedule {} after execution", schedule.getId(), e);
        attempt.advanceFailed(e);
      }
    } finally {
      attempt.executionTimeMs = Duration.between(attempt.startedAt, clock.instant()).toMillis();
      writeHistory(schedule, attempt);
    }

    return new ExecutionOutcome(
        schedule.getId(),
        attempt.status,
        attempt.createdUpdateId,
        attempt.emailSent,
        attempt.executionTimeMs,
        attempt.errorMessage);
  }

  private void produceAndDeliver(ScheduledUpdate schedule, Attempt attempt) {
    Owner owner = ownerRepository.findById(schedule.getOwnerId()).orElse(null);
    if (owner == null) {
      log.warn("Owner {} of schedule {} not found", schedule.getOwnerId(), schedule.getId());
      attempt.status = ExecutionStatus.FAILED;
      attempt.errorMessage = "Owner not found: " + schedule.getOwnerId();
      return;
    }

    var request =
        new ContentRequest(
            schedule.getId(),
            schedule.getOwnerId(),
            schedule.getCompanyId(),
            schedule.getContent(),
            schedule.getTagIds(),
            attempt.startedAt);

    ContentArtifact artifact;
    ReportingPeriod period = null;
    try {
      if (schedule.getUpdateType() == UpdateType.WEEKLY) {
        period = ReportingPeriod.endingAt(attempt.startedAt, WEEKLY_LOOKBACK);
        List<ContentArtifact> dailies =
            contextProvider.findDailyArtifacts(
                schedule.getOwnerId(), schedule.getCompanyId(), period.start(), period.end());
        artifact = contentProvider.createWeeklyArtifact(request, period, dailies);
      } else {
        artifact = contentProvider.createDailyArtifact(request);
      }
    } catch (RuntimeException e) {
      log.warn("Content creation failed for schedule {}: {}", schedule.getId(), e.getMessage());
      attempt.fail(e);
      return;
    }

    attempt.status = ExecutionStatus.SUCCESS;
    attempt.createdUpdateId = artifact.id();

    if (schedule.isSendEmail() && !schedule.getRecipients().isEmpty()) {
      var delivery = notifier.send(schedule.getRecipients(), owner, artifact, period);
      if (delivery.delivered()) {
        attempt.emailSent = true;
      } else {
        attempt.status = ExecutionStatus.PARTIAL;
        attempt.errorMessage = delivery.errorMessage();
        attempt.errorDetail =
            "Failed recipients: " + String.join(", ", delivery.failedRecipients());
      }
    }
  }

  /** Retries once on a version conflict; the retry reloads the schedule in a new transaction. */
  private void advance(ScheduledUpdate schedule) {
    try {
      scheduleService.recordRun(schedule.getId(), clock.instant());
    } catch (OptimisticLockingFailureException e) {
      log.warn("Schedule {} changed during execution, retrying advance", schedule.getId());
      scheduleService.recordRun(schedule.getId(), clock.instant());
    }
  }

  private void writeHistory(ScheduledUpdate schedule, Attempt attempt) {
    try {
      historyRecorder.record(
          ScheduleHistoryEntry.builder()
              .scheduleId(schedule.getId())
              .ownerId(schedule.getOwnerId())
              .executedAt(attempt.startedAt)
              .status(attempt.status)
              .updateType(schedule.getUpdateType())
              .createdUpdateId(attempt.createdUpdateId)
              .emailSent(attempt.emailSent)
              .emailRecipients(schedule.isSendEmail() ? schedule.getRecipients() : List.of())
              .executionTimeMs(attempt.executionTimeMs)
              .error(attempt.errorMessage, attempt.errorDetail)
              .scheduleType(schedule.getScheduleType())
              .companyId(schedule.getCompanyId())
              .tagsCount(schedule.getTagIds() != null ? schedule.getTagIds().size() : 0)
              .contentLength(schedule.getContent() != null ? schedule.getContent().length() : 0)
              .build());
    } catch (RuntimeException e) {
      log.error(
          "Failed to record {} execution of schedule {}", attempt.status, schedule.getId(), e);
    }
  }

  static String describe(Throwable e) {
    var writer = new StringWriter();
    e.printStackTrace(new PrintWriter(writer));
    String trace = writer.toString();
    return trace.length() > MAX_ERROR_DETAIL_LENGTH
        ? trace.substring(0, MAX_ERROR_DETAIL_LENGTH)
        : trace;
  }

  /** Mutable state of one attempt, read by the history write. */
  private static final class Attempt {

    private final Instant startedAt;
    private ExecutionStatus status = ExecutionStatus.FAILED;
    private UUID createdUpdateId;
    private boolean emailSent;
    private long executionTimeMs;
    private String errorMessage;
    private String errorDetail;

    private Attempt(Instant startedAt) {
      this.startedAt = startedAt;
    }

    /** A failure after content exists downgrades to PARTIAL, otherwise the attempt FAILED. */
    private void fail(RuntimeException e) {
      status = createdUpdateId != null ? ExecutionStatus.PARTIAL : ExecutionStatus.FAILED;
      append(messageOf(e));
      errorDetail = describe(e);
    }

    /** The schedule kept its due run time and will run this occurrence again. */
    private void advanceFailed(RuntimeException e) {
      status = ExecutionStatus.FAILED;
      append("Schedule could not be advanced after execution: " + messageOf(e));
      errorDetail = describe(e);
    }

    private void append(String message) {
      errorMessage = errorMessage != null ? errorMessage + "; " + message : message;
    }

    private static String messageOf(RuntimeException e) {
      return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
  }
}
