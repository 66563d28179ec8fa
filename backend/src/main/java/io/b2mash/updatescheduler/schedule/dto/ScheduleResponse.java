package io.b2mash.updatescheduler.schedule.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.updatescheduler.schedule.ScheduleType;
import io.b2mash.updatescheduler.schedule.ScheduledUpdate;
import io.b2mash.updatescheduler.update.UpdateType;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record ScheduleResponse(
    UUID id,
    UUID ownerId,
    UpdateType updateType,
    UUID companyId,
    List<UUID> tagIds,
    String content,
    ScheduleType scheduleType,
    String scheduledTime,
    LocalDate scheduledDate,
    Integer dayOfWeek,
    Integer dayOfMonth,
    String timezone,
    @JsonProperty("isActive") boolean isActive,
    Instant lastRun,
    Instant nextRun,
    List<String> recipients,
    boolean sendEmail,
    Instant createdAt,
    Instant updatedAt) {

  public static ScheduleResponse from(ScheduledUpdate schedule) {
    return new ScheduleResponse(
        schedule.getId(),
        schedule.getOwnerId(),
        schedule.getUpdateType(),
        schedule.getCompanyId(),
        copy(schedule.getTagIds()),
        schedule.getContent(),
        schedule.getScheduleType(),
        schedule.getScheduledTime(),
        schedule.getScheduledDate(),
        schedule.getDayOfWeek(),
        schedule.getDayOfMonth(),
        schedule.getTimezone(),
        schedule.isActive(),
        schedule.getLastRun(),
        schedule.getNextRun(),
        copy(schedule.getRecipients()),
        schedule.isSendEmail(),
        schedule.getCreatedAt(),
        schedule.getUpdatedAt());
  }

  private static <T> List<T> copy(List<T> values) {
    return values != null ? List.copyOf(values) : List.of();
  }
}
