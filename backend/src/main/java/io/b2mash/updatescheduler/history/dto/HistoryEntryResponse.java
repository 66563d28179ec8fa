package io.b2mash.updatescheduler.history.dto;

import io.b2mash.updatescheduler.history.ExecutionStatus;
import io.b2mash.updatescheduler.history.ScheduleHistoryEntry;
import io.b2mash.updatescheduler.schedule.ScheduleType;
import io.b2mash.updatescheduler.update.UpdateType;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record HistoryEntryResponse(
    UUID id,
    UUID scheduleId,
    Instant executedAt,
    ExecutionStatus status,
    UpdateType updateType,
    UUID createdUpdateId,
    boolean emailSent,
    List<String> emailRecipients,
    long executionTimeMs,
    String errorMessage,
    Metadata metadata) {

  public record Metadata(
      ScheduleType scheduleType, UUID companyId, int tagsCount, int contentLength) {}

  public static HistoryEntryResponse from(ScheduleHistoryEntry entry) {
    return new HistoryEntryResponse(
        entry.getId(),
        entry.getScheduleId(),
        entry.getExecutedAt(),
        entry.getStatus(),
        entry.getUpdateType(),
        entry.getCreatedUpdateId(),
        entry.isEmailSent(),
        entry.getEmailRecipients() != null ? List.copyOf(entry.getEmailRecipients()) : List.of(),
        entry.getExecutionTimeMs(),
        entry.getErrorMessage(),
        new Metadata(
            entry.getScheduleType(),
            entry.getCompanyId(),
            entry.getTagsCount(),
            entry.getContentLength()));
  }
}
