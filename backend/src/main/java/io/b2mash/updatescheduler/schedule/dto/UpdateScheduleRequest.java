package io.b2mash.updatescheduler.schedule.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.updatescheduler.schedule.ScheduleType;
import io.b2mash.updatescheduler.update.UpdateType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/** Partial update: {@code null} leaves the stored value untouched. */
public record UpdateScheduleRequest(
    UpdateType updateType,
    UUID companyId,
    List<UUID> tagIds,
    @Size(max = 10000) String content,
    ScheduleType scheduleType,
    @Pattern(regexp = "^([0-1]?[0-9]|2[0-3]):[0-5][0-9]$") String scheduledTime,
    LocalDate scheduledDate,
    @Min(0) @Max(6) Integer dayOfWeek,
    @Min(1) @Max(31) Integer dayOfMonth,
    String timezone,
    List<String> recipients,
    Boolean sendEmail,
    @JsonProperty("isActive") Boolean isActive) {

  public boolean touchesCadence() {
    return scheduleType != null
        || scheduledTime != null
        || scheduledDate != null
        || dayOfWeek != null
        || dayOfMonth != null
        || timezone != null;
  }
}
