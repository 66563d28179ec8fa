package io.b2mash.updatescheduler.schedule.dto;

import io.b2mash.updatescheduler.schedule.ScheduleType;
import io.b2mash.updatescheduler.update.UpdateType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record CreateScheduleRequest(
    @NotNull UpdateType updateType,
    UUID companyId,
    List<UUID> tagIds,
    @NotBlank @Size(max = 10000) String content,
    @NotNull ScheduleType scheduleType,
    @NotBlank @Pattern(regexp = "^([0-1]?[0-9]|2[0-3]):[0-5][0-9]$") String scheduledTime,
    LocalDate scheduledDate,
    @Min(0) @Max(6) Integer dayOfWeek,
    @Min(1) @Max(31) Integer dayOfMonth,
    String timezone,
    List<String> recipients,
    boolean sendEmail) {}
