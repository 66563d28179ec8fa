package io.b2mash.updatescheduler.schedule;

import io.b2mash.updatescheduler.exception.ScheduleValidationException;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Rejects cadence/anchor combinations that {@link NextRunCalculator} cannot evaluate. Runs on every
 * create and update, before anything is stored.
 */
@Component
public class CadenceValidator {

  private static final Pattern TIME_PATTERN = Pattern.compile("^([0-1]?[0-9]|2[0-3]):[0-5][0-9]$");

  public void validate(Cadence cadence) {
    if (cadence.type() == null) {
      throw new ScheduleValidationException("Schedule type is required");
    }
    if (cadence.scheduledTime() == null || cadence.scheduledTime().isBlank()) {
      throw new ScheduleValidationException("Scheduled time is required");
    }
    if (!TIME_PATTERN.matcher(cadence.scheduledTime()).matches()) {
      throw new ScheduleValidationException("Invalid time format. Use HH:MM (24-hour format)");
    }
    if (cadence.dayOfWeek() != null && (cadence.dayOfWeek() < 0 || cadence.dayOfWeek() > 6)) {
      throw new ScheduleValidationException("Day of week must be between 0 (Sunday) and 6");
    }
    if (cadence.dayOfMonth() != null && (cadence.dayOfMonth() < 1 || cadence.dayOfMonth() > 31)) {
      throw new ScheduleValidationException("Day of month must be between 1 and 31");
    }

    switch (cadence.type()) {
      case ONCE -> {
        if (cadence.scheduledDate() == null) {
          throw new ScheduleValidationException(
              "Scheduled date is required for one-time schedules");
        }
      }
      case WEEKLY -> {
        if (cadence.dayOfWeek() == null) {
          throw new ScheduleValidationException("Day of week is required for weekly schedules");
        }
      }
      case MONTHLY -> {
        if (cadence.dayOfMonth() == null) {
          throw new ScheduleValidationException("Day of month is required for monthly schedules");
        }
      }
      case DAILY -> {
        // time of day is the only anchor
      }
    }

    if (cadence.timezone() != null) {
      try {
        ZoneId.of(cadence.timezone());
      } catch (DateTimeException e) {
        throw new ScheduleValidationException("Unknown timezone: " + cadence.timezone());
      }
    }
  }
}
