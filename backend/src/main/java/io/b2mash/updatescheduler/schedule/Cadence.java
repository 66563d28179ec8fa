package io.b2mash.updatescheduler.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * The timing half of a schedule definition: repeat pattern, local time of day and the anchor that
 * applies to the pattern.
 *
 * @param type repeat pattern
 * @param scheduledTime time of day as {@code HH:MM} (24-hour), local to {@code timezone}
 * @param scheduledDate calendar date, used by {@link ScheduleType#ONCE}
 * @param dayOfWeek 0 (Sunday) to 6 (Saturday), used by {@link ScheduleType#WEEKLY}
 * @param dayOfMonth 1 to 31, used by {@link ScheduleType#MONTHLY}
 * @param timezone IANA zone id the schedule is evaluated in
 */
public record Cadence(
    ScheduleType type,
    String scheduledTime,
    LocalDate scheduledDate,
    Integer dayOfWeek,
    Integer dayOfMonth,
    String timezone) {

  public static final String DEFAULT_TIMEZONE = "UTC";

  public LocalTime localTime() {
    String[] parts = scheduledTime.split(":");
    return LocalTime.of(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
  }

  /** Maps the 0 = Sunday numbering onto {@link DayOfWeek}. */
  public DayOfWeek weekday() {
    return DayOfWeek.of(dayOfWeek == 0 ? 7 : dayOfWeek);
  }
}
