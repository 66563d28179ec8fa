package io.b2mash.updatescheduler.schedule;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import org.springframework.stereotype.Component;

/**
 * Maps a schedule's cadence and the current instant to its next execution instant. Pure: all
 * arithmetic happens in the schedule's zone and the result is normalized to an {@link Instant}.
 *
 * <p>Input is expected to have passed {@link CadenceValidator}.
 */
@Component
public class NextRunCalculator {

  public Instant computeNextRun(ScheduledUpdate schedule, Instant now) {
    return computeNextRun(schedule.getCadence(), now);
  }

  public Instant computeNextRun(Cadence cadence, Instant now) {
    ZoneId zone = ZoneId.of(cadence.timezone());
    LocalTime time = cadence.localTime();
    LocalDate today = now.atZone(zone).toLocalDate();

    ZonedDateTime next =
        switch (cadence.type()) {
          // a past date stays in the past and is picked up by the next tick
          case ONCE -> ZonedDateTime.of(cadence.scheduledDate(), time, zone);
          case DAILY -> {
            var candidate = ZonedDateTime.of(today, time, zone);
            yield isAfter(candidate, now) ? candidate : candidate.plusDays(1);
          }
          case WEEKLY -> {
            LocalDate target = today.with(TemporalAdjusters.nextOrSame(cadence.weekday()));
            var candidate = ZonedDateTime.of(target, time, zone);
            yield isAfter(candidate, now)
                ? candidate
                : ZonedDateTime.of(target.plusWeeks(1), time, zone);
          }
          case MONTHLY -> {
            YearMonth month = YearMonth.from(today);
            int day = cadence.dayOfMonth();
            var candidate = ZonedDateTime.of(dayInMonth(month, day), time, zone);
            yield isAfter(candidate, now)
                ? candidate
                : ZonedDateTime.of(dayInMonth(month.plusMonths(1), day), time, zone);
          }
        };
    return next.toInstant();
  }

  /** Clamps to the last day of short months: day 31 in April is April 30. */
  static LocalDate dayInMonth(YearMonth month, int dayOfMonth) {
    return month.atDay(Math.min(dayOfMonth, month.lengthOfMonth()));
  }

  private static boolean isAfter(ZonedDateTime candidate, Instant now) {
    return candidate.toInstant().isAfter(now);
  }
}
