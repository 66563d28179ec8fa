package io.b2mash.updatescheduler.schedule;

import static io.b2mash.updatescheduler.schedule.TestSchedules.daily;
import static io.b2mash.updatescheduler.schedule.TestSchedules.monthly;
import static io.b2mash.updatescheduler.schedule.TestSchedules.once;
import static io.b2mash.updatescheduler.schedule.TestSchedules.weekly;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class NextRunCalculatorTest {

  private final NextRunCalculator calculator = new NextRunCalculator();

  // ---- daily ----

  @Test
  void dailyAfterTimeOfDayMovesToTomorrow() {
    var next = calculator.computeNextRun(daily("09:00"), Instant.parse("2025-11-06T10:00:00Z"));
    assertThat(next).isEqualTo(Instant.parse("2025-11-07T09:00:00Z"));
  }

  @Test
  void dailyBeforeTimeOfDayStaysToday() {
    var next = calculator.computeNextRun(daily("09:00"), Instant.parse("2025-11-06T08:59:00Z"));
    assertThat(next).isEqualTo(Instant.parse("2025-11-06T09:00:00Z"));
  }

  @Test
  void dailyExactlyAtTimeOfDayMovesToTomorrow() {
    var next = calculator.computeNextRun(daily("09:00"), Instant.parse("2025-11-06T09:00:00Z"));
    assertThat(next).isEqualTo(Instant.parse("2025-11-07T09:00:00Z"));
  }

  @Test
  void dailyAcceptsSingleDigitHour() {
    var next = calculator.computeNextRun(daily("7:30"), Instant.parse("2025-11-06T06:00:00Z"));
    assertThat(next).isEqualTo(Instant.parse("2025-11-06T07:30:00Z"));
  }

  // ---- weekly ----

  @Test
  void weeklyOnTargetDayBeforeTimeRunsToday() {
    // 2025-11-05 is a Wednesday
    var next = calculator.computeNextRun(weekly(3, "08:00"), Instant.parse("2025-11-05T07:00:00Z"));
    assertThat(next).isEqualTo(Instant.parse("2025-11-05T08:00:00Z"));
  }

  @Test
  void weeklyOnTargetDayAfterTimeRunsNextWeek() {
    var next = calculator.computeNextRun(weekly(3, "08:00"), Instant.parse("2025-11-05T09:00:00Z"));
    assertThat(next).isEqualTo(Instant.parse("2025-11-12T08:00:00Z"));
  }

  @Test
  void weeklySundayIsDayZero() {
    var next = calculator.computeNextRun(weekly(0, "10:00"), Instant.parse("2025-11-05T12:00:00Z"));
    assertThat(next).isEqualTo(Instant.parse("2025-11-09T10:00:00Z"));
  }

  @Test
  void weeklySaturdayIsDaySix() {
    var next = calculator.computeNextRun(weekly(6, "10:00"), Instant.parse("2025-11-05T12:00:00Z"));
    assertThat(next).isEqualTo(Instant.parse("2025-11-08T10:00:00Z"));
  }

  // ---- monthly ----

  @Test
  void monthlyLaterThisMonth() {
    var next =
        calculator.computeNextRun(monthly(15, "10:00"), Instant.parse("2025-11-06T12:00:00Z"));
    assertThat(next).isEqualTo(Instant.parse("2025-11-15T10:00:00Z"));
  }

  @Test
  void monthlyAlreadyPassedMovesToNextMonth() {
    var next =
        calculator.computeNextRun(monthly(15, "10:00"), Instant.parse("2025-11-20T12:00:00Z"));
    assertThat(next).isEqualTo(Instant.parse("2025-12-15T10:00:00Z"));
  }

  @Test
  void monthlyDay31ClampsToLastDayOfShortMonth() {
    var next =
        calculator.computeNextRun(monthly(31, "10:00"), Instant.parse("2025-11-06T12:00:00Z"));
    assertThat(next).isEqualTo(Instant.parse("2025-11-30T10:00:00Z"));
  }

  @Test
  void monthlyAfterClampedDayUsesConfiguredDayNextMonth() {
    var next =
        calculator.computeNextRun(monthly(31, "10:00"), Instant.parse("2025-11-30T12:00:00Z"));
    assertThat(next).isEqualTo(Instant.parse("2025-12-31T10:00:00Z"));
  }

  @Test
  void monthlyClampsToFebruaryEnd() {
    assertThat(
            calculator.computeNextRun(monthly(30, "10:00"), Instant.parse("2026-02-01T00:00:00Z")))
        .isEqualTo(Instant.parse("2026-02-28T10:00:00Z"));
    assertThat(
            calculator.computeNextRun(monthly(30, "10:00"), Instant.parse("2028-02-01T00:00:00Z")))
        .isEqualTo(Instant.parse("2028-02-29T10:00:00Z"));
  }

  // ---- once ----

  @Test
  void onceInThePastIsNotAdjusted() {
    var next =
        calculator.computeNextRun(
            once(LocalDate.of(2025, 1, 1), "09:00"), Instant.parse("2025-11-06T10:00:00Z"));
    assertThat(next).isEqualTo(Instant.parse("2025-01-01T09:00:00Z"));
  }

  @Test
  void onceInTheFuture() {
    var next =
        calculator.computeNextRun(
            once(LocalDate.of(2025, 12, 24), "18:30"), Instant.parse("2025-11-06T10:00:00Z"));
    assertThat(next).isEqualTo(Instant.parse("2025-12-24T18:30:00Z"));
  }

  // ---- time zones ----

  @Test
  void dailyIsEvaluatedInScheduleZone() {
    var cadence = new Cadence(ScheduleType.DAILY, "09:00", null, null, null, "America/New_York");
    // 10:00Z is 05:00 EST, so 09:00 local is still ahead today
    var next = calculator.computeNextRun(cadence, Instant.parse("2025-11-06T10:00:00Z"));
    assertThat(next).isEqualTo(Instant.parse("2025-11-06T14:00:00Z"));
  }

  @Test
  void weeklyUsesLocalDateNotUtcDate() {
    // 2025-11-05T23:30Z is already Thursday in Tokyo
    var cadence = new Cadence(ScheduleType.WEEKLY, "09:00", null, 4, null, "Asia/Tokyo");
    var next = calculator.computeNextRun(cadence, Instant.parse("2025-11-05T23:30:00Z"));
    assertThat(next).isEqualTo(Instant.parse("2025-11-06T00:00:00Z"));
  }

  @Test
  void timeInsideSpringForwardGapShiftsLater() {
    var cadence = new Cadence(ScheduleType.DAILY, "02:30", null, null, null, "Europe/Berlin");
    var next = calculator.computeNextRun(cadence, Instant.parse("2026-03-28T12:00:00Z"));
    // 02:30 does not exist on 2026-03-29 in Berlin; resolves to 03:30 CEST
    assertThat(next).isEqualTo(Instant.parse("2026-03-29T01:30:00Z"));
  }

  // ---- monotonicity ----

  @Test
  void recurringNextRunIsAlwaysAfterNow() {
    var cadences =
        List.of(
            daily("00:00"),
            daily("23:59"),
            weekly(1, "12:15"),
            monthly(31, "06:45"),
            new Cadence(ScheduleType.MONTHLY, "01:00", null, null, 29, "Pacific/Auckland"),
            new Cadence(ScheduleType.WEEKLY, "02:30", null, 0, null, "Europe/Berlin"));
    Instant start = Instant.parse("2025-12-20T00:00:00Z");
    for (var cadence : cadences) {
      for (int step = 0; step < 400; step++) {
        Instant now = start.plus(Duration.ofMinutes(217L * step));
        assertThat(calculator.computeNextRun(cadence, now))
            .as("%s at %s", cadence, now)
            .isAfter(now);
      }
    }
  }

  @Test
  void recurringNextRunIsWithinOneCycle() {
    Instant now = Instant.parse("2025-11-06T10:00:00Z");
    assertThat(Duration.between(now, calculator.computeNextRun(daily("09:59"), now)))
        .isLessThanOrEqualTo(Duration.ofDays(1));
    assertThat(Duration.between(now, calculator.computeNextRun(weekly(4, "09:59"), now)))
        .isLessThanOrEqualTo(Duration.ofDays(7));
  }
}
