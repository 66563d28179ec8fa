package io.b2mash.updatescheduler.schedule;

/** Repeat pattern of a schedule. */
public enum ScheduleType {
  ONCE,
  DAILY,
  WEEKLY,
  MONTHLY;

  public boolean isRecurring() {
    return this != ONCE;
  }
}
