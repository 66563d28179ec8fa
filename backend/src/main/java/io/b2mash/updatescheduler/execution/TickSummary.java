package io.b2mash.updatescheduler.execution;

/**
 * Counts for one dispatcher tick. {@code failed} counts executions that ended {@code FAILED};
 * {@code skipped} counts due schedules that were not started (still in flight or rejected).
 */
public record TickSummary(int due, int executed, int failed, int skipped, int timedOut) {

  public static final TickSummary NONE = new TickSummary(0, 0, 0, 0, 0);
}
