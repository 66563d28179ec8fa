package io.b2mash.updatescheduler.history;

/** Per-status aggregate over a schedule's history, read through a JPQL projection. */
public interface StatusSummary {

  ExecutionStatus getStatus();

  long getCount();

  Double getAverageTimeMs();
}
