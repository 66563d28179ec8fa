package io.b2mash.updatescheduler.history;

public enum ExecutionStatus {
  /** Content created and, where requested, delivered. */
  SUCCESS,
  /** No content created, or the attempt could not start. */
  FAILED,
  /** Content created, but delivery or the schedule advance failed. */
  PARTIAL
}
