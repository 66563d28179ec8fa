package io.b2mash.updatescheduler.update;

/** Kind of content a schedule produces. */
public enum UpdateType {
  DAILY,
  WEEKLY
}
