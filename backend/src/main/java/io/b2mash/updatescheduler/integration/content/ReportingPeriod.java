package io.b2mash.updatescheduler.integration.content;

import java.time.Duration;
import java.time.Instant;

/** Window a weekly artifact summarizes. */
public record ReportingPeriod(Instant start, Instant end) {

  public static ReportingPeriod endingAt(Instant end, Duration length) {
    return new ReportingPeriod(end.minus(length), end);
  }
}
