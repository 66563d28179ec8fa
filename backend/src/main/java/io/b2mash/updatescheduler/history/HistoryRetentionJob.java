package io.b2mash.updatescheduler.history;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Daily purge of history entries past the retention window. */
@Component
@EnableConfigurationProperties(HistoryRetentionProperties.class)
public class HistoryRetentionJob {

  private static final Logger log = LoggerFactory.getLogger(HistoryRetentionJob.class);

  private final ScheduleHistoryService historyService;
  private final HistoryRetentionProperties properties;
  private final Clock clock;

  public HistoryRetentionJob(
      ScheduleHistoryService historyService, HistoryRetentionProperties properties, Clock clock) {
    this.historyService = historyService;
    this.properties = properties;
    this.clock = clock;
  }

  @Scheduled(cron = "${updatescheduler.history.retention.cron:0 30 3 * * *}")
  public void purge() {
    if (!properties.purgeEnabled()) {
      log.debug("History purge disabled, skipping");
      return;
    }
    Instant cutoff = clock.instant().minus(Duration.ofDays(properties.retentionDays()));
    try {
      int deleted = historyService.purgeExpired(cutoff);
      if (deleted > 0) {
        log.info("Purged {} history entries executed before {}", deleted, cutoff);
      }
    } catch (RuntimeException e) {
      log.error("History purge before {} failed", cutoff, e);
    }
  }
}
