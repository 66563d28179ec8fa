package io.b2mash.updatescheduler.history;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Retention of execution history.
 *
 * @param retentionDays entries older than this many days are purged
 * @param purgeEnabled whether the daily purge job deletes anything
 */
@ConfigurationProperties(prefix = "updatescheduler.history.retention")
public record HistoryRetentionProperties(
    @DefaultValue("90") int retentionDays, @DefaultValue("true") boolean purgeEnabled) {}
