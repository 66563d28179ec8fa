package io.b2mash.updatescheduler.history.dto;

import java.time.LocalDate;
import java.util.List;

/**
 * Execution statistics over a trailing window.
 *
 * @param successRate percentage of non-failed executions, two decimals, 0 without executions
 * @param daily one row per UTC day that had executions, oldest first
 */
public record HistoryStatsResponse(
    int days,
    long totalExecutions,
    long successCount,
    long failedCount,
    long partialCount,
    double successRate,
    List<DailyStats> daily) {

  public record DailyStats(LocalDate date, long total, long success, long failed, long partial) {}
}
