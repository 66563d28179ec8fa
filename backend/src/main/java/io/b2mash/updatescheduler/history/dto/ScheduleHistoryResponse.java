package io.b2mash.updatescheduler.history.dto;

import io.b2mash.updatescheduler.history.ExecutionStatus;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record ScheduleHistoryResponse(
    UUID scheduleId,
    List<HistoryEntryResponse> history,
    long total,
    int page,
    int size,
    Map<ExecutionStatus, StatusStats> stats) {

  public record StatusStats(long count, double averageTimeMs) {}
}
