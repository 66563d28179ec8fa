package io.b2mash.updatescheduler.history;

import io.b2mash.updatescheduler.exception.ForbiddenException;
import io.b2mash.updatescheduler.exception.ResourceNotFoundException;
import io.b2mash.updatescheduler.history.dto.HistoryEntryResponse;
import io.b2mash.updatescheduler.history.dto.HistoryPageResponse;
import io.b2mash.updatescheduler.history.dto.HistoryStatsResponse;
import io.b2mash.updatescheduler.history.dto.HistoryStatsResponse.DailyStats;
import io.b2mash.updatescheduler.history.dto.ScheduleHistoryResponse;
import io.b2mash.updatescheduler.history.dto.ScheduleHistoryResponse.StatusStats;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Owner-scoped reads, statistics and deletion over execution history. */
@Service
public class ScheduleHistoryService {

  private static final Logger log = LoggerFactory.getLogger(ScheduleHistoryService.class);

  static final int MAX_PAGE_SIZE = 100;

  private final ScheduleHistoryRepository historyRepository;
  private final Clock clock;

  public ScheduleHistoryService(ScheduleHistoryRepository historyRepository, Clock clock) {
    this.historyRepository = historyRepository;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public HistoryPageResponse list(
      UUID ownerId, UUID scheduleId, ExecutionStatus status, int page, int size) {
    var pageable = PageRequest.of(Math.max(page, 0), clampSize(size));
    Page<ScheduleHistoryEntry> result;
    if (scheduleId != null && status != null) {
      result =
          historyRepository.findByOwnerIdAndScheduleIdAndStatusOrderByExecutedAtDesc(
              ownerId, scheduleId, status, pageable);
    } else if (scheduleId != null) {
      result =
          historyRepository.findByOwnerIdAndScheduleIdOrderByExecutedAtDesc(
              ownerId, scheduleId, pageable);
    } else if (status != null) {
      result =
          historyRepository.findByOwnerIdAndStatusOrderByExecutedAtDesc(ownerId, status, pageable);
    } else {
      result = historyRepository.findByOwnerIdOrderByExecutedAtDesc(ownerId, pageable);
    }
    return new HistoryPageResponse(
        result.getContent().stream().map(HistoryEntryResponse::from).toList(),
        result.getTotalElements(),
        result.getNumber(),
        result.getSize(),
        result.hasNext());
  }

  @Transactional(readOnly = true)
  public HistoryEntryResponse get(UUID id, UUID ownerId) {
    return HistoryEntryResponse.from(requireOwned(id, ownerId));
  }

  @Transactional(readOnly = true)
  public ScheduleHistoryResponse forSchedule(UUID scheduleId, UUID ownerId, int page, int size) {
    var pageable = PageRequest.of(Math.max(page, 0), clampSize(size));
    var result =
        historyRepository.findByOwnerIdAndScheduleIdOrderByExecutedAtDesc(
            ownerId, scheduleId, pageable);

    Map<ExecutionStatus, StatusStats> stats = new EnumMap<>(ExecutionStatus.class);
    for (var summary : historyRepository.summarizeBySchedule(ownerId, scheduleId)) {
      double average = summary.getAverageTimeMs() != null ? summary.getAverageTimeMs() : 0.0;
      stats.put(summary.getStatus(), new StatusStats(summary.getCount(), round(average)));
    }

    return new ScheduleHistoryResponse(
        scheduleId,
        result.getContent().stream().map(HistoryEntryResponse::from).toList(),
        result.getTotalElements(),
        result.getNumber(),
        result.getSize(),
        stats);
  }

  /** Totals and per-day breakdown for the trailing {@code days} days, grouped by UTC date. */
  @Transactional(readOnly = true)
  public HistoryStatsResponse stats(UUID ownerId, int days) {
    int window = Math.max(days, 1);
    Instant since = clock.instant().minus(Duration.ofDays(window));
    var entries =
        historyRepository.findByOwnerIdAndExecutedAtGreaterThanEqualOrderByExecutedAtAsc(
            ownerId, since);

    long success = 0;
    long failed = 0;
    long partial = 0;
    Map<LocalDate, long[]> perDay = new TreeMap<>();
    for (var entry : entries) {
      LocalDate date = LocalDate.ofInstant(entry.getExecutedAt(), ZoneOffset.UTC);
      long[] counts = perDay.computeIfAbsent(date, d -> new long[3]);
      switch (entry.getStatus()) {
        case SUCCESS -> {
          success++;
          counts[0]++;
        }
        case FAILED -> {
          failed++;
          counts[1]++;
        }
        case PARTIAL -> {
          partial++;
          counts[2]++;
        }
      }
    }

    List<DailyStats> daily = new ArrayList<>();
    perDay.forEach(
        (date, c) -> daily.add(new DailyStats(date, c[0] + c[1] + c[2], c[0], c[1], c[2])));

    long total = entries.size();
    return new HistoryStatsResponse(
        window, total, success, failed, partial, successRate(total, failed), daily);
  }

  @Transactional
  public void delete(UUID id, UUID ownerId) {
    var entry = requireOwned(id, ownerId);
    historyRepository.delete(entry);
    log.info("Deleted history entry {}", id);
  }

  @Transactional
  public int deleteForSchedule(UUID scheduleId, UUID ownerId) {
    int deleted = historyRepository.deleteByOwnerIdAndScheduleId(ownerId, scheduleId);
    log.info("Deleted {} history entries of schedule {}", deleted, scheduleId);
    return deleted;
  }

  @Transactional
  public int purgeExpired(Instant cutoff) {
    return historyRepository.deleteByExecutedAtBefore(cutoff);
  }

  /** Partial executions count as successful: only FAILED lowers the rate. */
  static double successRate(long total, long failed) {
    if (total == 0) {
      return 0.0;
    }
    return round((total - failed) * 100.0 / total);
  }

  private static double round(double value) {
    return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }

  private static int clampSize(int size) {
    return Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
  }

  private ScheduleHistoryEntry requireOwned(UUID id, UUID ownerId) {
    var entry =
        historyRepository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("ScheduleHistoryEntry", id));
    if (!Objects.equals(entry.getOwnerId(), ownerId)) {
      throw new ForbiddenException("Access denied", "Not authorized to access history entry " + id);
    }
    return entry;
  }
}
