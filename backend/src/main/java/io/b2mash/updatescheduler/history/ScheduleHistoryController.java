package io.b2mash.updatescheduler.history;

import io.b2mash.updatescheduler.history.dto.DeleteHistoryResponse;
import io.b2mash.updatescheduler.history.dto.HistoryEntryResponse;
import io.b2mash.updatescheduler.history.dto.HistoryPageResponse;
import io.b2mash.updatescheduler.history.dto.HistoryStatsResponse;
import io.b2mash.updatescheduler.history.dto.ScheduleHistoryResponse;
import io.b2mash.updatescheduler.owner.OwnerHeaders;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/schedule-history")
public class ScheduleHistoryController {

  private final ScheduleHistoryService historyService;

  public ScheduleHistoryController(ScheduleHistoryService historyService) {
    this.historyService = historyService;
  }

  /**
   * Lists the caller's execution history, newest first.
   *
   * @param page zero-based page number (default 0)
   * @param size page size (default 50, max 100)
   */
  @GetMapping
  public ResponseEntity<HistoryPageResponse> listHistory(
      @RequestHeader(OwnerHeaders.OWNER_ID) UUID ownerId,
      @RequestParam(required = false) UUID scheduleId,
      @RequestParam(required = false) ExecutionStatus status,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {
    return ResponseEntity.ok(historyService.list(ownerId, scheduleId, status, page, size));
  }

  @GetMapping("/stats")
  public ResponseEntity<HistoryStatsResponse> getStats(
      @RequestHeader(OwnerHeaders.OWNER_ID) UUID ownerId,
      @RequestParam(defaultValue = "30") int days) {
    return ResponseEntity.ok(historyService.stats(ownerId, days));
  }

  @GetMapping("/{id}")
  public ResponseEntity<HistoryEntryResponse> getEntry(
      @RequestHeader(OwnerHeaders.OWNER_ID) UUID ownerId, @PathVariable UUID id) {
    return ResponseEntity.ok(historyService.get(id, ownerId));
  }

  @GetMapping("/schedule/{scheduleId}")
  public ResponseEntity<ScheduleHistoryResponse> getScheduleHistory(
      @RequestHeader(OwnerHeaders.OWNER_ID) UUID ownerId,
      @PathVariable UUID scheduleId,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "20") int size) {
    return ResponseEntity.ok(historyService.forSchedule(scheduleId, ownerId, page, size));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteEntry(
      @RequestHeader(OwnerHeaders.OWNER_ID) UUID ownerId, @PathVariable UUID id) {
    historyService.delete(id, ownerId);
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/schedule/{scheduleId}")
  public ResponseEntity<DeleteHistoryResponse> deleteScheduleHistory(
      @RequestHeader(OwnerHeaders.OWNER_ID) UUID ownerId, @PathVariable UUID scheduleId) {
    return ResponseEntity.ok(
        new DeleteHistoryResponse(historyService.deleteForSchedule(scheduleId, ownerId)));
  }
}
