package io.b2mash.updatescheduler.schedule;

import io.b2mash.updatescheduler.owner.OwnerHeaders;
import io.b2mash.updatescheduler.schedule.dto.CreateScheduleRequest;
import io.b2mash.updatescheduler.schedule.dto.ScheduleResponse;
import io.b2mash.updatescheduler.schedule.dto.UpdateScheduleRequest;
import io.b2mash.updatescheduler.update.UpdateType;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/schedules")
public class ScheduledUpdateController {

  private final ScheduledUpdateService scheduleService;

  public ScheduledUpdateController(ScheduledUpdateService scheduleService) {
    this.scheduleService = scheduleService;
  }

  @GetMapping
  public ResponseEntity<List<ScheduleResponse>> listSchedules(
      @RequestHeader(OwnerHeaders.OWNER_ID) UUID ownerId,
      @RequestParam(required = false) UpdateType type,
      @RequestParam(required = false) Boolean isActive) {
    return ResponseEntity.ok(scheduleService.list(ownerId, type, isActive));
  }

  @GetMapping("/{id}")
  public ResponseEntity<ScheduleResponse> getSchedule(
      @RequestHeader(OwnerHeaders.OWNER_ID) UUID ownerId, @PathVariable UUID id) {
    return ResponseEntity.ok(scheduleService.get(id, ownerId));
  }

  @PostMapping
  public ResponseEntity<ScheduleResponse> createSchedule(
      @RequestHeader(OwnerHeaders.OWNER_ID) UUID ownerId,
      @Valid @RequestBody CreateScheduleRequest request) {
    var response = scheduleService.create(request, ownerId);
    return ResponseEntity.created(URI.create("/api/schedules/" + response.id())).body(response);
  }

  @PutMapping("/{id}")
  public ResponseEntity<ScheduleResponse> updateSchedule(
      @RequestHeader(OwnerHeaders.OWNER_ID) UUID ownerId,
      @PathVariable UUID id,
      @Valid @RequestBody UpdateScheduleRequest request) {
    return ResponseEntity.ok(scheduleService.update(id, request, ownerId));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteSchedule(
      @RequestHeader(OwnerHeaders.OWNER_ID) UUID ownerId, @PathVariable UUID id) {
    scheduleService.delete(id, ownerId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/toggle")
  public ResponseEntity<ScheduleResponse> toggleSchedule(
      @RequestHeader(OwnerHeaders.OWNER_ID) UUID ownerId, @PathVariable UUID id) {
    return ResponseEntity.ok(scheduleService.toggle(id, ownerId));
  }
}
