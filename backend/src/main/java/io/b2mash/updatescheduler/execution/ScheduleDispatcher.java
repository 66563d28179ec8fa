package io.b2mash.updatescheduler.execution;

import io.b2mash.updatescheduler.history.ExecutionStatus;
import io.b2mash.updatescheduler.schedule.ScheduledUpdate;
import io.b2mash.updatescheduler.schedule.ScheduledUpdateService;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Periodic driver of the engine. A tick reads every due schedule and hands each one to the {@link
 * ScheduleExecutionRunner} on the execution executor. Failures of one schedule never affect the
 * others and no exception leaves a tick.
 *
 * <p>Ticks do not overlap: a tick that starts while the previous one is still running is skipped.
 * A schedule still executing from an earlier tick is not started again.
 *
 * <p>An execution that exceeds the execution timeout is cancelled and its worker interrupted, so
 * queued schedules get the worker back. A cancelled execution that never started is released at
 * once.
 */
@Component
public class ScheduleDispatcher {

  private static final Logger log = LoggerFactory.getLogger(ScheduleDispatcher.class);

  private final ScheduledUpdateService scheduleService;
  private final ScheduleExecutionRunner runner;
  private final Executor executor;
  private final DispatcherProperties properties;
  private final Clock clock;

  private final AtomicBoolean ticking = new AtomicBoolean(false);
  private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

  public ScheduleDispatcher(
      ScheduledUpdateService scheduleService,
      ScheduleExecutionRunner runner,
      @Qualifier("scheduleExecutionExecutor") Executor executor,
      DispatcherProperties properties,
      Clock clock) {
    this.scheduleService = scheduleService;
    this.runner = runner;
    this.executor = executor;
    this.properties = properties;
    this.clock = clock;
  }

  public TickSummary tick() {
    if (!ticking.compareAndSet(false, true)) {
      log.warn("Previous dispatcher tick still running, skipping this tick");
      return TickSummary.NONE;
    }
    try {
      return dispatchDue(clock.instant());
    } finally {
      ticking.set(false);
    }
  }

  boolean isInFlight(UUID scheduleId) {
    return inFlight.contains(scheduleId);
  }

  private TickSummary dispatchDue(Instant now) {
    List<ScheduledUpdate> due;
    try {
      due = scheduleService.findDue(now);
    } catch (RuntimeException e) {
      log.error("Failed to load due schedules", e);
      return TickSummary.NONE;
    }
    if (due.isEmpty()) {
      log.debug("No schedules due at {}", now);
      return TickSummary.NONE;
    }
    log.info("Dispatching {} due schedule(s)", due.size());

    int skipped = 0;
    List<Submitted> submitted = new ArrayList<>();
    for (var schedule : due) {
      UUID id = schedule.getId();
      if (!inFlight.add(id)) {
        log.warn("Schedule {} is still executing from an earlier tick, skipping", id);
        skipped++;
        continue;
      }
      var claimed = new AtomicBoolean(false);
      var task =
          new FutureTask<ExecutionOutcome>(
              () -> {
                if (!claimed.compareAndSet(false, true)) {
                  return null;
                }
                try {
                  return runner.execute(schedule);
                } finally {
                  inFlight.remove(id);
                }
              });
      try {
        executor.execute(task);
        submitted.add(new Submitted(id, task, claimed));
      } catch (RejectedExecutionException e) {
        inFlight.remove(id);
        log.warn("Execution of schedule {} rejected: {}", id, e.getMessage());
        skipped++;
      }
    }

    int executed = 0;
    int failed = 0;
    int timedOut = 0;
    long timeoutMs = properties.executionTimeout().toMillis();
    for (var pending : submitted) {
      try {
        var outcome = pending.task().get(timeoutMs, TimeUnit.MILLISECONDS);
        executed++;
        if (outcome.status() == ExecutionStatus.FAILED) {
          failed++;
        }
      } catch (TimeoutException e) {
        log.warn(
            "Schedule {} did not finish within {}, cancelling it",
            pending.scheduleId(),
            properties.executionTimeout());
        cancel(pending);
        timedOut++;
      } catch (ExecutionException e) {
        log.error("Execution of schedule {} failed", pending.scheduleId(), e.getCause());
        executed++;
        failed++;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Dispatcher interrupted while waiting for schedule {}", pending.scheduleId());
        break;
      }
    }

    var summary = new TickSummary(due.size(), executed, failed, skipped, timedOut);
    log.info(
        "Dispatcher tick completed: {} due, {} executed, {} failed, {} skipped, {} timed out",
        summary.due(),
        summary.executed(),
        summary.failed(),
        summary.skipped(),
        summary.timedOut());
    return summary;
  }

  private void cancel(Submitted pending) {
    pending.task().cancel(true);
    // never started: the task body will not run, so nothing else releases the schedule
    if (pending.claimed().compareAndSet(false, true)) {
      inFlight.remove(pending.scheduleId());
    }
  }

  private record Submitted(
      UUID scheduleId, FutureTask<ExecutionOutcome> task, AtomicBoolean claimed) {}
}
