package io.b2mash.updatescheduler.history;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/** Appends execution history. Each write commits on its own, independent of the caller. */
@Component
public class ScheduleHistoryRecorder {

  private static final Logger log = LoggerFactory.getLogger(ScheduleHistoryRecorder.class);

  private final ScheduleHistoryRepository historyRepository;

  public ScheduleHistoryRecorder(ScheduleHistoryRepository historyRepository) {
    this.historyRepository = historyRepository;
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public ScheduleHistoryEntry record(ScheduleHistoryEntry entry) {
    var saved = historyRepository.save(entry);
    log.info(
        "Recorded {} execution of schedule {} ({} ms)",
        saved.getStatus(),
        saved.getScheduleId(),
        saved.getExecutionTimeMs());
    return saved;
  }
}
