package io.b2mash.updatescheduler.schedule;

import io.b2mash.updatescheduler.update.UpdateType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A definition of content to be produced automatically, once or on a repeating cadence, together
 * with its runtime state. {@code nextRun} is what the dispatcher's due-query selects on.
 */
@Entity
@Table(name = "scheduled_updates")
public class ScheduledUpdate {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "owner_id", nullable = false)
  private UUID ownerId;

  @Enumerated(EnumType.STRING)
  @Column(name = "update_type", nullable = false, length = 20)
  private UpdateType updateType;

  @Column(name = "company_id")
  private UUID companyId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "tag_ids", columnDefinition = "jsonb")
  private List<UUID> tagIds;

  @Column(name = "content", nullable = false, columnDefinition = "text")
  private String content;

  @Enumerated(EnumType.STRING)
  @Column(name = "schedule_type", nullable = false, length = 20)
  private ScheduleType scheduleType;

  @Column(name = "scheduled_time", nullable = false, length = 5)
  private String scheduledTime;

  @Column(name = "scheduled_date")
  private LocalDate scheduledDate;

  @Column(name = "day_of_week")
  private Integer dayOfWeek;

  @Column(name = "day_of_month")
  private Integer dayOfMonth;

  @Column(name = "timezone", nullable = false, length = 64)
  private String timezone;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  @Column(name = "last_run")
  private Instant lastRun;

  @Column(name = "next_run")
  private Instant nextRun;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "recipients", columnDefinition = "jsonb")
  private List<String> recipients;

  @Column(name = "send_email", nullable = false)
  private boolean sendEmail;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ScheduledUpdate() {}

  public ScheduledUpdate(
      UUID ownerId,
      UpdateType updateType,
      UUID companyId,
      List<UUID> tagIds,
      String content,
      Cadence cadence,
      List<String> recipients,
      boolean sendEmail) {
    this.ownerId = ownerId;
    this.updateType = updateType;
    this.companyId = companyId;
    this.tagIds = tagIds != null ? new ArrayList<>(tagIds) : new ArrayList<>();
    this.content = content;
    applyCadence(cadence);
    this.recipients = recipients != null ? new ArrayList<>(recipients) : new ArrayList<>();
    this.sendEmail = sendEmail;
    this.active = true;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public Cadence getCadence() {
    return new Cadence(
        scheduleType, scheduledTime, scheduledDate, dayOfWeek, dayOfMonth, timezone);
  }

  public void updateCadence(Cadence cadence) {
    applyCadence(cadence);
    this.updatedAt = Instant.now();
  }

  public void updateDetails(
      UpdateType updateType,
      UUID companyId,
      List<UUID> tagIds,
      String content,
      List<String> recipients,
      boolean sendEmail) {
    this.updateType = updateType;
    this.companyId = companyId;
    this.tagIds = tagIds != null ? new ArrayList<>(tagIds) : new ArrayList<>();
    this.content = content;
    this.recipients = recipients != null ? new ArrayList<>(recipients) : new ArrayList<>();
    this.sendEmail = sendEmail;
    this.updatedAt = Instant.now();
  }

  /** Records that an execution attempt finished at {@code ranAt}. */
  public void recordRun(Instant ranAt) {
    this.lastRun = ranAt;
    this.updatedAt = Instant.now();
  }

  public void setNextRun(Instant nextRun) {
    this.nextRun = nextRun;
    this.updatedAt = Instant.now();
  }

  public void activate() {
    this.active = true;
    this.updatedAt = Instant.now();
  }

  public void deactivate() {
    this.active = false;
    this.updatedAt = Instant.now();
  }

  private void applyCadence(Cadence cadence) {
    this.scheduleType = cadence.type();
    this.scheduledTime = cadence.scheduledTime();
    this.scheduledDate = cadence.scheduledDate();
    this.dayOfWeek = cadence.dayOfWeek();
    this.dayOfMonth = cadence.dayOfMonth();
    this.timezone = cadence.timezone() != null ? cadence.timezone() : Cadence.DEFAULT_TIMEZONE;
  }

  public UUID getId() {
    return id;
  }

  public UUID getOwnerId() {
    return ownerId;
  }

  public UpdateType getUpdateType() {
    return updateType;
  }

  public UUID getCompanyId() {
    return companyId;
  }

  public List<UUID> getTagIds() {
    return tagIds;
  }

  public String getContent() {
    return content;
  }

  public ScheduleType getScheduleType() {
    return scheduleType;
  }

  public String getScheduledTime() {
    return scheduledTime;
  }

  public LocalDate getScheduledDate() {
    return scheduledDate;
  }

  public Integer getDayOfWeek() {
    return dayOfWeek;
  }

  public Integer getDayOfMonth() {
    return dayOfMonth;
  }

  public String getTimezone() {
    return timezone;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getLastRun() {
    return lastRun;
  }

  public Instant getNextRun() {
    return nextRun;
  }

  public List<String> getRecipients() {
    return recipients;
  }

  public boolean isSendEmail() {
    return sendEmail;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
