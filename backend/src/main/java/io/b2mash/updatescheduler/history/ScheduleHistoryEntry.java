package io.b2mash.updatescheduler.history;

import io.b2mash.updatescheduler.schedule.ScheduleType;
import io.b2mash.updatescheduler.update.UpdateType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One execution attempt of a scheduled update. Written once at the end of the attempt whatever its
 * outcome, and never updated afterwards.
 *
 * <p>{@code scheduleId} is a plain column, not a foreign key: history outlives deleted schedules.
 */
@Entity
@Table(name = "schedule_history")
public class ScheduleHistoryEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "schedule_id", nullable = false)
  private UUID scheduleId;

  @Column(name = "owner_id", nullable = false)
  private UUID ownerId;

  @Column(name = "executed_at", nullable = false)
  private Instant executedAt;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ExecutionStatus status;

  @Enumerated(EnumType.STRING)
  @Column(name = "update_type", nullable = false, length = 20)
  private UpdateType updateType;

  @Column(name = "created_update_id")
  private UUID createdUpdateId;

  @Column(name = "email_sent", nullable = false)
  private boolean emailSent;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "email_recipients", columnDefinition = "jsonb")
  private List<String> emailRecipients;

  @Column(name = "execution_time_ms", nullable = false)
  private long executionTimeMs;

  @Column(name = "error_message", columnDefinition = "text")
  private String errorMessage;

  @Column(name = "error_detail", columnDefinition = "text")
  private String errorDetail;

  @Enumerated(EnumType.STRING)
  @Column(name = "schedule_type", length = 20)
  private ScheduleType scheduleType;

  @Column(name = "company_id")
  private UUID companyId;

  @Column(name = "tags_count", nullable = false)
  private int tagsCount;

  @Column(name = "content_length", nullable = false)
  private int contentLength;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ScheduleHistoryEntry() {}

  private ScheduleHistoryEntry(Builder builder) {
    this.scheduleId = builder.scheduleId;
    this.ownerId = builder.ownerId;
    this.executedAt = builder.executedAt;
    this.status = builder.status;
    this.updateType = builder.updateType;
    this.createdUpdateId = builder.createdUpdateId;
    this.emailSent = builder.emailSent;
    this.emailRecipients = new ArrayList<>(builder.emailRecipients);
    this.executionTimeMs = builder.executionTimeMs;
    this.errorMessage = builder.errorMessage;
    this.errorDetail = builder.errorDetail;
    this.scheduleType = builder.scheduleType;
    this.companyId = builder.companyId;
    this.tagsCount = builder.tagsCount;
    this.contentLength = builder.contentLength;
    this.createdAt = Instant.now();
  }

  public static Builder builder() {
    return new Builder();
  }

  public UUID getId() {
    return id;
  }

  public UUID getScheduleId() {
    return scheduleId;
  }

  public UUID getOwnerId() {
    return ownerId;
  }

  public Instant getExecutedAt() {
    return executedAt;
  }

  public ExecutionStatus getStatus() {
    return status;
  }

  public UpdateType getUpdateType() {
    return updateType;
  }

  public UUID getCreatedUpdateId() {
    return createdUpdateId;
  }

  public boolean isEmailSent() {
    return emailSent;
  }

  public List<String> getEmailRecipients() {
    return emailRecipients;
  }

  public long getExecutionTimeMs() {
    return executionTimeMs;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public String getErrorDetail() {
    return errorDetail;
  }

  public ScheduleType getScheduleType() {
    return scheduleType;
  }

  public UUID getCompanyId() {
    return companyId;
  }

  public int getTagsCount() {
    return tagsCount;
  }

  public int getContentLength() {
    return contentLength;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public static final class Builder {

    private UUID scheduleId;
    private UUID ownerId;
    private Instant executedAt;
    private ExecutionStatus status;
    private UpdateType updateType;
    private UUID createdUpdateId;
    private boolean emailSent;
    private List<String> emailRecipients = List.of();
    private long executionTimeMs;
    private String errorMessage;
    private String errorDetail;
    private ScheduleType scheduleType;
    private UUID companyId;
    private int tagsCount;
    private int contentLength;

    private Builder() {}

    public Builder scheduleId(UUID scheduleId) {
      this.scheduleId = scheduleId;
      return this;
    }

    public Builder ownerId(UUID ownerId) {
      this.ownerId = ownerId;
      return this;
    }

    public Builder executedAt(Instant executedAt) {
      this.executedAt = executedAt;
      return this;
    }

    public Builder status(ExecutionStatus status) {
      this.status = status;
      return this;
    }

    public Builder updateType(UpdateType updateType) {
      this.updateType = updateType;
      return this;
    }

    public Builder createdUpdateId(UUID createdUpdateId) {
      this.createdUpdateId = createdUpdateId;
      return this;
    }

    public Builder emailSent(boolean emailSent) {
      this.emailSent = emailSent;
      return this;
    }

    public Builder emailRecipients(List<String> emailRecipients) {
      this.emailRecipients = emailRecipients != null ? emailRecipients : List.of();
      return this;
    }

    public Builder executionTimeMs(long executionTimeMs) {
      this.executionTimeMs = executionTimeMs;
      return this;
    }

    public Builder error(String errorMessage, String errorDetail) {
      this.errorMessage = errorMessage;
      this.errorDetail = errorDetail;
      return this;
    }

    public Builder scheduleType(ScheduleType scheduleType) {
      this.scheduleType = scheduleType;
      return this;
    }

    public Builder companyId(UUID companyId) {
      this.companyId = companyId;
      return this;
    }

    public Builder tagsCount(int tagsCount) {
      this.tagsCount = tagsCount;
      return this;
    }

    public Builder contentLength(int contentLength) {
      this.contentLength = contentLength;
      return this;
    }

    public ScheduleHistoryEntry build() {
      if (scheduleId == null || ownerId == null || status == null || executedAt == null) {
        throw new IllegalStateException(
            "scheduleId, ownerId, status and executedAt are required for a history entry");
      }
      return new ScheduleHistoryEntry(this);
    }
  }
}
