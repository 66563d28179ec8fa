package io.b2mash.updatescheduler.update;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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
 * Weekly summary artifact. Keeps the ids of the daily updates that were gathered as supporting
 * context for the covered period.
 */
@Entity
@Table(name = "weekly_updates")
public class WeeklyUpdate {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "owner_id", nullable = false)
  private UUID ownerId;

  @Column(name = "company_id")
  private UUID companyId;

  @Column(name = "content", nullable = false, columnDefinition = "text")
  private String content;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "tag_ids", columnDefinition = "jsonb")
  private List<UUID> tagIds;

  @Column(name = "period_start", nullable = false)
  private Instant periodStart;

  @Column(name = "period_end", nullable = false)
  private Instant periodEnd;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "daily_update_ids", columnDefinition = "jsonb")
  private List<UUID> dailyUpdateIds;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected WeeklyUpdate() {}

  public WeeklyUpdate(
      UUID ownerId,
      UUID companyId,
      String content,
      List<UUID> tagIds,
      Instant periodStart,
      Instant periodEnd,
      List<UUID> dailyUpdateIds,
      Instant createdAt) {
    this.ownerId = ownerId;
    this.companyId = companyId;
    this.content = content;
    this.tagIds = tagIds != null ? new ArrayList<>(tagIds) : new ArrayList<>();
    this.periodStart = periodStart;
    this.periodEnd = periodEnd;
    this.dailyUpdateIds =
        dailyUpdateIds != null ? new ArrayList<>(dailyUpdateIds) : new ArrayList<>();
    this.createdAt = createdAt;
  }

  public UUID getId() {
    return id;
  }

  public UUID getOwnerId() {
    return ownerId;
  }

  public UUID getCompanyId() {
    return companyId;
  }

  public String getContent() {
    return content;
  }

  public List<UUID> getTagIds() {
    return tagIds;
  }

  public Instant getPeriodStart() {
    return periodStart;
  }

  public Instant getPeriodEnd() {
    return periodEnd;
  }

  public List<UUID> getDailyUpdateIds() {
    return dailyUpdateIds;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
