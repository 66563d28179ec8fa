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

@Entity
@Table(name = "daily_updates")
public class DailyUpdate {

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

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected DailyUpdate() {}

  public DailyUpdate(
      UUID ownerId, UUID companyId, String content, List<UUID> tagIds, Instant createdAt) {
    this.ownerId = ownerId;
    this.companyId = companyId;
    this.content = content;
    this.tagIds = tagIds != null ? new ArrayList<>(tagIds) : new ArrayList<>();
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

  public Instant getCreatedAt() {
    return createdAt;
  }
}
