package io.b2mash.updatescheduler.integration.content;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/** What a schedule asks the content provider to produce. */
public record ContentRequest(
    UUID scheduleId,
    UUID ownerId,
    UUID companyId,
    String template,
    List<UUID> tagIds,
    Instant requestedAt) {

  public ContentRequest {
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(template, "template");
    tagIds = tagIds != null ? List.copyOf(tagIds) : List.of();
  }
}
