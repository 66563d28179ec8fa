package io.b2mash.updatescheduler.integration.content;

import io.b2mash.updatescheduler.update.UpdateType;
import java.time.Instant;
import java.util.UUID;

/** A produced daily or weekly update, as seen by the execution engine. */
public record ContentArtifact(
    UUID id, UpdateType type, UUID ownerId, UUID companyId, String content, Instant createdAt) {}
