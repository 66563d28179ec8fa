package io.b2mash.updatescheduler.integration.content;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Port for reading the prior daily artifacts a weekly artifact is built from. */
public interface SupportingContextProvider {

  /**
   * Daily artifacts of {@code ownerId} created within {@code [from, to]}. When {@code companyId} is
   * non-null only artifacts of that company are returned.
   */
  List<ContentArtifact> findDailyArtifacts(UUID ownerId, UUID companyId, Instant from, Instant to);
}
