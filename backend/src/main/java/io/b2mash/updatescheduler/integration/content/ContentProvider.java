package io.b2mash.updatescheduler.integration.content;

import java.util.List;

/**
 * Port for producing the content artifact of a scheduled execution. Implementations may persist
 * the template as-is or hand it to an external formatting service; either way a call is made at
 * most once per execution and failures surface as exceptions.
 */
public interface ContentProvider {

  /** Create a single daily artifact from the schedule's template. */
  ContentArtifact createDailyArtifact(ContentRequest request);

  /**
   * Create a weekly artifact covering {@code period}, with the owner's daily artifacts from that
   * period as supporting context.
   */
  ContentArtifact createWeeklyArtifact(
      ContentRequest request, ReportingPeriod period, List<ContentArtifact> supportingArtifacts);
}
