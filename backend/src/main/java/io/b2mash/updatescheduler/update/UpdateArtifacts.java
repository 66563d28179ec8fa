package io.b2mash.updatescheduler.update;

import io.b2mash.updatescheduler.integration.content.ContentArtifact;

final class UpdateArtifacts {

  private UpdateArtifacts() {}

  static ContentArtifact fromDaily(DailyUpdate update) {
    return new ContentArtifact(
        update.getId(),
        UpdateType.DAILY,
        update.getOwnerId(),
        update.getCompanyId(),
        update.getContent(),
        update.getCreatedAt());
  }

  static ContentArtifact fromWeekly(WeeklyUpdate update) {
    return new ContentArtifact(
        update.getId(),
        UpdateType.WEEKLY,
        update.getOwnerId(),
        update.getCompanyId(),
        update.getContent(),
        update.getCreatedAt());
  }
}
