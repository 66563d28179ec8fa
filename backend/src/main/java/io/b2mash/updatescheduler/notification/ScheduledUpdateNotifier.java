package io.b2mash.updatescheduler.notification;

import io.b2mash.updatescheduler.integration.content.ContentArtifact;
import io.b2mash.updatescheduler.integration.content.ReportingPeriod;
import io.b2mash.updatescheduler.integration.email.EmailMessage;
import io.b2mash.updatescheduler.integration.email.EmailProvider;
import io.b2mash.updatescheduler.integration.email.RenderedEmail;
import io.b2mash.updatescheduler.notification.template.EmailTemplateRenderer;
import io.b2mash.updatescheduler.owner.Owner;
import io.b2mash.updatescheduler.update.UpdateType;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Emails a freshly produced update to a schedule's recipients, one message per recipient. Dates in
 * the message are rendered in UTC.
 */
@Service
public class ScheduledUpdateNotifier {

  private static final Logger log = LoggerFactory.getLogger(ScheduledUpdateNotifier.class);

  static final String DAILY_TEMPLATE = "scheduled-daily-update";
  static final String WEEKLY_TEMPLATE = "scheduled-weekly-summary";

  private static final DateTimeFormatter LONG_DATE =
      DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy", Locale.US).withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter SHORT_DATE =
      DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.US).withZone(ZoneOffset.UTC);

  private final EmailTemplateRenderer templateRenderer;
  private final EmailProvider emailProvider;

  public ScheduledUpdateNotifier(
      EmailTemplateRenderer templateRenderer, EmailProvider emailProvider) {
    this.templateRenderer = templateRenderer;
    this.emailProvider = emailProvider;
  }

  /**
   * Sends the artifact to every recipient. Delivery fails as a whole when any recipient fails.
   *
   * @param period the window a weekly artifact covers; ignored for daily artifacts
   */
  public DeliveryResult send(
      List<String> recipients, Owner owner, ContentArtifact artifact, ReportingPeriod period) {
    if (recipients == null || recipients.isEmpty()) {
      return DeliveryResult.success();
    }

    RenderedEmail rendered;
    try {
      rendered = render(owner, artifact, period);
    } catch (RuntimeException e) {
      log.warn("Failed to render email for update {}: {}", artifact.id(), e.getMessage());
      return DeliveryResult.failure(recipients, "Failed to render email: " + e.getMessage());
    }

    List<String> failed = new ArrayList<>();
    String lastError = null;
    for (String recipient : recipients) {
      try {
        var result = emailProvider.sendEmail(EmailMessage.of(recipient, rendered));
        if (!result.success()) {
          failed.add(recipient);
          lastError = result.errorMessage();
          log.warn("Email to {} was not accepted: {}", recipient, result.errorMessage());
        }
      } catch (RuntimeException e) {
        failed.add(recipient);
        lastError = e.getMessage();
        log.warn("Email to {} failed: {}", recipient, e.getMessage());
      }
    }

    if (!failed.isEmpty()) {
      return DeliveryResult.failure(
          failed,
          "Email delivery failed for %d of %d recipient(s): %s"
              .formatted(failed.size(), recipients.size(), lastError));
    }
    log.info(
        "Sent {} update {} to {} recipient(s) via {}",
        artifact.type(),
        artifact.id(),
        recipients.size(),
        emailProvider.providerId());
    return DeliveryResult.success();
  }

  private RenderedEmail render(Owner owner, ContentArtifact artifact, ReportingPeriod period) {
    Map<String, Object> variables = new HashMap<>();
    variables.put("ownerName", owner.getName());
    variables.put("content", artifact.content());

    if (artifact.type() == UpdateType.WEEKLY && period != null) {
      String start = SHORT_DATE.format(period.start());
      String end = SHORT_DATE.format(period.end());
      variables.put("periodStart", start);
      variables.put("periodEnd", end);
      variables.put("subject", "Weekly Summary - " + start + " to " + end);
      return templateRenderer.render(WEEKLY_TEMPLATE, variables);
    }

    Instant createdAt = artifact.createdAt() != null ? artifact.createdAt() : Instant.now();
    String date = LONG_DATE.format(createdAt);
    variables.put("date", date);
    variables.put("subject", "Daily Update - " + date);
    return templateRenderer.render(DAILY_TEMPLATE, variables);
  }
}
