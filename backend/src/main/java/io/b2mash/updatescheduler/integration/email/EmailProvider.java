package io.b2mash.updatescheduler.integration.email;

/** Port for sending emails via an external provider (SMTP, or a logging no-op). */
public interface EmailProvider {

  /** Provider identifier (e.g., "smtp", "noop"). */
  String providerId();

  /** Send an email message. Delivery failures are reported in the result, not thrown. */
  SendResult sendEmail(EmailMessage message);
}
