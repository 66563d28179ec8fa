package io.b2mash.updatescheduler.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.updatescheduler.integration.content.ContentArtifact;
import io.b2mash.updatescheduler.integration.content.ReportingPeriod;
import io.b2mash.updatescheduler.integration.email.EmailMessage;
import io.b2mash.updatescheduler.integration.email.EmailProvider;
import io.b2mash.updatescheduler.integration.email.SendResult;
import io.b2mash.updatescheduler.notification.template.EmailTemplateRenderer;
import io.b2mash.updatescheduler.owner.Owner;
import io.b2mash.updatescheduler.update.UpdateType;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ScheduledUpdateNotifierTest {

  private static final Instant CREATED_AT = Instant.parse("2025-11-06T09:00:00Z");

  @Mock private EmailProvider emailProvider;

  private final Owner owner = new Owner("Dana Reyes", "dana@example.com");
  private ScheduledUpdateNotifier notifier;

  @BeforeEach
  void setUp() {
    notifier = new ScheduledUpdateNotifier(new EmailTemplateRenderer(), emailProvider);
  }

  @Test
  void sendsOneMessagePerRecipient() {
    when(emailProvider.sendEmail(any(EmailMessage.class)))
        .thenReturn(new SendResult(true, "msg-1", null));

    var result =
        notifier.send(List.of("a@example.com", "b@example.com"), owner, daily(), null);

    assertThat(result.delivered()).isTrue();
    assertThat(result.failedRecipients()).isEmpty();
    var captor = ArgumentCaptor.forClass(EmailMessage.class);
    verify(emailProvider, times(2)).sendEmail(captor.capture());
    assertThat(captor.getAllValues())
        .extracting(EmailMessage::to)
        .containsExactly("a@example.com", "b@example.com");
    var message = captor.getAllValues().get(0);
    assertThat(message.subject()).isEqualTo("Daily Update - Thursday, November 6, 2025");
    assertThat(message.htmlBody()).contains("Fixed the login bug").contains("Dana Reyes");
    assertThat(message.plainTextBody()).contains("Fixed the login bug");
  }

  @Test
  void oneRejectedRecipientFailsTheDelivery() {
    when(emailProvider.sendEmail(argThat(m -> m != null && m.to().equals("a@example.com"))))
        .thenReturn(new SendResult(true, "msg-1", null));
    when(emailProvider.sendEmail(argThat(m -> m != null && m.to().equals("bad@example.com"))))
        .thenReturn(new SendResult(false, null, "mailbox unavailable"));

    var result =
        notifier.send(List.of("a@example.com", "bad@example.com"), owner, daily(), null);

    assertThat(result.delivered()).isFalse();
    assertThat(result.failedRecipients()).containsExactly("bad@example.com");
    assertThat(result.errorMessage()).contains("1 of 2").contains("mailbox unavailable");
  }

  @Test
  void providerExceptionIsCapturedPerRecipient() {
    when(emailProvider.sendEmail(any(EmailMessage.class)))
        .thenThrow(new IllegalStateException("SMTP timeout"));

    var result = notifier.send(List.of("a@example.com"), owner, daily(), null);

    assertThat(result.delivered()).isFalse();
    assertThat(result.failedRecipients()).containsExactly("a@example.com");
    assertThat(result.errorMessage()).contains("SMTP timeout");
  }

  @Test
  void emptyRecipientListSendsNothing() {
    var result = notifier.send(List.of(), owner, daily(), null);

    assertThat(result.delivered()).isTrue();
    verifyNoInteractions(emailProvider);
  }

  @Test
  void weeklySummaryNamesItsPeriod() {
    when(emailProvider.sendEmail(any(EmailMessage.class)))
        .thenReturn(new SendResult(true, "msg-1", null));
    var weekly =
        new ContentArtifact(
            UUID.randomUUID(),
            UpdateType.WEEKLY,
            UUID.randomUUID(),
            null,
            "Week recap",
            CREATED_AT);
    var period =
        new ReportingPeriod(
            Instant.parse("2025-10-30T09:00:00Z"), Instant.parse("2025-11-06T09:00:00Z"));

    notifier.send(List.of("a@example.com"), owner, weekly, period);

    var captor = ArgumentCaptor.forClass(EmailMessage.class);
    verify(emailProvider).sendEmail(captor.capture());
    assertThat(captor.getValue().subject())
        .isEqualTo("Weekly Summary - Oct 30, 2025 to Nov 6, 2025");
    assertThat(captor.getValue().htmlBody()).contains("Week recap");
  }

  private static ContentArtifact daily() {
    return new ContentArtifact(
        UUID.randomUUID(),
        UpdateType.DAILY,
        UUID.randomUUID(),
        null,
        "Fixed the login bug",
        CREATED_AT);
  }
}
