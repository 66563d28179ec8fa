package io.b2mash.updatescheduler.notification.template;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class EmailTemplateRendererTest {

  private final EmailTemplateRenderer renderer = new EmailTemplateRenderer();

  @Test
  void rendersContentInsideLayout() {
    var email =
        renderer.render(
            "scheduled-daily-update",
            Map.of(
                "subject", "Daily Update - Thursday",
                "ownerName", "Dana",
                "date", "Thursday, November 6, 2025",
                "content", "Reviewed PRs"));

    assertThat(email.subject()).isEqualTo("Daily Update - Thursday");
    assertThat(email.htmlBody()).startsWith("<!DOCTYPE html>");
    assertThat(email.htmlBody()).contains("Reviewed PRs").contains("Thursday, November 6, 2025");
    assertThat(email.htmlBody()).contains("sent automatically");
  }

  @Test
  void escapesUserContent() {
    var email =
        renderer.render(
            "scheduled-daily-update",
            Map.of("ownerName", "Dana", "date", "today", "content", "<script>alert(1)</script>"));

    assertThat(email.htmlBody()).doesNotContain("<script>");
    assertThat(email.htmlBody()).contains("&lt;script&gt;");
    assertThat(email.plainTextBody()).contains("<script>alert(1)</script>");
  }

  @Test
  void fallsBackToDefaultSubject() {
    var email =
        renderer.render(
            "scheduled-weekly-summary",
            Map.of("ownerName", "Dana", "periodStart", "a", "periodEnd", "b", "content", "x"));

    assertThat(email.subject()).isEqualTo(EmailTemplateRenderer.DEFAULT_SUBJECT);
  }

  @Test
  void plainTextKeepsLinksAndLineBreaks() {
    String text =
        renderer.toPlainText(
            "<div><p>Hello &amp; welcome</p>Line one<br/>Line two"
                + " <a href=\"https://example.com\">Open</a></div>");

    assertThat(text).isEqualTo("Hello & welcome\n\nLine one\nLine two Open (https://example.com)");
  }

  @Test
  void plainTextOfBlankHtmlIsEmpty() {
    assertThat(renderer.toPlainText("  ")).isEmpty();
    assertThat(renderer.toPlainText(null)).isEmpty();
  }
}
