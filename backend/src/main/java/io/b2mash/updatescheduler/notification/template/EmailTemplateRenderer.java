package io.b2mash.updatescheduler.notification.template;

import io.b2mash.updatescheduler.integration.email.RenderedEmail;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

/**
 * Renders notification emails from Thymeleaf templates under {@code templates/email/}.
 *
 * <p>The content template is rendered first and its HTML is then placed into the shared {@code
 * layout} template, which prints it unescaped.
 */
@Service
public class EmailTemplateRenderer {

  private static final Logger log = LoggerFactory.getLogger(EmailTemplateRenderer.class);

  static final String LAYOUT_TEMPLATE = "layout";
  static final String DEFAULT_SUBJECT = "Daily Update";

  private static final Pattern LINK = Pattern.compile("<a[^>]*href=\"([^\"]*)\"[^>]*>([^<]*)</a>");
  private static final Pattern LINE_BREAK = Pattern.compile("<br\\s*/?>|</div>|</tr>|</li>");
  private static final Pattern PARAGRAPH_END = Pattern.compile("</p>|</h[1-6]>");
  private static final Pattern TAG = Pattern.compile("<[^>]+>");
  private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t]+");
  private static final Pattern INDENTED_LINE = Pattern.compile("\\n ");
  private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

  private final TemplateEngine templateEngine;

  public EmailTemplateRenderer() {
    this.templateEngine = createTemplateEngine();
  }

  /**
   * @param templateName template file name without prefix or suffix
   * @param variables template variables; {@code subject} doubles as the email subject
   */
  public RenderedEmail render(String templateName, Map<String, Object> variables) {
    var ctx = new Context();
    variables.forEach(ctx::setVariable);

    String bodyHtml = templateEngine.process(templateName, ctx);
    ctx.setVariable("bodyHtml", bodyHtml);
    String html = templateEngine.process(LAYOUT_TEMPLATE, ctx);

    Object subject = variables.get("subject");
    log.debug("Rendered email template '{}' ({} chars)", templateName, html.length());
    return new RenderedEmail(
        subject != null ? subject.toString() : DEFAULT_SUBJECT, html, toPlainText(html));
  }

  /** Plain-text alternative: tags stripped, links kept as {@code text (url)}. */
  String toPlainText(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }
    String text = LINK.matcher(html).replaceAll("$2 ($1)");
    text = LINE_BREAK.matcher(text).replaceAll("\n");
    text = PARAGRAPH_END.matcher(text).replaceAll("\n\n");
    text = TAG.matcher(text).replaceAll("");
    text =
        text.replace("&lt;", "<")
            .replace("&gt;", ">")
            .replace("&quot;", "\"")
            .replace("&#39;", "'")
            .replace("&nbsp;", " ")
            .replace("&amp;", "&");
    text = HORIZONTAL_SPACE.matcher(text).replaceAll(" ");
    text = INDENTED_LINE.matcher(text).replaceAll("\n");
    text = BLANK_LINES.matcher(text).replaceAll("\n\n");
    return text.strip();
  }

  private static TemplateEngine createTemplateEngine() {
    var resolver = new ClassLoaderTemplateResolver();
    resolver.setPrefix("templates/email/");
    resolver.setSuffix(".html");
    resolver.setTemplateMode(TemplateMode.HTML);
    resolver.setCharacterEncoding("UTF-8");
    resolver.setCacheable(true);

    var engine = new TemplateEngine();
    engine.setTemplateResolver(resolver);
    return engine;
  }
}
