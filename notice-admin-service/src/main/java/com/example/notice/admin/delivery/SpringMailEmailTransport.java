package com.example.notice.admin.delivery;

import com.example.notice.shared.config.AppProperties;
import com.example.notice.shared.util.Constants;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Sends templated HTML mail through the configured SMTP server. Blocks until the server accepted
 * or rejected the message.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpringMailEmailTransport implements EmailTransport {

    private final JavaMailSender mailSender;
    private final AppProperties appProperties;

    @Override
    public void send(String to, String subject, String template, Map<String, String> data) {
        MimeMessage message = mailSender.createMimeMessage();
        try {
            MimeMessageHelper helper = new MimeMessageHelper(message, false, StandardCharsets.UTF_8.name());
            helper.setFrom(appProperties.getMail().getFrom());
            helper.setTo(to);
            helper.setSubject(subject);
            helper.setText(render(template, data), true);
        } catch (MessagingException e) {
            throw new MailPreparationException("Could not build message to " + to, e);
        }
        mailSender.send(message);
        log.debug("Sent '{}' mail to {}", template, to);
    }

    String render(String template, Map<String, String> data) {
        if (!Constants.EMAIL_TEMPLATE_BROADCAST.equals(template)) {
            throw new IllegalArgumentException("Unknown email template: " + template);
        }
        return "<html><body>"
                + "<p>Hello " + escape(data.get("recipientName")) + ",</p>"
                + "<h2>[" + escape(data.get("type")) + "] " + escape(data.get("title")) + "</h2>"
                + "<p>" + escape(data.get("message")).replace("\n", "<br/>") + "</p>"
                + "</body></html>";
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
