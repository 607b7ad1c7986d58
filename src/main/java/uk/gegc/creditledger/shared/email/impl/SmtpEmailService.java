package uk.gegc.creditledger.shared.email.impl;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;
import uk.gegc.creditledger.shared.email.EmailService;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * SMTP delivery through Spring's JavaMailSender. Activated when app.email.provider=smtp.
 */
@Slf4j
@Service
@Primary
@ConditionalOnProperty(name = "app.email.provider", havingValue = "smtp")
@RequiredArgsConstructor
public class SmtpEmailService implements EmailService {

    private final JavaMailSender mailSender;

    @Value("${spring.mail.username:}")
    private String fromEmail;

    @Value("${app.email.overage.subject:Overage charges for your workspace}")
    private String overageSubject;

    @PostConstruct
    void verifyEmailConfiguration() {
        if (fromEmail == null || fromEmail.isBlank()) {
            log.warn("Email service disabled: spring.mail.username is not configured");
        } else {
            log.info("Email service enabled with sender: {}", fromEmail);
        }
    }

    @Override
    public void sendPlainTextEmail(String to, String subject, String body) {
        if (fromEmail == null || fromEmail.isBlank()) {
            log.warn("Email service disabled - skipping email to: {}", EmailMasking.maskEmail(to));
            return;
        }
        try {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(fromEmail);
            message.setTo(to);
            message.setSubject(subject);
            message.setText(body);
            mailSender.send(message);
            log.info("Email '{}' sent to: {}", subject, EmailMasking.maskEmail(to));
        } catch (MailException e) {
            log.error("Failed to send email '{}' to: {}", subject, EmailMasking.maskEmail(to), e);
        }
    }

    @Override
    public void sendOverageNotification(String to, String workspaceName, long usage, long limit,
                                        BigDecimal charge, String currency) {
        sendPlainTextEmail(to, overageSubject, createOverageContent(workspaceName, usage, limit, charge, currency));
    }

    private String createOverageContent(String workspaceName, long usage, long limit,
                                        BigDecimal charge, String currency) {
        return String.format("""
            Hello,

            Your workspace "%s" used %d credits this billing period against a plan limit of %d.

            The %d credits above the limit have been added to your next invoice as an overage charge of %s %s.

            You can review usage for the period in your workspace billing page.
            """, workspaceName, usage, limit, usage - limit, charge.toPlainString(),
                currency.toUpperCase(Locale.ROOT));
    }
}
