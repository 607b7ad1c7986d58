package uk.gegc.creditledger.shared.email.impl;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.creditledger.shared.email.EmailService;

import java.math.BigDecimal;

/**
 * Logs email send attempts without sending anything.
 * Activated when app.email.provider=noop (the default).
 */
@Slf4j
public class NoopEmailService implements EmailService {

    public NoopEmailService() {
        log.info("NoopEmailService initialized - emails will be logged but not sent");
    }

    @Override
    public void sendPlainTextEmail(String to, String subject, String body) {
        log.info("[NOOP] Would send plain text email to: {} with subject: {}", EmailMasking.maskEmail(to), subject);
    }

    @Override
    public void sendOverageNotification(String to, String workspaceName, long usage, long limit,
                                        BigDecimal charge, String currency) {
        log.info("[NOOP] Would send overage notification to: {} for workspace: {} usage={} limit={} charge={} {}",
                EmailMasking.maskEmail(to), workspaceName, usage, limit, charge, currency);
    }
}
