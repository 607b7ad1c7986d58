package uk.gegc.creditledger.shared.email;

import java.math.BigDecimal;

public interface EmailService {
    void sendPlainTextEmail(String to, String subject, String body);
    void sendOverageNotification(String to, String workspaceName, long usage, long limit,
                                 BigDecimal charge, String currency);
}
