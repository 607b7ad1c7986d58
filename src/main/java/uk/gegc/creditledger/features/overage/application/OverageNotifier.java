package uk.gegc.creditledger.features.overage.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.creditledger.features.overage.domain.event.OverageRecordedEvent;
import uk.gegc.creditledger.shared.email.EmailService;

/**
 * Emails the workspace owner once an overage charge has been committed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OverageNotifier {

    private final EmailService emailService;

    @Async("notificationTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onOverageRecorded(OverageRecordedEvent event) {
        try {
            emailService.sendOverageNotification(event.getOwnerEmail(), event.getWorkspaceName(),
                    event.getUsage(), event.getCreditLimit(), event.getCharge(), event.getCurrency());
        } catch (RuntimeException ex) {
            log.error("Failed to notify owner of workspace {} about overage charge {} {}",
                    event.getWorkspaceId(), event.getCharge(), event.getCurrency(), ex);
        }
    }
}
