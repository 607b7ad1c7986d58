package uk.gegc.creditledger.features.usage.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.creditledger.features.billing.domain.event.CreditsSettledEvent;
import uk.gegc.creditledger.features.billing.domain.event.OverageChargedEvent;

/**
 * Folds ledger events into the usage summary before the ledger transaction commits,
 * so the summary and the ledger commit or roll back together.
 */
@Component
@RequiredArgsConstructor
public class UsageEventListener {

    private final UsageAggregationService usageAggregationService;

    @TransactionalEventListener(phase = TransactionPhase.BEFORE_COMMIT)
    public void onCreditsSettled(CreditsSettledEvent event) {
        usageAggregationService.recordSettlement(event);
    }

    @TransactionalEventListener(phase = TransactionPhase.BEFORE_COMMIT)
    public void onOverageCharged(OverageChargedEvent event) {
        usageAggregationService.recordOverage(event);
    }
}
