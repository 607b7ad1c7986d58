package uk.gegc.creditledger.features.billing.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.creditledger.features.billing.domain.exception.LedgerWriteConflictException;

import java.util.function.Supplier;

/**
 * Runs a balance mutation in its own transaction and retries it when it loses a race on the
 * workspace row (version mismatch, lock timeout or deadlock). Each attempt starts a fresh
 * transaction, so every retry re-reads the row it locks.
 */
@Slf4j
@Component
public class LedgerWriteExecutor {

    private final TransactionTemplate transactionTemplate;
    private final BillingProperties billingProperties;
    private final BillingMetricsService metricsService;

    public LedgerWriteExecutor(PlatformTransactionManager transactionManager,
                               BillingProperties billingProperties,
                               BillingMetricsService metricsService) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.billingProperties = billingProperties;
        this.metricsService = metricsService;
    }

    public <T> T execute(String operation, Supplier<T> work) {
        int maxAttempts = Math.max(1, billingProperties.getLedger().getMaxWriteAttempts());
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (OptimisticLockingFailureException | PessimisticLockingFailureException ex) {
                metricsService.incrementWriteConflict(operation);
                if (attempts >= maxAttempts) {
                    log.error("Giving up on {} after {} attempts: {}", operation, attempts, ex.getMessage());
                    throw new LedgerWriteConflictException(operation, attempts, ex);
                }
                log.debug("Write conflict on {} (attempt {}/{}), retrying", operation, attempts, maxAttempts);
                backoff(operation, attempts, ex);
            }
        }
    }

    private void backoff(String operation, int attempt, RuntimeException cause) {
        long delay = billingProperties.getLedger().getRetryBackoffMs() * attempt;
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new LedgerWriteConflictException(operation, attempt, cause);
        }
    }
}
