package uk.gegc.creditledger.features.billing.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;
import uk.gegc.creditledger.features.billing.domain.exception.LedgerWriteConflictException;
import uk.gegc.creditledger.features.workspace.domain.model.Workspace;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerWriteExecutorTest {

    @Mock
    private PlatformTransactionManager transactionManager;
    @Mock
    private BillingMetricsService metricsService;

    private LedgerWriteExecutor executor;

    @BeforeEach
    void setUp() {
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        BillingProperties properties = new BillingProperties();
        properties.getLedger().setMaxWriteAttempts(3);
        properties.getLedger().setRetryBackoffMs(0L);
        executor = new LedgerWriteExecutor(transactionManager, properties, metricsService);
    }

    @Test
    void returnsResultOfFirstSuccessfulAttempt() {
        String result = executor.execute("reserve", () -> "ok");

        assertThat(result).isEqualTo("ok");
        verify(transactionManager).commit(any());
        verify(metricsService, never()).incrementWriteConflict(any());
    }

    @Test
    void retriesOptimisticAndPessimisticConflictsInFreshTransactions() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("settle", () -> {
            int call = calls.incrementAndGet();
            if (call == 1) {
                throw new ObjectOptimisticLockingFailureException(Workspace.class, "ws");
            }
            if (call == 2) {
                throw new CannotAcquireLockException("lock timeout");
            }
            return "settled";
        });

        assertThat(result).isEqualTo("settled");
        assertThat(calls).hasValue(3);
        verify(transactionManager, times(3)).getTransaction(any());
        verify(transactionManager, times(2)).rollback(any());
        verify(metricsService, times(2)).incrementWriteConflict("settle");
    }

    @Test
    void givesUpAfterMaxAttemptsWithWriteConflict() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("reserve", () -> {
            calls.incrementAndGet();
            throw new CannotAcquireLockException("deadlock");
        }))
                .isInstanceOf(LedgerWriteConflictException.class)
                .satisfies(ex -> assertThat(((LedgerWriteConflictException) ex).getAttempts()).isEqualTo(3));

        assertThat(calls).hasValue(3);
    }

    @Test
    void otherFailuresAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("purchase", () -> {
            calls.incrementAndGet();
            throw new DataIntegrityViolationException("duplicate key");
        })).isInstanceOf(DataIntegrityViolationException.class);

        assertThat(calls).hasValue(1);
        verify(metricsService, never()).incrementWriteConflict(any());
    }
}
