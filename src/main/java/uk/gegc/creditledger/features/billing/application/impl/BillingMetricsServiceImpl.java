package uk.gegc.creditledger.features.billing.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.creditledger.features.billing.application.BillingMetricsService;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Service
public class BillingMetricsServiceImpl implements BillingMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter reservationCreatedCounter;
    private final Counter reservationSettledCounter;
    private final Counter reservationReleasedCounter;
    private final Counter reservationExpiredCounter;
    private final Counter insufficientCreditsCounter;
    private final Counter creditsChargedCounter;
    private final Counter creditsRefundedCounter;
    private final Counter creditsAdjustedCounter;
    private final Counter overrunAbsorbedCounter;
    private final Counter reconciliationSuccessCounter;
    private final Counter reconciliationDriftCounter;

    private final AtomicLong sweeperBacklog = new AtomicLong();

    public BillingMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.reservationCreatedCounter = Counter.builder("billing.reservations.created")
                .description("Credits placed on hold by new reservations")
                .register(meterRegistry);
        this.reservationSettledCounter = Counter.builder("billing.reservations.settled")
                .description("Number of reservations settled")
                .register(meterRegistry);
        this.reservationReleasedCounter = Counter.builder("billing.reservations.released")
                .description("Credits returned to balance by releases")
                .register(meterRegistry);
        this.reservationExpiredCounter = Counter.builder("billing.reservations.expired")
                .description("Number of reservations released by the sweeper")
                .register(meterRegistry);
        this.insufficientCreditsCounter = Counter.builder("billing.reservations.rejected")
                .description("Reservations rejected for insufficient credits")
                .register(meterRegistry);
        this.creditsChargedCounter = Counter.builder("billing.credits.charged")
                .description("Credits charged by settlements")
                .register(meterRegistry);
        this.creditsRefundedCounter = Counter.builder("billing.credits.refunded")
                .description("Credits refunded on overestimated settlements")
                .register(meterRegistry);
        this.creditsAdjustedCounter = Counter.builder("billing.credits.adjusted")
                .description("Absolute credits moved by admin adjustments")
                .register(meterRegistry);
        this.overrunAbsorbedCounter = Counter.builder("billing.overrun.absorbed")
                .description("Credits of actual usage absorbed beyond the overrun allowance")
                .register(meterRegistry);
        this.reconciliationSuccessCounter = Counter.builder("billing.reconciliation.success")
                .description("Number of workspaces reconciled without drift")
                .register(meterRegistry);
        this.reconciliationDriftCounter = Counter.builder("billing.reconciliation.drift")
                .description("Number of workspaces found with ledger drift")
                .register(meterRegistry);

        Gauge.builder("billing.sweeper.backlog", sweeperBacklog, AtomicLong::get)
                .description("Expired reservations still held at the last sweep")
                .register(meterRegistry);
    }

    @Override
    public void incrementReservationCreated(UUID workspaceId, long amount) {
        log.info("METRIC: billing.reservations.created workspaceId={} amount={}", workspaceId, amount);
        reservationCreatedCounter.increment(amount);
    }

    @Override
    public void incrementReservationSettled(UUID workspaceId, long charged, long refunded) {
        log.info("METRIC: billing.reservations.settled workspaceId={} charged={} refunded={}", workspaceId, charged, refunded);
        reservationSettledCounter.increment();
        creditsChargedCounter.increment(charged);
        if (refunded > 0) {
            creditsRefundedCounter.increment(refunded);
        }
    }

    @Override
    public void incrementReservationReleased(UUID workspaceId, long amount, String reason) {
        log.info("METRIC: billing.reservations.released workspaceId={} amount={} reason={}", workspaceId, amount, reason);
        reservationReleasedCounter.increment(amount);
    }

    @Override
    public void incrementReservationExpired(UUID workspaceId, long amount) {
        log.info("METRIC: billing.reservations.expired workspaceId={} amount={}", workspaceId, amount);
        reservationExpiredCounter.increment();
    }

    @Override
    public void incrementInsufficientCredits(UUID workspaceId) {
        log.info("METRIC: billing.reservations.rejected workspaceId={}", workspaceId);
        insufficientCreditsCounter.increment();
    }

    @Override
    public void incrementCreditsGranted(UUID workspaceId, long amount, String source) {
        log.info("METRIC: billing.credits.granted workspaceId={} amount={} source={}", workspaceId, amount, source);
        meterRegistry.counter("billing.credits.granted", "source", source).increment(amount);
    }

    @Override
    public void incrementCreditsAdjusted(UUID workspaceId, long amount) {
        log.info("METRIC: billing.credits.adjusted workspaceId={} amount={}", workspaceId, amount);
        creditsAdjustedCounter.increment(Math.abs(amount));
    }

    @Override
    public void recordOverrunAbsorbed(UUID workspaceId, long amount) {
        log.warn("METRIC: billing.overrun.absorbed workspaceId={} amount={}", workspaceId, amount);
        overrunAbsorbedCounter.increment(amount);
    }

    @Override
    public void incrementWriteConflict(String operation) {
        log.info("METRIC: billing.ledger.write.conflicts operation={}", operation);
        meterRegistry.counter("billing.ledger.write.conflicts", "operation", operation).increment();
    }

    @Override
    public void recordReconciliationDrift(UUID workspaceId, long driftAmount) {
        log.warn("METRIC: billing.reconciliation.drift workspaceId={} drift={}", workspaceId, driftAmount);
        reconciliationDriftCounter.increment();
    }

    @Override
    public void recordReconciliationSuccess(UUID workspaceId) {
        log.debug("METRIC: billing.reconciliation.success workspaceId={}", workspaceId);
        reconciliationSuccessCounter.increment();
    }

    @Override
    public void recordSweeperBacklog(long expiredReservations) {
        log.info("METRIC: billing.sweeper.backlog count={}", expiredReservations);
        sweeperBacklog.set(expiredReservations);
    }
}
