package uk.gegc.creditledger.features.billing.application;

import java.util.UUID;

/**
 * Counters and gauges for the credit ledger.
 */
public interface BillingMetricsService {

    void incrementReservationCreated(UUID workspaceId, long amount);
    void incrementReservationSettled(UUID workspaceId, long charged, long refunded);
    void incrementReservationReleased(UUID workspaceId, long amount, String reason);
    void incrementReservationExpired(UUID workspaceId, long amount);
    void incrementInsufficientCredits(UUID workspaceId);

    void incrementCreditsGranted(UUID workspaceId, long amount, String source);
    void incrementCreditsAdjusted(UUID workspaceId, long amount);
    void recordOverrunAbsorbed(UUID workspaceId, long amount);

    void incrementWriteConflict(String operation);

    void recordReconciliationDrift(UUID workspaceId, long driftAmount);
    void recordReconciliationSuccess(UUID workspaceId);

    void recordSweeperBacklog(long expiredReservations);
}
