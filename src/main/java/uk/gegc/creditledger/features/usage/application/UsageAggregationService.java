package uk.gegc.creditledger.features.usage.application;

import uk.gegc.creditledger.features.billing.domain.event.CreditsSettledEvent;
import uk.gegc.creditledger.features.billing.domain.event.OverageChargedEvent;
import uk.gegc.creditledger.features.usage.api.dto.UsageReportDto;
import uk.gegc.creditledger.features.usage.api.dto.UsageVerificationDto;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Per-period usage totals for workspaces. Writes happen inside the ledger transaction
 * that produced the usage; reads never scan the ledger.
 */
public interface UsageAggregationService {

    void recordSettlement(CreditsSettledEvent event);

    void recordOverage(OverageChargedEvent event);

    UsageReportDto getPeriodUsage(UUID workspaceId, LocalDateTime periodStart);

    UsageReportDto getCurrentPeriodUsage(UUID workspaceId);

    /**
     * Credits charged in the period, the figure overage is evaluated against.
     */
    long getCreditsCharged(UUID workspaceId, LocalDateTime periodStart);

    /**
     * Replays the ledger for the period and overwrites the incremental summary with the result.
     */
    UsageReportDto rebuildPeriod(UUID workspaceId, LocalDateTime periodStart);

    UsageVerificationDto verifyPeriod(UUID workspaceId, LocalDateTime periodStart);
}
