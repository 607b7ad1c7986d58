package uk.gegc.creditledger.features.usage.api.dto;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Comparison of the incremental period summary with a replay of the ledger.
 */
public record UsageVerificationDto(
        UUID workspaceId,
        LocalDateTime periodStart,
        boolean consistent,
        long summaryCreditsCharged,
        long ledgerCreditsCharged,
        long summaryRequestCount,
        long ledgerRequestCount,
        long summaryOverageUnits,
        long ledgerOverageUnits
) {}
