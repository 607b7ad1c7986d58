package uk.gegc.creditledger.features.billing.api.dto;

import java.util.UUID;

public record ReleaseResultDto(
        UUID reservationId,
        UUID workspaceId,
        TerminalOutcome outcome,
        long releasedAmount,
        String reason,
        UUID transactionId
) {

    public static ReleaseResultDto notFound(UUID reservationId) {
        return new ReleaseResultDto(reservationId, null, TerminalOutcome.NOT_FOUND, 0L, null, null);
    }
}
