package uk.gegc.creditledger.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "SettlementResultDto", description = "Outcome of settling a reservation")
public record SettlementResultDto(
        UUID reservationId,
        UUID workspaceId,
        TerminalOutcome outcome,
        @Schema(description = "Credits held at reservation time", example = "50")
        long estimatedAmount,
        @Schema(description = "Provider-reported usage", example = "30")
        long actualAmount,
        @Schema(description = "Credits charged to the workspace", example = "30")
        long chargedAmount,
        @Schema(description = "Credits returned to the balance", example = "20")
        long refundAmount,
        @Schema(description = "Usage beyond the overrun allowance absorbed by the platform", example = "0")
        long absorbedAmount,
        UUID transactionId
) {

    public static SettlementResultDto notFound(UUID reservationId) {
        return new SettlementResultDto(reservationId, null, TerminalOutcome.NOT_FOUND, 0L, 0L, 0L, 0L, 0L, null);
    }
}
