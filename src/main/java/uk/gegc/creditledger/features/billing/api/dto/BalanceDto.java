package uk.gegc.creditledger.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "BalanceDto", description = "Workspace credit balance")
public record BalanceDto(
        @Schema(description = "Workspace UUID")
        UUID workspaceId,

        @Schema(description = "Spendable credits", example = "10000")
        long balance,

        @Schema(description = "Credits held by outstanding reservations", example = "500")
        long reserved,

        @Schema(description = "Start of the current billing period")
        LocalDateTime billingPeriodStart,

        @Schema(description = "End of the current billing period (exclusive)")
        LocalDateTime billingPeriodEnd,

        @Schema(description = "Last balance update timestamp")
        LocalDateTime updatedAt
) {}
