package uk.gegc.creditledger.features.overage.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.creditledger.features.overage.domain.model.OverageStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "OverageResultDto", description = "Overage evaluation for one billing period")
public record OverageResultDto(
        UUID workspaceId,
        LocalDateTime periodStart,
        LocalDateTime periodEnd,
        OverageStatus status,
        @Schema(description = "Credits charged in the period", example = "1500")
        long usage,
        @Schema(description = "Plan credit limit; null when unlimited", example = "1000")
        Long creditLimit,
        @Schema(description = "Credits above the limit", example = "500")
        long overageUnits,
        @Schema(description = "Currency per credit", example = "0.01")
        BigDecimal rate,
        @Schema(description = "Money charge, two decimal places", example = "5.00")
        BigDecimal charge,
        String currency,
        String idempotencyKey,
        String invoiceItemId,
        UUID ledgerTransactionId
) {}
