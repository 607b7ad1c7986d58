package uk.gegc.creditledger.features.workspace.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.util.UUID;

@Schema(name = "PlanDto", description = "Subscription plan")
public record PlanDto(
        UUID id,
        @Schema(example = "pro")
        String code,
        String name,
        @Schema(description = "Credits per period before overage; null means unlimited", example = "1000")
        Long creditLimit,
        @Schema(description = "Currency amount per overage credit", example = "0.01")
        BigDecimal overageRate,
        @Schema(description = "Credits granted at each period start", example = "1000")
        long allotmentCredits
) {}
