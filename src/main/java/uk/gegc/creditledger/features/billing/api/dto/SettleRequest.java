package uk.gegc.creditledger.features.billing.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.PositiveOrZero;

public record SettleRequest(
        @PositiveOrZero
        @Max(1_000_000_000L)
        long actualCredits
) {}
