package uk.gegc.creditledger.features.billing.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record PurchaseRequest(
        @Positive
        @Max(1_000_000_000L)
        long credits,

        @NotBlank
        @Size(max = 255)
        String idempotencyKey,

        @Size(max = 255)
        String reference
) {}
