package uk.gegc.creditledger.features.workspace.api.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

public record CreateWorkspaceRequest(
        @NotBlank
        @Size(max = 255)
        String name,

        @NotBlank
        @Email
        String ownerEmail,

        @NotBlank
        String planCode,

        @PositiveOrZero
        @Max(1_000_000_000L)
        Long creditLimitOverride,

        @DecimalMin("0.0")
        BigDecimal overageRateOverride,

        @Size(max = 255)
        String stripeCustomerId
) {}
