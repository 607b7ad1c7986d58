package uk.gegc.creditledger.features.workspace.api.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

public record CreatePlanRequest(
        @NotBlank
        @Size(max = 64)
        @Pattern(regexp = "[a-z0-9_-]+")
        String code,

        @NotBlank
        @Size(max = 255)
        String name,

        @PositiveOrZero
        @Max(1_000_000_000L)
        Long creditLimit,

        @DecimalMin("0.0")
        BigDecimal overageRate,

        @PositiveOrZero
        @Max(1_000_000_000L)
        long allotmentCredits
) {}
