package uk.gegc.creditledger.features.workspace.api.dto;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDateTime;

public record StartBillingPeriodRequest(
        @NotNull
        LocalDateTime periodStart,

        @NotNull
        LocalDateTime periodEnd
) {}
