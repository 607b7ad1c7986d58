package uk.gegc.creditledger.features.billing.api.dto;

import jakarta.validation.constraints.Size;

public record ReleaseRequest(
        @Size(max = 255)
        String reason
) {}
