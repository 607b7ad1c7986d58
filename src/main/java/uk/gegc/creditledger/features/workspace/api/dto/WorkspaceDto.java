package uk.gegc.creditledger.features.workspace.api.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

public record WorkspaceDto(
        UUID id,
        String name,
        String ownerEmail,
        String planCode,
        long balance,
        long reserved,
        LocalDateTime billingPeriodStart,
        LocalDateTime billingPeriodEnd,
        Long creditLimitOverride,
        BigDecimal overageRateOverride,
        String stripeCustomerId,
        LocalDateTime createdAt
) {}
