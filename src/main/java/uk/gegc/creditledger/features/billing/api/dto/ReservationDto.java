package uk.gegc.creditledger.features.billing.api.dto;

import uk.gegc.creditledger.features.billing.domain.model.ReservationState;
import uk.gegc.creditledger.features.billing.domain.model.ServiceType;

import java.time.LocalDateTime;
import java.util.UUID;

public record ReservationDto(
        UUID id,
        UUID workspaceId,
        String requestId,
        ReservationState state,
        long estimatedAmount,
        ServiceType serviceType,
        String model,
        String provider,
        Long actualAmount,
        Long chargedAmount,
        Long refundAmount,
        Long absorbedAmount,
        String releaseReason,
        LocalDateTime expiresAt,
        LocalDateTime completedAt,
        LocalDateTime createdAt
) {}
