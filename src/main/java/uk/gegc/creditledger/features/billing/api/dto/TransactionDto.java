package uk.gegc.creditledger.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.creditledger.features.billing.domain.model.CreditTransactionSource;
import uk.gegc.creditledger.features.billing.domain.model.CreditTransactionType;
import uk.gegc.creditledger.features.billing.domain.model.ServiceType;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "TransactionDto", description = "Ledger entry")
public record TransactionDto(
        UUID id,
        UUID workspaceId,
        CreditTransactionType type,
        CreditTransactionSource source,
        @Schema(description = "Signed credit amount", example = "-30")
        long amount,
        @Schema(description = "Metered quantity for entries that do not move credits")
        Long units,
        Long refundAmount,
        UUID reservationId,
        String relatedRequestId,
        String idempotencyKey,
        ServiceType serviceType,
        String model,
        String provider,
        LocalDateTime periodStart,
        String description,
        Long balanceAfter,
        Long reservedAfter,
        LocalDateTime createdAt
) {}
