package uk.gegc.creditledger.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import uk.gegc.creditledger.features.billing.domain.model.ServiceType;

import java.util.UUID;

@Schema(name = "ReserveRequest", description = "Place a hold for one generation request")
public record ReserveRequest(
        @NotNull
        UUID workspaceId,

        @Schema(description = "Stable id of the generation request, used as the idempotency key")
        @NotBlank
        @Size(max = 255)
        String requestId,

        @Schema(description = "Estimated credits", example = "50")
        @PositiveOrZero
        @Max(1_000_000_000L)
        long estimatedCredits,

        ServiceType serviceType,

        @Size(max = 128)
        String model,

        @Size(max = 64)
        String provider
) {}
