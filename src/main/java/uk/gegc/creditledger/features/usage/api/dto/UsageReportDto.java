package uk.gegc.creditledger.features.usage.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Schema(name = "UsageReportDto", description = "Settled usage for one billing period")
public record UsageReportDto(
        UUID workspaceId,
        LocalDateTime periodStart,
        long requestCount,
        @Schema(description = "Credits charged by settlements in the period", example = "1500")
        long creditsCharged,
        @Schema(description = "Provider-reported usage in the period", example = "1520")
        long unitsReported,
        @Schema(description = "Usage absorbed beyond the overrun allowance", example = "20")
        long absorbedCredits,
        @Schema(description = "Overage units recorded for the period", example = "500")
        long overageUnits,
        Map<String, Long> creditsByServiceType,
        List<UsageBreakdownDto> breakdown
) {}
