package uk.gegc.creditledger.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.creditledger.features.billing.domain.model.ServiceType;

@Schema(name = "EstimationDto", description = "Upper-bound credit cost of a generation request")
public record EstimationDto(
        @Schema(example = "gpt-4o")
        String model,

        ServiceType serviceType,

        @Schema(example = "openai")
        String provider,

        @Schema(description = "Billable units the estimate is based on (tokens, images, characters or minutes)", example = "1800")
        long units,

        @Schema(description = "Credits to reserve", example = "33")
        long estimatedCredits,

        @Schema(description = "Humanized description of the estimate", example = "~33 credits (1800 tokens)")
        String humanizedEstimate
) {

    public static String createHumanizedEstimate(long credits, long units, String unitName) {
        String creditPart = credits == 1 ? "1 credit" : credits + " credits";
        String unitPart = units == 1 ? "1 " + unitName : units + " " + unitName + "s";
        return String.format("~%s (%s)", creditPart, unitPart);
    }
}
