package uk.gegc.creditledger.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import uk.gegc.creditledger.features.billing.domain.model.ServiceType;

@Schema(name = "EstimateRequest", description = "Parameters of a generation request to price")
public record EstimateRequest(
        @Schema(example = "gpt-4o")
        @NotBlank
        String model,

        @NotNull
        ServiceType serviceType,

        @Schema(description = "TEXT: prompt size in tokens, when known", example = "800")
        @PositiveOrZero
        @Max(MAX_TOKENS)
        Long inputTokens,

        @Schema(description = "TEXT: prompt size in characters, used when inputTokens is absent", example = "3200")
        @PositiveOrZero
        @Max(MAX_CHARACTERS)
        Long promptCharacters,

        @Schema(description = "TEXT: maximum completion tokens", example = "1000")
        @Positive
        @Max(MAX_TOKENS)
        Long maxOutputTokens,

        @Schema(description = "IMAGE: resolution", example = "1024x1024")
        String imageSize,

        @Schema(description = "IMAGE: number of images", example = "1")
        @Positive
        @Max(10)
        Integer imageCount,

        @Schema(description = "SPEECH: characters to synthesize", example = "1500")
        @Positive
        @Max(MAX_CHARACTERS)
        Long characters,

        @Schema(description = "TRANSCRIPTION: audio length in seconds", example = "95")
        @Positive
        @Max(MAX_DURATION_SECONDS)
        Long durationSeconds
) {

    public static final long MAX_TOKENS = 10_000_000L;
    public static final long MAX_CHARACTERS = 50_000_000L;
    /** One week of audio. */
    public static final long MAX_DURATION_SECONDS = 604_800L;

    public static EstimateRequest text(String model, long inputTokens, long maxOutputTokens) {
        return new EstimateRequest(model, ServiceType.TEXT, inputTokens, null, maxOutputTokens, null, null, null, null);
    }

    public static EstimateRequest image(String model, String size, int count) {
        return new EstimateRequest(model, ServiceType.IMAGE, null, null, null, size, count, null, null);
    }

    public static EstimateRequest speech(String model, long characters) {
        return new EstimateRequest(model, ServiceType.SPEECH, null, null, null, null, null, characters, null);
    }

    public static EstimateRequest transcription(String model, long durationSeconds) {
        return new EstimateRequest(model, ServiceType.TRANSCRIPTION, null, null, null, null, null, null, durationSeconds);
    }
}
