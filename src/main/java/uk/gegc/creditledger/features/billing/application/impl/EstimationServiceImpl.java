package uk.gegc.creditledger.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.creditledger.features.billing.api.dto.EstimateRequest;
import uk.gegc.creditledger.features.billing.api.dto.EstimationDto;
import uk.gegc.creditledger.features.billing.application.EstimationService;
import uk.gegc.creditledger.features.billing.application.PricingProperties;
import uk.gegc.creditledger.features.billing.application.PricingProperties.ModelPricing;
import uk.gegc.creditledger.features.billing.domain.exception.UnknownModelException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

@Service
@RequiredArgsConstructor
@Slf4j
public class EstimationServiceImpl implements EstimationService {

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);
    // Largest amount a single reservation can hold
    private static final long MAX_ESTIMATE = 1_000_000_000L;
    // Rough prompt size when only the character count is known
    private static final long CHARS_PER_TOKEN = 4L;

    private final PricingProperties pricingProperties;

    @Override
    public EstimationDto estimate(EstimateRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String model = normalize(request.model());
        ModelPricing pricing = findPricing(model);
        if (pricing.getServiceType() != request.serviceType()) {
            throw new UnknownModelException(model,
                    "Model " + model + " is not registered for " + request.serviceType());
        }

        EstimationDto result = switch (request.serviceType()) {
            case TEXT -> estimateText(model, pricing, request);
            case IMAGE -> estimateImage(model, pricing, request);
            case SPEECH -> estimateSpeech(model, pricing, request);
            case TRANSCRIPTION -> estimateTranscription(model, pricing, request);
        };
        log.debug("Estimated {} credits for model={} type={} units={}",
                result.estimatedCredits(), model, request.serviceType(), result.units());
        return result;
    }

    private EstimationDto estimateText(String model, ModelPricing pricing, EstimateRequest request) {
        if (request.maxOutputTokens() == null) {
            throw new IllegalArgumentException("maxOutputTokens is required for TEXT estimates");
        }
        long maxOutputTokens = requireInRange(request.maxOutputTokens(), 1L, EstimateRequest.MAX_TOKENS,
                "maxOutputTokens");
        long inputTokens;
        if (request.inputTokens() != null) {
            inputTokens = requireInRange(request.inputTokens(), 0L, EstimateRequest.MAX_TOKENS, "inputTokens");
        } else if (request.promptCharacters() != null) {
            inputTokens = ceilDiv(requireInRange(request.promptCharacters(), 0L, EstimateRequest.MAX_CHARACTERS,
                    "promptCharacters"), CHARS_PER_TOKEN);
        } else {
            inputTokens = 0L;
        }
        long tokens = Math.addExact(inputTokens, maxOutputTokens);
        BigDecimal raw = BigDecimal.valueOf(tokens)
                .multiply(requireRate(model, pricing.getCreditsPerThousandTokens()))
                .multiply(pricingProperties.getSafetyFactor())
                .divide(THOUSAND, 6, RoundingMode.CEILING);
        long credits = toCredits(raw);
        return new EstimationDto(model, request.serviceType(), pricing.getProvider(), tokens, credits,
                EstimationDto.createHumanizedEstimate(credits, tokens, "token"));
    }

    private EstimationDto estimateImage(String model, ModelPricing pricing, EstimateRequest request) {
        if (request.imageSize() == null || request.imageSize().isBlank()) {
            throw new IllegalArgumentException("imageSize is required for IMAGE estimates");
        }
        String size = request.imageSize().trim().toLowerCase(Locale.ROOT);
        Long perImage = pricing.getImageSizes().get(size);
        if (perImage == null) {
            throw new IllegalArgumentException("Unsupported image size " + size + " for model " + model
                    + "; supported: " + pricing.getImageSizes().keySet());
        }
        int count = request.imageCount() != null ? request.imageCount() : 1;
        requireInRange(count, 1L, 10L, "imageCount");
        long credits = toCredits(BigDecimal.valueOf(perImage).multiply(BigDecimal.valueOf(count)));
        return new EstimationDto(model, request.serviceType(), pricing.getProvider(), count, credits,
                EstimationDto.createHumanizedEstimate(credits, count, "image"));
    }

    private EstimationDto estimateSpeech(String model, ModelPricing pricing, EstimateRequest request) {
        if (request.characters() == null) {
            throw new IllegalArgumentException("characters is required for SPEECH estimates");
        }
        long characters = requireInRange(request.characters(), 1L, EstimateRequest.MAX_CHARACTERS, "characters");
        BigDecimal raw = BigDecimal.valueOf(characters)
                .multiply(requireRate(model, pricing.getCreditsPerThousandCharacters()))
                .divide(THOUSAND, 6, RoundingMode.CEILING);
        long credits = toCredits(raw);
        return new EstimationDto(model, request.serviceType(), pricing.getProvider(), characters, credits,
                EstimationDto.createHumanizedEstimate(credits, characters, "character"));
    }

    private EstimationDto estimateTranscription(String model, ModelPricing pricing, EstimateRequest request) {
        if (request.durationSeconds() == null) {
            throw new IllegalArgumentException("durationSeconds is required for TRANSCRIPTION estimates");
        }
        long minutes = ceilDiv(requireInRange(request.durationSeconds(), 1L, EstimateRequest.MAX_DURATION_SECONDS,
                "durationSeconds"), 60L);
        BigDecimal raw = BigDecimal.valueOf(minutes)
                .multiply(requireRate(model, pricing.getCreditsPerMinute()));
        long credits = toCredits(raw);
        return new EstimationDto(model, request.serviceType(), pricing.getProvider(), minutes, credits,
                EstimationDto.createHumanizedEstimate(credits, minutes, "minute"));
    }

    private ModelPricing findPricing(String model) {
        for (Map.Entry<String, ModelPricing> entry : pricingProperties.getModels().entrySet()) {
            if (normalize(entry.getKey()).equals(model)) {
                return entry.getValue();
            }
        }
        throw new UnknownModelException(model, "Unknown model: " + model);
    }

    private BigDecimal requireRate(String model, BigDecimal rate) {
        if (rate == null || rate.signum() <= 0) {
            throw new UnknownModelException(model, "Model " + model + " has no rate configured");
        }
        return rate;
    }

    /**
     * Rounds up with a floor of one credit. An amount no reservation could hold is rejected rather than clamped.
     */
    private static long toCredits(BigDecimal raw) {
        BigDecimal credits = raw.setScale(0, RoundingMode.CEILING);
        if (credits.compareTo(BigDecimal.valueOf(MAX_ESTIMATE)) > 0) {
            throw new IllegalArgumentException("Estimate of " + credits.toPlainString()
                    + " credits exceeds the maximum of " + MAX_ESTIMATE);
        }
        return Math.max(1L, credits.longValue());
    }

    private static long requireInRange(long value, long min, long max, String field) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(field + " must be between " + min + " and " + max + ", was " + value);
        }
        return value;
    }

    private static long ceilDiv(long value, long divisor) {
        return Math.floorDiv(Math.addExact(value, divisor - 1), divisor);
    }

    private static String normalize(String model) {
        return model == null ? "" : model.trim().toLowerCase(Locale.ROOT);
    }
}
