package uk.gegc.creditledger.features.billing.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;
import uk.gegc.creditledger.features.billing.domain.model.ServiceType;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-model pricing table used by the estimator. Keys are model identifiers (matched case-insensitively).
 */
@Configuration
@ConfigurationProperties(prefix = "billing.pricing")
@Validated
@Data
public class PricingProperties {

    /**
     * Multiplier applied to token-based estimates (>= 1.0).
     */
    @DecimalMin("1.0")
    private BigDecimal safetyFactor = new BigDecimal("1.2");

    @Valid
    private Map<String, ModelPricing> models = new LinkedHashMap<>();

    @Data
    public static class ModelPricing {
        @NotNull
        private ServiceType serviceType;

        private String provider;

        /** TEXT: credits per 1,000 tokens. */
        private BigDecimal creditsPerThousandTokens;

        /** IMAGE: credits per image keyed by size, e.g. {@code 1024x1024}. */
        private Map<String, Long> imageSizes = new LinkedHashMap<>();

        /** SPEECH: credits per 1,000 input characters. */
        private BigDecimal creditsPerThousandCharacters;

        /** TRANSCRIPTION: credits per started minute of audio. */
        private BigDecimal creditsPerMinute;
    }
}
