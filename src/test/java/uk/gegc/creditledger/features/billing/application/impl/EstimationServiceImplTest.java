package uk.gegc.creditledger.features.billing.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.creditledger.features.billing.api.dto.EstimateRequest;
import uk.gegc.creditledger.features.billing.api.dto.EstimationDto;
import uk.gegc.creditledger.features.billing.application.PricingProperties;
import uk.gegc.creditledger.features.billing.application.PricingProperties.ModelPricing;
import uk.gegc.creditledger.features.billing.domain.exception.UnknownModelException;
import uk.gegc.creditledger.features.billing.domain.model.ServiceType;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EstimationServiceImpl")
class EstimationServiceImplTest {

    private EstimationServiceImpl estimationService;

    @BeforeEach
    void setUp() {
        PricingProperties pricing = new PricingProperties();
        pricing.setSafetyFactor(new BigDecimal("1.2"));
        pricing.getModels().put("gpt-4o", text("openai", "15"));
        pricing.getModels().put("gpt-3.5-turbo", text("openai", "2"));

        ModelPricing dalle = new ModelPricing();
        dalle.setServiceType(ServiceType.IMAGE);
        dalle.setProvider("openai");
        dalle.setImageSizes(Map.of("1024x1024", 40L, "1792x1024", 60L));
        pricing.getModels().put("dall-e-3", dalle);

        ModelPricing tts = new ModelPricing();
        tts.setServiceType(ServiceType.SPEECH);
        tts.setProvider("openai");
        tts.setCreditsPerThousandCharacters(new BigDecimal("5"));
        pricing.getModels().put("tts-1", tts);

        ModelPricing whisper = new ModelPricing();
        whisper.setServiceType(ServiceType.TRANSCRIPTION);
        whisper.setProvider("openai");
        whisper.setCreditsPerMinute(new BigDecimal("3"));
        pricing.getModels().put("whisper-1", whisper);

        estimationService = new EstimationServiceImpl(pricing);
    }

    private static ModelPricing text(String provider, String perThousand) {
        ModelPricing pricing = new ModelPricing();
        pricing.setServiceType(ServiceType.TEXT);
        pricing.setProvider(provider);
        pricing.setCreditsPerThousandTokens(new BigDecimal(perThousand));
        return pricing;
    }

    @Nested
    @DisplayName("Text models")
    class TextEstimates {

        @Test
        @DisplayName("prompt and completion tokens are priced with the safety factor and rounded up")
        void estimatesTokensWithSafetyFactor() {
            // 1800 tokens * 15 / 1000 * 1.2 = 32.4
            EstimationDto result = estimationService.estimate(EstimateRequest.text("gpt-4o", 800, 1000));

            assertThat(result.estimatedCredits()).isEqualTo(33L);
            assertThat(result.units()).isEqualTo(1800L);
            assertThat(result.provider()).isEqualTo("openai");
            assertThat(result.humanizedEstimate()).isEqualTo("~33 credits (1800 tokens)");
        }

        @Test
        @DisplayName("identical input yields the identical estimate")
        void deterministic() {
            EstimationDto first = estimationService.estimate(EstimateRequest.text("gpt-4o", 1234, 567));
            EstimationDto second = estimationService.estimate(EstimateRequest.text("gpt-4o", 1234, 567));

            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("tiny requests still cost at least one credit")
        void neverBelowOneCredit() {
            EstimationDto result = estimationService.estimate(EstimateRequest.text("gpt-3.5-turbo", 0, 1));

            assertThat(result.estimatedCredits()).isEqualTo(1L);
            assertThat(result.humanizedEstimate()).isEqualTo("~1 credit (1 token)");
        }

        @Test
        @DisplayName("prompt characters are converted to tokens when the token count is unknown")
        void promptCharactersFallback() {
            EstimateRequest byCharacters = new EstimateRequest("gpt-4o", ServiceType.TEXT, null, 3200L, 1000L,
                    null, null, null, null);

            assertThat(estimationService.estimate(byCharacters).estimatedCredits())
                    .isEqualTo(estimationService.estimate(EstimateRequest.text("gpt-4o", 800, 1000)).estimatedCredits());
        }

        @Test
        @DisplayName("model lookup ignores case and surrounding whitespace")
        void modelLookupIsCaseInsensitive() {
            EstimationDto result = estimationService.estimate(EstimateRequest.text("  GPT-4o ", 800, 1000));

            assertThat(result.model()).isEqualTo("gpt-4o");
            assertThat(result.estimatedCredits()).isEqualTo(33L);
        }

        @Test
        @DisplayName("maxOutputTokens is required")
        void requiresMaxOutputTokens() {
            EstimateRequest request = new EstimateRequest("gpt-4o", ServiceType.TEXT, 100L, null, null,
                    null, null, null, null);

            assertThatThrownBy(() -> estimationService.estimate(request))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("maxOutputTokens");
        }
    }

    @Nested
    @DisplayName("Oversized requests")
    class OversizedRequests {

        @Test
        @DisplayName("token counts that would overflow are rejected instead of floored to one credit")
        void overflowingTokenCountIsRejected() {
            assertThatThrownBy(() -> estimationService.estimate(EstimateRequest.text("gpt-4o", Long.MAX_VALUE, 1000L)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("inputTokens");
        }

        @Test
        void overflowingPromptCharactersAreRejected() {
            EstimateRequest request = new EstimateRequest("gpt-4o", ServiceType.TEXT, null, Long.MAX_VALUE, 1000L,
                    null, null, null, null);

            assertThatThrownBy(() -> estimationService.estimate(request))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("promptCharacters");
        }

        @Test
        void overflowingDurationIsRejected() {
            assertThatThrownBy(() -> estimationService.estimate(
                    EstimateRequest.transcription("whisper-1", Long.MAX_VALUE)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("durationSeconds");
        }

        @Test
        void negativeCountsAreRejected() {
            assertThatThrownBy(() -> estimationService.estimate(EstimateRequest.text("gpt-4o", -5000L, 1000L)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> estimationService.estimate(EstimateRequest.speech("tts-1", -1L)))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("the largest accepted request is priced in full")
        void largestAcceptedRequestIsPricedInFull() {
            // 20,000,000 tokens * 15 / 1000 * 1.2
            EstimationDto result = estimationService.estimate(
                    EstimateRequest.text("gpt-4o", EstimateRequest.MAX_TOKENS, EstimateRequest.MAX_TOKENS));

            assertThat(result.estimatedCredits()).isEqualTo(360_000L);
        }
    }

    @Nested
    @DisplayName("Other capabilities")
    class OtherCapabilities {

        @Test
        void imagesArePricedPerImageAndSize() {
            EstimationDto result = estimationService.estimate(EstimateRequest.image("dall-e-3", "1792x1024", 2));

            assertThat(result.estimatedCredits()).isEqualTo(120L);
            assertThat(result.units()).isEqualTo(2L);
        }

        @Test
        void unsupportedImageSizeIsRejected() {
            assertThatThrownBy(() -> estimationService.estimate(EstimateRequest.image("dall-e-3", "640x480", 1)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("640x480");
        }

        @Test
        void speechIsPricedPerThousandCharacters() {
            // 1500 * 5 / 1000 = 7.5
            assertThat(estimationService.estimate(EstimateRequest.speech("tts-1", 1500)).estimatedCredits())
                    .isEqualTo(8L);
        }

        @Test
        void transcriptionChargesEveryStartedMinute() {
            EstimationDto result = estimationService.estimate(EstimateRequest.transcription("whisper-1", 95));

            assertThat(result.units()).isEqualTo(2L);
            assertThat(result.estimatedCredits()).isEqualTo(6L);
        }
    }

    @Nested
    @DisplayName("Unknown models")
    class UnknownModels {

        @Test
        void unknownModelIsRejected() {
            assertThatThrownBy(() -> estimationService.estimate(EstimateRequest.text("gpt-9", 10, 10)))
                    .isInstanceOf(UnknownModelException.class)
                    .satisfies(ex -> assertThat(((UnknownModelException) ex).getModel()).isEqualTo("gpt-9"));
        }

        @Test
        void modelWithoutTheRequestedCapabilityIsRejected() {
            assertThatThrownBy(() -> estimationService.estimate(EstimateRequest.text("dall-e-3", 10, 10)))
                    .isInstanceOf(UnknownModelException.class)
                    .hasMessageContaining("TEXT");
        }
    }
}
