package uk.gegc.creditledger.features.overage.infra.stripe;

import com.stripe.Stripe;
import com.stripe.StripeClient;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import uk.gegc.creditledger.features.overage.application.StripeProperties;

/**
 * Initializes the global API key and exposes a typed client when a secret key is configured.
 */
@Configuration
@RequiredArgsConstructor
public class StripeClientConfig {

    private final StripeProperties stripe;

    @PostConstruct
    void init() {
        if (StringUtils.hasText(stripe.getSecretKey())) {
            Stripe.apiKey = stripe.getSecretKey();
        }
    }

    @Bean
    @ConditionalOnProperty(name = "stripe.secret-key")
    public StripeClient stripeClient() {
        return new StripeClient(stripe.getSecretKey());
    }
}
