package uk.gegc.creditledger.features.overage.application;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Overage billing configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "billing.overage")
@Validated
@Data
public class OverageProperties {

    /**
     * Currency per credit when neither the workspace nor its plan sets a rate.
     */
    @NotNull
    @DecimalMin("0")
    private BigDecimal defaultRate = new BigDecimal("0.01");

    /** Delay between retries of pending invoice items. */
    @Positive
    private long retryDelayMs = 300_000L;

    /** Pending invoice items are abandoned to manual follow-up after this many attempts. */
    @Positive
    private int maxInvoiceAttempts = 10;

    @Positive
    private int retryBatchSize = 100;

    /** A submission claimed longer ago than this is presumed abandoned and may be claimed again. */
    @Positive
    private int submissionTimeoutMinutes = 15;

    /** Send the owner an email when an overage is recorded. */
    private boolean notifyOwner = true;
}
