package uk.gegc.creditledger.features.billing.application;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Billing configuration (reservation lifecycle and ledger write policy).
 */
@Configuration
@ConfigurationProperties(prefix = "billing")
@Validated
@Data
public class BillingProperties {

    /**
     * Reservation TTL in minutes before the sweeper releases the hold.
     */
    @Positive
    private int reservationTtlMinutes = 10;

    /**
     * Delay between sweeper runs.
     */
    @Positive
    private long reservationSweeperMs = 60_000L;

    /**
     * Maximum number of expired reservations released per sweeper run.
     */
    @Positive
    private int sweeperBatchSize = 500;

    /**
     * Credits a settlement may charge above the estimate. Anything beyond it is absorbed as an adjustment.
     */
    @PositiveOrZero
    private long overrunAllowance = 0L;

    /**
     * Invoice currency (ISO code, lower case as Stripe expects).
     */
    @NotBlank
    private String currency = "usd";

    /**
     * Length of a billing period in months when a period is rolled over automatically.
     */
    @Min(1)
    private int billingPeriodMonths = 1;

    private Ledger ledger = new Ledger();

    @Data
    public static class Ledger {
        /**
         * Attempts per balance mutation before a write conflict is reported.
         */
        @Min(1)
        private int maxWriteAttempts = 4;

        /**
         * Base backoff between attempts; attempt n waits n times this value.
         */
        @PositiveOrZero
        private long retryBackoffMs = 25L;
    }
}
