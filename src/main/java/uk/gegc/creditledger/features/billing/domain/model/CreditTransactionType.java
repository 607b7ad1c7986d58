package uk.gegc.creditledger.features.billing.domain.model;

public enum CreditTransactionType {
    RESERVE,
    SETTLE,
    RELEASE,
    PURCHASE,
    /** Plan credits granted at the start of a billing period. */
    ALLOTMENT,
    OVERAGE_CHARGE,
    ADJUSTMENT;

    /**
     * Whether the type moves credits between balance and reserved without changing their sum.
     */
    public boolean isHoldMovement() {
        return this == RESERVE || this == RELEASE;
    }
}
