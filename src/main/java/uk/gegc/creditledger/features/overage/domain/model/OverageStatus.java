package uk.gegc.creditledger.features.overage.domain.model;

public enum OverageStatus {
    /** Plan has no credit limit. */
    UNLIMITED,
    /** Usage at or below the limit, or a charge that rounds to zero. */
    WITHIN_LIMIT,
    /** Figures computed without recording anything. */
    PREVIEW,
    /** Recorded; invoice item not yet accepted by the invoicing collaborator. */
    PENDING,
    /** Claimed by one submitter; the invoice item request is in flight. */
    SUBMITTING,
    INVOICED,
    /** Recorded, but the workspace has no billing customer to invoice. */
    NO_BILLING_CUSTOMER;

    public boolean isRecorded() {
        return this == PENDING || this == SUBMITTING || this == INVOICED || this == NO_BILLING_CUSTOMER;
    }
}
