package uk.gegc.creditledger.features.billing.api.dto;

/**
 * Result of a settle or release call. Only SETTLED and RELEASED mean this call changed the ledger.
 */
public enum TerminalOutcome {
    SETTLED,
    RELEASED,
    ALREADY_SETTLED,
    ALREADY_RELEASED,
    NOT_FOUND
}
