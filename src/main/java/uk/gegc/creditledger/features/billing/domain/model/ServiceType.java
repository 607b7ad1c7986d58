package uk.gegc.creditledger.features.billing.domain.model;

/**
 * Generation capability a request is billed under.
 */
public enum ServiceType {
    TEXT,
    IMAGE,
    SPEECH,
    TRANSCRIPTION
}
