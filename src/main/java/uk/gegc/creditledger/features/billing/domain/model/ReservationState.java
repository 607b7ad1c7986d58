package uk.gegc.creditledger.features.billing.domain.model;

public enum ReservationState {
    HELD,
    SETTLED,
    RELEASED;

    public boolean isTerminal() {
        return this != HELD;
    }
}
