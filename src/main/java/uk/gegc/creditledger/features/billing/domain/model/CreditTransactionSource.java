package uk.gegc.creditledger.features.billing.domain.model;

public enum CreditTransactionSource {
    ORCHESTRATOR,
    SWEEPER,
    CHECKOUT,
    PLAN,
    OVERAGE,
    ADMIN
}
