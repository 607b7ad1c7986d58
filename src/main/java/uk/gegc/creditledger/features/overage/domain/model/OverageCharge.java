package uk.gegc.creditledger.features.overage.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Money side of one OVERAGE_CHARGE ledger entry, referenced by {@link #ledgerTransactionId} and sharing its
 * idempotency key. A period has one row for the overage found at its first evaluation and one more for each
 * later evaluation that found usage beyond what was already billed.
 */
@Entity
@Table(name = "overage_charges",
        indexes = {
                @Index(name = "idx_overage_charge_status", columnList = "status"),
                @Index(name = "idx_overage_charge_period", columnList = "workspace_id, period_start, period_end")
        })
@Getter
@Setter
public class OverageCharge {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "workspace_id", nullable = false, updatable = false)
    private UUID workspaceId;

    @Column(name = "period_start", nullable = false, updatable = false)
    private LocalDateTime periodStart;

    @Column(name = "period_end", nullable = false, updatable = false)
    private LocalDateTime periodEnd;

    @Column(name = "usage_credits", nullable = false)
    private long usageCredits;

    @Column(name = "credit_limit", nullable = false)
    private long creditLimit;

    /** Units this row bills. */
    @Column(name = "overage_units", nullable = false)
    private long overageUnits;

    /** Overage units of the period billed by this row and every earlier one. */
    @Column(name = "overage_units_to_date", nullable = false)
    private long overageUnitsToDate;

    @Column(name = "rate", nullable = false, precision = 19, scale = 6)
    private BigDecimal rate;

    @Column(name = "charge", nullable = false, precision = 19, scale = 2)
    private BigDecimal charge;

    @Column(name = "amount_cents", nullable = false)
    private long amountCents;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private OverageStatus status;

    @Column(name = "idempotency_key", nullable = false, unique = true)
    private String idempotencyKey;

    @Column(name = "ledger_transaction_id")
    private UUID ledgerTransactionId;

    @Column(name = "invoice_item_id")
    private String invoiceItemId;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "claimed_at")
    private LocalDateTime claimedAt;

    @Column(name = "invoiced_at")
    private LocalDateTime invoicedAt;
}
