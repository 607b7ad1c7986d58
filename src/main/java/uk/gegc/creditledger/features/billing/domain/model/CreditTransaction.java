package uk.gegc.creditledger.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only ledger entry.
 * <p>
 * {@code amount} is the signed change to {@code balance + reserved} for PURCHASE, ALLOTMENT,
 * ADJUSTMENT, SETTLE and OVERAGE_CHARGE. RESERVE and RELEASE record the credits moved between
 * the spendable balance and the reserved bucket ({@code -estimate} and {@code +estimate}).
 * Quantities that never touch the balance (overage units, absorbed overrun) go in {@code units}.
 */
@Entity
@Immutable
@Table(name = "credit_transactions",
        indexes = @Index(name = "idx_credit_tx_workspace_created", columnList = "workspace_id, created_at"))
@Getter
@Setter
public class CreditTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "workspace_id", nullable = false, updatable = false)
    private UUID workspaceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 32, updatable = false)
    private CreditTransactionType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 32, updatable = false)
    private CreditTransactionSource source;

    @Column(name = "amount", nullable = false, updatable = false)
    private long amount;

    @Column(name = "units", updatable = false)
    private Long units;

    @Column(name = "refund_amount", updatable = false)
    private Long refundAmount;

    @Column(name = "reservation_id", updatable = false)
    private UUID reservationId;

    @Column(name = "related_request_id", updatable = false)
    private String relatedRequestId;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "service_type", length = 32, updatable = false)
    private ServiceType serviceType;

    @Column(name = "model", length = 128, updatable = false)
    private String model;

    @Column(name = "provider", length = 64, updatable = false)
    private String provider;

    @Column(name = "period_start", updatable = false)
    private LocalDateTime periodStart;

    @Column(name = "description", length = 512, updatable = false)
    private String description;

    @Column(name = "meta_json", length = 4000, updatable = false)
    private String metaJson;

    @Column(name = "balance_after", updatable = false)
    private Long balanceAfter;

    @Column(name = "reserved_after", updatable = false)
    private Long reservedAfter;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }
}
