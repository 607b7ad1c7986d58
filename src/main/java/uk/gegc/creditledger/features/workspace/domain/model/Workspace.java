package uk.gegc.creditledger.features.workspace.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Owner of a credit balance. The balance columns are only ever mutated under a
 * pessimistic row lock by the ledger service.
 */
@Entity
@Table(name = "workspaces")
@Getter
@Setter
public class Workspace {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "owner_email", nullable = false)
    private String ownerEmail;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "plan_id", nullable = false)
    private Plan plan;

    @Column(name = "balance", nullable = false)
    private long balance;

    @Column(name = "reserved", nullable = false)
    private long reserved;

    /** Lifetime PURCHASE, ALLOTMENT and positive ADJUSTMENT credits. */
    @Column(name = "total_granted", nullable = false)
    private long totalGranted;

    /** Lifetime SETTLE charges and negative ADJUSTMENT credits. */
    @Column(name = "total_charged", nullable = false)
    private long totalCharged;

    @Column(name = "billing_period_start", nullable = false)
    private LocalDateTime billingPeriodStart;

    @Column(name = "billing_period_end", nullable = false)
    private LocalDateTime billingPeriodEnd;

    @Column(name = "credit_limit_override")
    private Long creditLimitOverride;

    @Column(name = "overage_rate_override", precision = 19, scale = 6)
    private BigDecimal overageRateOverride;

    @Column(name = "stripe_customer_id")
    private String stripeCustomerId;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Period credit limit, workspace override first, then the plan. Null means unlimited.
     */
    public Long effectiveCreditLimit() {
        return creditLimitOverride != null ? creditLimitOverride : plan.getCreditLimit();
    }

    /**
     * Overage rate, workspace override first, then the plan. Null means use the configured default.
     */
    public BigDecimal effectiveOverageRate() {
        return overageRateOverride != null ? overageRateOverride : plan.getOverageRate();
    }
}
