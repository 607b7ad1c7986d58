package uk.gegc.creditledger.features.workspace.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "plans")
@Getter
@Setter
public class Plan {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "code", nullable = false, unique = true, length = 64)
    private String code;

    @Column(name = "name", nullable = false)
    private String name;

    /** Credits usable per billing period before overage applies; null means unlimited. */
    @Column(name = "credit_limit")
    private Long creditLimit;

    /** Currency amount charged per overage credit; null falls back to the configured default. */
    @Column(name = "overage_rate", precision = 19, scale = 6)
    private BigDecimal overageRate;

    /** Credits granted to the workspace balance at the start of each billing period. */
    @Column(name = "allotment_credits", nullable = false)
    private long allotmentCredits;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public boolean isUnlimited() {
        return creditLimit == null;
    }
}
