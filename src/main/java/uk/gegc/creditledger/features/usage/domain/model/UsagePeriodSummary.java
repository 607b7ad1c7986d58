package uk.gegc.creditledger.features.usage.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Running totals for one workspace billing period, kept current on every settlement.
 */
@Entity
@Table(name = "usage_period_summaries",
        uniqueConstraints = @UniqueConstraint(name = "uk_usage_summary_period",
                columnNames = {"workspace_id", "period_start"}))
@Getter
@Setter
public class UsagePeriodSummary {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "workspace_id", nullable = false, updatable = false)
    private UUID workspaceId;

    @Column(name = "period_start", nullable = false, updatable = false)
    private LocalDateTime periodStart;

    @Column(name = "request_count", nullable = false)
    private long requestCount;

    @Column(name = "credits_charged", nullable = false)
    private long creditsCharged;

    @Column(name = "units_reported", nullable = false)
    private long unitsReported;

    @Column(name = "absorbed_credits", nullable = false)
    private long absorbedCredits;

    @Column(name = "overage_units", nullable = false)
    private long overageUnits;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
