package uk.gegc.creditledger.features.usage.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Period totals for one service type, model and provider combination.
 */
@Entity
@Table(name = "usage_breakdowns",
        uniqueConstraints = @UniqueConstraint(name = "uk_usage_breakdown_key",
                columnNames = {"workspace_id", "period_start", "service_type", "model", "provider"}))
@Getter
@Setter
public class UsageBreakdown {

    public static final String UNSPECIFIED = "unspecified";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "workspace_id", nullable = false, updatable = false)
    private UUID workspaceId;

    @Column(name = "period_start", nullable = false, updatable = false)
    private LocalDateTime periodStart;

    @Column(name = "service_type", nullable = false, length = 32, updatable = false)
    private String serviceType;

    @Column(name = "model", nullable = false, length = 128, updatable = false)
    private String model;

    @Column(name = "provider", nullable = false, length = 64, updatable = false)
    private String provider;

    @Column(name = "request_count", nullable = false)
    private long requestCount;

    @Column(name = "credits_charged", nullable = false)
    private long creditsCharged;

    @Column(name = "units_reported", nullable = false)
    private long unitsReported;

    @Version
    @Column(name = "version", nullable = false)
    private long version;
}
