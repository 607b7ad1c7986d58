package uk.gegc.creditledger.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A hold on part of a workspace balance for one in-flight generation request.
 * Terminal rows are kept for audit and carry the recorded outcome so repeated
 * settle/release calls can return it unchanged.
 */
@Entity
@Table(name = "reservations",
        indexes = {
                @Index(name = "idx_reservations_state", columnList = "state"),
                @Index(name = "idx_reservations_expires_at", columnList = "expires_at")
        })
@Getter
@Setter
public class Reservation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "workspace_id", nullable = false, updatable = false)
    private UUID workspaceId;

    @Column(name = "request_id", nullable = false, unique = true, updatable = false)
    private String requestId;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 32)
    private ReservationState state;

    @Column(name = "estimated_amount", nullable = false, updatable = false)
    private long estimatedAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "service_type", length = 32)
    private ServiceType serviceType;

    @Column(name = "model", length = 128)
    private String model;

    @Column(name = "provider", length = 64)
    private String provider;

    @Column(name = "actual_amount")
    private Long actualAmount;

    @Column(name = "charged_amount")
    private Long chargedAmount;

    @Column(name = "refund_amount")
    private Long refundAmount;

    @Column(name = "absorbed_amount")
    private Long absorbedAmount;

    @Column(name = "release_reason", length = 255)
    private String releaseReason;

    @Column(name = "terminal_transaction_id")
    private UUID terminalTransactionId;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
