package uk.gegc.creditledger.features.billing.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.creditledger.features.billing.domain.model.Reservation;
import uk.gegc.creditledger.features.billing.domain.model.ReservationState;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ReservationRepository extends JpaRepository<Reservation, UUID> {

    Optional<Reservation> findByRequestId(String requestId);

    /**
     * Terminal transitions lock the reservation row before the workspace row.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Reservation r WHERE r.id = :id")
    Optional<Reservation> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
        select r.id from Reservation r
        where r.state = :state and r.expiresAt < :cutoff
        order by r.expiresAt asc
    """)
    List<UUID> findIdsByStateAndExpiresAtBefore(@Param("state") ReservationState state,
                                                @Param("cutoff") LocalDateTime cutoff,
                                                Pageable pageable);

    @Query("select coalesce(sum(r.estimatedAmount), 0) from Reservation r where r.workspaceId = :workspaceId and r.state = :state")
    long sumEstimatedAmountByWorkspaceIdAndState(@Param("workspaceId") UUID workspaceId,
                                                 @Param("state") ReservationState state);
}
