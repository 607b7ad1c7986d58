package uk.gegc.creditledger.features.overage.infra.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.creditledger.features.overage.domain.model.OverageCharge;
import uk.gegc.creditledger.features.overage.domain.model.OverageStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface OverageChargeRepository extends JpaRepository<OverageCharge, UUID> {

    List<OverageCharge> findByWorkspaceIdAndPeriodStartAndPeriodEndOrderByOverageUnitsToDateAsc(UUID workspaceId,
                                                                                               LocalDateTime periodStart,
                                                                                               LocalDateTime periodEnd);

    Optional<OverageCharge> findByIdempotencyKey(String idempotencyKey);

    List<OverageCharge> findByWorkspaceIdOrderByPeriodStartDescOverageUnitsToDateAsc(UUID workspaceId);

    /**
     * Pending charges, plus submissions whose claim is older than {@code staleBefore} (the submitter died
     * between claiming and recording the outcome).
     */
    @Query("""
        select c.id from OverageCharge c
        where c.attempts < :maxAttempts
          and (c.status = :pending or (c.status = :submitting and c.claimedAt < :staleBefore))
        order by c.createdAt asc
        """)
    List<UUID> findIdsDueForSubmission(@Param("pending") OverageStatus pending,
                                       @Param("submitting") OverageStatus submitting,
                                       @Param("staleBefore") LocalDateTime staleBefore,
                                       @Param("maxAttempts") int maxAttempts,
                                       Pageable pageable);

    /**
     * Compare-and-set from PENDING (or a stale SUBMITTING) to SUBMITTING. Exactly one concurrent caller
     * sees 1; everyone else sees 0 and must not call the invoicing collaborator.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update OverageCharge c
        set c.status = :submitting, c.claimedAt = :now, c.attempts = c.attempts + 1, c.version = c.version + 1
        where c.id = :id
          and (c.status = :pending or (c.status = :submitting and c.claimedAt < :staleBefore))
        """)
    int claimForSubmission(@Param("id") UUID id,
                           @Param("pending") OverageStatus pending,
                           @Param("submitting") OverageStatus submitting,
                           @Param("now") LocalDateTime now,
                           @Param("staleBefore") LocalDateTime staleBefore);
}
