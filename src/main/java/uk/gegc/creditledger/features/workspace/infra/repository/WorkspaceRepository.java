package uk.gegc.creditledger.features.workspace.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.creditledger.features.workspace.domain.model.Workspace;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WorkspaceRepository extends JpaRepository<Workspace, UUID> {

    /**
     * Loads the workspace with {@code SELECT ... FOR UPDATE}. Every balance mutation goes through here,
     * so concurrent reservations against the same workspace serialize on the row.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM Workspace w WHERE w.id = :id")
    Optional<Workspace> findByIdForUpdate(@Param("id") UUID id);

    @Query("SELECT w.id FROM Workspace w")
    List<UUID> findAllIds();

    @Query("SELECT w.id FROM Workspace w WHERE w.billingPeriodEnd <= :now")
    List<UUID> findIdsWithPeriodEndedBefore(@Param("now") LocalDateTime now);
}
