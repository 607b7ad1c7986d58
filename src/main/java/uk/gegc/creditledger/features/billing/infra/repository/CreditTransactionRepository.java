package uk.gegc.creditledger.features.billing.infra.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.creditledger.features.billing.domain.model.CreditTransaction;
import uk.gegc.creditledger.features.billing.domain.model.CreditTransactionType;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CreditTransactionRepository extends JpaRepository<CreditTransaction, UUID> {

    @Query("""
        select t from CreditTransaction t
        where t.workspaceId = :workspaceId
          and (:type is null or t.type = :type)
          and (:dateFrom is null or t.createdAt >= :dateFrom)
          and (:dateTo is null or t.createdAt <= :dateTo)
        order by t.createdAt desc, t.id desc
    """)
    Page<CreditTransaction> findByFilters(
            @Param("workspaceId") UUID workspaceId,
            @Param("type") CreditTransactionType type,
            @Param("dateFrom") LocalDateTime dateFrom,
            @Param("dateTo") LocalDateTime dateTo,
            Pageable pageable
    );

    Optional<CreditTransaction> findByIdempotencyKey(String idempotencyKey);

    List<CreditTransaction> findByWorkspaceIdOrderByCreatedAtAsc(UUID workspaceId);

    List<CreditTransaction> findByWorkspaceIdAndPeriodStartAndTypeIn(UUID workspaceId,
                                                                     LocalDateTime periodStart,
                                                                     Collection<CreditTransactionType> types);

    List<CreditTransaction> findByReservationIdOrderByCreatedAtAsc(UUID reservationId);
}
