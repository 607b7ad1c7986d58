package uk.gegc.creditledger.features.usage.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.creditledger.features.usage.domain.model.UsageBreakdown;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface UsageBreakdownRepository extends JpaRepository<UsageBreakdown, UUID> {

    Optional<UsageBreakdown> findByWorkspaceIdAndPeriodStartAndServiceTypeAndModelAndProvider(
            UUID workspaceId, LocalDateTime periodStart, String serviceType, String model, String provider);

    List<UsageBreakdown> findByWorkspaceIdAndPeriodStartOrderByCreditsChargedDesc(UUID workspaceId,
                                                                                  LocalDateTime periodStart);

    @Modifying
    @Query("delete from UsageBreakdown b where b.workspaceId = :workspaceId and b.periodStart = :periodStart")
    int deleteByPeriod(@Param("workspaceId") UUID workspaceId, @Param("periodStart") LocalDateTime periodStart);
}
