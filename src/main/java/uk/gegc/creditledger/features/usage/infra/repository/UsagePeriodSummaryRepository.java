package uk.gegc.creditledger.features.usage.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.creditledger.features.usage.domain.model.UsagePeriodSummary;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

public interface UsagePeriodSummaryRepository extends JpaRepository<UsagePeriodSummary, UUID> {
    Optional<UsagePeriodSummary> findByWorkspaceIdAndPeriodStart(UUID workspaceId, LocalDateTime periodStart);
}
