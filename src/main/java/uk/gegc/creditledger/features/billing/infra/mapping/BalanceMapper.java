package uk.gegc.creditledger.features.billing.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;
import uk.gegc.creditledger.features.billing.api.dto.BalanceDto;
import uk.gegc.creditledger.features.workspace.domain.model.Workspace;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface BalanceMapper {

    @Mapping(target = "workspaceId", source = "id")
    BalanceDto toDto(Workspace workspace);
}
