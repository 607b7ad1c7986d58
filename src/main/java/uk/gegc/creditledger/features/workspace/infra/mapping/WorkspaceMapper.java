package uk.gegc.creditledger.features.workspace.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;
import uk.gegc.creditledger.features.workspace.api.dto.PlanDto;
import uk.gegc.creditledger.features.workspace.api.dto.WorkspaceDto;
import uk.gegc.creditledger.features.workspace.domain.model.Plan;
import uk.gegc.creditledger.features.workspace.domain.model.Workspace;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface WorkspaceMapper {

    @Mapping(target = "planCode", source = "plan.code")
    WorkspaceDto toDto(Workspace workspace);

    PlanDto toPlanDto(Plan plan);

    List<PlanDto> toPlanDtos(List<Plan> plans);
}
