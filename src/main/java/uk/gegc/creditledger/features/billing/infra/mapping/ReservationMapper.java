package uk.gegc.creditledger.features.billing.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.creditledger.features.billing.api.dto.ReservationDto;
import uk.gegc.creditledger.features.billing.domain.model.Reservation;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface ReservationMapper {
    ReservationDto toDto(Reservation entity);
}
