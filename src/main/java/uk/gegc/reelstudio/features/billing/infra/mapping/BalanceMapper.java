package uk.gegc.reelstudio.features.billing.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.reelstudio.features.billing.api.dto.BalanceDto;
import uk.gegc.reelstudio.features.billing.domain.model.Balance;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface BalanceMapper {
    BalanceDto toDto(Balance entity);
}
