package uk.gegc.reelstudio.features.billing.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.reelstudio.features.billing.api.dto.TransactionDto;
import uk.gegc.reelstudio.features.billing.domain.model.TokenTransaction;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface TokenTransactionMapper {
    TransactionDto toDto(TokenTransaction entity);
    List<TransactionDto> toDtos(List<TokenTransaction> entities);
}
