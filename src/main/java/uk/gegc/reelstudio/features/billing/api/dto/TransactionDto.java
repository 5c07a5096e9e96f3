package uk.gegc.reelstudio.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.reelstudio.features.billing.domain.model.TokenTransactionType;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "TransactionDto", description = "One ledger movement")
public record TransactionDto(
        UUID id,
        TokenTransactionType type,
        @Schema(description = "Signed amount; negative for consumption", example = "-160")
        long amount,
        long balanceAfter,
        long reservedAfter,
        @Schema(description = "Segment id or external reference")
        String refId,
        String description,
        LocalDateTime createdAt
) {}
