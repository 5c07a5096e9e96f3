package uk.gegc.reelstudio.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "BalanceDto", description = "User's token balance")
public record BalanceDto(
        @Schema(description = "User UUID")
        UUID userId,

        @Schema(description = "Total funds, including reserved tokens", example = "1000")
        long balance,

        @Schema(description = "Tokens earmarked for in-flight segments", example = "160")
        long reserved,

        @Schema(description = "Tokens that can back a new reservation", example = "840")
        long available,

        @Schema(description = "Lifetime tokens purchased or granted", example = "1500")
        long totalPurchased,

        @Schema(description = "Lifetime tokens consumed", example = "500")
        long totalConsumed,

        @Schema(description = "Last balance update timestamp")
        LocalDateTime updatedAt
) {

    /**
     * Balance of a user who has never been funded. No row exists for them.
     */
    public static BalanceDto empty(UUID userId) {
        return new BalanceDto(userId, 0, 0, 0, 0, 0, null);
    }
}
