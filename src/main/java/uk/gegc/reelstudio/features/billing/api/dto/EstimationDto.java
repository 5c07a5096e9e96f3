package uk.gegc.reelstudio.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "EstimationDto", description = "Token cost of generating one segment")
public record EstimationDto(
        @Schema(example = "seedance_2_0")
        String model,

        @Schema(example = "1080p")
        String resolution,

        @Schema(example = "5")
        int durationSec,

        @Schema(description = "Provider price in cents per second", example = "80")
        int pricePerSecondCents,

        @Schema(example = "2")
        int markup,

        @Schema(description = "Tokens reserved when the segment is submitted", example = "8")
        long estimatedTokens,

        @Schema(example = "8 tokens for 5s at 1080p")
        String humanizedEstimate
) {

    public static String createHumanizedEstimate(long tokens, int durationSec, String resolution) {
        String tokenPart = tokens == 1 ? "1 token" : tokens + " tokens";
        return String.format("%s for %ds at %s", tokenPart, durationSec, resolution);
    }
}
