package uk.gegc.reelstudio.features.segment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "ResetScopeResult")
public record ResetScopeResult(
        @Schema(description = "Segments removed", example = "6") int deleted,
        @Schema(description = "In-flight segments cancelled before removal", example = "2") int cancelled,
        @Schema(description = "Tokens returned to the available balance", example = "16") long refundedTokens,
        @Schema(description = "Segments left because they changed state during the reset", example = "0") int skipped
) {}
