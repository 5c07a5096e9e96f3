package uk.gegc.reelstudio.features.segment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "ReplacePlanResult")
public record ReplacePlanResult(
        @Schema(description = "What happened to the previous segments") ResetScopeResult cleared,
        @Schema(description = "New pending segments, positions 0..n-1") List<SegmentDto> segments
) {}
