package uk.gegc.reelstudio.features.segment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "SegmentBatchResult")
public record SegmentBatchResult(
        @Schema(description = "Created segments in position order, after submission") List<SegmentDto> segments,
        @Schema(description = "Tokens reserved for the whole batch", example = "24") long totalCost
) {}
