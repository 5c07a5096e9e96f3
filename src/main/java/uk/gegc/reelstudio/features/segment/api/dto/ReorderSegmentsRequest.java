package uk.gegc.reelstudio.features.segment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

@Schema(name = "ReorderSegmentsRequest", description = "New positions for some or all segments of an episode")
public record ReorderSegmentsRequest(
        @NotNull List<@Valid @NotNull PositionAssignment> assignments
) {}
