package uk.gegc.reelstudio.features.segment.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import uk.gegc.reelstudio.features.segment.domain.model.VideoSegment;

import java.util.UUID;

public record PositionAssignment(
        @NotNull UUID segmentId,
        @NotNull @Min(0) @Max(VideoSegment.MAX_POSITION) Integer position
) {}
