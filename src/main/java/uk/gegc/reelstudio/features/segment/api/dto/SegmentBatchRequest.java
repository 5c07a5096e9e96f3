package uk.gegc.reelstudio.features.segment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.reelstudio.features.segment.domain.model.VideoSegment;

import java.util.List;

@Schema(name = "SegmentBatchRequest", description = "Segments created and submitted together; all are paid for or none is created")
public record SegmentBatchRequest(
        @Schema(description = "Insert the batch after this position; -1 inserts at the head, null appends", example = "-1")
        @Min(-1) @Max(VideoSegment.MAX_POSITION - 1)
        Integer afterPosition,

        @NotBlank @Size(max = 50)
        String model,

        @NotBlank @Size(max = 20)
        String resolution,

        @NotEmpty @Size(max = 50)
        List<@Valid @NotNull PlannedSegment> segments
) {}
