package uk.gegc.reelstudio.features.segment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.reelstudio.features.segment.domain.model.VideoSegment;

@Schema(name = "CreateSegmentRequest", description = "New segment, placed after an existing position")
public record CreateSegmentRequest(
        @Schema(description = "Insert after this position; -1 inserts at the head, null appends", example = "2")
        @Min(-1) @Max(VideoSegment.MAX_POSITION - 1)
        Integer afterPosition,

        @NotBlank @Size(max = 4000)
        String prompt,

        @Size(max = 50)
        String shotType,

        @Size(max = 50)
        String cameraMove,

        @Min(0)
        Integer sceneNum,

        @NotBlank @Size(max = 50)
        String model,

        @NotBlank @Size(max = 20)
        String resolution,

        @NotNull @Min(1) @Max(60)
        Integer durationSec,

        @Schema(description = "Submit to the provider right away", defaultValue = "false")
        boolean submit
) {}
