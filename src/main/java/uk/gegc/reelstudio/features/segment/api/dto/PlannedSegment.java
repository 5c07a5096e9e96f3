package uk.gegc.reelstudio.features.segment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@Schema(name = "PlannedSegment", description = "One segment of a batch or episode plan; model and resolution come from the enclosing request")
public record PlannedSegment(
        @NotBlank @Size(max = 4000)
        String prompt,

        @Size(max = 50)
        String shotType,

        @Size(max = 50)
        String cameraMove,

        @Min(0)
        Integer sceneNum,

        @NotNull @Min(1) @Max(60)
        Integer durationSec
) {}
