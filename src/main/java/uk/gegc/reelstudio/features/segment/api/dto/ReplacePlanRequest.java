package uk.gegc.reelstudio.features.segment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

@Schema(name = "ReplacePlanRequest", description = "New segment plan for an episode; replaces every existing segment")
public record ReplacePlanRequest(
        @NotBlank @Size(max = 50)
        String model,

        @NotBlank @Size(max = 20)
        String resolution,

        @NotEmpty @Size(max = 200)
        List<@Valid @NotNull PlannedSegment> segments
) {}
