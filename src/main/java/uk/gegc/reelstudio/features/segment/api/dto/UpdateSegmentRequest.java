package uk.gegc.reelstudio.features.segment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/**
 * Partial edit; null fields are left unchanged. Model, resolution and duration set the cost and can only
 * change while the segment is pending.
 */
@Schema(name = "UpdateSegmentRequest")
public record UpdateSegmentRequest(
        @Size(min = 1, max = 4000) String prompt,
        @Size(max = 50) String shotType,
        @Size(max = 50) String cameraMove,
        @Min(0) Integer sceneNum,
        @Size(min = 1, max = 50) String model,
        @Size(min = 1, max = 20) String resolution,
        @Min(1) @Max(60) Integer durationSec
) {

    public boolean touchesCost() {
        return model != null || resolution != null || durationSec != null;
    }
}
