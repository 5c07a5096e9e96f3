package uk.gegc.reelstudio.features.segment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.reelstudio.features.segment.domain.model.SegmentStatus;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "SegmentDto", description = "A generated video segment and its provider state")
public record SegmentDto(
        UUID id,
        UUID workId,
        @Schema(example = "1") Integer episodeNum,
        @Schema(description = "Order within the episode; gaps are allowed", example = "3") Integer position,
        Integer sceneNum,
        String prompt,
        @Schema(example = "close-up") String shotType,
        @Schema(example = "dolly-in") String cameraMove,
        @Schema(example = "seedance_2_0") String model,
        @Schema(example = "1080p") String resolution,
        @Schema(example = "5") Integer durationSec,
        SegmentStatus status,
        String providerTaskId,
        String resultUrl,
        String errorMessage,
        @Schema(description = "Tokens reserved at submission; null if never submitted", example = "8") Long tokenCost,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        LocalDateTime completedAt
) {}
