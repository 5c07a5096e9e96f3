package uk.gegc.reelstudio.features.segment.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import uk.gegc.reelstudio.features.segment.api.dto.SegmentDto;
import uk.gegc.reelstudio.features.segment.api.dto.UpdateSegmentRequest;
import uk.gegc.reelstudio.features.segment.application.SegmentService;
import uk.gegc.reelstudio.features.work.application.WorkAccessService;
import uk.gegc.reelstudio.shared.security.CurrentUser;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/segments")
@RequiredArgsConstructor
@Tag(name = "Segments", description = "Single segment status, edits and submission")
public class SegmentController {

    private final SegmentService segmentService;
    private final WorkAccessService workAccessService;

    @Operation(summary = "Get segment", description = "Polls the provider if the segment is in flight, then returns it")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Segment retrieved",
                    content = @Content(schema = @Schema(implementation = SegmentDto.class))),
            @ApiResponse(responseCode = "404", description = "Segment not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{segmentId}")
    public ResponseEntity<SegmentDto> getSegment(@PathVariable UUID segmentId, Authentication authentication) {
        requireAccess(segmentId, authentication);
        return ResponseEntity.ok(segmentService.getJob(segmentId));
    }

    @Operation(summary = "Edit segment", description = "Cost fields (model, resolution, duration) are only editable while pending")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Segment updated"),
            @ApiResponse(responseCode = "409", description = "Segment changed concurrently",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "Cost fields on a submitted segment",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PatchMapping("/{segmentId}")
    public ResponseEntity<SegmentDto> updateSegment(
            @PathVariable UUID segmentId,
            @RequestBody @Valid UpdateSegmentRequest request,
            Authentication authentication) {
        requireAccess(segmentId, authentication);
        return ResponseEntity.ok(segmentService.updateJobFields(segmentId, request));
    }

    @Operation(summary = "Submit segment", description = "Reserves the segment's cost and sends it to the provider")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Submitted, or failed at the provider with its reservation refunded",
                    content = @Content(schema = @Schema(implementation = SegmentDto.class))),
            @ApiResponse(responseCode = "402", description = "Not enough tokens",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "Segment is not pending",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{segmentId}/submit")
    public ResponseEntity<SegmentDto> submitSegment(@PathVariable UUID segmentId, Authentication authentication) {
        requireAccess(segmentId, authentication);
        return ResponseEntity.ok(segmentService.submit(segmentId));
    }

    @Operation(summary = "Delete segment", description = "In-flight segments are cancelled and refunded first")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Segment deleted"),
            @ApiResponse(responseCode = "409", description = "Segment changed state during deletion",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @DeleteMapping("/{segmentId}")
    public ResponseEntity<Void> deleteSegment(@PathVariable UUID segmentId, Authentication authentication) {
        requireAccess(segmentId, authentication);
        segmentService.deleteJob(segmentId);
        return ResponseEntity.noContent().build();
    }

    private void requireAccess(UUID segmentId, Authentication authentication) {
        workAccessService.requireOwner(segmentService.workIdOf(segmentId), CurrentUser.id(authentication));
    }
}
