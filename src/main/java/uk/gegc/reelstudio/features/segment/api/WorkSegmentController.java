package uk.gegc.reelstudio.features.segment.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;
import uk.gegc.reelstudio.features.segment.api.dto.CreateSegmentRequest;
import uk.gegc.reelstudio.features.segment.api.dto.ReorderSegmentsRequest;
import uk.gegc.reelstudio.features.segment.api.dto.ReplacePlanRequest;
import uk.gegc.reelstudio.features.segment.api.dto.ReplacePlanResult;
import uk.gegc.reelstudio.features.segment.api.dto.ResetScopeResult;
import uk.gegc.reelstudio.features.segment.api.dto.SegmentBatchRequest;
import uk.gegc.reelstudio.features.segment.api.dto.SegmentBatchResult;
import uk.gegc.reelstudio.features.segment.api.dto.SegmentDto;
import uk.gegc.reelstudio.features.segment.application.SegmentService;
import uk.gegc.reelstudio.features.work.application.WorkAccessService;
import uk.gegc.reelstudio.shared.security.CurrentUser;

import java.net.URI;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/works/{workId}")
@RequiredArgsConstructor
@Validated
@Tag(name = "Work Segments", description = "Ordered segments of a work's episodes")
public class WorkSegmentController {

    private final SegmentService segmentService;
    private final WorkAccessService workAccessService;

    @Operation(summary = "List segments", description = "Polls the provider for in-flight segments, then returns them in position order")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Segments retrieved"),
            @ApiResponse(responseCode = "403", description = "Work belongs to another user",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Work not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/segments")
    public ResponseEntity<List<SegmentDto>> listSegments(
            @PathVariable UUID workId,
            @Parameter(description = "Restrict to one episode; all episodes when omitted")
            @RequestParam(required = false) @Min(0) Integer episodeNum,
            Authentication authentication) {
        workAccessService.requireOwner(workId, CurrentUser.id(authentication));
        return ResponseEntity.ok(segmentService.listJobs(workId, episodeNum));
    }

    @Operation(summary = "Create segment", description = "Inserts a segment after the given position, shifting later segments up by one")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Segment created",
                    content = @Content(schema = @Schema(implementation = SegmentDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request or unpriced model",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "402", description = "Not enough tokens for immediate submission",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/episodes/{episodeNum}/segments")
    public ResponseEntity<SegmentDto> createSegment(
            @PathVariable UUID workId,
            @PathVariable @Min(0) Integer episodeNum,
            @RequestBody @Valid CreateSegmentRequest request,
            Authentication authentication) {
        workAccessService.requireOwner(workId, CurrentUser.id(authentication));
        SegmentDto created = segmentService.createJob(workId, episodeNum, request);
        URI location = ServletUriComponentsBuilder.fromCurrentContextPath()
                .path("/api/v1/segments/{id}")
                .buildAndExpand(created.id())
                .toUri();
        return ResponseEntity.created(location).body(created);
    }

    @Operation(summary = "Create and submit a batch",
            description = "Inserts the segments one after another and reserves their total cost; none is created when the balance cannot cover all of them")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Batch created and handed to the provider",
                    content = @Content(schema = @Schema(implementation = SegmentBatchResult.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request or unpriced model",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "402", description = "Not enough tokens for the whole batch",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/episodes/{episodeNum}/segments/batch")
    public ResponseEntity<SegmentBatchResult> submitBatch(
            @PathVariable UUID workId,
            @PathVariable @Min(0) Integer episodeNum,
            @RequestBody @Valid SegmentBatchRequest request,
            Authentication authentication) {
        workAccessService.requireOwner(workId, CurrentUser.id(authentication));
        return ResponseEntity.status(HttpStatus.CREATED).body(segmentService.submitBatch(workId, episodeNum, request));
    }

    @Operation(summary = "Replace episode plan",
            description = "Cancels in-flight segments with a refund, deletes the episode's segments and writes the new plan as pending segments, in one transaction")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Plan replaced"),
            @ApiResponse(responseCode = "400", description = "Invalid request or unpriced model",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "A segment changed state during the replacement",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PutMapping("/episodes/{episodeNum}/segments")
    public ResponseEntity<ReplacePlanResult> replacePlan(
            @PathVariable UUID workId,
            @PathVariable @Min(0) Integer episodeNum,
            @RequestBody @Valid ReplacePlanRequest request,
            Authentication authentication) {
        workAccessService.requireOwner(workId, CurrentUser.id(authentication));
        return ResponseEntity.ok(segmentService.replacePlan(workId, episodeNum, request));
    }

    @Operation(summary = "Reorder segments", description = "Moves segments to explicit positions; unnamed segments keep theirs")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Episode reordered"),
            @ApiResponse(responseCode = "409", description = "Mapping would duplicate a position or names a foreign segment",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PutMapping("/episodes/{episodeNum}/segments/order")
    public ResponseEntity<List<SegmentDto>> reorderSegments(
            @PathVariable UUID workId,
            @PathVariable @Min(0) Integer episodeNum,
            @RequestBody @Valid ReorderSegmentsRequest request,
            Authentication authentication) {
        workAccessService.requireOwner(workId, CurrentUser.id(authentication));
        return ResponseEntity.ok(segmentService.reorder(workId, episodeNum, request.assignments()));
    }

    @Operation(summary = "Reset episode", description = "Cancels in-flight segments with a refund, then deletes the episode's segments")
    @ApiResponse(responseCode = "200", description = "Episode reset")
    @DeleteMapping("/episodes/{episodeNum}/segments")
    public ResponseEntity<ResetScopeResult> resetEpisode(
            @PathVariable UUID workId,
            @PathVariable @Min(0) Integer episodeNum,
            Authentication authentication) {
        workAccessService.requireOwner(workId, CurrentUser.id(authentication));
        return ResponseEntity.ok(segmentService.resetScope(workId, episodeNum));
    }
}
