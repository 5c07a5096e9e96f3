package uk.gegc.reelstudio.features.segment.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.reelstudio.features.provider.domain.exception.ProviderException;
import uk.gegc.reelstudio.features.segment.api.dto.SegmentDto;
import uk.gegc.reelstudio.features.segment.api.dto.UpdateSegmentRequest;
import uk.gegc.reelstudio.features.segment.application.SegmentService;
import uk.gegc.reelstudio.features.segment.domain.model.SegmentStatus;
import uk.gegc.reelstudio.features.work.application.WorkAccessService;
import uk.gegc.reelstudio.shared.exception.ResourceNotFoundException;
import uk.gegc.reelstudio.testsupport.WebMvcSecurityTestConfig;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SegmentController.class)
@Import(WebMvcSecurityTestConfig.class)
@DisplayName("SegmentController")
class SegmentControllerTest {

    private static final String USER_ID = "7f3c2a10-4b5e-4c61-9d2a-0c8e5b1f6a01";
    private static final UUID USER = UUID.fromString(USER_ID);
    private static final UUID WORK_ID = UUID.fromString("2d9e8f70-1a2b-4c3d-8e9f-a0b1c2d3e4f5");
    private static final UUID SEGMENT_ID = UUID.fromString("5b6c7d8e-9f00-4a1b-8c2d-3e4f5a6b7c8d");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SegmentService segmentService;

    @MockitoBean
    private WorkAccessService workAccessService;

    private SegmentDto dto(SegmentStatus status, String errorMessage) {
        return new SegmentDto(SEGMENT_ID, WORK_ID, 1, 0, null, "Harbour at dawn", null, null,
                "seedance_2_0", "1080p", 5, status, "task-1", null, errorMessage, 8L, null, null, null);
    }

    @Test
    @DisplayName("GET /segments/{id}: checks ownership of the parent work")
    @WithMockUser(username = USER_ID)
    void get_checksOwnership() throws Exception {
        when(segmentService.workIdOf(SEGMENT_ID)).thenReturn(WORK_ID);
        when(segmentService.getJob(SEGMENT_ID)).thenReturn(dto(SegmentStatus.DONE, null));

        mockMvc.perform(get("/api/v1/segments/{id}", SEGMENT_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DONE"))
                .andExpect(jsonPath("$.tokenCost").value(8));

        verify(workAccessService).requireOwner(WORK_ID, USER);
    }

    @Test
    @DisplayName("GET /segments/{id}: unknown segment is 404")
    @WithMockUser(username = USER_ID)
    void get_unknown() throws Exception {
        when(segmentService.workIdOf(SEGMENT_ID)).thenThrow(new ResourceNotFoundException("Segment " + SEGMENT_ID + " not found"));

        mockMvc.perform(get("/api/v1/segments/{id}", SEGMENT_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Resource Not Found"));
    }

    @Test
    @DisplayName("GET /segments/{id}: malformed id is 400")
    @WithMockUser(username = USER_ID)
    void get_badId() throws Exception {
        mockMvc.perform(get("/api/v1/segments/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("PATCH /segments/{id}: cost fields on a submitted segment are 422")
    @WithMockUser(username = USER_ID)
    void patch_locked() throws Exception {
        when(segmentService.workIdOf(SEGMENT_ID)).thenReturn(WORK_ID);
        when(segmentService.updateJobFields(eq(SEGMENT_ID), any(UpdateSegmentRequest.class)))
                .thenThrow(new IllegalStateException("Model, resolution and duration can only change while the segment is pending"));

        mockMvc.perform(patch("/api/v1/segments/{id}", SEGMENT_ID)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resolution\":\"720p\"}"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    @DisplayName("POST /segments/{id}/submit: provider failure still returns the failed segment")
    @WithMockUser(username = USER_ID)
    void submit_providerFailedSegment() throws Exception {
        when(segmentService.workIdOf(SEGMENT_ID)).thenReturn(WORK_ID);
        when(segmentService.submit(SEGMENT_ID)).thenReturn(dto(SegmentStatus.FAILED, "Submission failed: 503"));

        mockMvc.perform(post("/api/v1/segments/{id}/submit", SEGMENT_ID).with(csrf()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andExpect(jsonPath("$.errorMessage").value("Submission failed: 503"));
    }

    @Test
    @DisplayName("POST /segments/{id}/submit: provider outage surfaced by the service is 503")
    @WithMockUser(username = USER_ID)
    void submit_providerOutage() throws Exception {
        when(segmentService.workIdOf(SEGMENT_ID)).thenReturn(WORK_ID);
        when(segmentService.submit(SEGMENT_ID)).thenThrow(new ProviderException("connect timed out"));

        mockMvc.perform(post("/api/v1/segments/{id}/submit", SEGMENT_ID).with(csrf()))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    @DisplayName("DELETE /segments/{id}: 204 on success")
    @WithMockUser(username = USER_ID)
    void delete_ok() throws Exception {
        when(segmentService.workIdOf(SEGMENT_ID)).thenReturn(WORK_ID);

        mockMvc.perform(delete("/api/v1/segments/{id}", SEGMENT_ID).with(csrf()))
                .andExpect(status().isNoContent());

        verify(segmentService).deleteJob(SEGMENT_ID);
    }

    @Test
    @DisplayName("DELETE /segments/{id}: concurrent state change is 409")
    @WithMockUser(username = USER_ID)
    void delete_conflict() throws Exception {
        when(segmentService.workIdOf(SEGMENT_ID)).thenReturn(WORK_ID);
        doThrow(new OptimisticLockingFailureException("Segment changed state while being deleted"))
                .when(segmentService).deleteJob(SEGMENT_ID);

        mockMvc.perform(delete("/api/v1/segments/{id}", SEGMENT_ID).with(csrf()))
                .andExpect(status().isConflict());
    }
}
