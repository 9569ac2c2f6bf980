package com.branchflow.dispatch.api;

import com.branchflow.core.engine.PromotionService;
import com.branchflow.core.events.EventKind;
import com.branchflow.core.events.PromotionEvent;
import com.branchflow.core.events.RunHistory;
import com.branchflow.core.model.PromotionAction;
import com.branchflow.core.model.PromotionResult;
import com.branchflow.core.model.PromotionStatus;
import com.branchflow.core.naming.BranchClassifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PromotionController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class PromotionControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-14T09:26:53Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private PromotionService promotionService;

    @MockitoBean
    private RunHistory runHistory;

    private String body(String branch, String runId) throws Exception {
        return objectMapper.writeValueAsString(new PromotionRequest(branch, runId));
    }

    // ── POST /api/v1/promotions ──────────────────────────────────────

    @Test
    @DisplayName("POST /promotions returns 200 with the run outcome and its events")
    void promoteCompleted() throws Exception {
        var event = new PromotionEvent(EventKind.RELEASE_CREATED, "run-7", "d7",
                Map.of("fromDev", "d7", "newRelease", "r7"), NOW);
        when(promotionService.promote("d7", "run-7")).thenReturn(new PromotionResult("run-7",
                BranchClassifier.classify("d7"), new PromotionAction.CreateRelease("d7", 7),
                PromotionStatus.COMPLETED, List.of(event), null));

        mockMvc.perform(post("/api/v1/promotions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("d7", "run-7")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.run_id").value("run-7"))
                .andExpect(jsonPath("$.kind").value("DEVELOPMENT"))
                .andExpect(jsonPath("$.action").value("create-release"))
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.exit_code").value(0))
                .andExpect(jsonPath("$.events", hasSize(1)))
                .andExpect(jsonPath("$.events[0].event").value("release.created"))
                .andExpect(jsonPath("$.events[0].payload.newRelease").value("r7"));
    }

    @Test
    @DisplayName("POST /promotions returns 200 with exit code 2 on conflict")
    void promoteConflict() throws Exception {
        var hotfix = BranchClassifier.classify("hotfix/r3-login").withParentRelease(3);
        when(promotionService.promote(eq("hotfix/r3-login"), any())).thenReturn(new PromotionResult("run-8",
                hotfix, new PromotionAction.PropagateHotfix("hotfix/r3-login", "r3"),
                PromotionStatus.CONFLICT, List.of(), null));

        mockMvc.perform(post("/api/v1/promotions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("hotfix/r3-login", null)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.parent_release").value("r3"))
                .andExpect(jsonPath("$.status").value("CONFLICT"))
                .andExpect(jsonPath("$.exit_code").value(2));
    }

    @Test
    @DisplayName("POST /promotions returns 500 when the run failed")
    void promoteFailed() throws Exception {
        when(promotionService.promote(eq("r4"), any())).thenReturn(new PromotionResult("run-9",
                BranchClassifier.classify("r4"), new PromotionAction.MergeToMaster("r4"),
                PromotionStatus.FAILED, List.of(), "push master failed"));

        mockMvc.perform(post("/api/v1/promotions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("r4", null)))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andExpect(jsonPath("$.error").value("push master failed"));
    }

    @Test
    @DisplayName("POST /promotions returns 400 without a branch")
    void promoteBlankBranch() throws Exception {
        mockMvc.perform(post("/api/v1/promotions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("  ", null)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Branch is required"));

        verify(promotionService, never()).promote(any(), any());
    }

    // ── POST /api/v1/promotions/plan ─────────────────────────────────

    @Test
    @DisplayName("POST /promotions/plan reports a closed gate")
    void planGateClosed() throws Exception {
        when(promotionService.plan("r5")).thenReturn(new PromotionResult("plan",
                BranchClassifier.classify("r5"), null, PromotionStatus.GATE_CLOSED, List.of(), null));

        mockMvc.perform(post("/api/v1/promotions/plan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("r5", null)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("GATE_CLOSED"))
                .andExpect(jsonPath("$.action").doesNotExist());
    }

    // ── GET /api/v1/promotions/{runId} ───────────────────────────────

    @Test
    @DisplayName("GET /promotions/{runId} returns recorded events")
    void getRun() throws Exception {
        var event = new PromotionEvent(EventKind.TAG_REMINDER, "run-3", "r3",
                Map.of("branchKind", "RELEASE", "branchName", "r3", "tagCommandText", "git tag r3-complete"), NOW);
        when(runHistory.eventsFor("run-3")).thenReturn(Optional.of(List.of(event)));

        mockMvc.perform(get("/api/v1/promotions/run-3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.run_id").value("run-3"))
                .andExpect(jsonPath("$.events[0].event").value("tag.reminder"))
                .andExpect(jsonPath("$.events[0].branch").value("r3"));
    }

    @Test
    @DisplayName("GET /promotions/{runId} returns 404 for an unknown run")
    void getRunNotFound() throws Exception {
        when(runHistory.eventsFor("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/promotions/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Run not found: missing"));
    }
}
