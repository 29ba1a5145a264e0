package com.example.shiftplanner.plan;

import com.example.shiftplanner.common.ApiResponse;
import com.example.shiftplanner.config.PlanningSettings;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/plan")
public class PlanController {

    private static final Logger logger = LoggerFactory.getLogger(PlanController.class);

    private final PlanGenerationService generationService;
    private final PlanCommitService commitService;
    private final PlanningSettings settings;

    public PlanController(PlanGenerationService generationService,
                          PlanCommitService commitService,
                          PlanningSettings settings) {
        this.generationService = generationService;
        this.commitService = commitService;
        this.settings = settings;
    }

    @PostMapping("/generate")
    public ResponseEntity<ApiResponse<PlanProposal>> generate(
            @Valid @RequestBody PlanGenerationRequest request,
            @RequestHeader(value = "X-User-Id", required = false) String userId) {
        PlanProposal proposal = generationService.generatePlan(request, resolveUser(userId));
        ApiResponse<PlanProposal> body = ApiResponse.ok("Plan generated", proposal)
                .withMeta("assignmentCount", proposal.assignments().size())
                .withMeta("coveragePercentage", proposal.coverage().coveragePercentage())
                .withMeta("violationCount", proposal.violations().size());
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @GetMapping("/{planId}")
    public ResponseEntity<ApiResponse<PlanProposal>> get(@PathVariable("planId") String planId) {
        return ResponseEntity.ok(ApiResponse.ok(generationService.getPlan(planId)));
    }

    @PostMapping("/{planId}/commit")
    public ResponseEntity<ApiResponse<CommitResult>> commit(
            @PathVariable("planId") String planId,
            @RequestBody(required = false) CommitRequest request,
            @RequestHeader(value = "X-User-Id", required = false) String headerUser) {
        String userId = request != null && request.userId() != null && !request.userId().isBlank()
                ? request.userId()
                : resolveUser(headerUser);
        CommitResult result = commitService.commitPlan(planId, request == null ? null : request.assignmentIds(), userId);
        String message = result.failures().isEmpty() ? "Plan committed" : "Plan committed with failures";
        return ResponseEntity.ok(ApiResponse.ok(message, result));
    }

    @DeleteMapping("/{planId}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable("planId") String planId) {
        generationService.deletePlan(planId);
        logger.debug("Plan {} deleted through API", planId);
        return ResponseEntity.ok(ApiResponse.ok("Plan deleted", null));
    }

    private String resolveUser(String userId) {
        return userId == null || userId.isBlank() ? settings.getDefaultUser() : userId;
    }
}
