package com.missioncontrol.dispatch.api;

import com.missioncontrol.core.model.ApprovalStatus;
import com.missioncontrol.core.model.Plan;
import com.missioncontrol.core.model.ValidationException;
import com.missioncontrol.core.plan.PlanApprovalService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the plan approval workflow.
 */
@RestController
@RequestMapping("/api/plans")
public class PlanController {

    private static final Logger log = LoggerFactory.getLogger(PlanController.class);

    private final PlanApprovalService planApprovalService;

    public PlanController(PlanApprovalService planApprovalService) {
        this.planApprovalService = planApprovalService;
    }

    /**
     * POST /api/plans: Agent submits a plan for approval.
     */
    @PostMapping
    public ResponseEntity<Plan> createPlan(@RequestBody CreatePlanRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        Plan plan = planApprovalService.createPlan(request.parentTask(), request.subtasks(),
                request.agentId(), request.sessionKey());
        return ResponseEntity.status(HttpStatus.CREATED).body(plan);
    }

    /**
     * GET /api/plans: Plans in a workspace, pending ones by default.
     */
    @GetMapping
    public ResponseEntity<List<Plan>> listPlans(
            @RequestParam(name = "workspace", required = false) String workspace,
            @RequestParam(name = "status", required = false) String status) {
        ApprovalStatus approvalStatus = status != null ? ApprovalStatus.fromWire(status) : null;
        return ResponseEntity.ok(planApprovalService.listPlans(workspace, approvalStatus));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Plan> getPlan(@PathVariable String id) {
        return ResponseEntity.ok(planApprovalService.getPlan(id));
    }

    /**
     * POST /api/plans/{id}/approve: Approve a pending plan and all its subtasks.
     */
    @PostMapping("/{id}/approve")
    public ResponseEntity<Plan> approve(@PathVariable String id,
                                        @RequestBody(required = false) ApproveRequest request) {
        String approver = request != null ? request.approvedBy() : null;
        log.info("Approval requested for plan {}", id);
        return ResponseEntity.ok(planApprovalService.approve(id, approver));
    }

    /**
     * POST /api/plans/{id}/reject: Reject a pending plan; subtasks are blocked.
     */
    @PostMapping("/{id}/reject")
    public ResponseEntity<Plan> reject(@PathVariable String id,
                                       @RequestBody(required = false) RejectRequest request) {
        String rejecter = request != null ? request.rejectedBy() : null;
        String reason = request != null ? request.reason() : null;
        log.info("Rejection requested for plan {}", id);
        return ResponseEntity.ok(planApprovalService.reject(id, rejecter, reason));
    }
}
