package com.xammer.tagops.controller;

import com.xammer.tagops.domain.Workflow;
import com.xammer.tagops.domain.WorkflowStatus;
import com.xammer.tagops.domain.WorkflowType;
import com.xammer.tagops.dto.ApprovalRequest;
import com.xammer.tagops.dto.DecisionRequest;
import com.xammer.tagops.dto.WorkflowFilter;
import com.xammer.tagops.dto.WorkflowRequest;
import com.xammer.tagops.dto.WorkflowStatsDto;
import com.xammer.tagops.exception.ValidationException;
import com.xammer.tagops.service.RemediationWorkflowService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/tagops/workflows")
public class WorkflowController {

    private final RemediationWorkflowService workflowService;

    public WorkflowController(RemediationWorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    @PostMapping
    public ResponseEntity<Workflow> create(@RequestBody WorkflowRequest request) {
        if (request == null || request.getWorkflowType() == null) {
            throw new ValidationException("workflow_type is required");
        }
        Workflow created = request.getWorkflowType() == WorkflowType.EXEMPTION
                ? workflowService.requestExemption(request.getResourceId(), request.getReason(), request.getCreatedBy())
                : workflowService.propose(request.getResourceId(), request.getIssues(), request.getSuggestedTags(), request.getCreatedBy());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping
    public ResponseEntity<List<Workflow>> list(@RequestParam(required = false) WorkflowStatus status,
                                               @RequestParam(required = false) WorkflowType workflowType,
                                               @RequestParam(required = false) String resourceId,
                                               @RequestParam(defaultValue = "0") int skip,
                                               @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(workflowService.list(new WorkflowFilter(status, workflowType, resourceId, skip, limit)));
    }

    @GetMapping("/stats")
    public ResponseEntity<WorkflowStatsDto> stats() {
        return ResponseEntity.ok(workflowService.stats());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Workflow> get(@PathVariable Long id) {
        return ResponseEntity.ok(workflowService.get(id));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<Workflow> approve(@PathVariable Long id, @RequestBody ApprovalRequest request) {
        return ResponseEntity.ok(workflowService.approve(id, request.getApprovedTags(), request.getApprovedBy()));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<Workflow> reject(@PathVariable Long id, @RequestBody DecisionRequest request) {
        return ResponseEntity.ok(workflowService.reject(id, request.getReason(), request.getDecidedBy()));
    }

    @PostMapping("/{id}/exemption/grant")
    public ResponseEntity<Workflow> grantExemption(@PathVariable Long id, @RequestBody(required = false) DecisionRequest request) {
        return ResponseEntity.ok(workflowService.grantExemption(id, request == null ? null : request.getDecidedBy()));
    }

    @PostMapping("/{id}/exemption/deny")
    public ResponseEntity<Workflow> denyExemption(@PathVariable Long id, @RequestBody DecisionRequest request) {
        return ResponseEntity.ok(workflowService.denyExemption(id, request.getReason(), request.getDecidedBy()));
    }
}
