package com.xammer.tagops.service;

import com.xammer.tagops.domain.CloudResource;
import com.xammer.tagops.domain.ComplianceIssues;
import com.xammer.tagops.domain.ComplianceStatus;
import com.xammer.tagops.domain.Policy;
import com.xammer.tagops.domain.Workflow;
import com.xammer.tagops.domain.WorkflowStatus;
import com.xammer.tagops.dto.ComplianceSummaryDto;
import com.xammer.tagops.dto.EvaluationResult;
import com.xammer.tagops.dto.EvaluationSummary;
import com.xammer.tagops.dto.WorkflowFilter;
import com.xammer.tagops.exception.InvalidStateException;
import com.xammer.tagops.exception.NotFoundException;
import com.xammer.tagops.exception.StorageException;
import com.xammer.tagops.repository.CloudResourceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Batch and single-resource evaluation with write-back, plus reconciliation of the remediation workflows
 * that follow from the verdicts.
 */
@Service
public class ComplianceService {

    private static final Logger logger = LoggerFactory.getLogger(ComplianceService.class);

    static final String SUPERSEDED_REASON = "Superseded by a newer evaluation with different issues";
    static final String RESOLVED_REASON = "Resource became compliant";

    private final ResourceCatalogService catalog;
    private final PolicyService policyService;
    private final ComplianceEvaluator evaluator;
    private final RemediationWorkflowService workflowService;
    private final CloudResourceRepository resourceRepository;
    private final TransactionTemplate transactionTemplate;
    private final String systemUser;

    public ComplianceService(ResourceCatalogService catalog,
                             PolicyService policyService,
                             ComplianceEvaluator evaluator,
                             RemediationWorkflowService workflowService,
                             CloudResourceRepository resourceRepository,
                             PlatformTransactionManager transactionManager,
                             @Value("${tagops.evaluation.system-user:system}") String systemUser) {
        this.catalog = catalog;
        this.policyService = policyService;
        this.evaluator = evaluator;
        this.workflowService = workflowService;
        this.resourceRepository = resourceRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.systemUser = systemUser;
    }

    /**
     * Evaluates every catalogued resource against one snapshot of the active policies. Each resource is written
     * in its own transaction, so an interrupted pass keeps what it already wrote. Re-running with unchanged
     * inputs proposes nothing new.
     */
    public EvaluationSummary evaluateAll() {
        long startTime = System.currentTimeMillis();
        List<Policy> policies = policyService.activeSnapshot();
        List<CloudResource> resources = catalog.all();
        logger.info("Evaluating {} resource(s) against {} active policy(ies)", resources.size(), policies.size());

        EvaluationSummary summary = new EvaluationSummary();
        summary.setTotal(resources.size());

        for (CloudResource resource : resources) {
            if (resource.getComplianceStatus() == ComplianceStatus.EXEMPT) {
                summary.setExempt(summary.getExempt() + 1);
                continue;
            }
            Outcome outcome;
            try {
                outcome = evaluateAndReconcile(resource, policies);
            } catch (InvalidStateException | NotFoundException e) {
                // raced with a workflow decision or a removal; the next pass picks it up
                logger.warn("Skipping resource {} in this pass: {}", resource.getResourceId(), e.getMessage());
                continue;
            }
            if (outcome.result.isCompliant()) {
                summary.setCompliant(summary.getCompliant() + 1);
            } else {
                summary.setNonCompliant(summary.getNonCompliant() + 1);
            }
            summary.setWorkflowsProposed(summary.getWorkflowsProposed() + outcome.proposed);
            summary.setWorkflowsCancelled(summary.getWorkflowsCancelled() + outcome.cancelled);
        }
        summary.setComplianceRate(rate(summary.getCompliant(), summary.getCompliant() + summary.getNonCompliant()));

        logger.info("Evaluation complete in {}ms - {} compliant, {} non-compliant, {} exempt; {} workflow(s) proposed, {} cancelled",
                System.currentTimeMillis() - startTime, summary.getCompliant(), summary.getNonCompliant(),
                summary.getExempt(), summary.getWorkflowsProposed(), summary.getWorkflowsCancelled());
        return summary;
    }

    /**
     * Re-checks one resource against the current active policies and writes the verdict back.
     * Exempt resources are returned unchanged.
     */
    public CloudResource evaluateResource(String resourceId) {
        CloudResource resource = catalog.require(resourceId);
        if (resource.getComplianceStatus() == ComplianceStatus.EXEMPT) {
            logger.debug("Resource {} is EXEMPT; skipping evaluation", resourceId);
            return resource;
        }
        evaluateAndReconcile(resource, policyService.activeSnapshot());
        return catalog.require(resourceId);
    }

    public ComplianceSummaryDto summary() {
        try {
            long compliant = resourceRepository.countByComplianceStatus(ComplianceStatus.COMPLIANT);
            long nonCompliant = resourceRepository.countByComplianceStatus(ComplianceStatus.NON_COMPLIANT);
            long unknown = resourceRepository.countByComplianceStatus(ComplianceStatus.UNKNOWN);
            long exempt = resourceRepository.countByComplianceStatus(ComplianceStatus.EXEMPT);
            long total = compliant + nonCompliant + unknown + exempt;
            return new ComplianceSummaryDto(total, compliant, nonCompliant, unknown, exempt,
                    rate(compliant, compliant + nonCompliant));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to compute compliance summary", e);
        }
    }

    // --- RECONCILIATION ---

    /**
     * Records the verdict in its own transaction under the resource lock, then reconciles workflows once that
     * transaction has committed. Workflow decisions take the workflow lock first, so it is never awaited while
     * this pass holds the resource row.
     */
    private Outcome evaluateAndReconcile(CloudResource resource, List<Policy> policies) {
        String resourceId = resource.getResourceId();
        Verdict verdict = catalog.withResourceLock(resourceId, () -> recordVerdict(resourceId, policies));
        return reconcile(resourceId, verdict, policies);
    }

    private Verdict recordVerdict(String resourceId, List<Policy> policies) {
        try {
            return transactionTemplate.execute(status -> {
                // re-read so tags written by a scan since the batch started are judged
                EvaluationResult result = evaluator.evaluate(catalog.require(resourceId), policies);
                CloudResource recorded = catalog.recordEvaluation(resourceId, result);
                return new Verdict(result, recorded.getVersion());
            });
        } catch (DataAccessException e) {
            throw new StorageException("Storage failure while evaluating " + resourceId, e);
        }
    }

    private Outcome reconcile(String resourceId, Verdict verdict, List<Policy> policies) {
        EvaluationResult result = verdict.result;
        if (!Objects.equals(catalog.require(resourceId).getVersion(), verdict.version)) {
            // written again since the verdict; the next pass judges the newer state
            logger.debug("Resource {} changed after evaluation; leaving its workflows to the next pass", resourceId);
            return new Outcome(result, 0, 0);
        }
        Optional<Workflow> pending = workflowService.pendingRemediation(resourceId);

        if (result.isCompliant()) {
            int cancelled = pending.isPresent() && workflowService.cancel(pending.get().getId(), RESOLVED_REASON) ? 1 : 0;
            return new Outcome(result, 0, cancelled);
        }
        if (pending.isPresent()) {
            ComplianceIssues previous = pending.get().getDetails().getIssues();
            if (result.getIssues().sameIssuesAs(previous)) {
                logger.debug("Resource {} already has workflow {} for the same issues", resourceId, pending.get().getId());
                return new Outcome(result, 0, 0);
            }
            if (!workflowService.cancel(pending.get().getId(), SUPERSEDED_REASON)) {
                return new Outcome(result, 0, 0);
            }
            propose(resourceId, result, policies);
            return new Outcome(result, 1, 1);
        }
        if (hasOtherPendingWorkflow(resourceId)) {
            // an exemption request is open; leave the decision to it
            return new Outcome(result, 0, 0);
        }
        propose(resourceId, result, policies);
        return new Outcome(result, 1, 0);
    }

    private void propose(String resourceId, EvaluationResult result, List<Policy> policies) {
        Map<String, String> suggested = evaluator.suggestTags(result.getIssues(), policies);
        workflowService.propose(resourceId, result.getIssues(), suggested, systemUser);
    }

    private boolean hasOtherPendingWorkflow(String resourceId) {
        return !workflowService.list(pendingFilter(resourceId)).isEmpty();
    }

    private static WorkflowFilter pendingFilter(String resourceId) {
        WorkflowFilter filter = new WorkflowFilter();
        filter.setResourceId(resourceId);
        filter.setStatus(WorkflowStatus.PENDING);
        filter.setLimit(1);
        return filter;
    }

    private static double rate(long compliant, long evaluated) {
        if (evaluated == 0) {
            return 0.0;
        }
        return Math.round(compliant * 10000.0 / evaluated) / 100.0;
    }

    private static final class Verdict {
        private final EvaluationResult result;
        private final Long version;

        private Verdict(EvaluationResult result, Long version) {
            this.result = result;
            this.version = version;
        }
    }

    private static final class Outcome {
        private final EvaluationResult result;
        private final int proposed;
        private final int cancelled;

        private Outcome(EvaluationResult result, int proposed, int cancelled) {
            this.result = result;
            this.proposed = proposed;
            this.cancelled = cancelled;
        }
    }
}
