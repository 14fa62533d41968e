package com.xammer.tagops.service;

import com.xammer.tagops.domain.CloudProvider;
import com.xammer.tagops.domain.CloudResource;
import com.xammer.tagops.domain.ComplianceIssues;
import com.xammer.tagops.domain.Workflow;
import com.xammer.tagops.domain.WorkflowDetails;
import com.xammer.tagops.domain.WorkflowStatus;
import com.xammer.tagops.domain.WorkflowType;
import com.xammer.tagops.dto.EvaluationResult;
import com.xammer.tagops.dto.WorkflowFilter;
import com.xammer.tagops.dto.WorkflowStatsDto;
import com.xammer.tagops.exception.ConnectorException;
import com.xammer.tagops.exception.InvalidStateException;
import com.xammer.tagops.exception.NotFoundException;
import com.xammer.tagops.exception.StorageException;
import com.xammer.tagops.exception.TagOpsException;
import com.xammer.tagops.exception.ValidationException;
import com.xammer.tagops.repository.FilterSpecifications;
import com.xammer.tagops.repository.WorkflowRepository;
import com.xammer.tagops.util.KeyedLocks;
import com.xammer.tagops.util.TagMaps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Lifecycle of remediation and exemption workflows.
 * <p>
 * A workflow starts PENDING and ends COMPLETED, REJECTED or CANCELLED. Decisions on one workflow are
 * serialized by an in-process lock, and every transition is a compare-and-set on the status column so that
 * two processes deciding the same workflow cannot both succeed. A resource has at most one PENDING workflow.
 * <p>
 * Lock order is workflow lock, then resource lock, then database rows. No method here is called from inside a
 * caller's transaction.
 */
@Service
public class RemediationWorkflowService {

    private static final Logger logger = LoggerFactory.getLogger(RemediationWorkflowService.class);

    private final WorkflowRepository workflowRepository;
    private final ResourceCatalogService catalog;
    private final PolicyService policyService;
    private final ComplianceEvaluator evaluator;
    private final Map<CloudProvider, CloudConnector> connectors;
    private final TransactionTemplate transactionTemplate;
    private final KeyedLocks<Long> workflowLocks = new KeyedLocks<>();
    private final KeyedLocks<String> proposalLocks = new KeyedLocks<>();

    public RemediationWorkflowService(WorkflowRepository workflowRepository,
                                      ResourceCatalogService catalog,
                                      PolicyService policyService,
                                      ComplianceEvaluator evaluator,
                                      Map<CloudProvider, CloudConnector> cloudConnectors,
                                      PlatformTransactionManager transactionManager) {
        this.workflowRepository = workflowRepository;
        this.catalog = catalog;
        this.policyService = policyService;
        this.evaluator = evaluator;
        this.connectors = cloudConnectors;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    // --- CREATION ---

    public Workflow propose(String resourceId, ComplianceIssues issues, Map<String, String> suggestedTags, String createdBy) {
        WorkflowDetails details = WorkflowDetails.builder()
                .issues(issues == null ? ComplianceIssues.none() : issues.canonical())
                .suggestedTags(TagMaps.copyOf(suggestedTags))
                .build();
        Workflow workflow = open(resourceId, WorkflowType.REMEDIATION, details, createdBy);
        logger.info("Proposed remediation workflow {} for resource {} ({} issue(s), created by {})",
                workflow.getId(), resourceId, workflow.getDetails().getIssues().getIssueCount(), createdBy);
        return workflow;
    }

    public Workflow requestExemption(String resourceId, String reason, String createdBy) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("An exemption request needs a reason");
        }
        WorkflowDetails details = WorkflowDetails.builder()
                .exemptionReason(reason)
                .build();
        Workflow workflow = open(resourceId, WorkflowType.EXEMPTION, details, createdBy);
        logger.info("Exemption requested for resource {} as workflow {} by {}", resourceId, workflow.getId(), createdBy);
        return workflow;
    }

    private Workflow open(String resourceId, WorkflowType type, WorkflowDetails details, String createdBy) {
        if (resourceId == null || resourceId.isBlank()) {
            throw new ValidationException("resource_id is required");
        }
        return proposalLocks.withLock(resourceId, () -> inTransaction("open workflow for " + resourceId, () -> {
            catalog.require(resourceId);
            if (workflowRepository.existsByResourceIdAndStatus(resourceId, WorkflowStatus.PENDING)) {
                throw new InvalidStateException("Resource " + resourceId + " already has a PENDING workflow");
            }
            return workflowRepository.saveAndFlush(new Workflow(resourceId, type, details, createdBy));
        }));
    }

    // --- REMEDIATION DECISIONS ---

    /**
     * Applies {@code approvedTags} through the resource's connector, then completes the workflow and re-evaluates
     * the resource. A connector failure leaves the workflow PENDING so the approval can be retried.
     */
    public Workflow approve(Long workflowId, Map<String, String> approvedTags, String approvedBy) {
        return workflowLocks.withLock(workflowId, () -> {
            Workflow workflow = get(workflowId);
            requireDecidable(workflow, WorkflowType.REMEDIATION, "approved");
            if (approvedTags == null || approvedTags.isEmpty()) {
                throw new ValidationException("approved_tags must not be empty");
            }
            String resourceId = workflow.getResourceId();
            CloudResource resource = catalog.require(resourceId);
            Map<String, String> tags = TagMaps.copyOf(approvedTags);

            applyTags(resource, tags);

            Workflow completed = catalog.withResourceLock(resourceId, () -> inTransaction("complete workflow " + workflowId, () -> {
                catalog.mergeTags(resourceId, tags);
                transition(workflowId, WorkflowStatus.COMPLETED);
                Workflow reloaded = get(workflowId);
                reloaded.setDetails(reloaded.getDetails().toBuilder().appliedTags(tags).build());
                reloaded.setApprovedBy(approvedBy);
                reloaded.setCompletedAt(LocalDateTime.now());
                Workflow saved = workflowRepository.saveAndFlush(reloaded);

                CloudResource refreshed = catalog.require(resourceId);
                EvaluationResult result = evaluator.evaluate(refreshed, policyService.activeSnapshot());
                catalog.recordEvaluation(resourceId, result);
                logger.info("Re-evaluated resource {} after remediation: {}", resourceId, result.toStatus());
                return saved;
            }));
            logger.info("Workflow {} approved by {} and COMPLETED; applied {} tag(s) to {}",
                    workflowId, approvedBy, tags.size(), resourceId);
            return completed;
        });
    }

    public Workflow reject(Long workflowId, String reason, String rejectedBy) {
        return decide(workflowId, WorkflowType.REMEDIATION, WorkflowStatus.REJECTED, reason, rejectedBy);
    }

    // --- EXEMPTION DECISIONS ---

    public Workflow grantExemption(Long workflowId, String approvedBy) {
        return workflowLocks.withLock(workflowId, () -> {
            Workflow workflow = get(workflowId);
            requireDecidable(workflow, WorkflowType.EXEMPTION, "granted");
            String resourceId = workflow.getResourceId();
            catalog.require(resourceId);

            Workflow granted = catalog.withResourceLock(resourceId, () -> inTransaction("grant exemption " + workflowId, () -> {
                transition(workflowId, WorkflowStatus.COMPLETED);
                Workflow reloaded = get(workflowId);
                reloaded.setApprovedBy(approvedBy);
                reloaded.setCompletedAt(LocalDateTime.now());
                Workflow saved = workflowRepository.saveAndFlush(reloaded);
                catalog.markExempt(resourceId);
                return saved;
            }));
            logger.info("Exemption workflow {} granted by {}; resource {} is EXEMPT", workflowId, approvedBy, resourceId);
            return granted;
        });
    }

    public Workflow denyExemption(Long workflowId, String reason, String deniedBy) {
        return decide(workflowId, WorkflowType.EXEMPTION, WorkflowStatus.REJECTED, reason, deniedBy);
    }

    private Workflow decide(Long workflowId, WorkflowType type, WorkflowStatus outcome, String reason, String decidedBy) {
        return workflowLocks.withLock(workflowId, () -> {
            Workflow workflow = get(workflowId);
            requireDecidable(workflow, type, "rejected");
            if (reason == null || reason.isBlank()) {
                throw new ValidationException("A rejection reason is required");
            }
            catalog.require(workflow.getResourceId());

            Workflow decided = inTransaction("reject workflow " + workflowId, () -> {
                transition(workflowId, outcome);
                Workflow reloaded = get(workflowId);
                reloaded.setDetails(reloaded.getDetails().toBuilder().rejectionReason(reason).build());
                reloaded.setApprovedBy(decidedBy);
                reloaded.setCompletedAt(LocalDateTime.now());
                return workflowRepository.saveAndFlush(reloaded);
            });
            logger.info("{} workflow {} {} by {}: {}", type, workflowId, outcome, decidedBy, reason);
            return decided;
        });
    }

    /**
     * Cancels a PENDING workflow whose fix is no longer wanted. Returns false if it was decided meanwhile.
     */
    public boolean cancel(Long workflowId, String reason) {
        return workflowLocks.withLock(workflowId, () -> inTransaction("cancel workflow " + workflowId, () -> {
            int updated = workflowRepository.transitionStatus(workflowId, WorkflowStatus.PENDING,
                    WorkflowStatus.CANCELLED, LocalDateTime.now());
            if (updated == 0) {
                logger.debug("Workflow {} was no longer PENDING; not cancelled", workflowId);
                return false;
            }
            Workflow reloaded = get(workflowId);
            reloaded.setDetails(reloaded.getDetails().toBuilder().cancellationReason(reason).build());
            reloaded.setCompletedAt(LocalDateTime.now());
            workflowRepository.saveAndFlush(reloaded);
            logger.info("Cancelled workflow {} for resource {}: {}", workflowId, reloaded.getResourceId(), reason);
            return true;
        }));
    }

    // --- QUERIES ---

    public Workflow get(Long workflowId) {
        if (workflowId == null) {
            throw new ValidationException("Workflow id is required");
        }
        try {
            return workflowRepository.findById(workflowId)
                    .orElseThrow(() -> new NotFoundException("Workflow not found: " + workflowId));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load workflow " + workflowId, e);
        }
    }

    public List<Workflow> list(WorkflowFilter filter) {
        WorkflowFilter f = filter == null ? new WorkflowFilter() : filter;
        if (f.getSkip() < 0 || f.getLimit() < 1) {
            throw new ValidationException("skip must be >= 0 and limit >= 1");
        }
        try {
            return workflowRepository.findAll(FilterSpecifications.matching(f), Sort.by("id")).stream()
                    .skip(f.getSkip())
                    .limit(f.getLimit())
                    .collect(Collectors.toList());
        } catch (DataAccessException e) {
            throw new StorageException("Failed to list workflows", e);
        }
    }

    public Optional<Workflow> pendingRemediation(String resourceId) {
        try {
            return workflowRepository.findByResourceIdAndStatusAndWorkflowTypeOrderByIdAsc(
                    resourceId, WorkflowStatus.PENDING, WorkflowType.REMEDIATION).stream().findFirst();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load pending workflows for " + resourceId, e);
        }
    }

    public WorkflowStatsDto stats() {
        try {
            Map<String, Long> byStatus = toCountMap(workflowRepository.countGroupedByStatus());
            Map<String, Long> byType = toCountMap(workflowRepository.countGroupedByType());
            long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
            return new WorkflowStatsDto(total, byStatus, byType, workflowRepository.findTop5ByOrderByCreatedAtDescIdDesc());
        } catch (DataAccessException e) {
            throw new StorageException("Failed to compute workflow stats", e);
        }
    }

    // --- HELPERS ---

    private void applyTags(CloudResource resource, Map<String, String> tags) {
        CloudConnector connector = connectors.get(resource.getCloudProvider());
        if (connector == null) {
            throw new ConnectorException("No connector configured for provider " + resource.getCloudProvider().getValue());
        }
        boolean applied;
        try {
            applied = connector.updateResourceTags(resource, tags);
        } catch (TagOpsException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Tag update on {} failed", resource.getResourceId(), e);
            throw new ConnectorException("Failed to apply tags to " + resource.getResourceId() + ": " + e.getMessage(), e);
        }
        if (!applied) {
            throw new ConnectorException(resource.getCloudProvider().getValue() + " connector did not apply tags to "
                    + resource.getResourceId());
        }
    }

    private void transition(Long workflowId, WorkflowStatus next) {
        int updated = workflowRepository.transitionStatus(workflowId, WorkflowStatus.PENDING, next, LocalDateTime.now());
        if (updated == 0) {
            logger.warn("Workflow {} left PENDING concurrently; {} transition lost", workflowId, next);
            throw new InvalidStateException("Workflow " + workflowId + " is no longer PENDING");
        }
    }

    private void requireDecidable(Workflow workflow, WorkflowType expectedType, String action) {
        if (workflow.getStatus() != WorkflowStatus.PENDING) {
            throw new InvalidStateException("Workflow " + workflow.getId() + " is " + workflow.getStatus()
                    + "; only PENDING workflows can be " + action);
        }
        if (workflow.getWorkflowType() != expectedType) {
            throw new InvalidStateException("Workflow " + workflow.getId() + " is a " + workflow.getWorkflowType()
                    + " workflow and cannot be " + action + " here");
        }
    }

    private static Map<String, Long> toCountMap(List<Object[]> rows) {
        Map<String, Long> counts = new TreeMap<>();
        for (Object[] row : rows) {
            counts.put(String.valueOf(row[0]), ((Number) row[1]).longValue());
        }
        return counts;
    }

    private <T> T inTransaction(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataAccessException e) {
            throw new StorageException("Storage failure during " + operation, e);
        }
    }
}
