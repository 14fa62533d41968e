package com.xammer.tagops.repository;

import com.xammer.tagops.domain.CloudResource;
import com.xammer.tagops.domain.Workflow;
import com.xammer.tagops.dto.ResourceFilter;
import com.xammer.tagops.dto.WorkflowFilter;
import org.springframework.data.jpa.domain.Specification;

import javax.persistence.criteria.Predicate;
import java.util.ArrayList;
import java.util.List;

/**
 * Criteria built from the optional list filters. Tag presence is not expressible against the JSON
 * column and is applied by the caller.
 */
public final class FilterSpecifications {

    private FilterSpecifications() {
    }

    public static Specification<CloudResource> matching(ResourceFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter.getProvider() != null) {
                predicates.add(cb.equal(root.get("cloudProvider"), filter.getProvider()));
            }
            if (filter.getResourceType() != null) {
                predicates.add(cb.equal(root.get("resourceType"), filter.getResourceType()));
            }
            if (filter.getComplianceStatus() != null) {
                predicates.add(cb.equal(root.get("complianceStatus"), filter.getComplianceStatus()));
            }
            if (filter.getRegion() != null) {
                predicates.add(cb.equal(root.get("region"), filter.getRegion()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    public static Specification<Workflow> matching(WorkflowFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter.getStatus() != null) {
                predicates.add(cb.equal(root.get("status"), filter.getStatus()));
            }
            if (filter.getWorkflowType() != null) {
                predicates.add(cb.equal(root.get("workflowType"), filter.getWorkflowType()));
            }
            if (filter.getResourceId() != null) {
                predicates.add(cb.equal(root.get("resourceId"), filter.getResourceId()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
