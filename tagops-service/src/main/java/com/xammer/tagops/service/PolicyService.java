package com.xammer.tagops.service;

import com.xammer.tagops.domain.CloudProvider;
import com.xammer.tagops.domain.Policy;
import com.xammer.tagops.domain.TagRule;
import com.xammer.tagops.dto.PolicyRequest;
import com.xammer.tagops.dto.PolicyUpdateRequest;
import com.xammer.tagops.exception.NotFoundException;
import com.xammer.tagops.exception.StorageException;
import com.xammer.tagops.exception.ValidationException;
import com.xammer.tagops.repository.PolicyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * CRUD over tag policies. Shape is validated before anything is written; {@link TagRule} validates
 * each rule on construction, this service checks the parts around it.
 */
@Service
public class PolicyService {

    private static final Logger logger = LoggerFactory.getLogger(PolicyService.class);

    private final PolicyRepository policyRepository;

    public PolicyService(PolicyRepository policyRepository) {
        this.policyRepository = policyRepository;
    }

    @Transactional
    public Policy create(PolicyRequest request) {
        if (request == null) {
            throw new ValidationException("Policy body is required");
        }
        validateName(request.getName());
        validateRules(request.getRequiredTags());
        validateResourceTypes(request.getResourceTypes());
        validateProviders(request.getCloudProviders());

        Policy policy = new Policy();
        policy.setName(request.getName().trim());
        policy.setDescription(request.getDescription());
        policy.setActive(request.getActive() == null || request.getActive());
        policy.setRequiredTags(new ArrayList<>(request.getRequiredTags()));
        policy.setResourceTypes(copyOrNull(request.getResourceTypes()));
        policy.setCloudProviders(copyOrNull(request.getCloudProviders()));

        Policy saved = save(policy);
        logger.info("Created policy {} '{}' with {} required tag(s)", saved.getId(), saved.getName(), saved.getRequiredTags().size());
        return saved;
    }

    @Transactional
    public Policy update(Long id, PolicyUpdateRequest request) {
        Policy policy = get(id);
        if (request == null) {
            return policy;
        }
        if (request.getName() != null) {
            validateName(request.getName());
            policy.setName(request.getName().trim());
        }
        if (request.getDescription() != null) {
            policy.setDescription(request.getDescription());
        }
        if (request.getActive() != null) {
            policy.setActive(request.getActive());
        }
        if (request.getRequiredTags() != null) {
            validateRules(request.getRequiredTags());
            policy.setRequiredTags(new ArrayList<>(request.getRequiredTags()));
        }
        if (request.getResourceTypes() != null) {
            validateResourceTypes(request.getResourceTypes());
            policy.setResourceTypes(new ArrayList<>(request.getResourceTypes()));
        }
        if (request.getCloudProviders() != null) {
            validateProviders(request.getCloudProviders());
            policy.setCloudProviders(new ArrayList<>(request.getCloudProviders()));
        }
        Policy saved = save(policy);
        logger.info("Updated policy {} '{}'", saved.getId(), saved.getName());
        return saved;
    }

    /**
     * Removes the policy. Workflows proposed under it keep their own copy of the issues and are left as they are.
     */
    @Transactional
    public void delete(Long id) {
        Policy policy = get(id);
        try {
            policyRepository.delete(policy);
            policyRepository.flush();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to delete policy " + id, e);
        }
        logger.info("Deleted policy {} '{}'", id, policy.getName());
    }

    @Transactional(readOnly = true)
    public Policy get(Long id) {
        if (id == null) {
            throw new ValidationException("Policy id is required");
        }
        try {
            return policyRepository.findById(id)
                    .orElseThrow(() -> new NotFoundException("Policy not found: " + id));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load policy " + id, e);
        }
    }

    @Transactional(readOnly = true)
    public List<Policy> list(boolean activeOnly) {
        try {
            return activeOnly
                    ? policyRepository.findAllByActiveTrueOrderByIdAsc()
                    : policyRepository.findAllByOrderByIdAsc();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to list policies", e);
        }
    }

    @Transactional(readOnly = true)
    public List<Policy> list(boolean activeOnly, int skip, int limit) {
        if (skip < 0 || limit < 1) {
            throw new ValidationException("skip must be >= 0 and limit >= 1");
        }
        return list(activeOnly).stream()
                .skip(skip)
                .limit(limit)
                .collect(Collectors.toList());
    }

    /**
     * Active policies as of now, in id order. Evaluation passes read this once and reuse it for the whole batch.
     */
    @Transactional(readOnly = true)
    public List<Policy> activeSnapshot() {
        return List.copyOf(list(true));
    }

    // --- VALIDATION ---

    private void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Policy name must not be empty");
        }
    }

    private void validateRules(List<TagRule> rules) {
        if (rules == null) {
            throw new ValidationException("required_tags must be a list of tag rules");
        }
        if (rules.stream().anyMatch(Objects::isNull)) {
            throw new ValidationException("required_tags must not contain null entries");
        }
    }

    private void validateResourceTypes(List<String> resourceTypes) {
        if (resourceTypes != null && resourceTypes.stream().anyMatch(t -> t == null || t.isBlank())) {
            throw new ValidationException("resource_types must not contain empty entries");
        }
    }

    private void validateProviders(List<CloudProvider> providers) {
        if (providers != null && providers.stream().anyMatch(Objects::isNull)) {
            throw new ValidationException("cloud_providers must not contain null entries");
        }
    }

    private static <T> List<T> copyOrNull(List<T> values) {
        return values == null ? null : new ArrayList<>(values);
    }

    private Policy save(Policy policy) {
        try {
            return policyRepository.saveAndFlush(policy);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to save policy '" + policy.getName() + "'", e);
        }
    }
}
