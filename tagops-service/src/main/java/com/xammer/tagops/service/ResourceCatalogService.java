package com.xammer.tagops.service;

import com.xammer.tagops.domain.CloudProvider;
import com.xammer.tagops.domain.CloudResource;
import com.xammer.tagops.domain.ComplianceIssues;
import com.xammer.tagops.domain.ComplianceStatus;
import com.xammer.tagops.domain.MissingTagIssue;
import com.xammer.tagops.dto.DiscoveredResource;
import com.xammer.tagops.dto.EvaluationResult;
import com.xammer.tagops.dto.ResourceFilter;
import com.xammer.tagops.dto.ResourceStatsDto;
import com.xammer.tagops.exception.NotFoundException;
import com.xammer.tagops.exception.StorageException;
import com.xammer.tagops.exception.ValidationException;
import com.xammer.tagops.repository.CloudResourceRepository;
import com.xammer.tagops.repository.FilterSpecifications;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Catalog of observed resources keyed by their global resource id. Writes to one id are serialized by an
 * in-process lock around a transaction; the entity version column catches writers in other processes.
 * <p>
 * The resource lock is always taken before a transaction touching the resource row, never inside one.
 * Callers that write a resource as part of a wider transaction wrap that transaction in
 * {@link #withResourceLock}; the catalog's own writes then re-enter the lock they already hold.
 */
@Service
public class ResourceCatalogService {

    private static final Logger logger = LoggerFactory.getLogger(ResourceCatalogService.class);
    private static final int COMMON_MISSING_TAGS_LIMIT = 10;

    private final CloudResourceRepository resourceRepository;
    private final TransactionTemplate transactionTemplate;
    private final KeyedLocks<String> resourceLocks = new KeyedLocks<>();

    public ResourceCatalogService(CloudResourceRepository resourceRepository, PlatformTransactionManager transactionManager) {
        this.resourceRepository = resourceRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    // --- WRITES ---

    /**
     * Runs {@code work} holding the in-process lock for {@code resourceId}. Must not be called from inside a
     * transaction that may already hold row locks.
     */
    public <T> T withResourceLock(String resourceId, Supplier<T> work) {
        return resourceLocks.withLock(resourceId, work);
    }

    /**
     * Merges an observation by resource id. Name, region, tags and lastChecked are overwritten; compliance
     * status and details are left for the next evaluation pass.
     */
    public CloudResource upsert(DiscoveredResource observed) {
        validateObservation(observed);
        String resourceId = observed.getResourceId();
        return resourceLocks.withLock(resourceId, () -> inTransaction("upsert " + resourceId, () -> {
            LocalDateTime now = LocalDateTime.now();
            Optional<CloudResource> existing = resourceRepository.findByResourceId(resourceId);
            CloudResource resource;
            if (existing.isPresent()) {
                resource = existing.get();
                if (resource.getCloudProvider() != observed.getCloudProvider()) {
                    throw new ValidationException("Resource " + resourceId + " is registered under "
                            + resource.getCloudProvider().getValue() + ", not " + observed.getCloudProvider().getValue());
                }
                logger.debug("Refreshing resource {}", resourceId);
            } else {
                resource = new CloudResource(resourceId, observed.getName(), observed.getResourceType(),
                        observed.getCloudProvider(), observed.getRegion());
                resource.setComplianceStatus(ComplianceStatus.UNKNOWN);
                logger.debug("Registering new resource {} ({} {})", resourceId,
                        observed.getCloudProvider().getValue(), observed.getResourceType());
            }
            resource.setName(observed.getName());
            resource.setRegion(observed.getRegion());
            resource.setTags(TagMaps.copyOf(observed.getTags()));
            resource.setLastChecked(now);
            return resourceRepository.saveAndFlush(resource);
        }));
    }

    /**
     * Overlays {@code newTags} on the stored tag map, incoming values winning. The stored map is replaced,
     * never mutated in place.
     */
    public CloudResource mergeTags(String resourceId, Map<String, String> newTags) {
        return resourceLocks.withLock(resourceId, () -> inTransaction("merge tags into " + resourceId, () -> {
            CloudResource resource = findOrThrow(resourceId);
            resource.setTags(TagMaps.merge(resource.getTags(), newTags));
            CloudResource saved = resourceRepository.saveAndFlush(resource);
            logger.info("Merged {} tag(s) into resource {}", newTags == null ? 0 : newTags.size(), resourceId);
            return saved;
        }));
    }

    public CloudResource recordEvaluation(String resourceId, EvaluationResult result) {
        return resourceLocks.withLock(resourceId, () -> inTransaction("record evaluation of " + resourceId, () -> {
            CloudResource resource = findOrThrow(resourceId);
            resource.setComplianceStatus(result.toStatus());
            resource.setComplianceDetails(result.getIssues().canonical());
            resource.setLastChecked(LocalDateTime.now());
            return resourceRepository.saveAndFlush(resource);
        }));
    }

    public CloudResource markExempt(String resourceId) {
        return resourceLocks.withLock(resourceId, () -> inTransaction("exempt " + resourceId, () -> {
            CloudResource resource = findOrThrow(resourceId);
            resource.setComplianceStatus(ComplianceStatus.EXEMPT);
            logger.info("Resource {} marked EXEMPT", resourceId);
            return resourceRepository.saveAndFlush(resource);
        }));
    }

    // --- READS ---

    public List<CloudResource> all() {
        return read("list resources", resourceRepository::findAllByOrderByIdAsc);
    }

    public Optional<CloudResource> get(String resourceId) {
        return read("load resource " + resourceId, () -> resourceRepository.findByResourceId(resourceId));
    }

    public CloudResource require(String resourceId) {
        return get(resourceId).orElseThrow(() -> new NotFoundException("Resource not found: " + resourceId));
    }

    public List<CloudResource> search(ResourceFilter filter) {
        ResourceFilter f = filter == null ? new ResourceFilter() : filter;
        if (f.getSkip() < 0 || f.getLimit() < 1) {
            throw new ValidationException("skip must be >= 0 and limit >= 1");
        }
        List<CloudResource> matches = read("search resources",
                () -> resourceRepository.findAll(FilterSpecifications.matching(f), Sort.by("id")));
        return matches.stream()
                .filter(r -> f.getHasTag() == null || r.getTags().containsKey(f.getHasTag()))
                .skip(f.getSkip())
                .limit(f.getLimit())
                .collect(Collectors.toList());
    }

    public ResourceStatsDto stats() {
        return read("compute resource stats", () -> {
            Map<String, Long> byProvider = toCountMap(resourceRepository.countGroupedByProvider());
            Map<String, Long> byType = toCountMap(resourceRepository.countGroupedByResourceType());
            Map<String, Long> byStatus = toCountMap(resourceRepository.countGroupedByComplianceStatus());
            long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
            return new ResourceStatsDto(total, byProvider, byType, byStatus, commonMissingTags());
        });
    }

    public List<String> resourceTypes() {
        return read("list resource types", resourceRepository::findDistinctResourceTypes);
    }

    public List<String> regions(CloudProvider provider) {
        return read("list regions", () -> provider == null
                ? resourceRepository.findDistinctRegions()
                : resourceRepository.findDistinctRegionsByProvider(provider));
    }

    // --- HELPERS ---

    private Map<String, Long> commonMissingTags() {
        Map<String, Long> counts = new TreeMap<>();
        for (CloudResource resource : resourceRepository.findAllByComplianceStatus(ComplianceStatus.NON_COMPLIANT)) {
            ComplianceIssues issues = resource.getComplianceDetails();
            if (issues == null || issues.getMissingTags() == null) {
                continue;
            }
            // a tag missing under several policies counts once per resource
            issues.getMissingTags().stream()
                    .map(MissingTagIssue::getTagName)
                    .distinct()
                    .forEach(tag -> counts.merge(tag, 1L, Long::sum));
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .limit(COMMON_MISSING_TAGS_LIMIT)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
    }

    private static Map<String, Long> toCountMap(List<Object[]> rows) {
        Map<String, Long> counts = new TreeMap<>();
        for (Object[] row : rows) {
            Object key = row[0];
            String name = key instanceof CloudProvider ? ((CloudProvider) key).getValue() : String.valueOf(key);
            counts.put(name, ((Number) row[1]).longValue());
        }
        return counts;
    }

    private CloudResource findOrThrow(String resourceId) {
        return resourceRepository.findByResourceId(resourceId)
                .orElseThrow(() -> new NotFoundException("Resource not found: " + resourceId));
    }

    private void validateObservation(DiscoveredResource observed) {
        if (observed == null) {
            throw new ValidationException("Resource observation is required");
        }
        if (observed.getResourceId() == null || observed.getResourceId().isBlank()) {
            throw new ValidationException("Resource observation has no resource id");
        }
        if (observed.getCloudProvider() == null) {
            throw new ValidationException("Resource " + observed.getResourceId() + " has no cloud provider");
        }
        if (observed.getResourceType() == null || observed.getResourceType().isBlank()) {
            throw new ValidationException("Resource " + observed.getResourceId() + " has no resource type");
        }
    }

    private <T> T inTransaction(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataAccessException e) {
            throw new StorageException("Storage failure during " + operation, e);
        }
    }

    private <T> T read(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException e) {
            throw new StorageException("Storage failure during " + operation, e);
        }
    }
}
