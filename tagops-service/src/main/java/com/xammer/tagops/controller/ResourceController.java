package com.xammer.tagops.controller;

import com.xammer.tagops.domain.CloudProvider;
import com.xammer.tagops.domain.CloudResource;
import com.xammer.tagops.domain.ComplianceStatus;
import com.xammer.tagops.dto.ResourceFilter;
import com.xammer.tagops.dto.ResourceStatsDto;
import com.xammer.tagops.service.ResourceCatalogService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/tagops/resources")
public class ResourceController {

    private final ResourceCatalogService catalog;

    public ResourceController(ResourceCatalogService catalog) {
        this.catalog = catalog;
    }

    @GetMapping
    public ResponseEntity<List<CloudResource>> list(@RequestParam(required = false) String provider,
                                                    @RequestParam(required = false) String resourceType,
                                                    @RequestParam(required = false) ComplianceStatus complianceStatus,
                                                    @RequestParam(required = false) String region,
                                                    @RequestParam(required = false) String hasTag,
                                                    @RequestParam(defaultValue = "0") int skip,
                                                    @RequestParam(defaultValue = "100") int limit) {
        ResourceFilter filter = new ResourceFilter(provider == null ? null : CloudProvider.fromValue(provider),
                resourceType, complianceStatus, region, hasTag, skip, limit);
        return ResponseEntity.ok(catalog.search(filter));
    }

    // ARNs and ARM ids contain slashes, so the id travels as a query parameter
    @GetMapping("/by-id")
    public ResponseEntity<CloudResource> get(@RequestParam String resourceId) {
        return ResponseEntity.ok(catalog.require(resourceId));
    }

    @GetMapping("/stats")
    public ResponseEntity<ResourceStatsDto> stats() {
        return ResponseEntity.ok(catalog.stats());
    }

    @GetMapping("/types")
    public ResponseEntity<List<String>> types() {
        return ResponseEntity.ok(catalog.resourceTypes());
    }

    @GetMapping("/regions")
    public ResponseEntity<List<String>> regions(@RequestParam(required = false) String provider) {
        return ResponseEntity.ok(catalog.regions(provider == null ? null : CloudProvider.fromValue(provider)));
    }
}
