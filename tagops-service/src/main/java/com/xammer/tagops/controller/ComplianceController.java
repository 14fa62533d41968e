package com.xammer.tagops.controller;

import com.xammer.tagops.domain.CloudProvider;
import com.xammer.tagops.domain.CloudResource;
import com.xammer.tagops.dto.ComplianceSummaryDto;
import com.xammer.tagops.dto.EvaluationSummary;
import com.xammer.tagops.dto.ScanResultDto;
import com.xammer.tagops.service.ComplianceService;
import com.xammer.tagops.service.ScanOrchestrator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api/tagops/compliance")
public class ComplianceController {

    private final ScanOrchestrator scanOrchestrator;
    private final ComplianceService complianceService;

    public ComplianceController(ScanOrchestrator scanOrchestrator, ComplianceService complianceService) {
        this.scanOrchestrator = scanOrchestrator;
        this.complianceService = complianceService;
    }

    @PostMapping("/scan")
    public ResponseEntity<ScanResultDto> scan(@RequestParam(required = false) String provider) {
        Optional<CloudProvider> target = Optional.ofNullable(provider).map(CloudProvider::fromValue);
        List<CloudResource> resources = scanOrchestrator.scan(target);
        return ResponseEntity.ok(new ScanResultDto(target.map(CloudProvider::getValue).orElse("all"), resources.size(), resources));
    }

    @PostMapping("/evaluate")
    public ResponseEntity<EvaluationSummary> evaluate() {
        return ResponseEntity.ok(complianceService.evaluateAll());
    }

    @PostMapping("/evaluate/resource")
    public ResponseEntity<CloudResource> evaluateResource(@RequestParam String resourceId) {
        return ResponseEntity.ok(complianceService.evaluateResource(resourceId));
    }

    @GetMapping("/status")
    public ResponseEntity<ComplianceSummaryDto> status() {
        return ResponseEntity.ok(complianceService.summary());
    }
}
