package com.xammer.tagops.controller;

import com.xammer.tagops.domain.Policy;
import com.xammer.tagops.dto.PolicyRequest;
import com.xammer.tagops.dto.PolicyUpdateRequest;
import com.xammer.tagops.service.PolicyService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/tagops/policies")
public class PolicyController {

    private final PolicyService policyService;

    public PolicyController(PolicyService policyService) {
        this.policyService = policyService;
    }

    @PostMapping
    public ResponseEntity<Policy> create(@RequestBody PolicyRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(policyService.create(request));
    }

    @GetMapping
    public ResponseEntity<List<Policy>> list(@RequestParam(defaultValue = "false") boolean activeOnly,
                                             @RequestParam(defaultValue = "0") int skip,
                                             @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(policyService.list(activeOnly, skip, limit));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Policy> get(@PathVariable Long id) {
        return ResponseEntity.ok(policyService.get(id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Policy> update(@PathVariable Long id, @RequestBody PolicyUpdateRequest request) {
        return ResponseEntity.ok(policyService.update(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        policyService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
