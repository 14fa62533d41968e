package com.xammer.tagops.service;

import com.xammer.tagops.domain.CloudProvider;
import com.xammer.tagops.domain.CloudResource;
import com.xammer.tagops.dto.EvaluationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Periodic triggers for scans and evaluation. Failures are logged and the next run retries.
 */
@Service
@ConditionalOnProperty(prefix = "tagops.scheduler", name = "enabled", havingValue = "true")
public class ComplianceScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ComplianceScheduler.class);

    private final ScanOrchestrator scanOrchestrator;
    private final ComplianceService complianceService;

    public ComplianceScheduler(ScanOrchestrator scanOrchestrator, ComplianceService complianceService) {
        this.scanOrchestrator = scanOrchestrator;
        this.complianceService = complianceService;
    }

    @Scheduled(cron = "${tagops.scheduler.full-scan-cron:0 0 2 * * *}", zone = "UTC")
    public void scanAllProviders() {
        runScan(Optional.empty());
    }

    @Scheduled(cron = "${tagops.scheduler.evaluation-cron:0 0 3 * * *}", zone = "UTC")
    public void evaluateCompliance() {
        long startTime = System.currentTimeMillis();
        logger.info("Scheduler: Starting compliance evaluation at {}", ZonedDateTime.now());
        try {
            EvaluationSummary summary = complianceService.evaluateAll();
            logger.info("Scheduler: Evaluation finished in {}ms - {} resources, {}% compliant, {} workflow(s) proposed",
                    System.currentTimeMillis() - startTime, summary.getTotal(), summary.getComplianceRate(),
                    summary.getWorkflowsProposed());
        } catch (Exception e) {
            logger.error("Scheduler: Compliance evaluation failed after {}ms", System.currentTimeMillis() - startTime, e);
        }
    }

    @Scheduled(cron = "${tagops.scheduler.aws-scan-cron:0 0 * * * *}", zone = "UTC")
    public void scanAws() {
        scanIfConfigured(CloudProvider.AWS);
    }

    @Scheduled(cron = "${tagops.scheduler.azure-scan-cron:0 15 * * * *}", zone = "UTC")
    public void scanAzure() {
        scanIfConfigured(CloudProvider.AZURE);
    }

    @Scheduled(cron = "${tagops.scheduler.gcp-scan-cron:0 30 * * * *}", zone = "UTC")
    public void scanGcp() {
        scanIfConfigured(CloudProvider.GCP);
    }

    private void scanIfConfigured(CloudProvider provider) {
        if (!scanOrchestrator.isConfigured(provider)) {
            logger.debug("Scheduler: {} connector not configured; skipping hourly scan", provider);
            return;
        }
        runScan(Optional.of(provider));
    }

    private void runScan(Optional<CloudProvider> provider) {
        String target = provider.map(CloudProvider::getValue).orElse("all providers");
        long startTime = System.currentTimeMillis();
        logger.info("Scheduler: Starting scan of {} at {}", target, ZonedDateTime.now());
        try {
            List<CloudResource> resources = scanOrchestrator.scan(provider);
            logger.info("Scheduler: Scan of {} finished in {}ms - {} resource(s)", target,
                    System.currentTimeMillis() - startTime, resources.size());
        } catch (Exception e) {
            logger.error("Scheduler: Scan of {} failed after {}ms", target, System.currentTimeMillis() - startTime, e);
        }
    }
}
