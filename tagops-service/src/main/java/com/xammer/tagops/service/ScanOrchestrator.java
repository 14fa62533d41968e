package com.xammer.tagops.service;

import com.xammer.tagops.domain.CloudProvider;
import com.xammer.tagops.domain.CloudResource;
import com.xammer.tagops.dto.DiscoveredResource;
import com.xammer.tagops.exception.ConnectorException;
import com.xammer.tagops.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pulls resource lists from the connectors and merges them into the catalog. Scanning only observes;
 * evaluation is triggered separately.
 */
@Service
public class ScanOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(ScanOrchestrator.class);

    private final Map<CloudProvider, CloudConnector> connectors;
    private final ResourceCatalogService catalog;

    public ScanOrchestrator(Map<CloudProvider, CloudConnector> cloudConnectors, ResourceCatalogService catalog) {
        Map<CloudProvider, CloudConnector> ordered = new EnumMap<>(CloudProvider.class);
        ordered.putAll(cloudConnectors);
        this.connectors = Collections.unmodifiableMap(ordered);
        this.catalog = catalog;
    }

    /**
     * With a provider, scans only that provider and fails if it cannot be listed. Without one, scans every
     * configured provider in declaration order and skips any that fail.
     */
    public List<CloudResource> scan(Optional<CloudProvider> provider) {
        long startTime = System.currentTimeMillis();
        List<CloudResource> upserted = new ArrayList<>();

        if (provider.isPresent()) {
            CloudConnector connector = connectors.get(provider.get());
            if (connector == null) {
                throw new ValidationException("No connector configured for provider " + provider.get().getValue());
            }
            upserted.addAll(ingest(connector, list(connector)));
        } else {
            for (CloudConnector connector : connectors.values()) {
                List<DiscoveredResource> observed;
                try {
                    observed = list(connector);
                } catch (ConnectorException e) {
                    logger.error("Scan of {} failed; continuing with remaining providers", connector.provider(), e);
                    continue;
                }
                upserted.addAll(ingest(connector, observed));
            }
        }

        logger.info("Scan of {} complete in {}ms - {} resource(s) upserted",
                provider.map(CloudProvider::getValue).orElse("all providers"),
                System.currentTimeMillis() - startTime, upserted.size());
        return upserted;
    }

    public boolean isConfigured(CloudProvider provider) {
        return connectors.containsKey(provider);
    }

    private List<DiscoveredResource> list(CloudConnector connector) {
        logger.info("Listing resources from {}", connector.provider());
        try {
            List<DiscoveredResource> observed = connector.listResources();
            return observed == null ? List.of() : observed;
        } catch (ConnectorException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConnectorException("Failed to list " + connector.provider().getValue() + " resources: " + e.getMessage(), e);
        }
    }

    // StorageException propagates and ends the scan
    private List<CloudResource> ingest(CloudConnector connector, List<DiscoveredResource> observed) {
        List<CloudResource> upserted = new ArrayList<>(observed.size());
        for (DiscoveredResource resource : observed) {
            try {
                upserted.add(catalog.upsert(resource));
            } catch (ValidationException e) {
                logger.warn("Skipping {} resource {}: {}", connector.provider(), resource.getResourceId(), e.getMessage());
            }
        }
        logger.info("{}: {} of {} observed resource(s) upserted", connector.provider(), upserted.size(), observed.size());
        return upserted;
    }
}
