package com.xammer.tagops.service.azure;

import com.azure.core.management.exception.ManagementException;
import com.azure.resourcemanager.AzureResourceManager;
import com.azure.resourcemanager.compute.models.VirtualMachine;
import com.azure.resourcemanager.storage.models.StorageAccount;
import com.xammer.tagops.domain.CloudProvider;
import com.xammer.tagops.domain.CloudResource;
import com.xammer.tagops.dto.DiscoveredResource;
import com.xammer.tagops.exception.ConnectorException;
import com.xammer.tagops.service.CloudConnector;
import com.xammer.tagops.util.TagMaps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Virtual machines and storage accounts of one Azure subscription. Resource ids are ARM ids.
 */
@Service
@ConditionalOnProperty(prefix = "tagops.connectors.azure", name = "enabled", havingValue = "true")
public class AzureConnector implements CloudConnector {

    private static final Logger log = LoggerFactory.getLogger(AzureConnector.class);

    static final String VM = "vm";
    static final String STORAGE_ACCOUNT = "storage-account";

    private final AzureClientProvider clientProvider;

    public AzureConnector(AzureClientProvider clientProvider) {
        this.clientProvider = clientProvider;
    }

    @Override
    public CloudProvider provider() {
        return CloudProvider.AZURE;
    }

    @Override
    public List<DiscoveredResource> listResources() {
        log.info("Listing Azure resources for subscription {}", clientProvider.getSubscriptionId());
        AzureResourceManager azure = clientProvider.getAzureClient();
        List<DiscoveredResource> resources = new ArrayList<>();

        // Virtual Machines
        try {
            azure.virtualMachines().list().forEach(vm -> resources.add(DiscoveredResource.builder()
                    .resourceId(vm.id())
                    .name(vm.name())
                    .resourceType(VM)
                    .cloudProvider(CloudProvider.AZURE)
                    .region(vm.regionName())
                    .tags(TagMaps.copyOf(vm.tags()))
                    .build()));
        } catch (RuntimeException e) {
            log.error("Failed to list Virtual Machines: {}", e.getMessage(), e);
        }

        // Storage Accounts
        try {
            azure.storageAccounts().list().forEach(sa -> resources.add(DiscoveredResource.builder()
                    .resourceId(sa.id())
                    .name(sa.name())
                    .resourceType(STORAGE_ACCOUNT)
                    .cloudProvider(CloudProvider.AZURE)
                    .region(sa.regionName())
                    .tags(TagMaps.copyOf(sa.tags()))
                    .build()));
        } catch (RuntimeException e) {
            log.error("Failed to list Storage Accounts: {}", e.getMessage(), e);
        }

        log.info("Found {} Azure resource(s)", resources.size());
        return resources;
    }

    @Override
    public boolean updateResourceTags(CloudResource resource, Map<String, String> tags) {
        String resourceId = resource.getResourceId();
        AzureResourceManager azure = clientProvider.getAzureClient();
        try {
            switch (resource.getResourceType()) {
                case VM: {
                    VirtualMachine vm = azure.virtualMachines().getById(resourceId);
                    if (vm == null) {
                        log.warn("Azure VM {} not found", resourceId);
                        return false;
                    }
                    vm.update().withTags(TagMaps.merge(vm.tags(), tags)).apply();
                    break;
                }
                case STORAGE_ACCOUNT: {
                    StorageAccount account = azure.storageAccounts().getById(resourceId);
                    if (account == null) {
                        log.warn("Azure storage account {} not found", resourceId);
                        return false;
                    }
                    account.update().withTags(TagMaps.merge(account.tags(), tags)).apply();
                    break;
                }
                default:
                    log.warn("Azure resource type '{}' of {} does not support tagging", resource.getResourceType(), resourceId);
                    return false;
            }
        } catch (ManagementException e) {
            log.error("Azure rejected tag update on {}: {}", resourceId, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            throw new ConnectorException("Azure tag update on " + resourceId + " failed: " + e.getMessage(), e);
        }
        log.info("Applied {} tag(s) to Azure {} {}", tags.size(), resource.getResourceType(), resourceId);
        return true;
    }
}
