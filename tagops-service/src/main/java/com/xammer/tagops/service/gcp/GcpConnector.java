package com.xammer.tagops.service.gcp;

import com.google.api.gax.rpc.ApiException;
import com.google.cloud.BaseServiceException;
import com.google.cloud.compute.v1.Instance;
import com.google.cloud.compute.v1.InstancesClient;
import com.google.cloud.compute.v1.InstancesScopedList;
import com.google.cloud.compute.v1.InstancesSetLabelsRequest;
import com.google.cloud.compute.v1.Operation;
import com.google.cloud.storage.Bucket;
import com.google.cloud.storage.Storage;
import com.xammer.tagops.domain.CloudProvider;
import com.xammer.tagops.domain.CloudResource;
import com.xammer.tagops.dto.DiscoveredResource;
import com.xammer.tagops.exception.ConnectorException;
import com.xammer.tagops.service.CloudConnector;
import com.xammer.tagops.util.TagMaps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compute Engine instances and Cloud Storage buckets of one GCP project. GCP calls these labels.
 */
@Service
@Slf4j
@ConditionalOnProperty(prefix = "tagops.connectors.gcp", name = "enabled", havingValue = "true")
public class GcpConnector implements CloudConnector {

    static final String COMPUTE_INSTANCE = "compute-instance";
    static final String STORAGE_BUCKET = "storage-bucket";

    private static final Pattern INSTANCE_ID =
            Pattern.compile("^//compute\\.googleapis\\.com/projects/([^/]+)/zones/([^/]+)/instances/([^/]+)$");
    private static final String BUCKET_ID_PREFIX = "//storage.googleapis.com/projects/_/buckets/";

    private final GcpClientProvider clientProvider;
    private final long timeoutSeconds;

    public GcpConnector(GcpClientProvider clientProvider,
                        @Value("${tagops.connectors.timeout-seconds:30}") long timeoutSeconds) {
        this.clientProvider = clientProvider;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public CloudProvider provider() {
        return CloudProvider.GCP;
    }

    @Override
    public List<DiscoveredResource> listResources() {
        String projectId = clientProvider.getProjectId();
        log.info("Listing GCP resources for project {}", projectId);
        List<DiscoveredResource> resources = new ArrayList<>();

        try {
            InstancesClient client = clientProvider.getInstancesClient();
            for (Map.Entry<String, InstancesScopedList> entry : client.aggregatedList(projectId).iterateAll()) {
                for (Instance instance : entry.getValue().getInstancesList()) {
                    String zone = lastSegment(instance.getZone());
                    resources.add(DiscoveredResource.builder()
                            .resourceId(instanceId(projectId, zone, instance.getName()))
                            .name(instance.getName())
                            .resourceType(COMPUTE_INSTANCE)
                            .cloudProvider(CloudProvider.GCP)
                            .region(zone)
                            .tags(TagMaps.copyOf(instance.getLabelsMap()))
                            .build());
                }
            }
        } catch (ApiException | ConnectorException e) {
            log.error("Error fetching Compute Instances for project: {}", projectId, e);
        }

        try {
            for (Bucket bucket : clientProvider.getStorage().list().iterateAll()) {
                resources.add(DiscoveredResource.builder()
                        .resourceId(BUCKET_ID_PREFIX + bucket.getName())
                        .name(bucket.getName())
                        .resourceType(STORAGE_BUCKET)
                        .cloudProvider(CloudProvider.GCP)
                        .region(bucket.getLocation() == null ? null : bucket.getLocation().toLowerCase(Locale.ROOT))
                        .tags(TagMaps.copyOf(bucket.getLabels()))
                        .build());
            }
        } catch (BaseServiceException | ConnectorException e) {
            log.error("Error fetching Cloud Storage buckets for project: {}", projectId, e);
        }

        log.info("Found {} GCP resource(s)", resources.size());
        return resources;
    }

    @Override
    public boolean updateResourceTags(CloudResource resource, Map<String, String> tags) {
        String resourceId = resource.getResourceId();
        try {
            boolean applied;
            switch (resource.getResourceType()) {
                case COMPUTE_INSTANCE:
                    applied = labelInstance(resourceId, tags);
                    break;
                case STORAGE_BUCKET:
                    applied = labelBucket(resourceId, tags);
                    break;
                default:
                    log.warn("GCP resource type '{}' of {} does not support labels", resource.getResourceType(), resourceId);
                    return false;
            }
            if (applied) {
                log.info("Applied {} label(s) to GCP {} {}", tags.size(), resource.getResourceType(), resourceId);
            }
            return applied;
        } catch (ApiException | BaseServiceException e) {
            log.error("GCP rejected label update on {}: {}", resourceId, e.getMessage());
            return false;
        }
    }

    // setLabels replaces the label set and needs the current fingerprint
    private boolean labelInstance(String resourceId, Map<String, String> tags) {
        Matcher matcher = INSTANCE_ID.matcher(resourceId);
        if (!matcher.matches()) {
            log.warn("Unrecognised compute instance id {}", resourceId);
            return false;
        }
        String project = matcher.group(1);
        String zone = matcher.group(2);
        String name = matcher.group(3);

        InstancesClient client = clientProvider.getInstancesClient();
        Instance instance = client.get(project, zone, name);
        InstancesSetLabelsRequest request = InstancesSetLabelsRequest.newBuilder()
                .putAllLabels(TagMaps.merge(instance.getLabelsMap(), tags))
                .setLabelFingerprint(instance.getLabelFingerprint())
                .build();
        try {
            Operation operation = client.setLabelsAsync(project, zone, name, request).get(timeoutSeconds, TimeUnit.SECONDS);
            if (operation.hasError()) {
                log.error("setLabels on {} finished with error: {}", resourceId, operation.getError());
                return false;
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectorException("Interrupted while labelling " + resourceId, e);
        } catch (ExecutionException e) {
            throw new ConnectorException("setLabels on " + resourceId + " failed: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new ConnectorException("setLabels on " + resourceId + " timed out after " + timeoutSeconds + "s", e);
        }
    }

    private boolean labelBucket(String resourceId, Map<String, String> tags) {
        String name = resourceId.startsWith(BUCKET_ID_PREFIX) ? resourceId.substring(BUCKET_ID_PREFIX.length()) : resourceId;
        Storage storage = clientProvider.getStorage();
        Bucket bucket = storage.get(name);
        if (bucket == null) {
            log.warn("GCS bucket {} not found", name);
            return false;
        }
        bucket.toBuilder().setLabels(TagMaps.merge(bucket.getLabels(), tags)).build().update();
        return true;
    }

    static String instanceId(String project, String zone, String name) {
        return "//compute.googleapis.com/projects/" + project + "/zones/" + zone + "/instances/" + name;
    }

    private static String lastSegment(String url) {
        if (url == null) {
            return null;
        }
        int slash = url.lastIndexOf('/');
        return slash < 0 ? url : url.substring(slash + 1);
    }
}
