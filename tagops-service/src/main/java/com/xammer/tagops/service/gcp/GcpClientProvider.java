package com.xammer.tagops.service.gcp;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.compute.v1.InstancesClient;
import com.google.cloud.compute.v1.InstancesSettings;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import com.xammer.tagops.exception.ConnectorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import javax.annotation.PreDestroy;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Compute and Storage clients for the configured project. Uses the service-account key at
 * {@code tagops.connectors.gcp.credentials-file}, or application-default credentials when none is set.
 */
@Service
@Slf4j
@ConditionalOnProperty(prefix = "tagops.connectors.gcp", name = "enabled", havingValue = "true")
public class GcpClientProvider {

    private static final String CLOUD_PLATFORM_SCOPE = "https://www.googleapis.com/auth/cloud-platform";

    private final String projectId;
    private final String credentialsFile;

    private GoogleCredentials credentials;
    private InstancesClient instancesClient;
    private Storage storage;

    public GcpClientProvider(@Value("${tagops.connectors.gcp.project-id}") String projectId,
                             @Value("${tagops.connectors.gcp.credentials-file:}") String credentialsFile) {
        this.projectId = projectId;
        this.credentialsFile = credentialsFile;
    }

    public String getProjectId() {
        return projectId;
    }

    public synchronized InstancesClient getInstancesClient() {
        if (instancesClient == null) {
            try {
                InstancesSettings settings = InstancesSettings.newBuilder()
                        .setCredentialsProvider(this::getCredentials)
                        .build();
                instancesClient = InstancesClient.create(settings);
            } catch (IOException e) {
                log.error("Failed to create InstancesClient for project ID: {}", projectId, e);
                throw new ConnectorException("Failed to create GCP compute client: " + e.getMessage(), e);
            }
        }
        return instancesClient;
    }

    public synchronized Storage getStorage() {
        if (storage == null) {
            storage = StorageOptions.newBuilder()
                    .setCredentials(getCredentials())
                    .setProjectId(projectId)
                    .build()
                    .getService();
        }
        return storage;
    }

    private synchronized GoogleCredentials getCredentials() {
        if (credentials == null) {
            try {
                if (credentialsFile == null || credentialsFile.isBlank()) {
                    credentials = GoogleCredentials.getApplicationDefault().createScoped(CLOUD_PLATFORM_SCOPE);
                } else {
                    try (InputStream in = new FileInputStream(credentialsFile)) {
                        credentials = GoogleCredentials.fromStream(in).createScoped(CLOUD_PLATFORM_SCOPE);
                    }
                }
            } catch (IOException e) {
                log.error("Failed to load GoogleCredentials for project ID: {}", projectId, e);
                throw new ConnectorException("Failed to load GCP credentials: " + e.getMessage(), e);
            }
        }
        return credentials;
    }

    @PreDestroy
    public synchronized void close() {
        if (instancesClient != null) {
            instancesClient.close();
        }
    }
}
