package com.xammer.tagops.service.azure;

import com.azure.core.credential.TokenCredential;
import com.azure.core.management.AzureEnvironment;
import com.azure.core.management.profile.AzureProfile;
import com.azure.identity.ClientSecretCredentialBuilder;
import com.azure.resourcemanager.AzureResourceManager;
import com.xammer.tagops.exception.ConnectorException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Resource manager for the configured subscription, authenticated with a service principal secret.
 */
@Service
@ConditionalOnProperty(prefix = "tagops.connectors.azure", name = "enabled", havingValue = "true")
public class AzureClientProvider {

    private final String tenantId;
    private final String clientId;
    private final String clientSecret;
    private final String subscriptionId;

    private volatile AzureResourceManager client;

    public AzureClientProvider(@Value("${tagops.connectors.azure.tenant-id}") String tenantId,
                               @Value("${tagops.connectors.azure.client-id}") String clientId,
                               @Value("${tagops.connectors.azure.client-secret}") String clientSecret,
                               @Value("${tagops.connectors.azure.subscription-id}") String subscriptionId) {
        this.tenantId = tenantId;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.subscriptionId = subscriptionId;
    }

    public AzureResourceManager getAzureClient() {
        AzureResourceManager current = client;
        if (current == null) {
            synchronized (this) {
                if (client == null) {
                    client = authenticate();
                }
                current = client;
            }
        }
        return current;
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }

    private AzureResourceManager authenticate() {
        try {
            AzureProfile profile = new AzureProfile(tenantId, subscriptionId, AzureEnvironment.AZURE);
            return AzureResourceManager.authenticate(buildCredential(), profile).withSubscription(subscriptionId);
        } catch (RuntimeException e) {
            throw new ConnectorException("Failed to authenticate to Azure subscription " + subscriptionId + ": " + e.getMessage(), e);
        }
    }

    private TokenCredential buildCredential() {
        return new ClientSecretCredentialBuilder()
                .clientId(clientId)
                .clientSecret(clientSecret)
                .tenantId(tenantId)
                .build();
    }
}
