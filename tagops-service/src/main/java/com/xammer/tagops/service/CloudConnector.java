package com.xammer.tagops.service;

import com.xammer.tagops.domain.CloudProvider;
import com.xammer.tagops.domain.CloudResource;
import com.xammer.tagops.dto.DiscoveredResource;

import java.util.List;
import java.util.Map;

/**
 * Per-provider adapter used by scans and by tag remediation.
 */
public interface CloudConnector {

    CloudProvider provider();

    /**
     * Lists every supported resource the configured credentials can see. A region or service that fails
     * is logged and left out; only a failure of the whole provider is thrown.
     */
    List<DiscoveredResource> listResources();

    /**
     * Merges {@code tags} into the provider-side tags of {@code resource}, keeping tags not named here.
     *
     * @return false when the provider refused or could not locate the resource
     */
    boolean updateResourceTags(CloudResource resource, Map<String, String> tags);
}
