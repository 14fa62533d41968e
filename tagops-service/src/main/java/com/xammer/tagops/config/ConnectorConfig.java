package com.xammer.tagops.config;

import com.xammer.tagops.domain.CloudProvider;
import com.xammer.tagops.service.CloudConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.EnumMap;
import java.util.Map;

@Configuration
public class ConnectorConfig {

    private static final Logger logger = LoggerFactory.getLogger(ConnectorConfig.class);

    /**
     * Capability map handed to the scan and workflow services. Only connectors enabled by configuration are present.
     */
    @Bean
    public Map<CloudProvider, CloudConnector> cloudConnectors(ObjectProvider<CloudConnector> connectors) {
        Map<CloudProvider, CloudConnector> registry = new EnumMap<>(CloudProvider.class);
        connectors.orderedStream().forEach(connector -> {
            CloudConnector previous = registry.put(connector.provider(), connector);
            if (previous != null) {
                throw new IllegalStateException("Two connectors registered for " + connector.provider());
            }
        });
        logger.info("Cloud connectors enabled: {}", registry.keySet());
        return registry;
    }

    @Bean("connectorTaskExecutor")
    public TaskExecutor connectorTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("Connector-Async-");
        executor.initialize();
        return executor;
    }
}
