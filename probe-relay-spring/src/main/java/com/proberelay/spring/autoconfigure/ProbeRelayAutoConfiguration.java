package com.proberelay.spring.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proberelay.core.ProbeRelay;
import com.proberelay.spring.HostEventBridge;
import com.proberelay.transport.CollectorClient;
import com.proberelay.transport.logging.LoggingCollectorClient;
import com.proberelay.transport.okhttp.OkHttpCollectorClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(ProbeRelayProperties.class)
@ConditionalOnProperty(prefix = "probe-relay", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ProbeRelayAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CollectorClient probeRelayCollectorClient(ProbeRelayProperties properties, ObjectProvider<ObjectMapper> json) {
        return switch (properties.getTransport()) {
            case LOGGING -> new LoggingCollectorClient();
            case OKHTTP -> new OkHttpCollectorClient(
                    properties.endpoint(),
                    json.getIfAvailable(ObjectMapper::new),
                    properties.getCollector().getQueueCapacity());
        };
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ProbeRelay probeRelay(
            ProbeRelayProperties properties, CollectorClient client, ObjectProvider<ObjectMapper> json) {
        return ProbeRelay.initialize(properties.toConfig(), client, json.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public HostEventBridge hostEventBridge(ProbeRelay relay, ProbeRelayProperties properties) {
        return new HostEventBridge(relay, properties.isConnectOnReady());
    }
}
