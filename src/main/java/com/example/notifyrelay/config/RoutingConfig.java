package com.example.notifyrelay.config;

import com.example.notifyrelay.routing.RoutingTable;
import com.example.notifyrelay.routing.RoutingTableLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

/**
 * Loads the routing table once at startup. A missing or invalid file fails the context.
 */
@Configuration
public class RoutingConfig {

    @Bean
    public RoutingTable routingTable(ObjectMapper objectMapper,
            @Value("${relay.routes.location:classpath:notifications.json}") Resource location) {
        return new RoutingTableLoader(objectMapper).load(location);
    }
}
