package com.example.sessionhub.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PropertiesConfig {

    @Value("${node.name:${NODE_NAME:session-hub-0}}")
    private String nodeName;

    @Bean
    @ConfigurationProperties(prefix = "hub")
    public AppProperties appProperties() {
        AppProperties properties = new AppProperties();

        // hub.node-name, when present, overrides this during binding
        properties.setNodeName(nodeName);
        return properties;
    }
}
