package com.example.consult.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jdbc.repository.config.EnableJdbcRepositories;

@Configuration
@EnableJdbcRepositories(basePackages = "com.example.consult.shared.repository")
public class PropertiesConfig {

    @Value("${pod.name:${POD_NAME:consult-session-service-0}}")
    private String podName;

    @Bean
    @ConfigurationProperties(prefix = "consult")
    public AppProperties appProperties() {
        AppProperties properties = new AppProperties();
        properties.setPodName(podName);
        return properties;
    }
}
