package com.example.notice.shared.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jdbc.repository.config.EnableJdbcRepositories;

import java.time.Clock;

@Configuration
@EnableJdbcRepositories(basePackages = "com.example.notice.shared.repository")
public class PropertiesConfig {

    @Bean
    @ConfigurationProperties(prefix = "app")
    public AppProperties appProperties() {
        return new AppProperties();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
