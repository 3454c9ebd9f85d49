package com.vcsight.ingestor.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(IngestProperties.class)
public class IngestConfig {

    /** Single time source for job timestamps, artifact names and retention cutoffs. */
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
