package com.fraud.scoring.config;

import com.fraud.scoring.artifact.ArtifactBundle;
import com.fraud.scoring.artifact.ArtifactLoader;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Loads the scoring artifacts at startup; a missing or corrupt artifact fails the context.
 */
@Configuration
@EnableConfigurationProperties(FraudScoringProperties.class)
public class ArtifactConfig {

    @Bean
    public ArtifactBundle artifactBundle(ArtifactLoader loader) {
        return loader.get();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
