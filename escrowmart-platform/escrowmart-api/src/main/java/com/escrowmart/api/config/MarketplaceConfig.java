package com.escrowmart.api.config;

import com.escrowmart.core.policy.RequirementPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class MarketplaceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RequirementPolicy requirementPolicy(MarketplaceProperties properties) {
        return RequirementPolicy.standard(properties.getRequirements().getHighQualityThreshold());
    }
}
