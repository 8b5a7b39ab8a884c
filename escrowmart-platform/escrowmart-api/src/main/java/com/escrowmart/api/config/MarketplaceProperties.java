package com.escrowmart.api.config;

import com.escrowmart.core.domain.QualityValidation;
import com.escrowmart.core.policy.RequirementPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.UUID;

/**
 * Marketplace settings bound from {@code escrowmart.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "escrowmart")
public class MarketplaceProperties {

    private final Admin admin = new Admin();
    private final Listing listing = new Listing();
    private final Requirements requirements = new Requirements();
    private final Settlement settlement = new Settlement();

    public Admin getAdmin() { return admin; }
    public Listing getListing() { return listing; }
    public Requirements getRequirements() { return requirements; }
    public Settlement getSettlement() { return settlement; }

    public static class Admin {
        /** Principal that receives the admin capability at startup. */
        private UUID principalId;

        public UUID getPrincipalId() { return principalId; }
        public void setPrincipalId(UUID principalId) { this.principalId = principalId; }
    }

    public static class Listing {
        private QualityValidation qualityValidation = QualityValidation.STRICT;

        public QualityValidation getQualityValidation() { return qualityValidation; }
        public void setQualityValidation(QualityValidation qualityValidation) { this.qualityValidation = qualityValidation; }
    }

    public static class Requirements {
        private int highQualityThreshold = RequirementPolicy.DEFAULT_HIGH_QUALITY_THRESHOLD;

        public int getHighQualityThreshold() { return highQualityThreshold; }
        public void setHighQualityThreshold(int highQualityThreshold) { this.highQualityThreshold = highQualityThreshold; }
    }

    public static class Settlement {
        private String currency = "USD";

        public String getCurrency() { return currency; }
        public void setCurrency(String currency) { this.currency = currency; }
    }
}
