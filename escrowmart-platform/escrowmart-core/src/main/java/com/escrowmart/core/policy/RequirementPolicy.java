package com.escrowmart.core.policy;

import com.escrowmart.core.domain.Product;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a bid's requirement tags are consistent with a product.
 * Tags without a registered rule are accepted.
 */
public final class RequirementPolicy {

    public static final String HIGH_QUALITY = "high_quality";
    public static final int DEFAULT_HIGH_QUALITY_THRESHOLD = 80;

    private final Map<String, RequirementRule> rules;

    private RequirementPolicy(Map<String, RequirementRule> rules) {
        this.rules = Map.copyOf(rules);
    }

    public static RequirementPolicy standard() {
        return standard(DEFAULT_HIGH_QUALITY_THRESHOLD);
    }

    public static RequirementPolicy standard(int highQualityThreshold) {
        return of(List.of(RequirementRule.minimumQuality(HIGH_QUALITY, highQualityThreshold)));
    }

    public static RequirementPolicy of(Collection<RequirementRule> rules) {
        Map<String, RequirementRule> byTag = new LinkedHashMap<>();
        for (RequirementRule rule : rules) {
            if (byTag.putIfAbsent(rule.tag(), rule) != null) {
                throw new IllegalArgumentException("Duplicate rule for tag: " + rule.tag());
            }
        }
        return new RequirementPolicy(byTag);
    }

    /**
     * Returns the first tag whose rule the product fails, if any.
     */
    public Optional<String> firstUnmet(Product product, Collection<String> tags) {
        for (String tag : tags) {
            RequirementRule rule = rules.get(tag);
            if (rule != null && !rule.isSatisfiedBy(product)) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }
}
