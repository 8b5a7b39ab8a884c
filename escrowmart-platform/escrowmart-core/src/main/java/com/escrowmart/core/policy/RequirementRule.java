package com.escrowmart.core.policy;

import com.escrowmart.core.domain.Product;

/**
 * Condition a product must meet for bids carrying a given tag.
 */
public interface RequirementRule {

    String tag();

    boolean isSatisfiedBy(Product product);

    static RequirementRule minimumQuality(String tag, int threshold) {
        return new RequirementRule() {
            @Override
            public String tag() {
                return tag;
            }

            @Override
            public boolean isSatisfiedBy(Product product) {
                return product.getQuality() >= threshold;
            }

            @Override
            public String toString() {
                return tag + " requires quality >= " + threshold;
            }
        };
    }
}
