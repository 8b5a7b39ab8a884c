package com.escrowmart.core.domain;

/**
 * How listing quality scores are checked at creation time.
 */
public enum QualityValidation {
    /** Rejects scores outside 0..100. */
    STRICT,
    /** Accepts any integer score. */
    LENIENT;

    public static final int MIN_QUALITY = 0;
    public static final int MAX_QUALITY = 100;

    public void check(int quality) {
        if (this == STRICT && (quality < MIN_QUALITY || quality > MAX_QUALITY)) {
            throw MarketplaceException.of(MarketError.INVALID_QUALITY,
                    "Quality must be between " + MIN_QUALITY + " and " + MAX_QUALITY + ": " + quality);
        }
    }
}
