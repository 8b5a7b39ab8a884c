package com.escrowmart.core.domain;

import java.util.Objects;

/**
 * Raised when a transition's precondition does not hold.
 * Always thrown before the target record is mutated.
 */
public class MarketplaceException extends RuntimeException {

    private final MarketError error;

    public MarketplaceException(MarketError error, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "Error cannot be null");
    }

    public MarketError getError() {
        return error;
    }

    public static MarketplaceException of(MarketError error, String message) {
        return new MarketplaceException(error, message);
    }
}
