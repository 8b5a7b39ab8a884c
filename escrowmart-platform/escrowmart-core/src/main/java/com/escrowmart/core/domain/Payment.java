package com.escrowmart.core.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Fungible value handed into escrow or delivered out of it.
 * Only the amount is ever inspected.
 */
public record Payment(BigDecimal amount) {

    public Payment {
        Objects.requireNonNull(amount, "Amount cannot be null");
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Payment amount must be positive");
        }
    }

    public static Payment of(BigDecimal amount) {
        return new Payment(amount);
    }

    public static Payment of(long amount) {
        return new Payment(BigDecimal.valueOf(amount));
    }

    public boolean covers(BigDecimal price) {
        return amount.compareTo(price) >= 0;
    }
}
