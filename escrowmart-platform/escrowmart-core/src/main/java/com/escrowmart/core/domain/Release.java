package com.escrowmart.core.domain;

import java.util.UUID;

/**
 * The full escrow balance leaving a product, and who receives it.
 */
public record Release(UUID productId, UUID recipientId, Payment payment, Reason reason) {

    public enum Reason {
        ORDER_CONFIRMED,
        DISPUTE_FOR_CONSUMER,
        DISPUTE_FOR_SUPPLIER
    }
}
