package com.escrowmart.api.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Escrow-relevant transition of a product, published inside the transaction that made it.
 * Records carry ids and amounts only, never entities, so they stay valid after commit.
 */
public sealed interface EscrowEvent
    permits ProductListedEvent,
        EscrowLockedEvent,
        EscrowReleasedEvent,
        DisputeRaisedEvent,
        DisputeResolvedEvent {

    UUID productId();

    Instant occurredAt();
}
