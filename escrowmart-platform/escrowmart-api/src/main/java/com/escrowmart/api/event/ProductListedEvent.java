package com.escrowmart.api.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record ProductListedEvent(UUID productId, UUID supplierId, BigDecimal price, Instant occurredAt)
        implements EscrowEvent {}
