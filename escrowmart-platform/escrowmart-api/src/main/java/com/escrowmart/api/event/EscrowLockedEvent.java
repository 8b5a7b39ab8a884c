package com.escrowmart.api.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record EscrowLockedEvent(UUID productId, UUID consumerId, BigDecimal amount, Instant occurredAt)
        implements EscrowEvent {}
