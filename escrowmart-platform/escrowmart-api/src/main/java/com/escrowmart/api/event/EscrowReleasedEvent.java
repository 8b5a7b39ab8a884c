package com.escrowmart.api.event;

import com.escrowmart.core.domain.Release;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record EscrowReleasedEvent(
        UUID productId,
        UUID recipientId,
        BigDecimal amount,
        Release.Reason reason,
        Instant occurredAt)
        implements EscrowEvent {}
