package com.escrowmart.api.event;

import java.time.Instant;
import java.util.UUID;

public record DisputeResolvedEvent(UUID productId, UUID complaintId, boolean forConsumer, Instant occurredAt)
        implements EscrowEvent {}
