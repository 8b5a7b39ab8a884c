package com.escrowmart.api.event;

import java.time.Instant;
import java.util.UUID;

public record DisputeRaisedEvent(UUID productId, UUID complaintId, String reason, Instant occurredAt)
        implements EscrowEvent {}
