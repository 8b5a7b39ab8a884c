package com.escrowmart.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * The single arbitration capability, minted once at system initialization.
 */
@Entity
@Table(name = "admin_caps")
public class AdminCap {

    @Id
    private UUID id;

    @NotNull
    @Column(name = "holder_id", nullable = false)
    private UUID holderId;

    @NotNull
    @Column(name = "minted_at", nullable = false, updatable = false)
    private Instant mintedAt;

    protected AdminCap() {}

    public static AdminCap mint(UUID holderId, Instant mintedAt) {
        var cap = new AdminCap();
        cap.id = UUID.randomUUID();
        cap.holderId = Objects.requireNonNull(holderId, "Holder cannot be null");
        cap.mintedAt = Objects.requireNonNull(mintedAt, "Mint time cannot be null");
        return cap;
    }

    public boolean isHeldBy(UUID principal) {
        return holderId.equals(principal);
    }

    public void transferTo(UUID newHolder) {
        this.holderId = Objects.requireNonNull(newHolder, "New holder cannot be null");
    }

    public UUID getId() { return id; }
    public UUID getHolderId() { return holderId; }
    public Instant getMintedAt() { return mintedAt; }
}
