package com.escrowmart.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only record of one marketplace transition.
 * Each receipt names its predecessor's hash, so the receipts form a single chain
 * ordered by {@code sequence}; {@link AuditChainHead} tracks the tip. The hash is
 * sealed once and never rewritten.
 */
@Entity
@Table(name = "audit_receipts", indexes = {
    @Index(name = "idx_audit_actor", columnList = "actor_id"),
    @Index(name = "idx_audit_resource", columnList = "resource_id"),
    @Index(name = "idx_audit_sequence", columnList = "sequence", unique = true),
    @Index(name = "idx_audit_hash", columnList = "hash")
})
public class AuditReceipt {

    public static final String GENESIS = "GENESIS";

    @Id
    private UUID id;

    @Column(nullable = false, updatable = false)
    private long sequence;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 64)
    private EventType eventType;

    @NotNull
    @Column(name = "actor_id", nullable = false)
    private UUID actorId;

    @NotNull
    @Column(name = "resource_id", nullable = false)
    private UUID resourceId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "resource_kind", nullable = false, length = 32)
    private ResourceKind resourceKind;

    @NotNull
    @Column(name = "details_digest", nullable = false, length = 64)
    private String detailsDigest;

    @NotNull
    @Column(name = "previous_hash", nullable = false, length = 64)
    private String previousHash;

    @Column(length = 64)
    private String hash;

    @NotNull
    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    protected AuditReceipt() {}

    /**
     * Next receipt after the current chain tip. The returned receipt still has to be sealed.
     */
    public static AuditReceipt chainedAfter(
            AuditChainHead head,
            EventType eventType,
            UUID actorId,
            UUID resourceId,
            ResourceKind resourceKind,
            String detailsDigest,
            Instant recordedAt) {

        Objects.requireNonNull(head, "Chain head cannot be null");
        var receipt = new AuditReceipt();
        receipt.id = UUID.randomUUID();
        receipt.sequence = head.getLastSequence() + 1;
        receipt.previousHash = head.getLastHash();
        receipt.eventType = Objects.requireNonNull(eventType, "Event type cannot be null");
        receipt.actorId = Objects.requireNonNull(actorId, "Actor cannot be null");
        receipt.resourceId = Objects.requireNonNull(resourceId, "Resource cannot be null");
        receipt.resourceKind = Objects.requireNonNull(resourceKind, "Resource kind cannot be null");
        receipt.detailsDigest = Objects.requireNonNull(detailsDigest, "Details digest cannot be null");
        receipt.recordedAt = Objects.requireNonNull(recordedAt, "Recording time cannot be null");
        return receipt;
    }

    /**
     * Text the receipt hash covers. Everything except the hash itself.
     */
    public String canonicalForm() {
        return String.join("|",
                Long.toString(sequence),
                eventType.name(),
                recordedAt.toString(),
                actorId.toString(),
                resourceKind.name(),
                resourceId.toString(),
                detailsDigest,
                previousHash);
    }

    public void seal(String hash) {
        if (isSealed()) {
            throw new IllegalStateException("Receipt " + id + " is already sealed");
        }
        this.hash = Objects.requireNonNull(hash, "Hash cannot be null");
    }

    public boolean isSealed() {
        return hash != null;
    }

    public boolean isFirst() {
        return GENESIS.equals(previousHash);
    }

    public UUID getId() { return id; }
    public long getSequence() { return sequence; }
    public EventType getEventType() { return eventType; }
    public UUID getActorId() { return actorId; }
    public UUID getResourceId() { return resourceId; }
    public ResourceKind getResourceKind() { return resourceKind; }
    public String getDetailsDigest() { return detailsDigest; }
    public String getPreviousHash() { return previousHash; }
    public String getHash() { return hash; }
    public Instant getRecordedAt() { return recordedAt; }

    public enum EventType {
        PRODUCT_LISTED,
        BID_PLACED,
        CONSUMER_SELECTED,
        ORDER_SUBMITTED,
        ORDER_CONFIRMED,
        COMPLAINT_FILED,
        DISPUTE_RESOLVED,
        CAPABILITY_TRANSFERRED,
        ADMIN_CAP_MINTED
    }

    public enum ResourceKind {
        PRODUCT,
        PRODUCT_CAP,
        ADMIN_CAP
    }
}
