package com.escrowmart.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Dispute ticket between the supplier and the chosen consumer of a product.
 * {@code decision} is false until arbitrated; afterwards true means the consumer won.
 */
@Entity
@Table(name = "complaints", indexes = {
    @Index(name = "idx_complaint_product", columnList = "product_id"),
    @Index(name = "idx_complaint_filed_by", columnList = "filed_by")
})
public class Complaint {

    @Id
    private UUID id;

    @NotNull
    @Column(name = "product_id", nullable = false, updatable = false)
    private UUID productId;

    @NotNull
    @Column(name = "consumer_id", nullable = false, updatable = false)
    private UUID consumerId;

    @NotNull
    @Column(name = "supplier_id", nullable = false, updatable = false)
    private UUID supplierId;

    @NotNull
    @Column(name = "filed_by", nullable = false, updatable = false)
    private UUID filedBy;

    @Column(length = 2000)
    private String reason;

    @Column(nullable = false)
    private boolean decision;

    @Column(nullable = false)
    private boolean resolved;

    @NotNull
    @Column(name = "filed_at", nullable = false, updatable = false)
    private Instant filedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    protected Complaint() {}

    static Complaint file(UUID productId, UUID consumerId, UUID supplierId, UUID filedBy,
                          String reason, Instant filedAt) {
        var complaint = new Complaint();
        complaint.id = UUID.randomUUID();
        complaint.productId = Objects.requireNonNull(productId, "Product ID cannot be null");
        complaint.consumerId = Objects.requireNonNull(consumerId, "Consumer cannot be null");
        complaint.supplierId = Objects.requireNonNull(supplierId, "Supplier cannot be null");
        complaint.filedBy = Objects.requireNonNull(filedBy, "Complainant cannot be null");
        complaint.reason = reason == null ? "" : reason;
        complaint.filedAt = filedAt;
        return complaint;
    }

    void decide(boolean forConsumer, Instant at) {
        this.decision = forConsumer;
        this.resolved = true;
        this.resolvedAt = at;
    }

    public UUID getId() { return id; }
    public UUID getProductId() { return productId; }
    public UUID getConsumerId() { return consumerId; }
    public UUID getSupplierId() { return supplierId; }
    public UUID getFiledBy() { return filedBy; }
    public String getReason() { return reason; }
    public boolean getDecision() { return decision; }
    public boolean isResolved() { return resolved; }
    public Instant getFiledAt() { return filedAt; }
    public Instant getResolvedAt() { return resolvedAt; }
}
