package com.escrowmart.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Administrative capability over a single product.
 * Whoever holds it may select a consumer and confirm the order.
 */
@Entity
@Table(name = "product_caps", indexes = {
    @Index(name = "idx_product_cap_product", columnList = "product_id", unique = true),
    @Index(name = "idx_product_cap_holder", columnList = "holder_id")
})
public class ProductCap {

    @Id
    private UUID id;

    @NotNull
    @Column(name = "product_id", nullable = false, updatable = false)
    private UUID productId;

    @NotNull
    @Column(name = "holder_id", nullable = false)
    private UUID holderId;

    @NotNull
    @Column(name = "issued_at", nullable = false, updatable = false)
    private Instant issuedAt;

    protected ProductCap() {}

    public static ProductCap issue(UUID productId, UUID holderId, Instant issuedAt) {
        var cap = new ProductCap();
        cap.id = UUID.randomUUID();
        cap.productId = Objects.requireNonNull(productId, "Product ID cannot be null");
        cap.holderId = Objects.requireNonNull(holderId, "Holder cannot be null");
        cap.issuedAt = Objects.requireNonNull(issuedAt, "Issue time cannot be null");
        return cap;
    }

    public boolean authorizes(Product product) {
        return product != null && productId.equals(product.getId());
    }

    public boolean isHeldBy(UUID principal) {
        return holderId.equals(principal);
    }

    public void transferTo(UUID newHolder) {
        this.holderId = Objects.requireNonNull(newHolder, "New holder cannot be null");
    }

    public UUID getId() { return id; }
    public UUID getProductId() { return productId; }
    public UUID getHolderId() { return holderId; }
    public Instant getIssuedAt() { return issuedAt; }
}
