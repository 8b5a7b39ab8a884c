package com.escrowmart.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A prospective consumer's bid against one product.
 * Built independently of the product, then attached to its bid table by
 * {@link Product#orderProduct}. Removed from the table once selected.
 */
@Entity
@Table(name = "consumer_bids",
        uniqueConstraints = @UniqueConstraint(name = "uk_bid_product_bidder", columnNames = {"product_id", "bidder_id"}),
        indexes = @Index(name = "idx_bid_product", columnList = "product_id"))
public class Consumer {

    @Id
    private UUID id;

    @NotNull
    @Column(name = "product_id", nullable = false, updatable = false)
    private UUID productId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "product_id", insertable = false, updatable = false)
    private Product product;

    @NotNull
    @Column(name = "bidder_id", nullable = false, updatable = false)
    private UUID bidderId;

    @Column(length = 2000)
    private String description;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "consumer_bid_requirements", joinColumns = @JoinColumn(name = "bid_id"))
    @OrderColumn(name = "position")
    @Column(name = "tag", nullable = false, length = 64)
    private List<String> requirements = new ArrayList<>();

    protected Consumer() {}

    /**
     * Builds a bid. Tags are trimmed, blanks dropped and duplicates removed keeping
     * the first occurrence.
     */
    public static Consumer create(UUID bidderId, UUID productId, String description, List<String> requirements) {
        var bid = new Consumer();
        bid.id = UUID.randomUUID();
        bid.bidderId = Objects.requireNonNull(bidderId, "Bidder cannot be null");
        bid.productId = Objects.requireNonNull(productId, "Product ID cannot be null");
        bid.description = description == null ? "" : description;
        bid.requirements = normalize(requirements);
        return bid;
    }

    private static List<String> normalize(List<String> tags) {
        if (tags == null) {
            return new ArrayList<>();
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                unique.add(tag.trim());
            }
        }
        return new ArrayList<>(unique);
    }

    void attachTo(Product owner) {
        this.product = owner;
    }

    void detach() {
        this.product = null;
    }

    public UUID getId() { return id; }
    public UUID getProductId() { return productId; }
    public UUID getBidderId() { return bidderId; }
    public String getDescription() { return description; }
    public List<String> getRequirements() { return Collections.unmodifiableList(requirements); }
}
