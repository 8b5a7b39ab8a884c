package com.escrowmart.api.product;

import com.escrowmart.core.domain.Consumer;
import com.escrowmart.core.domain.Escrow;
import com.escrowmart.core.domain.Product;
import com.escrowmart.core.domain.Release;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read models returned by the product services.
 */
public final class ProductViews {

    private ProductViews() {}

    public record ProductView(
            UUID id,
            UUID supplierId,
            String description,
            int quality,
            BigDecimal price,
            Instant createdAt,
            Instant deadline,
            boolean biddingClosed,
            UUID consumerId,
            boolean orderSubmitted,
            boolean disputeOpen,
            BigDecimal escrowBalance,
            Escrow.EscrowState escrowState,
            Product.LifecycleState lifecycleState,
            int pendingBids
    ) {
        public static ProductView of(Product product) {
            return new ProductView(
                    product.getId(),
                    product.getSupplierId(),
                    product.getDescription(),
                    product.getQuality(),
                    product.getPrice(),
                    product.getCreatedAt(),
                    product.getDeadline(),
                    product.isBiddingClosed(),
                    product.getConsumerId().orElse(null),
                    product.isOrderSubmitted(),
                    product.isDisputeOpen(),
                    product.getEscrowBalance(),
                    product.getEscrowState(),
                    product.lifecycleState(),
                    product.getConsumers().size()
            );
        }
    }

    public record BidView(UUID bidId, UUID productId, UUID bidderId, String description, List<String> requirements) {
        public static BidView of(Consumer bid) {
            return new BidView(bid.getId(), bid.getProductId(), bid.getBidderId(), bid.getDescription(),
                    List.copyOf(bid.getRequirements()));
        }
    }

    public record ListingResult(ProductView product, UUID productCapId) {}

    public record SelectionResult(ProductView product, BidView chosenBid) {}

    public record ReleaseView(UUID productId, UUID recipientId, BigDecimal amount, Release.Reason reason) {
        public static ReleaseView of(Release release) {
            return new ReleaseView(release.productId(), release.recipientId(), release.payment().amount(), release.reason());
        }
    }
}
