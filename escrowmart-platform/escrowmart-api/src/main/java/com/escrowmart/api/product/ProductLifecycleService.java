package com.escrowmart.api.product;

import com.escrowmart.api.audit.AuditService;
import com.escrowmart.api.audit.Digests;
import com.escrowmart.api.capability.CapabilityService;
import com.escrowmart.api.config.MarketplaceProperties;
import com.escrowmart.api.event.ProductListedEvent;
import com.escrowmart.api.product.ProductViews.BidView;
import com.escrowmart.api.product.ProductViews.ListingResult;
import com.escrowmart.api.product.ProductViews.ProductView;
import com.escrowmart.api.product.ProductViews.ReleaseView;
import com.escrowmart.api.product.ProductViews.SelectionResult;
import com.escrowmart.api.settlement.SettlementService;
import com.escrowmart.core.domain.AuditReceipt;
import com.escrowmart.core.domain.Consumer;
import com.escrowmart.core.domain.MarketError;
import com.escrowmart.core.domain.MarketplaceException;
import com.escrowmart.core.domain.Payment;
import com.escrowmart.core.domain.Product;
import com.escrowmart.core.domain.ProductCap;
import com.escrowmart.core.domain.Release;
import com.escrowmart.core.policy.RequirementPolicy;
import com.escrowmart.core.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Product lifecycle: listing, bidding, selection with escrow, order submission
 * and confirmation.
 *
 * Every mutating call loads the product under a row lock and either completes
 * or leaves it untouched.
 */
@Service
public class ProductLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(ProductLifecycleService.class);

    private final ProductRepository productRepository;
    private final CapabilityService capabilityService;
    private final SettlementService settlementService;
    private final AuditService auditService;
    private final ApplicationEventPublisher eventPublisher;
    private final RequirementPolicy requirementPolicy;
    private final MarketplaceProperties properties;

    public ProductLifecycleService(
            ProductRepository productRepository,
            CapabilityService capabilityService,
            SettlementService settlementService,
            AuditService auditService,
            ApplicationEventPublisher eventPublisher,
            RequirementPolicy requirementPolicy,
            MarketplaceProperties properties) {
        this.productRepository = productRepository;
        this.capabilityService = capabilityService;
        this.settlementService = settlementService;
        this.auditService = auditService;
        this.eventPublisher = eventPublisher;
        this.requirementPolicy = requirementPolicy;
        this.properties = properties;
    }

    // ==================== Listing ====================

    /**
     * Lists a product and issues its capability to the supplier.
     */
    @Transactional
    public ListingResult newProduct(UUID supplierId, String description, int quality, BigDecimal price,
                                    Duration duration, Instant now) {
        Product product = Product.list(supplierId, description, quality, price, now, duration,
                properties.getListing().getQualityValidation());
        Product saved = productRepository.save(product);
        ProductCap cap = capabilityService.issueProductCap(saved.getId(), supplierId, now);

        audit(AuditReceipt.EventType.PRODUCT_LISTED, supplierId, saved, now);
        eventPublisher.publishEvent(new ProductListedEvent(saved.getId(), supplierId, price, now));
        log.info("Product {} listed by {} at price {} until {}", saved.getId(), supplierId,
                price.toPlainString(), saved.getDeadline());

        return new ListingResult(ProductView.of(saved), cap.getId());
    }

    // ==================== Bidding ====================

    /**
     * Builds a bid without touching any product.
     */
    public Consumer newConsumer(UUID bidderId, UUID productId, String description, List<String> requirements) {
        return Consumer.create(bidderId, productId, description, requirements);
    }

    /**
     * Adds a bid to the product's bid table.
     */
    @Transactional
    public BidView orderProduct(Consumer bid, Instant now) {
        Objects.requireNonNull(bid, "Bid cannot be null");
        Product product = lockProduct(bid.getProductId());
        product.orderProduct(bid, requirementPolicy);
        productRepository.save(product);

        audit(AuditReceipt.EventType.BID_PLACED, bid.getBidderId(), product, now);
        log.info("Bid {} placed on product {} by {}", bid.getId(), product.getId(), bid.getBidderId());
        return BidView.of(bid);
    }

    /**
     * Convenience for {@link #newConsumer} followed by {@link #orderProduct}.
     */
    @Transactional
    public BidView placeBid(UUID bidderId, UUID productId, String description, List<String> requirements, Instant now) {
        return orderProduct(newConsumer(bidderId, productId, description, requirements), now);
    }

    // ==================== Selection ====================

    /**
     * Chooses the winning bid. The whole payment is locked in escrow and the bid is
     * returned to the caller.
     */
    @Transactional
    public SelectionResult chooseConsumer(UUID productId, UUID capId, UUID caller, BigDecimal amount,
                                          UUID chosenBidder, Instant now) {
        ProductCap cap = capabilityService.requireProductCap(capId, caller);
        Product product = lockProduct(productId);
        Payment payment = Payment.of(amount);

        Consumer chosen = product.chooseConsumer(cap, payment, chosenBidder, requirementPolicy);
        Product saved = productRepository.save(product);
        settlementService.recordEscrowFill(productId, caller, chosenBidder, payment.amount(), now);

        audit(AuditReceipt.EventType.CONSUMER_SELECTED, caller, saved, now);
        log.info("Consumer {} chosen for product {}; {} held in escrow", chosenBidder, productId,
                payment.amount().toPlainString());
        return new SelectionResult(ProductView.of(saved), BidView.of(chosen));
    }

    // ==================== Fulfillment ====================

    @Transactional
    public ProductView submitOrder(UUID productId, UUID caller, Instant now) {
        Product product = lockProduct(productId);
        product.submitOrder(caller, now);
        Product saved = productRepository.save(product);

        audit(AuditReceipt.EventType.ORDER_SUBMITTED, caller, saved, now);
        log.info("Order on product {} submitted by {}", productId, caller);
        return ProductView.of(saved);
    }

    /**
     * Confirms the order and releases the whole escrow to the chosen consumer.
     */
    @Transactional
    public ReleaseView confirmOrder(UUID productId, UUID capId, UUID caller, Instant now) {
        ProductCap cap = capabilityService.requireProductCap(capId, caller);
        Product product = lockProduct(productId);

        Release release = product.confirmOrder(cap, now);
        productRepository.save(product);
        settlementService.deliver(release, now);

        audit(AuditReceipt.EventType.ORDER_CONFIRMED, caller, product, now);
        return ReleaseView.of(release);
    }

    // ==================== Queries ====================

    @Transactional(readOnly = true)
    public ProductView getProduct(UUID productId) {
        return ProductView.of(findProduct(productId));
    }

    @Transactional(readOnly = true)
    public List<ProductView> listBySupplier(UUID supplierId) {
        return productRepository.findBySupplierIdOrderByCreatedAtDesc(supplierId).stream()
                .map(ProductView::of)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<BidView> listBids(UUID productId) {
        return findProduct(productId).getConsumers().values().stream()
                .map(BidView::of)
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<BidView> findBid(UUID productId, UUID bidderId) {
        return findProduct(productId).findBid(bidderId).map(BidView::of);
    }

    private Product findProduct(UUID productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> MarketplaceException.of(MarketError.NO_SUCH_PRODUCT, "Product not found: " + productId));
    }

    private Product lockProduct(UUID productId) {
        return productRepository.findByIdForUpdate(productId)
                .orElseThrow(() -> MarketplaceException.of(MarketError.NO_SUCH_PRODUCT, "Product not found: " + productId));
    }

    private void audit(AuditReceipt.EventType type, UUID actor, Product product, Instant now) {
        auditService.appendReceipt(type, actor, product.getId(), AuditReceipt.ResourceKind.PRODUCT,
                computeDetailsHash(product), now);
    }

    static String computeDetailsHash(Product product) {
        return Digests.sha256Of(
                product.getId(),
                product.lifecycleState().name(),
                product.getConsumerId().orElse(null),
                product.getEscrowState().name(),
                product.getEscrowBalance().toPlainString()
        );
    }
}
