package com.escrowmart.core.domain;

import com.escrowmart.core.policy.RequirementPolicy;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A listed product and the escrow held against it.
 *
 * All transitions check every precondition before touching state, so a rejected
 * call leaves the record exactly as it was. Transition methods are synchronized on
 * the instance; persistent callers additionally hold a row lock and a version check.
 */
@Entity
@Table(name = "products", indexes = {
    @Index(name = "idx_product_supplier", columnList = "supplier_id"),
    @Index(name = "idx_product_deadline", columnList = "deadline")
})
public class Product {

    @Id
    private UUID id;

    @NotNull
    @Column(name = "supplier_id", nullable = false, updatable = false)
    private UUID supplierId;

    @Column(length = 2000)
    private String description;

    @Column(nullable = false)
    private int quality;

    @NotNull
    @Positive
    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal price;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @NotNull
    @Column(nullable = false, updatable = false)
    private Instant deadline;

    @OneToMany(mappedBy = "product", cascade = CascadeType.ALL, orphanRemoval = true)
    @MapKey(name = "bidderId")
    private Map<UUID, Consumer> consumers = new LinkedHashMap<>();

    @Column(name = "bidding_closed", nullable = false)
    private boolean biddingClosed;

    @Column(name = "consumer_id")
    private UUID consumerId;

    @Column(name = "order_submitted", nullable = false)
    private boolean orderSubmitted;

    @Column(name = "dispute_open", nullable = false)
    private boolean disputeOpen;

    @Embedded
    private Escrow escrow;

    @Enumerated(EnumType.STRING)
    @Column(name = "settled_by", length = 32)
    private Release.Reason settledBy;

    @Version
    private Long version;

    protected Product() {}

    /**
     * Lists a new product. The deadline is {@code now + duration}.
     */
    public static Product list(UUID supplierId, String description, int quality, BigDecimal price,
                               Instant now, Duration duration, QualityValidation validation) {
        Objects.requireNonNull(supplierId, "Supplier cannot be null");
        Objects.requireNonNull(now, "Current time cannot be null");
        Objects.requireNonNull(validation, "Quality validation cannot be null");
        if (price == null || price.signum() <= 0) {
            throw MarketplaceException.of(MarketError.INVALID_LISTING, "Price must be positive");
        }
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw MarketplaceException.of(MarketError.INVALID_LISTING, "Duration must be positive");
        }
        validation.check(quality);
        Instant deadline = deadlineAfter(now, duration);

        var product = new Product();
        product.id = UUID.randomUUID();
        product.supplierId = supplierId;
        product.description = description == null ? "" : description;
        product.quality = quality;
        product.price = price;
        product.createdAt = now;
        product.deadline = deadline;
        product.escrow = Escrow.empty();
        return product;
    }

    private static Instant deadlineAfter(Instant now, Duration duration) {
        try {
            return now.plus(duration);
        } catch (ArithmeticException | DateTimeException e) {
            throw MarketplaceException.of(MarketError.INVALID_LISTING,
                    "Duration " + duration + " puts the deadline out of range");
        }
    }

    /**
     * Places a bid in the bid table.
     */
    public synchronized void orderProduct(Consumer bid, RequirementPolicy policy) {
        Objects.requireNonNull(bid, "Bid cannot be null");
        Objects.requireNonNull(policy, "Policy cannot be null");
        if (biddingClosed) {
            throw MarketplaceException.of(MarketError.OUT_OF_STOCK, "Bidding is closed for product " + id);
        }
        if (!id.equals(bid.getProductId())) {
            throw MarketplaceException.of(MarketError.BID_PRODUCT_MISMATCH,
                    "Bid targets product " + bid.getProductId() + ", not " + id);
        }
        checkRequirements(bid, policy);
        if (consumers.containsKey(bid.getBidderId())) {
            throw MarketplaceException.of(MarketError.DUPLICATE_BID,
                    "Bidder " + bid.getBidderId() + " already has a pending bid");
        }
        bid.attachTo(this);
        consumers.put(bid.getBidderId(), bid);
    }

    /**
     * Selects the winning bid and locks the whole payment in escrow.
     * Returns the bid, which is no longer in the bid table.
     */
    public synchronized Consumer chooseConsumer(ProductCap cap, Payment payment, UUID chosen,
                                                RequirementPolicy policy) {
        Objects.requireNonNull(payment, "Payment cannot be null");
        Objects.requireNonNull(chosen, "Chosen bidder cannot be null");
        Objects.requireNonNull(policy, "Policy cannot be null");
        checkCapability(cap);
        if (biddingClosed) {
            throw MarketplaceException.of(MarketError.OUT_OF_STOCK, "A consumer was already chosen for product " + id);
        }
        if (!payment.covers(price)) {
            throw MarketplaceException.of(MarketError.INSUFFICIENT_FUNDS,
                    "Payment " + payment.amount().toPlainString() + " below price " + price.toPlainString());
        }
        Consumer bid = consumers.get(chosen);
        if (bid == null) {
            throw MarketplaceException.of(MarketError.NO_SUCH_BID, "No pending bid from " + chosen);
        }
        checkRequirements(bid, policy);

        escrow.join(payment);
        consumers.remove(chosen);
        bid.detach();
        this.biddingClosed = true;
        this.consumerId = chosen;
        return bid;
    }

    /**
     * The chosen consumer confirms intent to proceed. Repeatable until the deadline.
     */
    public synchronized void submitOrder(UUID caller, Instant now) {
        Objects.requireNonNull(now, "Current time cannot be null");
        if (!now.isBefore(deadline)) {
            throw MarketplaceException.of(MarketError.DEADLINE_EXPIRED, "Deadline " + deadline + " has passed");
        }
        if (consumerId == null || !consumerId.equals(caller)) {
            throw MarketplaceException.of(MarketError.WRONG_ADDRESS, "Only the chosen consumer may submit the order");
        }
        this.orderSubmitted = true;
    }

    /**
     * Releases the full escrow to the chosen consumer.
     */
    public synchronized Release confirmOrder(ProductCap cap, Instant now) {
        Objects.requireNonNull(now, "Current time cannot be null");
        checkCapability(cap);
        if (!orderSubmitted) {
            throw MarketplaceException.of(MarketError.ORDER_NOT_SUBMITTED, "Order has not been submitted");
        }
        if (!now.isBefore(deadline)) {
            throw MarketplaceException.of(MarketError.DEADLINE_EXPIRED, "Deadline " + deadline + " has passed");
        }
        if (disputeOpen) {
            throw MarketplaceException.of(MarketError.DISPUTE_ALREADY_OPEN, "Product " + id + " is under dispute");
        }
        Payment payment = escrow.withdrawAll();
        this.settledBy = Release.Reason.ORDER_CONFIRMED;
        return new Release(id, consumerId, payment, Release.Reason.ORDER_CONFIRMED);
    }

    /**
     * Opens a dispute after the deadline. Escrow is untouched.
     */
    public synchronized Complaint fileComplaint(UUID caller, Instant now, String reason) {
        Objects.requireNonNull(now, "Current time cannot be null");
        if (!now.isAfter(deadline)) {
            throw MarketplaceException.of(MarketError.DEADLINE_NOT_REACHED,
                    "Complaints open after " + deadline);
        }
        if (caller == null || !(caller.equals(supplierId) || caller.equals(consumerId))) {
            throw MarketplaceException.of(MarketError.INCORRECT_SUPPLIER,
                    "Only the supplier or the chosen consumer may complain");
        }
        if (disputeOpen) {
            throw MarketplaceException.of(MarketError.DISPUTE_ALREADY_OPEN, "Product " + id + " is already disputed");
        }
        if (!escrow.isHeld()) {
            throw MarketplaceException.of(MarketError.NOTHING_TO_DISPUTE, "No escrow is held for product " + id);
        }
        Complaint complaint = Complaint.file(id, consumerId, supplierId, caller, reason, now);
        this.disputeOpen = true;
        return complaint;
    }

    public synchronized Release resolveDisputeForConsumer(AdminCap admin, Complaint complaint, Instant now) {
        return resolve(admin, complaint, now, true);
    }

    public synchronized Release resolveDisputeForSupplier(AdminCap admin, Complaint complaint, Instant now) {
        return resolve(admin, complaint, now, false);
    }

    private Release resolve(AdminCap admin, Complaint complaint, Instant now, boolean forConsumer) {
        Objects.requireNonNull(complaint, "Complaint cannot be null");
        Objects.requireNonNull(now, "Current time cannot be null");
        if (admin == null) {
            throw MarketplaceException.of(MarketError.NOT_ADMIN, "Arbitration requires the admin capability");
        }
        if (!disputeOpen || complaint.isResolved()) {
            throw MarketplaceException.of(MarketError.DISPUTE_FALSE, "No open dispute on product " + id);
        }
        if (!id.equals(complaint.getProductId())) {
            throw MarketplaceException.of(MarketError.COMPLAINT_MISMATCH,
                    "Complaint " + complaint.getId() + " belongs to another product");
        }
        Payment payment = escrow.withdrawAll();
        Release.Reason reason = forConsumer ? Release.Reason.DISPUTE_FOR_CONSUMER : Release.Reason.DISPUTE_FOR_SUPPLIER;
        UUID recipient = forConsumer ? complaint.getConsumerId() : supplierId;
        this.disputeOpen = false;
        this.settledBy = reason;
        complaint.decide(forConsumer, now);
        return new Release(id, recipient, payment, reason);
    }

    private void checkCapability(ProductCap cap) {
        if (cap == null || !cap.authorizes(this)) {
            throw MarketplaceException.of(MarketError.INVALID_CAPABILITY, "Capability does not control product " + id);
        }
    }

    private void checkRequirements(Consumer bid, RequirementPolicy policy) {
        Optional<String> unmet = policy.firstUnmet(this, bid.getRequirements());
        if (unmet.isPresent()) {
            throw MarketplaceException.of(MarketError.REQUIREMENTS_NOT_MET,
                    "Requirement '" + unmet.get() + "' not met by quality " + quality);
        }
    }

    public synchronized LifecycleState lifecycleState() {
        if (settledBy != null) {
            return switch (settledBy) {
                case ORDER_CONFIRMED -> LifecycleState.CONFIRMED;
                case DISPUTE_FOR_CONSUMER -> LifecycleState.RESOLVED_FOR_CONSUMER;
                case DISPUTE_FOR_SUPPLIER -> LifecycleState.RESOLVED_FOR_SUPPLIER;
            };
        }
        if (disputeOpen) return LifecycleState.DISPUTED;
        if (orderSubmitted) return LifecycleState.SUBMITTED;
        if (biddingClosed) return LifecycleState.SELECTED;
        return consumers.isEmpty() ? LifecycleState.LISTED : LifecycleState.BIDDING_OPEN;
    }

    public synchronized Optional<Consumer> findBid(UUID bidderId) {
        return Optional.ofNullable(consumers.get(bidderId));
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getSupplierId() { return supplierId; }
    public String getDescription() { return description; }
    public int getQuality() { return quality; }
    public BigDecimal getPrice() { return price; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getDeadline() { return deadline; }
    public synchronized Map<UUID, Consumer> getConsumers() { return Collections.unmodifiableMap(new LinkedHashMap<>(consumers)); }
    public boolean isBiddingClosed() { return biddingClosed; }
    public Optional<UUID> getConsumerId() { return Optional.ofNullable(consumerId); }
    public boolean isOrderSubmitted() { return orderSubmitted; }
    public boolean isDisputeOpen() { return disputeOpen; }
    public BigDecimal getEscrowBalance() { return escrow.getBalance(); }
    public Escrow.EscrowState getEscrowState() { return escrow.getState(); }
    public Long getVersion() { return version; }

    public enum LifecycleState {
        LISTED,
        BIDDING_OPEN,
        SELECTED,
        SUBMITTED,
        CONFIRMED,
        DISPUTED,
        RESOLVED_FOR_CONSUMER,
        RESOLVED_FOR_SUPPLIER
    }
}
