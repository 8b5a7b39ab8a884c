package com.escrowmart.api.product;

import com.escrowmart.api.dispute.DisputeService;
import com.escrowmart.api.dispute.DisputeService.ComplaintView;
import com.escrowmart.api.product.ProductViews.BidView;
import com.escrowmart.api.product.ProductViews.ListingResult;
import com.escrowmart.api.product.ProductViews.ProductView;
import com.escrowmart.api.product.ProductViews.ReleaseView;
import com.escrowmart.api.product.ProductViews.SelectionResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Product lifecycle REST API.
 * The calling principal is taken from the {@code X-Principal-ID} header.
 */
@RestController
@RequestMapping("/api/v1/products")
public class ProductController {

    private final ProductLifecycleService lifecycleService;
    private final DisputeService disputeService;
    private final Clock clock;

    public ProductController(ProductLifecycleService lifecycleService, DisputeService disputeService, Clock clock) {
        this.lifecycleService = lifecycleService;
        this.disputeService = disputeService;
        this.clock = clock;
    }

    /**
     * List a product.
     * POST /api/v1/products
     */
    @PostMapping
    public ResponseEntity<ListingResult> listProduct(
            @RequestHeader("X-Principal-ID") UUID supplierId,
            @Valid @RequestBody ListProductRequest request) {
        ListingResult result = lifecycleService.newProduct(
                supplierId,
                request.description(),
                request.quality(),
                request.price(),
                Duration.ofSeconds(request.durationSeconds()),
                clock.instant());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @GetMapping("/{productId}")
    public ResponseEntity<ProductView> getProduct(@PathVariable UUID productId) {
        return ResponseEntity.ok(lifecycleService.getProduct(productId));
    }

    @GetMapping
    public ResponseEntity<List<ProductView>> listBySupplier(@RequestParam UUID supplierId) {
        return ResponseEntity.ok(lifecycleService.listBySupplier(supplierId));
    }

    /**
     * Place a bid.
     * POST /api/v1/products/{productId}/bids
     */
    @PostMapping("/{productId}/bids")
    public ResponseEntity<BidView> placeBid(
            @PathVariable UUID productId,
            @RequestHeader("X-Principal-ID") UUID bidderId,
            @Valid @RequestBody BidRequest request) {
        BidView bid = lifecycleService.placeBid(bidderId, productId, request.description(),
                request.requirements(), clock.instant());
        return ResponseEntity.status(HttpStatus.CREATED).body(bid);
    }

    @GetMapping("/{productId}/bids")
    public ResponseEntity<List<BidView>> listBids(@PathVariable UUID productId) {
        return ResponseEntity.ok(lifecycleService.listBids(productId));
    }

    @GetMapping("/{productId}/bids/{bidderId}")
    public ResponseEntity<BidView> getBid(@PathVariable UUID productId, @PathVariable UUID bidderId) {
        return lifecycleService.findBid(productId, bidderId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Choose the winning bid and lock payment in escrow.
     * POST /api/v1/products/{productId}/choose
     */
    @PostMapping("/{productId}/choose")
    public ResponseEntity<SelectionResult> chooseConsumer(
            @PathVariable UUID productId,
            @RequestHeader("X-Principal-ID") UUID caller,
            @Valid @RequestBody ChooseRequest request) {
        return ResponseEntity.ok(lifecycleService.chooseConsumer(productId, request.productCapId(), caller,
                request.payment(), request.consumerId(), clock.instant()));
    }

    @PostMapping("/{productId}/submit")
    public ResponseEntity<ProductView> submitOrder(
            @PathVariable UUID productId,
            @RequestHeader("X-Principal-ID") UUID caller) {
        return ResponseEntity.ok(lifecycleService.submitOrder(productId, caller, clock.instant()));
    }

    @PostMapping("/{productId}/confirm")
    public ResponseEntity<ReleaseView> confirmOrder(
            @PathVariable UUID productId,
            @RequestHeader("X-Principal-ID") UUID caller,
            @Valid @RequestBody ConfirmRequest request) {
        return ResponseEntity.ok(lifecycleService.confirmOrder(productId, request.productCapId(), caller, clock.instant()));
    }

    /**
     * File a complaint after the deadline.
     * POST /api/v1/products/{productId}/complaints
     */
    @PostMapping("/{productId}/complaints")
    public ResponseEntity<ComplaintView> fileComplaint(
            @PathVariable UUID productId,
            @RequestHeader("X-Principal-ID") UUID caller,
            @Valid @RequestBody ComplaintRequest request) {
        ComplaintView complaint = disputeService.fileComplaint(productId, caller, request.reason(), clock.instant());
        return ResponseEntity.status(HttpStatus.CREATED).body(complaint);
    }

    @GetMapping("/{productId}/complaints")
    public ResponseEntity<List<ComplaintView>> listComplaints(@PathVariable UUID productId) {
        return ResponseEntity.ok(disputeService.listComplaints(productId));
    }

    // DTOs
    public record ListProductRequest(
        @Size(max = 2000) String description,
        @NotNull Integer quality,
        @NotNull @Positive BigDecimal price,
        @Positive long durationSeconds
    ) {}

    public record BidRequest(
        @Size(max = 2000) String description,
        @Size(max = 32) List<@Size(max = 64) String> requirements
    ) {}

    public record ChooseRequest(
        @NotNull UUID productCapId,
        @NotNull UUID consumerId,
        @NotNull @Positive BigDecimal payment
    ) {}

    public record ConfirmRequest(@NotNull UUID productCapId) {}

    public record ComplaintRequest(@Size(max = 2000) String reason) {}
}
