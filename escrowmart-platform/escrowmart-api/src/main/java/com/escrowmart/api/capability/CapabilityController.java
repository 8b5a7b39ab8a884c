package com.escrowmart.api.capability;

import com.escrowmart.api.capability.CapabilityService.CapabilityView;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.UUID;

/**
 * Capability transfer API.
 */
@RestController
@RequestMapping("/api/v1/capabilities")
public class CapabilityController {

    private final CapabilityService capabilityService;
    private final Clock clock;

    public CapabilityController(CapabilityService capabilityService, Clock clock) {
        this.capabilityService = capabilityService;
        this.clock = clock;
    }

    /**
     * Current holder of a product's capability.
     * GET /api/v1/capabilities/product?productId=...
     */
    @GetMapping("/product")
    public ResponseEntity<CapabilityView> findProductCap(@RequestParam UUID productId) {
        return capabilityService.findProductCapFor(productId)
                .map(CapabilityView::of)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * POST /api/v1/capabilities/product/{capId}/transfer
     */
    @PostMapping("/product/{capId}/transfer")
    public ResponseEntity<CapabilityView> transferProductCap(
            @PathVariable UUID capId,
            @RequestHeader("X-Principal-ID") UUID caller,
            @Valid @RequestBody TransferRequest request) {
        return ResponseEntity.ok(capabilityService.transferProductCap(capId, caller, request.newHolderId(), clock.instant()));
    }

    /**
     * POST /api/v1/capabilities/admin/{capId}/transfer
     */
    @PostMapping("/admin/{capId}/transfer")
    public ResponseEntity<CapabilityView> transferAdminCap(
            @PathVariable UUID capId,
            @RequestHeader("X-Principal-ID") UUID caller,
            @Valid @RequestBody TransferRequest request) {
        return ResponseEntity.ok(capabilityService.transferAdminCap(capId, caller, request.newHolderId(), clock.instant()));
    }

    public record TransferRequest(@NotNull UUID newHolderId) {}
}
