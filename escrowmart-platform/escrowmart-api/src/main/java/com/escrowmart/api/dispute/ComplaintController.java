package com.escrowmart.api.dispute;

import com.escrowmart.api.dispute.DisputeService.ComplaintView;
import com.escrowmart.api.dispute.DisputeService.Resolution;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.UUID;

/**
 * Complaint lookup and arbitration API.
 */
@RestController
@RequestMapping("/api/v1/complaints")
public class ComplaintController {

    private final DisputeService disputeService;
    private final Clock clock;

    public ComplaintController(DisputeService disputeService, Clock clock) {
        this.disputeService = disputeService;
        this.clock = clock;
    }

    @GetMapping("/{complaintId}")
    public ResponseEntity<ComplaintView> getComplaint(@PathVariable UUID complaintId) {
        return ResponseEntity.ok(disputeService.getComplaint(complaintId));
    }

    /**
     * POST /api/v1/complaints/{complaintId}/resolve
     */
    @PostMapping("/{complaintId}/resolve")
    public ResponseEntity<Resolution> resolve(
            @PathVariable UUID complaintId,
            @RequestHeader("X-Principal-ID") UUID caller,
            @Valid @RequestBody ResolveRequest request) {
        Resolution resolution = switch (request.outcome()) {
            case CONSUMER -> disputeService.resolveForConsumer(complaintId, request.adminCapId(), caller, clock.instant());
            case SUPPLIER -> disputeService.resolveForSupplier(complaintId, request.adminCapId(), caller, clock.instant());
        };
        return ResponseEntity.ok(resolution);
    }

    public enum Outcome { CONSUMER, SUPPLIER }

    public record ResolveRequest(@NotNull UUID adminCapId, @NotNull Outcome outcome) {}
}
