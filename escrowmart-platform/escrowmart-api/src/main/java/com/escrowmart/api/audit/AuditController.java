package com.escrowmart.api.audit;

import com.escrowmart.api.audit.AuditService.ReceiptVerificationResult;
import com.escrowmart.api.audit.AuditService.TrailVerificationResult;
import com.escrowmart.core.domain.AuditReceipt;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/audit")
public class AuditController {

    private final AuditService auditService;

    public AuditController(AuditService auditService) {
        this.auditService = auditService;
    }

    @GetMapping("/resources/{resourceId}")
    public ResponseEntity<List<ReceiptView>> getReceipts(@PathVariable UUID resourceId) {
        return ResponseEntity.ok(auditService.getReceiptsByResource(resourceId).stream()
                .map(ReceiptView::of)
                .toList());
    }

    @GetMapping("/resources/{resourceId}/verify")
    public ResponseEntity<TrailVerificationResult> verifyTrail(@PathVariable UUID resourceId) {
        return ResponseEntity.ok(auditService.verifyTrail(resourceId));
    }

    @GetMapping("/receipts/{receiptId}/verify")
    public ResponseEntity<ReceiptVerificationResult> verifyReceipt(@PathVariable UUID receiptId) {
        return ResponseEntity.ok(auditService.verifyReceiptIntegrity(receiptId));
    }

    public record ReceiptView(
        UUID receiptId,
        long sequence,
        AuditReceipt.EventType eventType,
        AuditReceipt.ResourceKind resourceKind,
        Instant recordedAt,
        UUID actorId,
        String hash,
        String previousHash
    ) {
        static ReceiptView of(AuditReceipt receipt) {
            return new ReceiptView(receipt.getId(), receipt.getSequence(), receipt.getEventType(),
                    receipt.getResourceKind(), receipt.getRecordedAt(), receipt.getActorId(), receipt.getHash(),
                    receipt.getPreviousHash());
        }
    }
}
