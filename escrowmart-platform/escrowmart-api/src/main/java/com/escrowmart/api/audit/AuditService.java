package com.escrowmart.api.audit;

import com.escrowmart.core.domain.AuditChainHead;
import com.escrowmart.core.domain.AuditReceipt;
import com.escrowmart.core.domain.AuditReceipt.EventType;
import com.escrowmart.core.domain.AuditReceipt.ResourceKind;
import com.escrowmart.core.domain.MarketError;
import com.escrowmart.core.domain.MarketplaceException;
import com.escrowmart.core.repository.AuditChainHeadRepository;
import com.escrowmart.core.repository.AuditReceiptRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Audit receipt ledger.
 * Append-only storage with hash chaining; every marketplace transition leaves a receipt.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditReceiptRepository auditRepository;
    private final AuditChainHeadRepository chainHeadRepository;

    public AuditService(AuditReceiptRepository auditRepository, AuditChainHeadRepository chainHeadRepository) {
        this.auditRepository = auditRepository;
        this.chainHeadRepository = chainHeadRepository;
    }

    /**
     * Appends a sealed receipt after the chain tip.
     * The tip row stays locked until the caller's transaction ends, so appends from
     * transitions on different records are numbered one after another.
     */
    @Transactional
    public AuditReceipt appendReceipt(
            EventType eventType,
            UUID actorId,
            UUID resourceId,
            ResourceKind resourceKind,
            String detailsDigest,
            Instant at) {

        AuditChainHead head = chainHeadRepository.findByIdForUpdate(AuditChainHead.CHAIN_ID)
                .orElseThrow(() -> new IllegalStateException("Audit chain head is missing"));
        AuditReceipt receipt = AuditReceipt.chainedAfter(
                head,
                eventType,
                actorId,
                resourceId,
                resourceKind,
                detailsDigest,
                at);
        receipt.seal(Digests.sha256(receipt.canonicalForm()));
        head.advanceTo(receipt);
        chainHeadRepository.save(head);
        return auditRepository.save(receipt);
    }

    /**
     * Verifies a receipt's own hash and its link to the preceding receipt.
     */
    public ReceiptVerificationResult verifyReceiptIntegrity(UUID receiptId) {
        AuditReceipt receipt = auditRepository.findById(receiptId)
                .orElseThrow(() -> MarketplaceException.of(MarketError.NO_SUCH_RECEIPT, "Receipt not found: " + receiptId));
        return verify(receipt);
    }

    /**
     * Verifies every receipt recorded for a resource.
     */
    public TrailVerificationResult verifyTrail(UUID resourceId) {
        List<ReceiptVerificationResult> results = auditRepository.findByResourceIdOrderBySequenceAsc(resourceId).stream()
                .map(this::verify)
                .toList();
        boolean valid = results.stream().allMatch(ReceiptVerificationResult::valid);
        if (!valid) {
            log.warn("Audit trail of {} failed verification", resourceId);
        }
        return new TrailVerificationResult(resourceId, results.size(), valid, results);
    }

    public List<AuditReceipt> getReceiptsByResource(UUID resourceId) {
        return auditRepository.findByResourceIdOrderBySequenceAsc(resourceId);
    }

    private ReceiptVerificationResult verify(AuditReceipt receipt) {
        boolean hashValid = receipt.isSealed()
                && Digests.sha256(receipt.canonicalForm()).equals(receipt.getHash());

        // The predecessor must exist and sit exactly one step earlier.
        boolean chainValid = receipt.isFirst()
                ? receipt.getSequence() == 1
                : auditRepository.findByHash(receipt.getPreviousHash())
                        .map(prev -> prev.getSequence() == receipt.getSequence() - 1)
                        .orElse(false);

        return new ReceiptVerificationResult(receipt.getId(), receipt.getSequence(), hashValid, chainValid,
                hashValid && chainValid);
    }

    public record ReceiptVerificationResult(
            UUID receiptId,
            long sequence,
            boolean hashValid,
            boolean chainValid,
            boolean valid
    ) {}

    public record TrailVerificationResult(
            UUID resourceId,
            int receiptCount,
            boolean valid,
            List<ReceiptVerificationResult> receipts
    ) {}
}
