package com.escrowmart.api.dispute;

import com.escrowmart.api.audit.AuditService;
import com.escrowmart.api.audit.Digests;
import com.escrowmart.api.capability.CapabilityService;
import com.escrowmart.api.event.DisputeRaisedEvent;
import com.escrowmart.api.event.DisputeResolvedEvent;
import com.escrowmart.api.product.ProductViews.ReleaseView;
import com.escrowmart.api.settlement.SettlementService;
import com.escrowmart.core.domain.AdminCap;
import com.escrowmart.core.domain.AuditReceipt;
import com.escrowmart.core.domain.Complaint;
import com.escrowmart.core.domain.MarketError;
import com.escrowmart.core.domain.MarketplaceException;
import com.escrowmart.core.domain.Product;
import com.escrowmart.core.domain.Release;
import com.escrowmart.core.repository.ComplaintRepository;
import com.escrowmart.core.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Complaints after the deadline and their arbitration by the admin capability holder.
 *
 * Escrow stays held while a dispute is open; resolution releases all of it to one side.
 * There is no timeout.
 */
@Service
public class DisputeService {

    private static final Logger log = LoggerFactory.getLogger(DisputeService.class);

    private final ProductRepository productRepository;
    private final ComplaintRepository complaintRepository;
    private final CapabilityService capabilityService;
    private final SettlementService settlementService;
    private final AuditService auditService;
    private final ApplicationEventPublisher eventPublisher;

    public DisputeService(
            ProductRepository productRepository,
            ComplaintRepository complaintRepository,
            CapabilityService capabilityService,
            SettlementService settlementService,
            AuditService auditService,
            ApplicationEventPublisher eventPublisher) {
        this.productRepository = productRepository;
        this.complaintRepository = complaintRepository;
        this.capabilityService = capabilityService;
        this.settlementService = settlementService;
        this.auditService = auditService;
        this.eventPublisher = eventPublisher;
    }

    // ==================== Filing ====================

    /**
     * Opens a dispute on a product. Only the supplier or the chosen consumer may file,
     * and only after the deadline.
     */
    @Transactional
    public ComplaintView fileComplaint(UUID productId, UUID caller, String reason, Instant now) {
        Product product = productRepository.findByIdForUpdate(productId)
                .orElseThrow(() -> MarketplaceException.of(MarketError.NO_SUCH_PRODUCT, "Product not found: " + productId));

        Complaint complaint = product.fileComplaint(caller, now, reason);
        Complaint saved = complaintRepository.save(complaint);
        productRepository.save(product);

        auditService.appendReceipt(
                AuditReceipt.EventType.COMPLAINT_FILED,
                caller,
                productId,
                AuditReceipt.ResourceKind.PRODUCT,
                computeDetailsHash(saved),
                now
        );
        eventPublisher.publishEvent(new DisputeRaisedEvent(productId, saved.getId(), reason, now));
        log.info("Complaint {} filed on product {} by {}", saved.getId(), productId, caller);
        return ComplaintView.of(saved);
    }

    // ==================== Resolution ====================

    @Transactional
    public Resolution resolveForConsumer(UUID complaintId, UUID adminCapId, UUID caller, Instant now) {
        return resolve(complaintId, adminCapId, caller, now, true);
    }

    @Transactional
    public Resolution resolveForSupplier(UUID complaintId, UUID adminCapId, UUID caller, Instant now) {
        return resolve(complaintId, adminCapId, caller, now, false);
    }

    private Resolution resolve(UUID complaintId, UUID adminCapId, UUID caller, Instant now, boolean forConsumer) {
        AdminCap admin = capabilityService.requireAdminCap(adminCapId, caller);
        Complaint complaint = complaintRepository.findById(complaintId)
                .orElseThrow(() -> MarketplaceException.of(MarketError.NO_SUCH_COMPLAINT, "Complaint not found: " + complaintId));
        Product product = productRepository.findByIdForUpdate(complaint.getProductId())
                .orElseThrow(() -> MarketplaceException.of(MarketError.NO_SUCH_PRODUCT,
                        "Product not found: " + complaint.getProductId()));

        Release release = forConsumer
                ? product.resolveDisputeForConsumer(admin, complaint, now)
                : product.resolveDisputeForSupplier(admin, complaint, now);
        productRepository.save(product);
        Complaint saved = complaintRepository.save(complaint);
        settlementService.deliver(release, now);

        auditService.appendReceipt(
                AuditReceipt.EventType.DISPUTE_RESOLVED,
                caller,
                product.getId(),
                AuditReceipt.ResourceKind.PRODUCT,
                computeDetailsHash(saved),
                now
        );
        eventPublisher.publishEvent(new DisputeResolvedEvent(product.getId(), complaintId, forConsumer, now));
        log.info("Complaint {} on product {} resolved for {}", complaintId, product.getId(),
                forConsumer ? "consumer" : "supplier");
        return new Resolution(ComplaintView.of(saved), ReleaseView.of(release));
    }

    // ==================== Queries ====================

    public ComplaintView getComplaint(UUID complaintId) {
        return complaintRepository.findById(complaintId)
                .map(ComplaintView::of)
                .orElseThrow(() -> MarketplaceException.of(MarketError.NO_SUCH_COMPLAINT, "Complaint not found: " + complaintId));
    }

    public List<ComplaintView> listComplaints(UUID productId) {
        return complaintRepository.findByProductIdOrderByFiledAtDesc(productId).stream()
                .map(ComplaintView::of)
                .toList();
    }

    private String computeDetailsHash(Complaint complaint) {
        return Digests.sha256Of(
                complaint.getId(),
                complaint.getProductId(),
                complaint.getFiledBy(),
                complaint.isResolved(),
                complaint.getDecision()
        );
    }

    public record ComplaintView(
            UUID id,
            UUID productId,
            UUID consumerId,
            UUID supplierId,
            UUID filedBy,
            String reason,
            boolean decision,
            boolean resolved,
            Instant filedAt,
            Instant resolvedAt
    ) {
        static ComplaintView of(Complaint complaint) {
            return new ComplaintView(
                    complaint.getId(),
                    complaint.getProductId(),
                    complaint.getConsumerId(),
                    complaint.getSupplierId(),
                    complaint.getFiledBy(),
                    complaint.getReason(),
                    complaint.getDecision(),
                    complaint.isResolved(),
                    complaint.getFiledAt(),
                    complaint.getResolvedAt()
            );
        }
    }

    public record Resolution(ComplaintView complaint, ReleaseView release) {}
}
