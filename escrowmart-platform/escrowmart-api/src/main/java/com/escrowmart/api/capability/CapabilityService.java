package com.escrowmart.api.capability;

import com.escrowmart.api.audit.AuditService;
import com.escrowmart.api.audit.Digests;
import com.escrowmart.core.domain.AdminCap;
import com.escrowmart.core.domain.AuditReceipt;
import com.escrowmart.core.domain.MarketError;
import com.escrowmart.core.domain.MarketplaceException;
import com.escrowmart.core.domain.ProductCap;
import com.escrowmart.core.repository.AdminCapRepository;
import com.escrowmart.core.repository.ProductCapRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Registry of issued capabilities.
 *
 * A capability is presented by id together with the calling principal. It is honoured
 * only when it exists and the caller is its current holder.
 */
@Service
public class CapabilityService {

    private static final Logger log = LoggerFactory.getLogger(CapabilityService.class);

    private final ProductCapRepository productCapRepository;
    private final AdminCapRepository adminCapRepository;
    private final AuditService auditService;

    public CapabilityService(
            ProductCapRepository productCapRepository,
            AdminCapRepository adminCapRepository,
            AuditService auditService) {
        this.productCapRepository = productCapRepository;
        this.adminCapRepository = adminCapRepository;
        this.auditService = auditService;
    }

    // ==================== Product capabilities ====================

    @Transactional
    public ProductCap issueProductCap(UUID productId, UUID holderId, Instant now) {
        return productCapRepository.save(ProductCap.issue(productId, holderId, now));
    }

    /**
     * Resolves a presented product capability. An unknown id or a caller who does not
     * hold it yields {@code INVALID_CAPABILITY}.
     */
    public ProductCap requireProductCap(UUID capId, UUID caller) {
        ProductCap cap = capId == null ? null : productCapRepository.findById(capId).orElse(null);
        if (cap == null || !cap.isHeldBy(caller)) {
            log.warn("Rejected product capability {} presented by {}", capId, caller);
            throw MarketplaceException.of(MarketError.INVALID_CAPABILITY, "Capability not held by caller");
        }
        return cap;
    }

    public Optional<ProductCap> findProductCapFor(UUID productId) {
        return productCapRepository.findByProductId(productId);
    }

    @Transactional
    public CapabilityView transferProductCap(UUID capId, UUID caller, UUID newHolder, Instant now) {
        Objects.requireNonNull(newHolder, "New holder cannot be null");
        ProductCap cap = requireProductCap(capId, caller);
        cap.transferTo(newHolder);
        productCapRepository.save(cap);
        recordTransfer(caller, cap.getId(), AuditReceipt.ResourceKind.PRODUCT_CAP, newHolder, now);
        log.info("Product capability {} for product {} transferred to {}", cap.getId(), cap.getProductId(), newHolder);
        return CapabilityView.of(cap);
    }

    // ==================== Admin capability ====================

    /**
     * Mints the single admin capability. Fails once one exists.
     */
    @Transactional
    public synchronized AdminCap mintAdminCap(UUID holderId, Instant now) {
        Objects.requireNonNull(holderId, "Admin holder cannot be null");
        if (adminCapRepository.count() > 0) {
            throw MarketplaceException.of(MarketError.ADMIN_ALREADY_MINTED, "Admin capability already minted");
        }
        AdminCap cap = adminCapRepository.save(AdminCap.mint(holderId, now));
        auditService.appendReceipt(
                AuditReceipt.EventType.ADMIN_CAP_MINTED,
                holderId,
                cap.getId(),
                AuditReceipt.ResourceKind.ADMIN_CAP,
                Digests.sha256Of(cap.getId(), holderId),
                now
        );
        log.info("Admin capability {} minted for {}", cap.getId(), holderId);
        return cap;
    }

    public boolean isAdminMinted() {
        return adminCapRepository.count() > 0;
    }

    /**
     * Resolves a presented admin capability, or fails with {@code NOT_ADMIN}.
     */
    public AdminCap requireAdminCap(UUID capId, UUID caller) {
        AdminCap cap = capId == null ? null : adminCapRepository.findById(capId).orElse(null);
        if (cap == null || !cap.isHeldBy(caller)) {
            log.warn("Rejected admin capability {} presented by {}", capId, caller);
            throw MarketplaceException.of(MarketError.NOT_ADMIN, "Caller does not hold the admin capability");
        }
        return cap;
    }

    @Transactional
    public CapabilityView transferAdminCap(UUID capId, UUID caller, UUID newHolder, Instant now) {
        Objects.requireNonNull(newHolder, "New holder cannot be null");
        AdminCap cap = requireAdminCap(capId, caller);
        cap.transferTo(newHolder);
        adminCapRepository.save(cap);
        recordTransfer(caller, cap.getId(), AuditReceipt.ResourceKind.ADMIN_CAP, newHolder, now);
        log.info("Admin capability {} transferred to {}", cap.getId(), newHolder);
        return CapabilityView.of(cap);
    }

    private void recordTransfer(UUID caller, UUID capId, AuditReceipt.ResourceKind kind, UUID newHolder, Instant now) {
        auditService.appendReceipt(
                AuditReceipt.EventType.CAPABILITY_TRANSFERRED,
                caller,
                capId,
                kind,
                Digests.sha256Of(capId, caller, newHolder),
                now
        );
    }

    public record CapabilityView(UUID capabilityId, String type, UUID productId, UUID holderId) {
        static CapabilityView of(ProductCap cap) {
            return new CapabilityView(cap.getId(), "PRODUCT", cap.getProductId(), cap.getHolderId());
        }

        static CapabilityView of(AdminCap cap) {
            return new CapabilityView(cap.getId(), "ADMIN", null, cap.getHolderId());
        }
    }
}
