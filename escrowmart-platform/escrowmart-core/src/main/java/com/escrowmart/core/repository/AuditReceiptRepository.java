package com.escrowmart.core.repository;

import com.escrowmart.core.domain.AuditReceipt;
import org.springframework.data.repository.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only receipt store. No update or delete operations are exposed.
 */
@org.springframework.stereotype.Repository
public interface AuditReceiptRepository extends Repository<AuditReceipt, UUID> {

    AuditReceipt save(AuditReceipt receipt);

    Optional<AuditReceipt> findById(UUID id);

    Optional<AuditReceipt> findByHash(String hash);

    List<AuditReceipt> findByResourceIdOrderBySequenceAsc(UUID resourceId);
}
