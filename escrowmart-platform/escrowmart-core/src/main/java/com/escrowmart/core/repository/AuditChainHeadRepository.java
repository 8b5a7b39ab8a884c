package com.escrowmart.core.repository;

import com.escrowmart.core.domain.AuditChainHead;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * The audit chain tip. Appenders hold its row lock until their transaction ends.
 */
@org.springframework.stereotype.Repository
public interface AuditChainHeadRepository extends Repository<AuditChainHead, Integer> {

    AuditChainHead save(AuditChainHead head);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM AuditChainHead h WHERE h.id = :id")
    Optional<AuditChainHead> findByIdForUpdate(@Param("id") Integer id);
}
