package com.escrowmart.core.repository;

import com.escrowmart.core.domain.Complaint;
import org.springframework.data.repository.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@org.springframework.stereotype.Repository
public interface ComplaintRepository extends Repository<Complaint, UUID> {

    Complaint save(Complaint complaint);

    Optional<Complaint> findById(UUID id);

    List<Complaint> findByProductIdOrderByFiledAtDesc(UUID productId);
}
