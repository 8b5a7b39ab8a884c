package com.escrowmart.api.support;

import com.escrowmart.core.domain.Complaint;
import com.escrowmart.core.repository.ComplaintRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryComplaintRepository implements ComplaintRepository {

    private final Map<UUID, Complaint> complaints = new ConcurrentHashMap<>();

    @Override
    public Complaint save(Complaint complaint) {
        complaints.put(complaint.getId(), complaint);
        return complaint;
    }

    @Override
    public Optional<Complaint> findById(UUID id) {
        return Optional.ofNullable(complaints.get(id));
    }

    @Override
    public List<Complaint> findByProductIdOrderByFiledAtDesc(UUID productId) {
        return complaints.values().stream()
                .filter(c -> c.getProductId().equals(productId))
                .sorted(Comparator.comparing(Complaint::getFiledAt).reversed())
                .toList();
    }
}
