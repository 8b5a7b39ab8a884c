package com.escrowmart.core.repository;

import com.escrowmart.core.domain.AdminCap;
import org.springframework.data.repository.Repository;

import java.util.Optional;
import java.util.UUID;

@org.springframework.stereotype.Repository
public interface AdminCapRepository extends Repository<AdminCap, UUID> {

    AdminCap save(AdminCap cap);

    Optional<AdminCap> findById(UUID id);

    long count();
}
