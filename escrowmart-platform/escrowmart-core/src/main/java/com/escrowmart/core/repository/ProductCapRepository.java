package com.escrowmart.core.repository;

import com.escrowmart.core.domain.ProductCap;
import org.springframework.data.repository.Repository;

import java.util.Optional;
import java.util.UUID;

@org.springframework.stereotype.Repository
public interface ProductCapRepository extends Repository<ProductCap, UUID> {

    ProductCap save(ProductCap cap);

    Optional<ProductCap> findById(UUID id);

    Optional<ProductCap> findByProductId(UUID productId);
}
