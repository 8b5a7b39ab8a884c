package com.escrowmart.core.repository;

import com.escrowmart.core.domain.Product;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Product records. Every transition loads through {@link #findByIdForUpdate} so
 * concurrent calls against one product serialize on its row.
 */
@org.springframework.stereotype.Repository
public interface ProductRepository extends Repository<Product, UUID> {

    Product save(Product product);

    Optional<Product> findById(UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Product p WHERE p.id = :id")
    Optional<Product> findByIdForUpdate(@Param("id") UUID id);

    List<Product> findBySupplierIdOrderByCreatedAtDesc(UUID supplierId);
}
