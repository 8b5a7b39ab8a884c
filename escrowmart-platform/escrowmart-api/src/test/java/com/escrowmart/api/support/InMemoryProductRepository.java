package com.escrowmart.api.support;

import com.escrowmart.core.domain.Product;
import com.escrowmart.core.repository.ProductRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryProductRepository implements ProductRepository {

    private final Map<UUID, Product> products = new ConcurrentHashMap<>();

    @Override
    public Product save(Product product) {
        products.put(product.getId(), product);
        return product;
    }

    @Override
    public Optional<Product> findById(UUID id) {
        return Optional.ofNullable(products.get(id));
    }

    @Override
    public Optional<Product> findByIdForUpdate(UUID id) {
        return findById(id);
    }

    @Override
    public List<Product> findBySupplierIdOrderByCreatedAtDesc(UUID supplierId) {
        return products.values().stream()
                .filter(p -> p.getSupplierId().equals(supplierId))
                .sorted(Comparator.comparing(Product::getCreatedAt).reversed())
                .toList();
    }
}
