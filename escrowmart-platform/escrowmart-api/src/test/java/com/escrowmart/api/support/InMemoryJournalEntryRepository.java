package com.escrowmart.api.support;

import com.escrowmart.core.domain.JournalEntry;
import com.escrowmart.core.repository.JournalEntryRepository;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Journal store enforcing the unique idempotency key like the database index does.
 */
public class InMemoryJournalEntryRepository implements JournalEntryRepository {

    private final List<JournalEntry> entries = new ArrayList<>();

    @Override
    public synchronized JournalEntry save(JournalEntry entry) {
        if (existsByIdempotencyKey(entry.getIdempotencyKey())) {
            throw new DataIntegrityViolationException("duplicate idempotency key " + entry.getIdempotencyKey());
        }
        entries.add(entry);
        return entry;
    }

    @Override
    public synchronized List<JournalEntry> findByProductIdOrderByPostedAtAsc(UUID productId) {
        return entries.stream()
                .filter(e -> e.getProductId().equals(productId))
                .sorted(Comparator.comparing(JournalEntry::getPostedAt))
                .toList();
    }

    @Override
    public synchronized BigDecimal sumDebitsByAccount(String account) {
        return entries.stream()
                .filter(e -> e.getDebitAccount().equals(account))
                .map(JournalEntry::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Override
    public synchronized BigDecimal sumCreditsByAccount(String account) {
        return entries.stream()
                .filter(e -> e.getCreditAccount().equals(account))
                .map(JournalEntry::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Override
    public synchronized boolean existsByIdempotencyKey(String idempotencyKey) {
        return entries.stream().anyMatch(e -> e.getIdempotencyKey().equals(idempotencyKey));
    }

    public synchronized List<JournalEntry> all() {
        return List.copyOf(entries);
    }
}
