package com.escrowmart.core.repository;

import com.escrowmart.core.domain.JournalEntry;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@org.springframework.stereotype.Repository
public interface JournalEntryRepository extends Repository<JournalEntry, UUID> {

    JournalEntry save(JournalEntry entry);

    List<JournalEntry> findByProductIdOrderByPostedAtAsc(UUID productId);

    @Query("SELECT COALESCE(SUM(j.amount), 0) FROM JournalEntry j WHERE j.debitAccount = :account")
    BigDecimal sumDebitsByAccount(@Param("account") String account);

    @Query("SELECT COALESCE(SUM(j.amount), 0) FROM JournalEntry j WHERE j.creditAccount = :account")
    BigDecimal sumCreditsByAccount(@Param("account") String account);

    boolean existsByIdempotencyKey(String idempotencyKey);
}
