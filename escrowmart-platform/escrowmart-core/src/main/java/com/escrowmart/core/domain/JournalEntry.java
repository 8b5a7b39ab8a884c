package com.escrowmart.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One side-balanced movement of a product's escrow.
 *
 * A product's escrow is moved at most twice: filled from the payer when a consumer is
 * chosen, and released once to whoever the settlement favours. The idempotency key is
 * derived from the posting kind and the product, and is unique in storage.
 */
@Entity
@Table(name = "journal_entries", indexes = {
    @Index(name = "idx_journal_debit", columnList = "debit_account"),
    @Index(name = "idx_journal_credit", columnList = "credit_account"),
    @Index(name = "idx_journal_product", columnList = "product_id"),
    @Index(name = "idx_journal_idempotency", columnList = "idempotency_key", unique = true)
})
public class JournalEntry {

    @Id
    private UUID id;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Posting posting;

    @NotNull
    @Column(name = "product_id", nullable = false)
    private UUID productId;

    @NotNull
    @Column(name = "debit_account", nullable = false)
    private String debitAccount;

    @NotNull
    @Column(name = "credit_account", nullable = false)
    private String creditAccount;

    @NotNull
    @Positive
    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @NotNull
    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "release_reason", length = 32)
    private Release.Reason releaseReason;

    @NotNull
    @Column(name = "idempotency_key", nullable = false, unique = true)
    private String idempotencyKey;

    @NotNull
    @Column(name = "posted_at", nullable = false)
    private Instant postedAt;

    protected JournalEntry() {}

    /**
     * Payer to escrow, posted when the supplier locks payment by choosing a consumer.
     */
    public static JournalEntry escrowFill(UUID productId, UUID payerId, BigDecimal amount, String currency, Instant at) {
        Objects.requireNonNull(payerId, "Payer cannot be null");
        return post(Posting.ESCROW_FILL, productId, principalAccount(payerId), escrowAccount(productId),
                amount, currency, null, at);
    }

    /**
     * Escrow to recipient, posted for the single release of the product's escrow.
     */
    public static JournalEntry escrowRelease(Release release, String currency, Instant at) {
        Objects.requireNonNull(release, "Release cannot be null");
        return post(Posting.ESCROW_RELEASE, release.productId(), escrowAccount(release.productId()),
                principalAccount(release.recipientId()), release.payment().amount(), currency, release.reason(), at);
    }

    private static JournalEntry post(
            Posting posting,
            UUID productId,
            String debitAccount,
            String creditAccount,
            BigDecimal amount,
            String currency,
            Release.Reason reason,
            Instant at) {

        Objects.requireNonNull(productId, "Product cannot be null");
        Objects.requireNonNull(currency, "Currency cannot be null");
        Objects.requireNonNull(at, "Posting time cannot be null");
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Posted amount must be positive");
        }

        var entry = new JournalEntry();
        entry.id = UUID.randomUUID();
        entry.posting = posting;
        entry.productId = productId;
        entry.debitAccount = debitAccount;
        entry.creditAccount = creditAccount;
        entry.amount = amount;
        entry.currency = currency;
        entry.releaseReason = reason;
        entry.idempotencyKey = posting.keyFor(productId);
        entry.postedAt = at;
        return entry;
    }

    public static String principalAccount(UUID principal) {
        return "PRINCIPAL:" + principal;
    }

    public static String escrowAccount(UUID productId) {
        return "ESCROW:" + productId;
    }

    public UUID getId() { return id; }
    public Posting getPosting() { return posting; }
    public UUID getProductId() { return productId; }
    public String getDebitAccount() { return debitAccount; }
    public String getCreditAccount() { return creditAccount; }
    public BigDecimal getAmount() { return amount; }
    public String getCurrency() { return currency; }
    public Release.Reason getReleaseReason() { return releaseReason; }
    public String getIdempotencyKey() { return idempotencyKey; }
    public Instant getPostedAt() { return postedAt; }

    public enum Posting {
        ESCROW_FILL("FILL:"),
        ESCROW_RELEASE("RELEASE:");

        private final String keyPrefix;

        Posting(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public String keyFor(UUID productId) {
            return keyPrefix + productId;
        }
    }
}
