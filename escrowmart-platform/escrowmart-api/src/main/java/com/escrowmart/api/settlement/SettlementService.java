package com.escrowmart.api.settlement;

import com.escrowmart.api.config.MarketplaceProperties;
import com.escrowmart.api.event.EscrowLockedEvent;
import com.escrowmart.api.event.EscrowReleasedEvent;
import com.escrowmart.core.domain.JournalEntry;
import com.escrowmart.core.domain.JournalEntry.Posting;
import com.escrowmart.core.domain.MarketError;
import com.escrowmart.core.domain.MarketplaceException;
import com.escrowmart.core.domain.Release;
import com.escrowmart.core.repository.JournalEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Settlement journal for escrow movements.
 *
 * A fill debits the payer and credits the product's escrow account; a release
 * debits the escrow account and credits the recipient. Each product has exactly
 * one fill key and one release key, so neither can be posted twice.
 */
@Service
public class SettlementService {

    private static final Logger log = LoggerFactory.getLogger(SettlementService.class);

    private final JournalEntryRepository journalEntryRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final MarketplaceProperties properties;

    public SettlementService(
            JournalEntryRepository journalEntryRepository,
            ApplicationEventPublisher eventPublisher,
            MarketplaceProperties properties) {
        this.journalEntryRepository = journalEntryRepository;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
    }

    @Transactional
    public JournalEntry recordEscrowFill(UUID productId, UUID payerId, UUID consumerId, BigDecimal amount, Instant at) {
        if (journalEntryRepository.existsByIdempotencyKey(Posting.ESCROW_FILL.keyFor(productId))) {
            throw MarketplaceException.of(MarketError.ESCROW_ALREADY_FILLED, "Escrow already filled for product " + productId);
        }
        JournalEntry entry = journalEntryRepository.save(
                JournalEntry.escrowFill(productId, payerId, amount, currency(), at));
        eventPublisher.publishEvent(new EscrowLockedEvent(productId, consumerId, amount, at));
        log.info("Escrow for product {} filled with {} by {}", productId, amount.toPlainString(), payerId);
        return entry;
    }

    /**
     * Posts the single release of a product's escrow.
     */
    @Transactional
    public JournalEntry deliver(Release release, Instant at) {
        if (journalEntryRepository.existsByIdempotencyKey(Posting.ESCROW_RELEASE.keyFor(release.productId()))) {
            throw MarketplaceException.of(MarketError.ESCROW_EMPTY, "Escrow already released for product " + release.productId());
        }
        JournalEntry entry = journalEntryRepository.save(JournalEntry.escrowRelease(release, currency(), at));
        BigDecimal amount = release.payment().amount();
        eventPublisher.publishEvent(new EscrowReleasedEvent(release.productId(), release.recipientId(), amount,
                release.reason(), at));
        log.info("Released {} from product {} escrow to {} ({})",
                amount.toPlainString(), release.productId(), release.recipientId(), release.reason());
        return entry;
    }

    /**
     * Net position of a principal: credits minus debits on its account.
     */
    public BalanceView balanceOf(UUID principalId) {
        String account = JournalEntry.principalAccount(principalId);
        BigDecimal credits = journalEntryRepository.sumCreditsByAccount(account);
        BigDecimal debits = journalEntryRepository.sumDebitsByAccount(account);
        return new BalanceView(principalId, credits, debits, credits.subtract(debits), currency());
    }

    /**
     * Amount currently held for a product according to the journal.
     */
    public EscrowBalanceView escrowBalance(UUID productId) {
        String account = JournalEntry.escrowAccount(productId);
        BigDecimal held = journalEntryRepository.sumCreditsByAccount(account)
                .subtract(journalEntryRepository.sumDebitsByAccount(account));
        return new EscrowBalanceView(productId, held, currency());
    }

    public List<JournalEntry> journalFor(UUID productId) {
        return journalEntryRepository.findByProductIdOrderByPostedAtAsc(productId);
    }

    private String currency() {
        return properties.getSettlement().getCurrency();
    }

    public record EscrowBalanceView(UUID productId, BigDecimal held, String currency) {}

    public record BalanceView(UUID principalId, BigDecimal credits, BigDecimal debits, BigDecimal net, String currency) {}
}
