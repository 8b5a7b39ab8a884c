package com.escrowmart.api.settlement;

import com.escrowmart.api.settlement.SettlementService.BalanceView;
import com.escrowmart.api.settlement.SettlementService.EscrowBalanceView;
import com.escrowmart.core.domain.JournalEntry;
import com.escrowmart.core.domain.Release;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Settlement REST API.
 */
@RestController
@RequestMapping("/api/v1/settlement")
public class SettlementController {

    private final SettlementService settlementService;

    public SettlementController(SettlementService settlementService) {
        this.settlementService = settlementService;
    }

    /**
     * Net balance of the calling principal.
     * GET /api/v1/settlement/balance
     */
    @GetMapping("/balance")
    public ResponseEntity<BalanceView> getBalance(@RequestHeader("X-Principal-ID") UUID principalId) {
        return ResponseEntity.ok(settlementService.balanceOf(principalId));
    }

    /**
     * Journal lines of a product's escrow.
     * GET /api/v1/settlement/products/{productId}/journal
     */
    @GetMapping("/products/{productId}/journal")
    public ResponseEntity<List<JournalLine>> getJournal(@PathVariable UUID productId) {
        return ResponseEntity.ok(settlementService.journalFor(productId).stream()
                .map(JournalLine::of)
                .toList());
    }

    /**
     * Amount the journal currently holds in a product's escrow account.
     * GET /api/v1/settlement/products/{productId}/escrow
     */
    @GetMapping("/products/{productId}/escrow")
    public ResponseEntity<EscrowBalanceView> getEscrowBalance(@PathVariable UUID productId) {
        return ResponseEntity.ok(settlementService.escrowBalance(productId));
    }

    public record JournalLine(
        UUID entryId,
        String debitAccount,
        String creditAccount,
        BigDecimal amount,
        String currency,
        JournalEntry.Posting posting,
        Release.Reason releaseReason,
        Instant postedAt
    ) {
        static JournalLine of(JournalEntry entry) {
            return new JournalLine(entry.getId(), entry.getDebitAccount(), entry.getCreditAccount(),
                    entry.getAmount(), entry.getCurrency(), entry.getPosting(), entry.getReleaseReason(),
                    entry.getPostedAt());
        }
    }
}
