package com.escrowmart.api.dispute;

import com.escrowmart.api.dispute.DisputeService.ComplaintView;
import com.escrowmart.api.dispute.DisputeService.Resolution;
import com.escrowmart.api.event.DisputeRaisedEvent;
import com.escrowmart.api.event.DisputeResolvedEvent;
import com.escrowmart.api.event.EscrowReleasedEvent;
import com.escrowmart.api.product.ProductLifecycleService;
import com.escrowmart.api.product.ProductViews.ListingResult;
import com.escrowmart.api.support.MarketplaceFixture;
import com.escrowmart.core.domain.AdminCap;
import com.escrowmart.core.domain.MarketError;
import com.escrowmart.core.domain.MarketplaceException;
import com.escrowmart.core.domain.Product;
import com.escrowmart.core.domain.Release;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class DisputeServiceTest {

    private static final Instant T = Instant.parse("2026-03-01T12:00:00Z");
    private static final Instant AFTER_DEADLINE = T.plusSeconds(1001);

    private MarketplaceFixture market;
    private ProductLifecycleService lifecycle;
    private DisputeService disputes;
    private UUID supplier;
    private UUID consumerA;
    private UUID adminPrincipal;
    private AdminCap admin;
    private UUID productId;
    private UUID productCapId;

    @BeforeEach
    void setUp() {
        market = new MarketplaceFixture();
        lifecycle = market.lifecycleService;
        disputes = market.disputeService;
        supplier = UUID.randomUUID();
        consumerA = UUID.randomUUID();
        adminPrincipal = UUID.randomUUID();
        admin = market.capabilityService.mintAdminCap(adminPrincipal, T);

        ListingResult listing = lifecycle.newProduct(supplier, "lamp", 60, BigDecimal.valueOf(100),
                Duration.ofSeconds(1000), T);
        productId = listing.product().id();
        productCapId = listing.productCapId();
        lifecycle.placeBid(consumerA, productId, "", List.of(), T);
        lifecycle.chooseConsumer(productId, listing.productCapId(), supplier, BigDecimal.valueOf(150), consumerA, T);
    }

    @Test
    void unsubmittedOrder_resolvedForSupplier() {
        // When
        ComplaintView complaint = disputes.fileComplaint(productId, supplier, "never submitted", AFTER_DEADLINE);

        // Then
        assertThat(lifecycle.getProduct(productId).disputeOpen()).isTrue();
        assertThat(complaint.consumerId()).isEqualTo(consumerA);
        assertThat(complaint.supplierId()).isEqualTo(supplier);
        assertThat(complaint.filedBy()).isEqualTo(supplier);

        Resolution resolution = disputes.resolveForSupplier(complaint.id(), admin.getId(), adminPrincipal,
                AFTER_DEADLINE.plusSeconds(10));
        assertThat(resolution.release().recipientId()).isEqualTo(supplier);
        assertThat(resolution.release().amount()).isEqualByComparingTo("150");
        assertThat(resolution.release().reason()).isEqualTo(Release.Reason.DISPUTE_FOR_SUPPLIER);
        assertThat(resolution.complaint().decision()).isFalse();
        assertThat(resolution.complaint().resolved()).isTrue();
        assertThat(lifecycle.getProduct(productId).disputeOpen()).isFalse();
        assertThat(market.settlementService.balanceOf(supplier).net()).isEqualByComparingTo("0");

        assertFails(MarketError.DISPUTE_FALSE, () -> disputes.resolveForConsumer(complaint.id(), admin.getId(),
                adminPrincipal, AFTER_DEADLINE.plusSeconds(20)));
        assertThat(market.settlementService.journalFor(productId)).hasSize(2);
    }

    @Test
    void resolvedForConsumer_paysConsumer() {
        ComplaintView complaint = disputes.fileComplaint(productId, consumerA, "not delivered", AFTER_DEADLINE);

        Resolution resolution = disputes.resolveForConsumer(complaint.id(), admin.getId(), adminPrincipal,
                AFTER_DEADLINE.plusSeconds(10));

        assertThat(resolution.release().recipientId()).isEqualTo(consumerA);
        assertThat(resolution.complaint().decision()).isTrue();
        assertThat(lifecycle.getProduct(productId).lifecycleState()).isEqualTo(Product.LifecycleState.RESOLVED_FOR_CONSUMER);
        assertThat(market.settlementService.balanceOf(consumerA).net()).isEqualByComparingTo("150");
    }

    @Test
    void confirmation_failsAfterResolution() {
        lifecycle.submitOrder(productId, consumerA, T.plusSeconds(10));
        ComplaintView complaint = disputes.fileComplaint(productId, supplier, "unpaid", AFTER_DEADLINE);
        disputes.resolveForSupplier(complaint.id(), admin.getId(), adminPrincipal, AFTER_DEADLINE.plusSeconds(10));

        assertFails(MarketError.DEADLINE_EXPIRED,
                () -> lifecycle.confirmOrder(productId, productCapId, supplier, AFTER_DEADLINE.plusSeconds(20)));
        assertThat(lifecycle.getProduct(productId).lifecycleState()).isEqualTo(Product.LifecycleState.RESOLVED_FOR_SUPPLIER);
        assertThat(market.settlementService.journalFor(productId)).hasSize(2);
        assertThat(market.events.ofType(EscrowReleasedEvent.class)).hasSize(1);
    }

    @Test
    void disputeTransitions_publishEscrowEvents() {
        ComplaintView complaint = disputes.fileComplaint(productId, consumerA, "broken", AFTER_DEADLINE);
        disputes.resolveForConsumer(complaint.id(), admin.getId(), adminPrincipal, AFTER_DEADLINE.plusSeconds(10));

        assertThat(market.events.ofType(DisputeRaisedEvent.class))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.complaintId()).isEqualTo(complaint.id());
                    assertThat(e.reason()).isEqualTo("broken");
                });
        assertThat(market.events.ofType(DisputeResolvedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.forConsumer()).isTrue());
        assertThat(market.events.ofType(EscrowReleasedEvent.class))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.recipientId()).isEqualTo(consumerA);
                    assertThat(e.amount()).isEqualByComparingTo("150");
                    assertThat(e.reason()).isEqualTo(Release.Reason.DISPUTE_FOR_CONSUMER);
                });
    }

    @Test
    void rejectedResolution_publishesNothing() {
        ComplaintView complaint = disputes.fileComplaint(productId, consumerA, "late", AFTER_DEADLINE);
        int before = market.events.size();

        assertFails(MarketError.NOT_ADMIN, () -> disputes.resolveForConsumer(complaint.id(), admin.getId(),
                supplier, AFTER_DEADLINE));

        assertThat(market.events.size()).isEqualTo(before);
    }

    @Test
    void resolution_requiresAdminCapabilityHolder() {
        ComplaintView complaint = disputes.fileComplaint(productId, consumerA, "late", AFTER_DEADLINE);

        assertFails(MarketError.NOT_ADMIN, () -> disputes.resolveForConsumer(complaint.id(), admin.getId(),
                supplier, AFTER_DEADLINE));
        assertFails(MarketError.NOT_ADMIN, () -> disputes.resolveForConsumer(complaint.id(), UUID.randomUUID(),
                adminPrincipal, AFTER_DEADLINE));
        assertThat(lifecycle.getProduct(productId).disputeOpen()).isTrue();
    }

    @Test
    void complaintBeforeDeadline_isRejected() {
        assertFails(MarketError.DEADLINE_NOT_REACHED,
                () -> disputes.fileComplaint(productId, supplier, "early", T.plusSeconds(1000)));
        assertThat(disputes.listComplaints(productId)).isEmpty();
    }

    @Test
    void strangerComplaint_isRejected() {
        assertFails(MarketError.INCORRECT_SUPPLIER,
                () -> disputes.fileComplaint(productId, UUID.randomUUID(), "nosy", AFTER_DEADLINE));
    }

    @Test
    void unknownComplaint_isNotFound() {
        assertFails(MarketError.NO_SUCH_COMPLAINT, () -> disputes.getComplaint(UUID.randomUUID()));
        assertFails(MarketError.NO_SUCH_COMPLAINT, () -> disputes.resolveForSupplier(UUID.randomUUID(), admin.getId(),
                adminPrincipal, AFTER_DEADLINE));
    }

    @Test
    void complaints_areListedPerProduct() {
        ComplaintView complaint = disputes.fileComplaint(productId, consumerA, "late", AFTER_DEADLINE);

        assertThat(disputes.listComplaints(productId)).containsExactly(complaint);
        assertThat(disputes.getComplaint(complaint.id())).isEqualTo(complaint);
    }

    private static void assertFails(MarketError expected, ThrowingCallable action) {
        assertThatThrownBy(action)
                .isInstanceOfSatisfying(MarketplaceException.class,
                        e -> assertThat(e.getError()).isEqualTo(expected));
    }
}
