package com.escrowmart.api.chain;

import com.escrowmart.api.event.DisputeRaisedEvent;
import com.escrowmart.api.event.DisputeResolvedEvent;
import com.escrowmart.api.event.EscrowLockedEvent;
import com.escrowmart.api.event.EscrowReleasedEvent;
import com.escrowmart.api.event.ProductListedEvent;
import com.escrowmart.chain.service.ChainEscrowMirror;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Forwards committed escrow transitions to the marketplace contract.
 *
 * <p>Handlers run AFTER_COMMIT, so the contract only sees transitions the database kept,
 * and a slow or failing node never holds a product row lock. The mirror logs its own
 * failures; nothing here can roll back the marketplace transaction.
 */
@Component
public class ChainMirrorEventHandler {

    private static final Logger log = LoggerFactory.getLogger(ChainMirrorEventHandler.class);

    private final ChainEscrowMirror chainMirror;

    public ChainMirrorEventHandler(ChainEscrowMirror chainMirror) {
        this.chainMirror = chainMirror;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onProductListed(ProductListedEvent event) {
        chainMirror.productListed(event.productId(), event.supplierId(), event.price());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onEscrowLocked(EscrowLockedEvent event) {
        chainMirror.escrowLocked(event.productId(), event.consumerId(), event.amount());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onEscrowReleased(EscrowReleasedEvent event) {
        log.debug("Mirroring {} release of product {}", event.reason(), event.productId());
        chainMirror.escrowReleased(event.productId(), event.recipientId(), event.amount());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onDisputeRaised(DisputeRaisedEvent event) {
        chainMirror.disputeRaised(event.productId(), event.complaintId(), event.reason());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onDisputeResolved(DisputeResolvedEvent event) {
        chainMirror.disputeResolved(event.productId(), event.forConsumer());
    }
}
