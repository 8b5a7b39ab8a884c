package com.escrowmart.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.util.Objects;

/**
 * Tip of the audit receipt chain.
 * A single row; appenders lock it so that receipts from independent transitions
 * are numbered one after another instead of racing for the same sequence.
 */
@Entity
@Table(name = "audit_chain_head")
public class AuditChainHead {

    public static final int CHAIN_ID = 1;

    @Id
    private Integer id;

    @Column(name = "last_sequence", nullable = false)
    private long lastSequence;

    @NotNull
    @Column(name = "last_hash", nullable = false, length = 64)
    private String lastHash;

    protected AuditChainHead() {}

    public static AuditChainHead genesis() {
        var head = new AuditChainHead();
        head.id = CHAIN_ID;
        head.lastSequence = 0;
        head.lastHash = AuditReceipt.GENESIS;
        return head;
    }

    /**
     * Moves the tip onto a sealed receipt that directly follows it.
     */
    public void advanceTo(AuditReceipt receipt) {
        Objects.requireNonNull(receipt, "Receipt cannot be null");
        if (!receipt.isSealed()) {
            throw new IllegalStateException("Cannot advance to unsealed receipt " + receipt.getId());
        }
        if (receipt.getSequence() != lastSequence + 1 || !lastHash.equals(receipt.getPreviousHash())) {
            throw new IllegalStateException("Receipt " + receipt.getId() + " does not follow sequence " + lastSequence);
        }
        this.lastSequence = receipt.getSequence();
        this.lastHash = receipt.getHash();
    }

    public Integer getId() { return id; }
    public long getLastSequence() { return lastSequence; }
    public String getLastHash() { return lastHash; }
}
