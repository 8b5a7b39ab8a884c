package com.escrowmart.core.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Funds held against one product.
 * Filled exactly once, drained exactly once: EMPTY -> HELD -> RELEASED.
 */
@Embeddable
public class Escrow {

    @NotNull
    @PositiveOrZero
    @Column(name = "escrow_balance", nullable = false, precision = 19, scale = 4)
    private BigDecimal balance;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "escrow_state", nullable = false, length = 16)
    private EscrowState state;

    protected Escrow() {}

    public static Escrow empty() {
        var escrow = new Escrow();
        escrow.balance = BigDecimal.ZERO;
        escrow.state = EscrowState.EMPTY;
        return escrow;
    }

    /**
     * Merges the whole payment into the balance.
     */
    void join(Payment payment) {
        Objects.requireNonNull(payment, "Payment cannot be null");
        if (state != EscrowState.EMPTY) {
            throw MarketplaceException.of(MarketError.ESCROW_ALREADY_FILLED,
                    "Escrow already filled (state " + state + ")");
        }
        this.balance = payment.amount();
        this.state = EscrowState.HELD;
    }

    /**
     * Takes the entire balance out. Succeeds at most once per fill.
     */
    Payment withdrawAll() {
        if (state != EscrowState.HELD) {
            throw MarketplaceException.of(MarketError.ESCROW_EMPTY,
                    "Nothing held in escrow (state " + state + ")");
        }
        Payment out = Payment.of(balance);
        this.balance = BigDecimal.ZERO;
        this.state = EscrowState.RELEASED;
        return out;
    }

    public boolean isHeld() {
        return state == EscrowState.HELD;
    }

    public BigDecimal getBalance() { return balance; }
    public EscrowState getState() { return state; }

    public enum EscrowState {
        EMPTY, HELD, RELEASED
    }
}
