package com.escrowmart.core.domain;

/**
 * Stable rejection codes for every marketplace transition.
 * Codes never change once published; clients match on {@link #code()} or the name.
 */
public enum MarketError {

    OUT_OF_STOCK(1, Category.STATE),
    REQUIREMENTS_NOT_MET(2, Category.VALUE),
    DUPLICATE_BID(3, Category.STATE),
    INVALID_CAPABILITY(4, Category.AUTHORIZATION),
    INSUFFICIENT_FUNDS(5, Category.VALUE),
    NO_SUCH_BID(6, Category.STATE),
    DEADLINE_EXPIRED(7, Category.TIMING),
    WRONG_ADDRESS(8, Category.AUTHORIZATION),
    ORDER_NOT_SUBMITTED(9, Category.STATE),
    INCORRECT_SUPPLIER(10, Category.AUTHORIZATION),
    DISPUTE_FALSE(11, Category.STATE),
    DEADLINE_NOT_REACHED(12, Category.TIMING),
    ESCROW_EMPTY(13, Category.STATE),
    ESCROW_ALREADY_FILLED(14, Category.STATE),
    DISPUTE_ALREADY_OPEN(15, Category.STATE),
    NOTHING_TO_DISPUTE(16, Category.STATE),
    COMPLAINT_MISMATCH(17, Category.STATE),
    NOT_ADMIN(18, Category.AUTHORIZATION),
    ADMIN_ALREADY_MINTED(19, Category.STATE),
    INVALID_QUALITY(20, Category.VALUE),
    INVALID_LISTING(21, Category.VALUE),
    BID_PRODUCT_MISMATCH(22, Category.STATE),
    NO_SUCH_PRODUCT(23, Category.NOT_FOUND),
    NO_SUCH_COMPLAINT(24, Category.NOT_FOUND),
    NO_SUCH_RECEIPT(25, Category.NOT_FOUND);

    private final int code;
    private final Category category;

    MarketError(int code, Category category) {
        this.code = code;
        this.category = category;
    }

    public int code() {
        return code;
    }

    public Category category() {
        return category;
    }

    public enum Category {
        AUTHORIZATION,
        STATE,
        TIMING,
        VALUE,
        NOT_FOUND
    }
}
