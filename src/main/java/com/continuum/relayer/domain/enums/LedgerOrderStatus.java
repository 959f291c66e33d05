package com.continuum.relayer.domain.enums;

/**
 * Status byte of an OrderState account as stored by the settlement program.
 * The ordinal is the on-ledger variant index and must not be reordered.
 */
public enum LedgerOrderStatus {
    PENDING,
    EXECUTED,
    CANCELLED,
    FAILED;

    public static LedgerOrderStatus fromVariant(int variant) {
        LedgerOrderStatus[] values = values();
        if (variant < 0 || variant >= values.length) {
            throw new IllegalArgumentException("Unknown order status variant: " + variant);
        }
        return values[variant];
    }
}
