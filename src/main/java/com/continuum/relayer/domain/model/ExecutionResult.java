package com.continuum.relayer.domain.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a confirmed execution. actualAmountOut and effectivePrice are null when the
 * output could not be read back from the confirmed transaction.
 */
@Value
@Builder
public class ExecutionResult {

    String signature;
    BigInteger actualAmountOut;

    /** actualAmountOut / amountIn, in raw token units. */
    BigDecimal effectivePrice;

    Instant executedAt;
}
