package com.continuum.relayer.ledger;

import java.math.BigInteger;
import lombok.Builder;
import lombok.Value;

/** What the relayer asks the signer to build and sign: execute the order at {@code sequence}. */
@Value
@Builder
public class ExecutionInstruction {

    String orderId;
    long sequence;

    /** OrderState account address. */
    String orderAddress;

    String userAddress;
    String poolId;

    /** AMM config of the pool, when the pool is configured locally. */
    String ammConfig;

    BigInteger amountIn;
    BigInteger minAmountOut;
    boolean baseInput;
}
