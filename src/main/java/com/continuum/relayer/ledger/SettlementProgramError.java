package com.continuum.relayer.ledger;

import com.continuum.relayer.domain.enums.FailureKind;
import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Custom error codes raised by the settlement program, with how the engine should treat them. */
@Getter
@RequiredArgsConstructor
public enum SettlementProgramError {
    INVALID_SEQUENCE(6000, "InvalidSequence", FailureKind.PERMANENT),
    ORDER_ALREADY_EXECUTED(6001, "OrderAlreadyExecuted", FailureKind.PERMANENT),
    ORDER_NOT_FOUND(6002, "OrderNotFound", FailureKind.PERMANENT),
    UNAUTHORIZED(6003, "Unauthorized", FailureKind.PERMANENT),
    POOL_NOT_REGISTERED(6004, "PoolNotRegistered", FailureKind.PERMANENT),
    POOL_ALREADY_REGISTERED(6005, "PoolAlreadyRegistered", FailureKind.PERMANENT),
    EMERGENCY_PAUSE(6006, "EmergencyPause", FailureKind.TRANSIENT),
    INVALID_POOL_CONFIG(6007, "InvalidPoolConfig", FailureKind.PERMANENT),
    SLIPPAGE_EXCEEDED(6008, "SlippageExceeded", FailureKind.PERMANENT),
    INVALID_ORDER_STATUS(6009, "InvalidOrderStatus", FailureKind.PERMANENT);

    private final int code;
    private final String errorName;
    private final FailureKind kind;

    public static Optional<SettlementProgramError> fromCode(long code) {
        return Arrays.stream(values()).filter(e -> e.code == code).findFirst();
    }

    public static Optional<SettlementProgramError> fromMessage(String message) {
        return Arrays.stream(values()).filter(e -> message.contains(e.errorName)).findFirst();
    }
}
