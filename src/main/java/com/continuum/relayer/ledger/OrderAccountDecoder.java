package com.continuum.relayer.ledger;

import com.continuum.relayer.domain.enums.LedgerOrderStatus;
import com.continuum.relayer.domain.model.OrderRecord;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * Decodes the settlement program's account data.
 *
 * <p>Both accounts start with an 8-byte account discriminator followed by little-endian fields.
 * <pre>
 * FifoState:  current_sequence u64 | admin [32] | emergency_pause u8
 * OrderState: sequence u64 | user [32] | pool_id [32] | amount_in u64 | min_amount_out u64
 *             | is_base_input u8 | status u8 | submitted_at i64 | executed_at Option&lt;i64&gt;
 * </pre>
 */
@Component
public class OrderAccountDecoder {

    public static final int DISCRIMINATOR_LENGTH = 8;

    /** Offset of OrderState.sequence, used for the memcmp filter. */
    public static final int ORDER_SEQUENCE_OFFSET = DISCRIMINATOR_LENGTH;

    public static final int ORDER_ACCOUNT_SIZE = 8 + 8 + 32 + 32 + 8 + 8 + 1 + 1 + 8 + 9;

    private static final int FIFO_MIN_SIZE = DISCRIMINATOR_LENGTH + 8;
    private static final int ORDER_MIN_SIZE = ORDER_ACCOUNT_SIZE - 8;

    public long decodeCurrentSequence(byte[] fifoStateData) {
        if (fifoStateData.length < FIFO_MIN_SIZE) {
            throw new IllegalArgumentException("FifoState account too short: " + fifoStateData.length + " bytes");
        }
        return buffer(fifoStateData).getLong(DISCRIMINATOR_LENGTH);
    }

    public OrderRecord decodeOrder(String address, byte[] data) {
        if (data.length < ORDER_MIN_SIZE) {
            throw new IllegalArgumentException("OrderState account too short: " + data.length + " bytes");
        }
        ByteBuffer buf = buffer(data);
        buf.position(DISCRIMINATOR_LENGTH);

        long sequence = buf.getLong();
        String user = Base58.encode(readBytes(buf, 32));
        String pool = Base58.encode(readBytes(buf, 32));
        BigInteger amountIn = unsigned(buf.getLong());
        BigInteger minAmountOut = unsigned(buf.getLong());
        boolean baseInput = buf.get() != 0;
        LedgerOrderStatus status = LedgerOrderStatus.fromVariant(buf.get() & 0xFF);
        Instant submittedAt = Instant.ofEpochSecond(buf.getLong());

        Instant executedAt = null;
        if (buf.remaining() >= 9 && buf.get() == 1) {
            executedAt = Instant.ofEpochSecond(buf.getLong());
        }

        return OrderRecord.builder()
                .address(address)
                .sequence(sequence)
                .userAddress(user)
                .poolId(pool)
                .amountIn(amountIn)
                .minAmountOut(minAmountOut)
                .baseInput(baseInput)
                .status(status)
                .submittedAt(submittedAt)
                .executedAt(executedAt)
                .build();
    }

    /** Base58 of the little-endian u64, the form the memcmp filter compares against. */
    public String encodeSequenceFilter(long sequence) {
        return Base58.encode(ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putLong(sequence).array());
    }

    private static ByteBuffer buffer(byte[] data) {
        return ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    }

    private static byte[] readBytes(ByteBuffer buf, int length) {
        byte[] bytes = new byte[length];
        buf.get(bytes);
        return bytes;
    }

    private static BigInteger unsigned(long value) {
        return new BigInteger(Long.toUnsignedString(value));
    }
}
