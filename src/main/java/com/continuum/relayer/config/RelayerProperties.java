package com.continuum.relayer.config;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Relayer configuration, bound from {@code relayer.*} in application.yml.
 *
 * <p>Every value has an environment override in application.yml
 * (e.g. {@code RPC_URL}, {@code MAX_CONCURRENT_EXECUTIONS}, {@code RETRY_ATTEMPTS}).
 */
@Data
@Component
@ConfigurationProperties(prefix = "relayer")
public class RelayerProperties {

    private Engine engine = new Engine();
    private Retry retry = new Retry();
    private Ledger ledger = new Ledger();
    private Signer signer = new Signer();
    private Intake intake = new Intake();
    private List<Pool> pools = new ArrayList<>();

    @Data
    public static class Engine {

        /** Delay between scheduling ticks. */
        private long pollIntervalMs = 1000;

        /** ConcurrencyGate limit: executions in flight at once. */
        private int maxConcurrentExecutions = 5;

        /**
         * Last sequence considered processed at startup. When unset the cursor starts at the
         * ledger's current sequence, i.e. only orders submitted after startup are executed.
         */
        private Long startSequence;
    }

    @Data
    public static class Retry {

        /** Total attempts per order, first attempt included. */
        private int maxAttempts = 3;

        private long baseDelayMs = 1000;

        /** Backoff growth per attempt. 1.0 gives a fixed delay. */
        private double multiplier = 2.0;

        private long maxDelayMs = 30_000;
    }

    @Data
    public static class Ledger {

        private String rpcUrl = "http://127.0.0.1:8899";

        /** Settlement program that owns the FifoState and OrderState accounts. */
        private String programId;

        /** Address of the program's FifoState account. */
        private String fifoStateAddress;

        private String commitment = "confirmed";

        private long confirmationTimeoutMs = 60_000;
        private long confirmationPollIntervalMs = 500;
        private long readTimeoutMs = 20_000;
    }

    @Data
    public static class Signer {

        /** Base URL of the signing service holding the relayer key. */
        private String url = "http://127.0.0.1:8090";

        /** Public address of the relayer key, reported by the info endpoint. */
        private String address;
    }

    @Data
    public static class Intake {

        private Duration dedupWindow = Duration.ofMinutes(5);

        /** Flat relayer fee quoted per order, in lamports. */
        private BigInteger feeLamports = BigInteger.valueOf(100_000);

        private int relayerFeeBps = 0;

        private BigInteger minOrderSize = BigInteger.ONE;
        private BigInteger maxOrderSize = new BigInteger("1000000000000");

        /** Per-order execution estimate used until real timings exist. */
        private long defaultExecutionEstimateMs = 5000;
    }

    @Data
    public static class Pool {

        private String poolId;
        private String ammConfig;
        private String tokenAMint;
        private String tokenBMint;
        private String tokenASymbol;
        private String tokenBSymbol;
        private int tokenADecimals;
        private int tokenBDecimals;
        private boolean active = true;
    }
}
