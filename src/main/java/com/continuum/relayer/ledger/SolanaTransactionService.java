package com.continuum.relayer.ledger;

import com.continuum.relayer.config.RelayerProperties;
import com.continuum.relayer.domain.model.ExecutionFailure;
import com.continuum.relayer.exception.LedgerException;
import com.continuum.relayer.exception.LedgerTimeoutException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Transaction writes and confirmation tracking against the ledger RPC.
 *
 * <p>Implementation detail of {@link SolanaLedgerGateway}. Sends are not retried here:
 * a resend is a new execution attempt and belongs to the engine's RetryPolicy.
 */
@Service
public class SolanaTransactionService {

    private static final Logger log = LoggerFactory.getLogger(SolanaTransactionService.class);

    private final SolanaRpcClient rpcClient;
    private final LedgerErrorClassifier errorClassifier;
    private final Clock clock;
    private final String commitment;
    private final Duration confirmationTimeout;
    private final Duration pollInterval;

    public SolanaTransactionService(
            SolanaRpcClient rpcClient,
            LedgerErrorClassifier errorClassifier,
            RelayerProperties relayerProperties,
            Clock clock) {
        this.rpcClient = rpcClient;
        this.errorClassifier = errorClassifier;
        this.clock = clock;
        RelayerProperties.Ledger ledger = relayerProperties.getLedger();
        this.commitment = ledger.getCommitment();
        this.confirmationTimeout = Duration.ofMillis(ledger.getConfirmationTimeoutMs());
        this.pollInterval = Duration.ofMillis(ledger.getConfirmationPollIntervalMs());
    }

    /** Sends a base64 transaction; returns its signature. Preflight failures are thrown classified. */
    @CircuitBreaker(name = "ledgerRpc")
    public String sendTransaction(String base64Transaction) {
        ObjectNode config = rpcClient.object();
        config.put("encoding", "base64");
        config.put("preflightCommitment", commitment);

        JsonNode result = rpcClient.call("sendTransaction", rpcClient.params().add(base64Transaction).add(config));
        if (!result.isTextual()) {
            throw new LedgerException(ExecutionFailure.transientFailure("sendTransaction returned no signature"));
        }
        return result.asText();
    }

    /**
     * Polls the signature until it reaches the configured commitment or fails on-ledger.
     *
     * @return empty when confirmed, otherwise the on-ledger failure
     * @throws LedgerTimeoutException if neither happens within the confirmation timeout
     */
    public Optional<ExecutionFailure> awaitConfirmation(String signature) {
        long deadline = clock.millis() + confirmationTimeout.toMillis();
        while (true) {
            JsonNode status = getSignatureStatus(signature);
            if (status != null) {
                JsonNode err = status.path("err");
                if (!err.isMissingNode() && !err.isNull()) {
                    ExecutionFailure failure = errorClassifier.classifyTransactionError(err);
                    log.warn("Transaction failed on-ledger: signature={}, error={}", signature, failure.reason());
                    return Optional.of(failure);
                }
                if (reachedCommitment(status.path("confirmationStatus").asText(""))) {
                    return Optional.empty();
                }
            }

            if (clock.millis() >= deadline) {
                throw new LedgerTimeoutException(signature, confirmationTimeout);
            }
            sleep(signature);
        }
    }

    /**
     * Net token amount credited to {@code owner} by a confirmed transaction, read from the token
     * balance deltas. Narrowed to {@code mint} when given. Empty when nothing was credited.
     */
    public Optional<BigInteger> getCreditedAmount(String signature, String owner, String mint) {
        ObjectNode config = rpcClient.object();
        config.put("encoding", "json");
        config.put("commitment", commitment);
        config.put("maxSupportedTransactionVersion", 0);

        JsonNode meta = rpcClient.call("getTransaction", rpcClient.params().add(signature).add(config)).path("meta");
        if (meta.isMissingNode() || meta.isNull()) {
            return Optional.empty();
        }

        Map<Integer, BigInteger> before = new HashMap<>();
        for (JsonNode balance : meta.path("preTokenBalances")) {
            if (isCandidate(balance, owner, mint)) {
                before.put(balance.path("accountIndex").asInt(), amountOf(balance));
            }
        }

        BigInteger credited = null;
        for (JsonNode balance : meta.path("postTokenBalances")) {
            if (!isCandidate(balance, owner, mint)) {
                continue;
            }
            BigInteger delta = amountOf(balance).subtract(before.getOrDefault(balance.path("accountIndex").asInt(), BigInteger.ZERO));
            if (delta.signum() > 0 && (credited == null || delta.compareTo(credited) > 0)) {
                credited = delta;
            }
        }
        return Optional.ofNullable(credited);
    }

    private JsonNode getSignatureStatus(String signature) {
        ObjectNode config = rpcClient.object();
        config.put("searchTransactionHistory", false);
        JsonNode value = rpcClient
                .call("getSignatureStatuses", rpcClient.params().add(rpcClient.params().add(signature)).add(config))
                .path("value");
        JsonNode status = value.path(0);
        return status.isMissingNode() || status.isNull() ? null : status;
    }

    private boolean reachedCommitment(String confirmationStatus) {
        if ("finalized".equals(confirmationStatus)) {
            return true;
        }
        return "confirmed".equals(confirmationStatus) && !"finalized".equals(commitment);
    }

    private static boolean isCandidate(JsonNode balance, String owner, String mint) {
        return owner.equals(balance.path("owner").asText())
                && (mint == null || mint.equals(balance.path("mint").asText()));
    }

    private static BigInteger amountOf(JsonNode balance) {
        return new BigInteger(balance.path("uiTokenAmount").path("amount").asText("0"));
    }

    private void sleep(String signature) {
        try {
            Thread.sleep(pollInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerException(
                    ExecutionFailure.transientFailure("Interrupted while awaiting confirmation"), signature, e);
        }
    }
}
