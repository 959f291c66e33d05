package com.continuum.relayer.ledger;

import com.continuum.relayer.config.RelayerProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Account reads against the ledger RPC.
 *
 * <p>Implementation detail of {@link SolanaLedgerGateway}; nothing else should inject it.
 * Reads are idempotent, so they get the {@code ledgerRead} retry on top of the shared
 * {@code ledgerRpc} circuit breaker.
 */
@Service
public class SolanaAccountService {

    private final SolanaRpcClient rpcClient;
    private final String commitment;

    public SolanaAccountService(SolanaRpcClient rpcClient, RelayerProperties relayerProperties) {
        this.rpcClient = rpcClient;
        this.commitment = relayerProperties.getLedger().getCommitment();
    }

    /** Raw data of the account at {@code address}, or empty when the account does not exist. */
    @CircuitBreaker(name = "ledgerRpc")
    @Retry(name = "ledgerRead")
    public Optional<byte[]> getAccountData(String address) {
        ObjectNode config = rpcClient.object();
        config.put("encoding", "base64");
        config.put("commitment", commitment);
        ArrayNode params = rpcClient.params().add(address).add(config);

        JsonNode value = rpcClient.call("getAccountInfo", params).path("value");
        if (value.isMissingNode() || value.isNull()) {
            return Optional.empty();
        }
        return Optional.of(decodeData(value.path("data")));
    }

    /** Accounts owned by {@code programId} of the given size whose bytes at {@code offset} equal {@code base58Bytes}. */
    @CircuitBreaker(name = "ledgerRpc")
    @Retry(name = "ledgerRead")
    public List<ProgramAccount> getProgramAccounts(String programId, int dataSize, int offset, String base58Bytes) {
        ObjectNode memcmp = rpcClient.object();
        memcmp.put("offset", offset);
        memcmp.put("bytes", base58Bytes);

        ObjectNode sizeFilter = rpcClient.object();
        sizeFilter.put("dataSize", dataSize);
        ObjectNode memcmpFilter = rpcClient.object();
        memcmpFilter.set("memcmp", memcmp);

        ObjectNode config = rpcClient.object();
        config.put("encoding", "base64");
        config.put("commitment", commitment);
        config.set("filters", rpcClient.params().add(sizeFilter).add(memcmpFilter));

        JsonNode result = rpcClient.call("getProgramAccounts", rpcClient.params().add(programId).add(config));

        List<ProgramAccount> accounts = new ArrayList<>();
        for (JsonNode entry : result) {
            accounts.add(new ProgramAccount(
                    entry.path("pubkey").asText(), decodeData(entry.path("account").path("data"))));
        }
        return accounts;
    }

    private static byte[] decodeData(JsonNode data) {
        // ["<base64>", "base64"]
        String encoded = data.isArray() ? data.path(0).asText("") : data.asText("");
        return Base64.getDecoder().decode(encoded);
    }

    public record ProgramAccount(String address, byte[] data) {}
}
