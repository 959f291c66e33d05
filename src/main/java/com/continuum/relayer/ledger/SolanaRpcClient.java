package com.continuum.relayer.ledger;

import com.continuum.relayer.domain.model.ExecutionFailure;
import com.continuum.relayer.exception.LedgerException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Minimal Solana JSON-RPC 2.0 client. One HTTP POST per call, no retries of its own:
 * reads are retried by Resilience4j in {@link SolanaAccountService}, writes by the engine.
 *
 * <p>Every failure surfaces as a classified {@link LedgerException}.
 */
@Component
public class SolanaRpcClient {

    private static final Logger log = LoggerFactory.getLogger(SolanaRpcClient.class);

    private final RestClient rpc;
    private final ObjectMapper objectMapper;
    private final LedgerErrorClassifier errorClassifier;
    private final AtomicLong requestIds = new AtomicLong(1);

    public SolanaRpcClient(
            @Qualifier("ledgerRpcRestClient") RestClient rpc,
            ObjectMapper objectMapper,
            LedgerErrorClassifier errorClassifier) {
        this.rpc = rpc;
        this.objectMapper = objectMapper;
        this.errorClassifier = errorClassifier;
    }

    public ArrayNode params() {
        return objectMapper.createArrayNode();
    }

    public ObjectNode object() {
        return objectMapper.createObjectNode();
    }

    /** Executes {@code method} and returns its {@code result} node (possibly JSON null). */
    public JsonNode call(String method, ArrayNode params) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("jsonrpc", "2.0");
        request.put("id", requestIds.getAndIncrement());
        request.put("method", method);
        request.set("params", params);

        String body;
        try {
            body = rpc.post()
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(request.toString())
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            log.warn("Ledger RPC HTTP error: method={}, status={}", method, e.getStatusCode().value());
            throw new LedgerException(
                    errorClassifier.classifyHttpStatus(e.getStatusCode().value(), e.getStatusText()), e);
        } catch (ResourceAccessException e) {
            log.warn("Ledger RPC unreachable: method={}, error={}", method, e.getMessage());
            throw new LedgerException(ExecutionFailure.transientFailure("Ledger RPC unreachable: " + e.getMessage()), e);
        } catch (RestClientException e) {
            throw new LedgerException(errorClassifier.classify(e.getMessage()), e);
        }

        if (body == null || body.isBlank()) {
            throw new LedgerException(ExecutionFailure.transientFailure("Empty ledger RPC response for " + method));
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new LedgerException(ExecutionFailure.transientFailure("Malformed ledger RPC response for " + method), e);
        }

        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new LedgerException(classifyRpcError(error));
        }
        return root.path("result");
    }

    private ExecutionFailure classifyRpcError(JsonNode error) {
        String message = error.path("message").asText("");
        JsonNode transactionError = error.path("data").path("err");
        if (!transactionError.isMissingNode() && !transactionError.isNull()) {
            ExecutionFailure failure = errorClassifier.classifyTransactionError(transactionError);
            return new ExecutionFailure(failure.kind(), message + ": " + failure.reason());
        }
        return errorClassifier.classify(message);
    }
}
