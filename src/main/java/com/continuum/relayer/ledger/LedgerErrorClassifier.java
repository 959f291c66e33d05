package com.continuum.relayer.ledger;

import com.continuum.relayer.domain.model.ExecutionFailure;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Maps ledger RPC errors and on-ledger transaction errors to TRANSIENT or PERMANENT.
 *
 * <p>Settlement program custom errors use their declared kind. Funding problems are permanent.
 * Expired blockhashes, rate limiting, timeouts and lagging nodes are transient. Anything not
 * recognised is treated as transient so RetryPolicy bounds it.
 */
@Component
public class LedgerErrorClassifier {

    private static final Pattern CUSTOM_ERROR_HEX = Pattern.compile("custom program error: 0x([0-9a-fA-F]+)");

    private static final List<String> PERMANENT_MARKERS = List.of(
            "insufficient funds",
            "insufficientfunds",
            "insufficient lamports",
            "accountnotfound",
            "invalid account data",
            "invalidaccountdata");

    private static final List<String> TRANSIENT_MARKERS = List.of(
            "blockhash not found",
            "blockhashnotfound",
            "block height exceeded",
            "too many requests",
            "timeout",
            "timed out",
            "node is behind",
            "node is unhealthy",
            "connection reset",
            "connection refused",
            "service unavailable");

    public ExecutionFailure classify(String message) {
        if (message == null || message.isBlank()) {
            return ExecutionFailure.transientFailure("Unknown ledger error");
        }

        Optional<SettlementProgramError> programError = findProgramError(message);
        if (programError.isPresent()) {
            return forProgramError(programError.get());
        }

        String normalized = message.toLowerCase(Locale.ROOT);
        if (PERMANENT_MARKERS.stream().anyMatch(normalized::contains)) {
            return ExecutionFailure.permanentFailure(message);
        }
        if (TRANSIENT_MARKERS.stream().anyMatch(normalized::contains)) {
            return ExecutionFailure.transientFailure(message);
        }
        return ExecutionFailure.transientFailure(message);
    }

    /**
     * Classifies the {@code err} value of a transaction status, e.g.
     * {@code {"InstructionError":[0,{"Custom":6008}]}} or {@code "InsufficientFundsForFee"}.
     */
    public ExecutionFailure classifyTransactionError(JsonNode err) {
        JsonNode instructionError = err.path("InstructionError");
        if (instructionError.isArray() && instructionError.size() == 2) {
            JsonNode custom = instructionError.get(1).path("Custom");
            if (custom.isNumber()) {
                Optional<SettlementProgramError> programError = SettlementProgramError.fromCode(custom.asLong());
                if (programError.isPresent()) {
                    return forProgramError(programError.get());
                }
                return ExecutionFailure.permanentFailure("Custom program error " + custom.asLong());
            }
        }
        return classify(err.isTextual() ? err.asText() : err.toString());
    }

    /** Classifies an HTTP status returned by the RPC endpoint itself. */
    public ExecutionFailure classifyHttpStatus(int status, String message) {
        if (status == 429 || status >= 500) {
            return ExecutionFailure.transientFailure("RPC HTTP " + status + ": " + message);
        }
        return ExecutionFailure.permanentFailure("RPC HTTP " + status + ": " + message);
    }

    private Optional<SettlementProgramError> findProgramError(String message) {
        Matcher matcher = CUSTOM_ERROR_HEX.matcher(message);
        if (matcher.find()) {
            return SettlementProgramError.fromCode(Long.parseLong(matcher.group(1), 16));
        }
        return SettlementProgramError.fromMessage(message);
    }

    private ExecutionFailure forProgramError(SettlementProgramError error) {
        return new ExecutionFailure(error.getKind(), error.getErrorName() + " (" + error.getCode() + ")");
    }
}
