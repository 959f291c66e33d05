package com.continuum.relayer.ledger;

import com.continuum.relayer.config.RelayerProperties;
import com.continuum.relayer.domain.model.ExecutionFailure;
import com.continuum.relayer.exception.LedgerException;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link TransactionSigner} backed by an external signing service that holds the relayer key.
 *
 * <p>{@code POST /sign} with the {@link ExecutionInstruction} as JSON; the service answers
 * {@code {"transaction": "<base64>", "outputMint": "..."}}.
 */
@Component
public class RemoteTransactionSigner implements TransactionSigner {

    private static final Logger log = LoggerFactory.getLogger(RemoteTransactionSigner.class);

    private final RestClient signer;
    private final LedgerErrorClassifier errorClassifier;
    private final String address;

    public RemoteTransactionSigner(
            @Qualifier("signerRestClient") RestClient signer,
            LedgerErrorClassifier errorClassifier,
            RelayerProperties relayerProperties) {
        this.signer = signer;
        this.errorClassifier = errorClassifier;
        this.address = relayerProperties.getSigner().getAddress();
    }

    @Override
    public SignedPayload sign(ExecutionInstruction instruction) {
        SignResponse response;
        try {
            response = signer.post()
                    .uri("/sign")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(instruction)
                    .retrieve()
                    .body(SignResponse.class);
        } catch (RestClientResponseException e) {
            log.warn("Signing rejected: orderId={}, status={}", instruction.getOrderId(), e.getStatusCode().value());
            throw new LedgerException(
                    errorClassifier.classifyHttpStatus(e.getStatusCode().value(), e.getResponseBodyAsString()), e);
        } catch (ResourceAccessException e) {
            throw new LedgerException(ExecutionFailure.transientFailure("Signer unreachable: " + e.getMessage()), e);
        }

        if (response == null || response.getTransaction() == null || response.getTransaction().isBlank()) {
            throw new LedgerException(ExecutionFailure.transientFailure(
                    "Signer returned no transaction for order " + instruction.getOrderId()));
        }

        return SignedPayload.builder()
                .orderId(instruction.getOrderId())
                .sequence(instruction.getSequence())
                .transaction(response.getTransaction())
                .beneficiary(instruction.getUserAddress())
                .outputMint(response.getOutputMint())
                .build();
    }

    @Override
    public String address() {
        return address;
    }

    @Data
    static class SignResponse {
        private String transaction;
        private String outputMint;
    }
}
