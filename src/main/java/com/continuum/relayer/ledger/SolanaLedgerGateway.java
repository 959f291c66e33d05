package com.continuum.relayer.ledger;

import com.continuum.relayer.config.RelayerProperties;
import com.continuum.relayer.domain.model.ExecutionFailure;
import com.continuum.relayer.domain.model.OrderRecord;
import com.continuum.relayer.exception.LedgerException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link LedgerGateway} over Solana JSON-RPC, delegating reads to {@link SolanaAccountService}
 * and writes to {@link SolanaTransactionService}.
 */
@Component
public class SolanaLedgerGateway implements LedgerGateway {

    private static final Logger log = LoggerFactory.getLogger(SolanaLedgerGateway.class);

    private final SolanaAccountService accountService;
    private final SolanaTransactionService transactionService;
    private final OrderAccountDecoder decoder;
    private final String programId;
    private final String fifoStateAddress;

    public SolanaLedgerGateway(
            SolanaAccountService accountService,
            SolanaTransactionService transactionService,
            OrderAccountDecoder decoder,
            RelayerProperties relayerProperties) {
        this.accountService = accountService;
        this.transactionService = transactionService;
        this.decoder = decoder;
        this.programId = relayerProperties.getLedger().getProgramId();
        this.fifoStateAddress = relayerProperties.getLedger().getFifoStateAddress();
    }

    @Override
    public long currentSequence() {
        byte[] data = guarded(() -> accountService.getAccountData(fifoStateAddress))
                .orElseThrow(() -> new LedgerException(
                        ExecutionFailure.permanentFailure("FifoState account not found: " + fifoStateAddress)));
        return decoder.decodeCurrentSequence(data);
    }

    @Override
    public Optional<OrderRecord> fetchOrder(long sequence) {
        List<SolanaAccountService.ProgramAccount> accounts = guarded(() -> accountService.getProgramAccounts(
                programId,
                OrderAccountDecoder.ORDER_ACCOUNT_SIZE,
                OrderAccountDecoder.ORDER_SEQUENCE_OFFSET,
                decoder.encodeSequenceFilter(sequence)));

        if (accounts.size() > 1) {
            log.warn("Multiple OrderState accounts for sequence: sequence={}, count={}", sequence, accounts.size());
        }
        return accounts.stream()
                .map(account -> decoder.decodeOrder(account.address(), account.data()))
                .filter(record -> record.getSequence() == sequence)
                .findFirst();
    }

    @Override
    public TransactionResult submit(SignedPayload payload) {
        String signature = guarded(() -> transactionService.sendTransaction(payload.getTransaction()));
        log.info("Execution transaction sent: orderId={}, sequence={}, signature={}",
                payload.getOrderId(), payload.getSequence(), signature);

        Optional<ExecutionFailure> failure;
        try {
            failure = transactionService.awaitConfirmation(signature);
        } catch (LedgerException e) {
            if (e.getSignature() != null) {
                throw e;
            }
            throw new LedgerException(e.getFailure(), signature, e);
        }
        if (failure.isPresent()) {
            return TransactionResult.failed(signature, failure.get());
        }

        return TransactionResult.confirmed(signature, readAmountOut(signature, payload));
    }

    @Override
    public String broadcast(String base64Transaction) {
        String signature = guarded(() -> transactionService.sendTransaction(base64Transaction));
        log.info("User transaction broadcast: signature={}", signature);
        return signature;
    }

    private BigInteger readAmountOut(String signature, SignedPayload payload) {
        try {
            return transactionService
                    .getCreditedAmount(signature, payload.getBeneficiary(), payload.getOutputMint())
                    .orElse(null);
        } catch (LedgerException e) {
            // Execution is confirmed; a missing output amount must not turn it into a failure.
            log.warn("Could not read output amount: signature={}, error={}", signature, e.getMessage());
            return null;
        }
    }

    /** Surfaces an open circuit breaker as a transient ledger failure. */
    private static <T> T guarded(Supplier<T> call) {
        try {
            return call.get();
        } catch (CallNotPermittedException e) {
            throw new LedgerException(ExecutionFailure.transientFailure("Ledger RPC circuit open"), e);
        }
    }
}
