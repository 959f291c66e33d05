package com.continuum.relayer.unit.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.continuum.relayer.config.RelayerProperties;
import com.continuum.relayer.domain.enums.FailureKind;
import com.continuum.relayer.domain.enums.LedgerOrderStatus;
import com.continuum.relayer.domain.model.OrderRecord;
import com.continuum.relayer.exception.LedgerException;
import com.continuum.relayer.exception.LedgerTimeoutException;
import com.continuum.relayer.ledger.LedgerErrorClassifier;
import com.continuum.relayer.ledger.OrderAccountDecoder;
import com.continuum.relayer.ledger.SignedPayload;
import com.continuum.relayer.ledger.SolanaAccountService;
import com.continuum.relayer.ledger.SolanaLedgerGateway;
import com.continuum.relayer.ledger.SolanaRpcClient;
import com.continuum.relayer.ledger.SolanaTransactionService;
import com.continuum.relayer.ledger.TransactionResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Clock;
import java.util.Base64;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

/**
 * Tests SolanaLedgerGateway end to end over JSON-RPC with MockRestServiceServer standing in
 * for the ledger node.
 */
class SolanaLedgerGatewayTest {

    private static final String PROGRAM_ID = "9tcAhE4XGcZZTE8ez1EW8FF7rxyBN8uat2kkepgaeyEa";
    private static final String FIFO_STATE = "5ZiE3vAkrdXBgyFL7KqG3RoEGBws4CjRcXVbABDLZTgx";

    private MockRestServiceServer server;
    private SolanaLedgerGateway gateway;

    @BeforeEach
    void setUp() {
        buildGateway(5_000);
    }

    @AfterEach
    void tearDown() {
        server.verify();
    }

    private void buildGateway(long confirmationTimeoutMs) {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://rpc.test");
        server = MockRestServiceServer.bindTo(builder).build();

        RelayerProperties properties = new RelayerProperties();
        properties.getLedger().setProgramId(PROGRAM_ID);
        properties.getLedger().setFifoStateAddress(FIFO_STATE);
        properties.getLedger().setConfirmationTimeoutMs(confirmationTimeoutMs);
        properties.getLedger().setConfirmationPollIntervalMs(1);

        LedgerErrorClassifier classifier = new LedgerErrorClassifier();
        SolanaRpcClient rpcClient = new SolanaRpcClient(builder.build(), new ObjectMapper(), classifier);
        gateway = new SolanaLedgerGateway(
                new SolanaAccountService(rpcClient, properties),
                new SolanaTransactionService(rpcClient, classifier, properties, Clock.systemUTC()),
                new OrderAccountDecoder(),
                properties);
    }

    private void expect(String rpcMethod, String result) {
        server.expect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.method").value(rpcMethod))
                .andRespond(withSuccess(
                        "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":" + result + "}", MediaType.APPLICATION_JSON));
    }

    private void expectError(String rpcMethod, String error) {
        server.expect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.method").value(rpcMethod))
                .andRespond(withSuccess(
                        "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":" + error + "}", MediaType.APPLICATION_JSON));
    }

    private static String base64(byte[] data) {
        return Base64.getEncoder().encodeToString(data);
    }

    private static SignedPayload payload() {
        return SignedPayload.builder()
                .orderId("ord_1")
                .sequence(1)
                .transaction("c2lnbmVkLXR4")
                .beneficiary("UserWallet")
                .outputMint("USDCMint")
                .build();
    }

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("currentSequence decodes the FifoState account")
        void currentSequence() {
            byte[] fifo = ByteBuffer.allocate(49).order(ByteOrder.LITTLE_ENDIAN).put(new byte[8]).putLong(42).array();
            server.expect(method(HttpMethod.POST))
                    .andExpect(jsonPath("$.method").value("getAccountInfo"))
                    .andExpect(jsonPath("$.params[0]").value(FIFO_STATE))
                    .andExpect(jsonPath("$.params[1].encoding").value("base64"))
                    .andRespond(withSuccess(
                            "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"context\":{\"slot\":9},\"value\":"
                                    + "{\"data\":[\"" + base64(fifo) + "\",\"base64\"],\"lamports\":1}}}",
                            MediaType.APPLICATION_JSON));

            assertThat(gateway.currentSequence()).isEqualTo(42);
        }

        @Test
        @DisplayName("Missing FifoState account is a permanent error")
        void missingFifoState() {
            expect("getAccountInfo", "{\"context\":{\"slot\":9},\"value\":null}");

            assertThatThrownBy(() -> gateway.currentSequence())
                    .isInstanceOf(LedgerException.class)
                    .satisfies(e -> assertThat(((LedgerException) e).isTransient()).isFalse());
        }

        @Test
        @DisplayName("fetchOrder filters program accounts by size and sequence")
        void fetchOrder() {
            byte[] order = OrderAccountDecoderTest.orderState(1, 1_000, 990, 0, 1_740_000_000L, null);
            server.expect(method(HttpMethod.POST))
                    .andExpect(jsonPath("$.method").value("getProgramAccounts"))
                    .andExpect(jsonPath("$.params[0]").value(PROGRAM_ID))
                    .andExpect(jsonPath("$.params[1].filters[0].dataSize").value(OrderAccountDecoder.ORDER_ACCOUNT_SIZE))
                    .andExpect(jsonPath("$.params[1].filters[1].memcmp.offset").value(8))
                    .andExpect(jsonPath("$.params[1].filters[1].memcmp.bytes").value("Ahg1opVcGX"))
                    .andRespond(withSuccess(
                            "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":[{\"pubkey\":\"OrderAcct1\",\"account\":"
                                    + "{\"data\":[\"" + base64(order) + "\",\"base64\"]}}]}",
                            MediaType.APPLICATION_JSON));

            Optional<OrderRecord> record = gateway.fetchOrder(1);

            assertThat(record).isPresent();
            assertThat(record.get().getAddress()).isEqualTo("OrderAcct1");
            assertThat(record.get().getUserAddress()).isEqualTo(OrderAccountDecoderTest.USER);
            assertThat(record.get().getStatus()).isEqualTo(LedgerOrderStatus.PENDING);
        }

        @Test
        @DisplayName("fetchOrder returns empty when no account holds the sequence")
        void fetchOrderAbsent() {
            expect("getProgramAccounts", "[]");

            assertThat(gateway.fetchOrder(7)).isEmpty();
        }

        @Test
        @DisplayName("HTTP 503 from the node is a transient error")
        void serviceUnavailable() {
            server.expect(method(HttpMethod.POST)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

            assertThatThrownBy(() -> gateway.fetchOrder(1))
                    .isInstanceOf(LedgerException.class)
                    .satisfies(e -> assertThat(((LedgerException) e).isTransient()).isTrue());
        }
    }

    @Nested
    @DisplayName("Submission")
    class Submission {

        @Test
        @DisplayName("Confirmed transaction reports the amount credited to the user")
        void confirmedWithAmount() {
            expect("sendTransaction", "\"sig1\"");
            expect("getSignatureStatuses", "{\"value\":[null]}");
            expect("getSignatureStatuses", "{\"value\":[{\"confirmationStatus\":\"processed\",\"err\":null}]}");
            expect("getSignatureStatuses", "{\"value\":[{\"confirmationStatus\":\"confirmed\",\"err\":null}]}");
            expect("getTransaction", "{\"meta\":{"
                    + "\"preTokenBalances\":[{\"accountIndex\":3,\"owner\":\"UserWallet\",\"mint\":\"USDCMint\","
                    + "\"uiTokenAmount\":{\"amount\":\"100\"}}],"
                    + "\"postTokenBalances\":[{\"accountIndex\":3,\"owner\":\"UserWallet\",\"mint\":\"USDCMint\","
                    + "\"uiTokenAmount\":{\"amount\":\"1100\"}},"
                    + "{\"accountIndex\":5,\"owner\":\"PoolVault\",\"mint\":\"USDCMint\","
                    + "\"uiTokenAmount\":{\"amount\":\"9000\"}}]}}");

            TransactionResult result = gateway.submit(payload());

            assertThat(result.isConfirmed()).isTrue();
            assertThat(result.getSignature()).isEqualTo("sig1");
            assertThat(result.getAmountOut()).isEqualTo(BigInteger.valueOf(1_000));
        }

        @Test
        @DisplayName("Transaction failing on-ledger returns a classified failure")
        void failedOnLedger() {
            expect("sendTransaction", "\"sig2\"");
            expect("getSignatureStatuses",
                    "{\"value\":[{\"confirmationStatus\":\"confirmed\",\"err\":{\"InstructionError\":[0,{\"Custom\":6008}]}}]}");

            TransactionResult result = gateway.submit(payload());

            assertThat(result.isConfirmed()).isFalse();
            assertThat(result.getSignature()).isEqualTo("sig2");
            assertThat(result.getError().kind()).isEqualTo(FailureKind.PERMANENT);
            assertThat(result.getError().reason()).contains("SlippageExceeded");
        }

        @Test
        @DisplayName("Preflight rejection is thrown with the program error's kind")
        void preflightRejection() {
            expectError("sendTransaction", "{\"code\":-32002,\"message\":\"Transaction simulation failed\","
                    + "\"data\":{\"err\":{\"InstructionError\":[0,{\"Custom\":6006}]}}}");

            assertThatThrownBy(() -> gateway.submit(payload()))
                    .isInstanceOf(LedgerException.class)
                    .hasMessageContaining("EmergencyPause")
                    .satisfies(e -> assertThat(((LedgerException) e).isTransient()).isTrue());
        }

        @Test
        @DisplayName("Confirmation timeout is transient and keeps the signature")
        void confirmationTimeout() {
            buildGateway(0);
            expect("sendTransaction", "\"sig3\"");
            expect("getSignatureStatuses", "{\"value\":[null]}");

            assertThatThrownBy(() -> gateway.submit(payload()))
                    .isInstanceOf(LedgerTimeoutException.class)
                    .satisfies(e -> {
                        LedgerException ledgerException = (LedgerException) e;
                        assertThat(ledgerException.isTransient()).isTrue();
                        assertThat(ledgerException.getSignature()).isEqualTo("sig3");
                    });
        }

        @Test
        @DisplayName("Status poll errors carry the sent signature")
        void statusPollError() {
            expect("sendTransaction", "\"sig4\"");
            server.expect(method(HttpMethod.POST)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

            assertThatThrownBy(() -> gateway.submit(payload()))
                    .isInstanceOf(LedgerException.class)
                    .satisfies(e -> assertThat(((LedgerException) e).getSignature()).isEqualTo("sig4"));
        }

        @Test
        @DisplayName("Unreadable output amount does not turn a confirmed execution into a failure")
        void amountUnavailable() {
            expect("sendTransaction", "\"sig5\"");
            expect("getSignatureStatuses", "{\"value\":[{\"confirmationStatus\":\"finalized\",\"err\":null}]}");
            server.expect(method(HttpMethod.POST)).andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

            TransactionResult result = gateway.submit(payload());

            assertThat(result.isConfirmed()).isTrue();
            assertThat(result.getAmountOut()).isNull();
        }

        @Test
        @DisplayName("broadcast relays the user's transaction and returns its signature")
        void broadcast() {
            server.expect(method(HttpMethod.POST))
                    .andExpect(jsonPath("$.method").value("sendTransaction"))
                    .andExpect(jsonPath("$.params[0]").value("dXNlci10eA=="))
                    .andRespond(withSuccess("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"userSig\"}", MediaType.APPLICATION_JSON));

            assertThat(gateway.broadcast("dXNlci10eA==")).isEqualTo("userSig");
        }
    }
}
