package dao.solana.svol.chain;

import com.fasterxml.jackson.databind.ObjectMapper;
import dao.solana.svol.config.ChainProperties;
import dao.solana.svol.exception.ChainRpcException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SolanaRpcChainGatewayTest {

    private static final String ENDPOINT = "http://localhost:8899";

    private MockRestServiceServer server;
    private SolanaRpcChainGateway gateway;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        ChainProperties props = new ChainProperties();
        props.setRpcEndpoint(ENDPOINT);
        props.getPolling().setConfirmPollInitialMs(100);
        props.getPolling().setConfirmPollMaxMs(100);
        gateway = new SolanaRpcChainGateway(restTemplate, new ObjectMapper(), props);
    }

    private void expect(String rpcMethod, String response) {
        server.expect(requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.jsonrpc").value("2.0"))
                .andExpect(jsonPath("$.method").value(rpcMethod))
                .andRespond(withSuccess(response, MediaType.APPLICATION_JSON));
    }

    @Test
    @DisplayName("Test latest blockhash is read from result.value")
    void testRecentBlockhash() {
        expect("getLatestBlockhash",
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"context\":{\"slot\":1},"
                        + "\"value\":{\"blockhash\":\"EkSnNWid2cvwEVnVx9aBqawnmiCNiDgp3gUdkDPTKN1N\",\"lastValidBlockHeight\":100}}}");

        assertEquals("EkSnNWid2cvwEVnVx9aBqawnmiCNiDgp3gUdkDPTKN1N", gateway.recentBlockhash());
        server.verify();
    }

    @Test
    @DisplayName("Test submit sends base64 and returns the signature")
    void testSubmit() {
        server.expect(requestTo(ENDPOINT))
                .andExpect(jsonPath("$.method").value("sendTransaction"))
                .andExpect(jsonPath("$.params[0]").value("AQID"))
                .andExpect(jsonPath("$.params[1].encoding").value("base64"))
                .andRespond(withSuccess("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"5sig\"}", MediaType.APPLICATION_JSON));

        String signature = gateway.submit(new SignedTransaction("5sig", new byte[]{1, 2, 3}, "a", "b", 1));

        assertEquals("5sig", signature);
        server.verify();
    }

    @Test
    @DisplayName("Test RPC error keeps the node's err and logs in the message")
    void testRpcError() {
        expect("sendTransaction", "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32002,"
                + "\"message\":\"Transaction simulation failed\",\"data\":{\"err\":\"InsufficientFundsForFee\","
                + "\"logs\":[\"Program log: low balance\"]}}}");

        ChainRpcException e = assertThrows(ChainRpcException.class, () ->
                gateway.submit(new SignedTransaction("s", new byte[]{1}, "a", "b", 1)));
        assertTrue(e.getMessage().contains("-32002"));
        assertTrue(e.getMessage().contains("InsufficientFundsForFee"));
        assertTrue(e.getMessage().contains("low balance"));
    }

    @Test
    @DisplayName("Test HTTP failure surfaces as ChainRpcException")
    void testHttpFailure() {
        server.expect(requestTo(ENDPOINT)).andRespond(withServerError());

        assertThrows(ChainRpcException.class, () -> gateway.recentBlockhash());
    }

    @Test
    @DisplayName("Test fee sample is the median of recent prioritization fees")
    void testFeeSampleMedian() {
        expect("getRecentPrioritizationFees", "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":["
                + "{\"slot\":1,\"prioritizationFee\":900},"
                + "{\"slot\":2,\"prioritizationFee\":100},"
                + "{\"slot\":3,\"prioritizationFee\":5000}]}");

        assertEquals(900L, gateway.latestFeeSample());
    }

    @Test
    @DisplayName("Test empty fee list is an error so the oracle can fall back")
    void testFeeSampleEmpty() {
        expect("getRecentPrioritizationFees", "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":[]}");

        assertThrows(ChainRpcException.class, () -> gateway.latestFeeSample());
    }

    @Test
    @DisplayName("Test confirmation polls until the commitment is reached")
    void testConfirmPolling() {
        expect("getSignatureStatuses", "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"value\":[null]}}");
        expect("getSignatureStatuses", "{\"jsonrpc\":\"2.0\",\"id\":2,\"result\":{\"value\":"
                + "[{\"slot\":5,\"confirmations\":0,\"err\":null,\"confirmationStatus\":\"processed\"}]}}");
        expect("getSignatureStatuses", "{\"jsonrpc\":\"2.0\",\"id\":3,\"result\":{\"value\":"
                + "[{\"slot\":5,\"confirmations\":1,\"err\":null,\"confirmationStatus\":\"confirmed\"}]}}");

        ConfirmationResult result = gateway.confirm("5sig", Duration.ofSeconds(10));

        assertTrue(result.confirmed());
        server.verify();
    }

    @Test
    @DisplayName("Test on-chain error ends confirmation as failed")
    void testConfirmFailed() {
        expect("getSignatureStatuses", "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"value\":"
                + "[{\"slot\":5,\"err\":{\"InstructionError\":[1,{\"Custom\":1}]},\"confirmationStatus\":\"confirmed\"}]}}");

        ConfirmationResult result = gateway.confirm("5sig", Duration.ofSeconds(10));

        assertFalse(result.confirmed());
        assertFalse(result.isTimeout());
        assertTrue(result.error().contains("InstructionError"));
    }

    @Test
    @DisplayName("Test unknown signature times out")
    void testConfirmTimeout() {
        server.expect(ExpectedCount.manyTimes(), requestTo(ENDPOINT))
                .andRespond(withSuccess("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"value\":[null]}}", MediaType.APPLICATION_JSON));

        ConfirmationResult result = gateway.confirm("5sig", Duration.ofMillis(500));

        assertTrue(result.isTimeout());
    }

    @Test
    @DisplayName("Test token account lookups are cached per owner and mint")
    void testFindTokenAccountCached() {
        server.expect(ExpectedCount.once(), requestTo(ENDPOINT))
                .andExpect(jsonPath("$.method").value("getTokenAccountsByOwner"))
                .andExpect(jsonPath("$.params[1].mint").value("mint"))
                .andRespond(withSuccess("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"value\":"
                        + "[{\"pubkey\":\"tokenAcc\",\"account\":{}}]}}", MediaType.APPLICATION_JSON));

        assertEquals(Optional.of("tokenAcc"), gateway.findTokenAccount("owner", "mint"));
        assertEquals(Optional.of("tokenAcc"), gateway.findTokenAccount("owner", "mint"));
        server.verify();
    }

    @Test
    @DisplayName("Test owner without a token account yields empty")
    void testFindTokenAccountMissing() {
        expect("getTokenAccountsByOwner", "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"value\":[]}}");

        assertTrue(gateway.findTokenAccount("owner", "mint").isEmpty());
    }
}
