package dao.solana.svol.chain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dao.solana.svol.config.ChainProperties;
import dao.solana.svol.exception.ChainRpcException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Solana JSON-RPC implementation of {@link ChainGateway}.
 */
@Slf4j
public class SolanaRpcChainGateway implements ChainGateway {

    private final RestTemplate http;
    private final ObjectMapper mapper;
    private final ChainProperties props;
    private final AtomicLong requestIds = new AtomicLong();
    private final Map<String, String> tokenAccountCache = new ConcurrentHashMap<>();

    public SolanaRpcChainGateway(RestTemplate http, ObjectMapper mapper, ChainProperties props) {
        this.http = http;
        this.mapper = mapper;
        this.props = props;
        log.info("Solana RPC gateway initialized: endpoint={}, commitment={}", props.getRpcEndpoint(), props.getCommitment());
    }

    @Override
    public String recentBlockhash() {
        JsonNode result = call("getLatestBlockhash", List.of(Map.of("commitment", props.getCommitment())));
        return ResponseFieldAliases.resolve(result.path("value"), ResponseFieldAliases.BLOCKHASH)
                .map(JsonNode::asText)
                .orElseThrow(() -> new ChainRpcException("getLatestBlockhash returned no blockhash"));
    }

    @Override
    public String submit(SignedTransaction transaction) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("encoding", "base64");
        options.put("preflightCommitment", props.getCommitment());
        JsonNode result = call("sendTransaction", List.of(transaction.base64(), options));
        String signature = result.asText(null);
        if (signature == null || signature.isBlank()) {
            throw new ChainRpcException("sendTransaction returned no signature");
        }
        log.debug("Submitted transaction {} ({} -> {})", signature, transaction.from(), transaction.to());
        return signature;
    }

    /**
     * Polls getSignatureStatuses until the configured commitment is reached, the transaction
     * reports an error, or the timeout passes. Poll interval grows by 1.5x with jitter.
     */
    @Override
    public ConfirmationResult confirm(String txHash, Duration timeout) {
        ChainProperties.Polling polling = props.getPolling();
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        long sleepMs = Math.max(100, polling.getConfirmPollInitialMs());
        long maxSleepMs = Math.max(sleepMs, polling.getConfirmPollMaxMs());

        while (System.currentTimeMillis() < deadline) {
            try {
                JsonNode status = call("getSignatureStatuses",
                        List.of(List.of(txHash), Map.of("searchTransactionHistory", true)))
                        .path("value").path(0);
                if (!status.isMissingNode() && !status.isNull()) {
                    JsonNode err = status.get("err");
                    if (err != null && !err.isNull()) {
                        return ConfirmationResult.failed(err.toString());
                    }
                    if (meetsCommitment(status.path("confirmationStatus").asText(""))) {
                        return ConfirmationResult.ok();
                    }
                }
            } catch (ChainRpcException e) {
                log.debug("Status poll for {} failed: {}", txHash, e.getMessage());
            }
            try {
                long jitter = ThreadLocalRandom.current().nextLong(0, 150);
                Thread.sleep(sleepMs + jitter);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return ConfirmationResult.timedOut();
            }
            sleepMs = Math.min(maxSleepMs, (long) Math.ceil(sleepMs * 1.5));
        }
        return ConfirmationResult.timedOut();
    }

    /**
     * Median of the recent prioritization fees reported by the node.
     */
    @Override
    public long latestFeeSample() {
        JsonNode result = call("getRecentPrioritizationFees", List.of());
        List<Long> fees = new ArrayList<>();
        for (JsonNode entry : result) {
            ResponseFieldAliases.resolve(entry, ResponseFieldAliases.FEE)
                    .filter(JsonNode::canConvertToLong)
                    .ifPresent(v -> fees.add(v.asLong()));
        }
        if (fees.isEmpty()) {
            throw new ChainRpcException("getRecentPrioritizationFees returned no samples");
        }
        Collections.sort(fees);
        return fees.get(fees.size() / 2);
    }

    @Override
    public Optional<String> findTokenAccount(String owner, String mint) {
        String key = owner + ":" + mint;
        String cached = tokenAccountCache.get(key);
        if (cached != null) return Optional.of(cached);

        JsonNode accounts = call("getTokenAccountsByOwner",
                List.of(owner, Map.of("mint", mint), Map.of("encoding", "jsonParsed")))
                .path("value");
        if (!accounts.isArray() || accounts.isEmpty()) {
            return Optional.empty();
        }
        String account = accounts.path(0).path("pubkey").asText(null);
        if (account == null) return Optional.empty();
        tokenAccountCache.put(key, account);
        return Optional.of(account);
    }

    JsonNode call(String method, List<?> params) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jsonrpc", "2.0");
        body.put("id", requestIds.incrementAndGet());
        body.put("method", method);
        body.put("params", params);

        String raw;
        try {
            raw = http.postForObject(props.getRpcEndpoint(), body, String.class);
        } catch (RestClientException e) {
            throw new ChainRpcException(method + " failed: " + e.getMessage(), e);
        }
        if (raw == null || raw.isBlank()) {
            throw new ChainRpcException(method + " returned an empty body");
        }

        JsonNode root;
        try {
            root = mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ChainRpcException(method + " returned malformed JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            throw new ChainRpcException(describeError(method, error));
        }
        return root.path("result");
    }

    // Preflight failures carry the useful part (err, logs) under error.data
    private static String describeError(String method, JsonNode error) {
        StringBuilder sb = new StringBuilder(method).append(" error ")
                .append(error.path("code").asText("?")).append(": ")
                .append(error.path("message").asText(""));
        JsonNode data = error.path("data");
        JsonNode err = data.path("err");
        if (!err.isMissingNode() && !err.isNull()) {
            sb.append(" err=").append(err);
        }
        JsonNode logs = data.path("logs");
        if (logs.isArray() && !logs.isEmpty()) {
            sb.append(" logs=").append(logs);
        }
        return sb.toString();
    }

    private boolean meetsCommitment(String status) {
        if (status.isEmpty()) return false;
        switch (props.getCommitment()) {
            case "processed":
                return true;
            case "finalized":
                return "finalized".equals(status);
            default:
                return "confirmed".equals(status) || "finalized".equals(status);
        }
    }
}
