package com.silentrisk.worker.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.silentrisk.common.config.SilentRiskProperties;
import com.silentrisk.common.error.ComputationFailureException;
import com.silentrisk.common.error.ErrorCode;
import com.silentrisk.common.error.UpstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.io.InterruptedIOException;
import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Minimal Ethereum JSON-RPC 2.0 client.
 *
 * Transport failures and timeouts become {@link UpstreamUnavailableException};
 * an {@code error} member in the response becomes {@link ComputationFailureException}.
 */
@Slf4j
@Component
public class EthereumRpcClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final SilentRiskProperties properties;
    private final AtomicLong requestIds = new AtomicLong();

    public EthereumRpcClient(@Qualifier("rpcRestTemplate") RestTemplate restTemplate,
                             ObjectMapper objectMapper,
                             SilentRiskProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public long blockNumber() {
        return parseQuantity(call("eth_blockNumber"));
    }

    public long transactionCount(String address, String blockTag) {
        return parseQuantity(call("eth_getTransactionCount", address, blockTag));
    }

    public long transactionCountAt(String address, long blockNumber) {
        return transactionCount(address, toQuantity(blockNumber));
    }

    public BigInteger balance(String address) {
        return parseBigQuantity(call("eth_getBalance", address, "latest"));
    }

    public long blockTimestamp(long blockNumber) {
        JsonNode block = call("eth_getBlockByNumber", toQuantity(blockNumber), false);
        if (block.isNull() || block.isMissingNode()) {
            throw new ComputationFailureException("Block " + blockNumber + " not found");
        }
        return parseQuantity(block.path("timestamp"));
    }

    public JsonNode blockWithTransactions(long blockNumber) {
        return call("eth_getBlockByNumber", toQuantity(blockNumber), true);
    }

    public JsonNode logs(ObjectNode filter) {
        return call("eth_getLogs", filter);
    }

    JsonNode call(String method, Object... params) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("jsonrpc", "2.0");
        request.put("id", requestIds.incrementAndGet());
        request.put("method", method);
        ArrayNode paramArray = request.putArray("params");
        for (Object param : params) {
            paramArray.add(objectMapper.valueToTree(param));
        }

        JsonNode response;
        try {
            response = restTemplate.postForObject(properties.getRpc().getUrl(), request, JsonNode.class);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof InterruptedIOException) {
                throw new UpstreamUnavailableException(ErrorCode.INT_UPSTREAM_TIMEOUT,
                        "RPC call " + method + " timed out", e);
            }
            throw new UpstreamUnavailableException(ErrorCode.INT_UPSTREAM_UNAVAILABLE,
                    "RPC node unreachable during " + method, e);
        } catch (HttpStatusCodeException e) {
            throw new UpstreamUnavailableException(ErrorCode.INT_UPSTREAM_UNAVAILABLE,
                    "RPC node returned HTTP " + e.getStatusCode().value() + " for " + method, e);
        }

        if (response == null) {
            throw new UpstreamUnavailableException(ErrorCode.INT_UPSTREAM_UNAVAILABLE,
                    "Empty RPC response for " + method, null);
        }
        if (response.hasNonNull("error")) {
            JsonNode error = response.get("error");
            log.debug("RPC error for {}: code={}", method, error.path("code").asText());
            throw new ComputationFailureException("RPC error " + error.path("code").asText()
                    + " for " + method + ": " + error.path("message").asText());
        }
        return response.path("result");
    }

    static String toQuantity(long value) {
        return "0x" + Long.toHexString(value);
    }

    static long parseQuantity(JsonNode node) {
        return parseBigQuantity(node).longValueExact();
    }

    static BigInteger parseBigQuantity(JsonNode node) {
        String text = node.asText();
        if (!text.startsWith("0x") || text.length() < 3) {
            throw new ComputationFailureException("Invalid RPC quantity: " + text);
        }
        return new BigInteger(text.substring(2), 16);
    }
}
