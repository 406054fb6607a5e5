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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Collects wallet activity straight from an Ethereum node.
 *
 * Sub-queries run on the collector executor. Independent queries (latest block,
 * nonce, balance) start together; the first-block search waits for the nonce
 * and latest block, the age lookup waits for the first block, and the log and
 * contract scans wait only for the latest block.
 *
 * RPC used:
 * - eth_blockNumber, eth_getTransactionCount, eth_getBalance
 * - eth_getBlockByNumber (age, contract sampling)
 * - eth_getLogs (ERC20 Transfer events)
 */
@Slf4j
@Component
public class JsonRpcWalletActivityCollector implements WalletActivityCollector {

    /**
     * keccak256("Transfer(address,address,uint256)").
     */
    static final String ERC20_TRANSFER_TOPIC =
            "0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef";

    static final double CONTRACT_USER_RATIO = 0.3;

    private static final long SECONDS_PER_DAY = 86_400L;

    private final EthereumRpcClient rpcClient;
    private final ObjectMapper objectMapper;
    private final SilentRiskProperties.Rpc settings;
    private final Executor executor;
    private final Clock clock;

    public JsonRpcWalletActivityCollector(EthereumRpcClient rpcClient,
                                          ObjectMapper objectMapper,
                                          SilentRiskProperties properties,
                                          @Qualifier("collectorExecutor") Executor executor,
                                          Clock clock) {
        this.rpcClient = rpcClient;
        this.objectMapper = objectMapper;
        this.settings = properties.getRpc();
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public WalletActivity collect(String walletAddress) {
        String address = walletAddress.toLowerCase(Locale.ROOT);

        CompletableFuture<Long> latestBlock = async(rpcClient::blockNumber);
        CompletableFuture<Long> nonce = async(() -> rpcClient.transactionCount(address, "latest"));
        CompletableFuture<BigInteger> balance = async(() -> rpcClient.balance(address));

        CompletableFuture<Long> firstBlock = latestBlock.thenCombineAsync(nonce,
                (latest, count) -> count == 0 ? null : findFirstActiveBlock(address, latest), executor);
        CompletableFuture<Integer> ageDays = firstBlock.thenCombineAsync(latestBlock,
                this::estimateAgeDays, executor);
        CompletableFuture<TokenScan> tokens = nonce.thenCombineAsync(latestBlock,
                (count, latest) -> count == 0 ? TokenScan.NONE : scanTokenTransfers(address, latest), executor);
        CompletableFuture<ContractScan> contracts = nonce.thenCombineAsync(latestBlock,
                (count, latest) -> count == 0 ? ContractScan.NONE : scanContractInteractions(address, latest), executor);

        await(latestBlock, nonce, balance, firstBlock, ageDays, tokens, contracts);

        long txCount = nonce.join();
        double balanceEth = new BigDecimal(balance.join()).movePointLeft(18).doubleValue();
        if (txCount == 0) {
            log.info("No outgoing transactions found, skipping activity scans");
            return WalletActivity.empty(balanceEth, latestBlock.join());
        }

        int age = ageDays.join();
        TokenScan tokenScan = tokens.join();
        ContractScan contractScan = contracts.join();
        double ratio = contractScan.sampled() == 0 ? 0.0 : (double) contractScan.contractCalls() / contractScan.sampled();

        WalletActivity activity = WalletActivity.builder()
                .totalTransactions(txCount)
                .walletAgeDays(age)
                .balanceEth(balanceEth)
                .uniqueTokens(tokenScan.uniqueTokens())
                .erc20TransfersSent(tokenScan.sent())
                .erc20TransfersReceived(tokenScan.received())
                .sampledTransactions(contractScan.sampled())
                .contractInteractionRatio(ratio)
                .contractUser(ratio > CONTRACT_USER_RATIO)
                .txPerDay(age > 0 ? (double) txCount / age : 0.0)
                .latestBlock(latestBlock.join())
                .build();

        log.info("Wallet activity collected: tx={}, ageDays={}, tokens={}, contractRatio={}",
                txCount, age, tokenScan.uniqueTokens(), String.format(Locale.ROOT, "%.2f", ratio));
        return activity;
    }

    /**
     * Binary search over historical nonces. Stops early when the node cannot
     * serve historical state, keeping the best estimate found so far.
     */
    Long findFirstActiveBlock(String address, long latestBlock) {
        long left = 0;
        long right = latestBlock;
        long firstActive = latestBlock;
        int iterations = 0;

        while (left < right && iterations < settings.getFirstBlockSearchIterations()) {
            long mid = (left + right) / 2;
            long nonceAtMid;
            try {
                nonceAtMid = rpcClient.transactionCountAt(address, mid);
            } catch (ComputationFailureException e) {
                log.info("Historical state unavailable at block {}, using estimate {}: {}",
                        mid, firstActive, e.getMessage());
                break;
            }
            if (nonceAtMid == 0) {
                left = mid + 1;
            } else {
                firstActive = mid;
                right = mid;
            }
            iterations++;
        }
        log.debug("First activity estimated at block {} after {} iterations", firstActive, iterations);
        return firstActive;
    }

    int estimateAgeDays(Long firstBlock, long latestBlock) {
        if (firstBlock == null) {
            return 0;
        }
        long nowSeconds = clock.instant().getEpochSecond();
        try {
            long firstTimestamp = rpcClient.blockTimestamp(firstBlock);
            return (int) Math.max(0, (nowSeconds - firstTimestamp) / SECONDS_PER_DAY);
        } catch (ComputationFailureException e) {
            long blocksElapsed = Math.max(0, latestBlock - firstBlock);
            int estimate = (int) (blocksElapsed * settings.getAverageBlockTime().getSeconds() / SECONDS_PER_DAY);
            log.warn("Block timestamp unavailable, estimating age from block count: {} days ({})",
                    estimate, e.getMessage());
            return estimate;
        }
    }

    TokenScan scanTokenTransfers(String address, long latestBlock) {
        long fromBlock = Math.max(0, latestBlock - settings.getRecentBlockWindow());
        String paddedAddress = "0x" + "0".repeat(24) + address.substring(2);

        JsonNode sent = rpcClient.logs(transferFilter(fromBlock, paddedAddress, null));
        JsonNode received = rpcClient.logs(transferFilter(fromBlock, null, paddedAddress));

        Set<String> tokenContracts = new HashSet<>();
        sent.forEach(entry -> tokenContracts.add(entry.path("address").asText().toLowerCase(Locale.ROOT)));
        received.forEach(entry -> tokenContracts.add(entry.path("address").asText().toLowerCase(Locale.ROOT)));

        return new TokenScan(tokenContracts.size(), sent.size(), received.size());
    }

    ContractScan scanContractInteractions(String address, long latestBlock) {
        long fromBlock = Math.max(0, latestBlock - settings.getContractScanBlocks() + 1);
        int sampled = 0;
        int contractCalls = 0;
        int skippedBlocks = 0;

        for (long blockNumber = latestBlock; blockNumber >= fromBlock; blockNumber--) {
            if (sampled >= settings.getMaxSampledTransactions()) {
                break;
            }
            JsonNode block;
            try {
                block = rpcClient.blockWithTransactions(blockNumber);
            } catch (ComputationFailureException e) {
                skippedBlocks++;
                log.debug("Skipping block {}: {}", blockNumber, e.getMessage());
                continue;
            }
            for (JsonNode tx : block.path("transactions")) {
                if (!address.equalsIgnoreCase(tx.path("from").asText())) {
                    continue;
                }
                sampled++;
                if (isContractCall(tx)) {
                    contractCalls++;
                }
                if (sampled >= settings.getMaxSampledTransactions()) {
                    break;
                }
            }
        }
        if (skippedBlocks > 0) {
            log.info("Contract scan skipped {} unreadable blocks", skippedBlocks);
        }
        return new ContractScan(sampled, contractCalls);
    }

    static boolean isContractCall(JsonNode tx) {
        JsonNode to = tx.path("to");
        String input = tx.path("input").asText("0x");
        return to.isNull() || to.isMissingNode() || input.length() > 2;
    }

    private ObjectNode transferFilter(long fromBlock, String fromTopic, String toTopic) {
        ObjectNode filter = objectMapper.createObjectNode();
        filter.put("fromBlock", EthereumRpcClient.toQuantity(fromBlock));
        filter.put("toBlock", "latest");
        ArrayNode topics = filter.putArray("topics");
        topics.add(ERC20_TRANSFER_TOPIC);
        if (fromTopic != null) {
            topics.add(fromTopic);
        } else {
            topics.addNull();
        }
        if (toTopic != null) {
            topics.add(toTopic);
        }
        return filter;
    }

    private <T> CompletableFuture<T> async(Supplier<T> query) {
        return CompletableFuture.supplyAsync(query, executor);
    }

    /**
     * Wait for every collection stage. On timeout, interruption or failure the
     * remaining stages are cancelled so no further RPC work is scheduled.
     */
    private void await(CompletableFuture<?>... stages) {
        long timeoutMs = settings.getCollectionTimeout().toMillis();
        try {
            CompletableFuture.allOf(stages).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            cancelAll(stages);
            throw new UpstreamUnavailableException(ErrorCode.INT_UPSTREAM_TIMEOUT,
                    "Blockchain data collection timed out after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            cancelAll(stages);
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException(ErrorCode.INT_UPSTREAM_UNAVAILABLE,
                    "Blockchain data collection interrupted", e);
        } catch (ExecutionException e) {
            cancelAll(stages);
            throw unwrap(e.getCause());
        }
    }

    private static void cancelAll(CompletableFuture<?>... stages) {
        for (CompletableFuture<?> stage : stages) {
            stage.cancel(true);
        }
    }

    private static RuntimeException unwrap(Throwable failure) {
        Throwable cause = failure;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new ComputationFailureException("Blockchain data collection failed", cause);
    }

    record TokenScan(int uniqueTokens, int sent, int received) {
        static final TokenScan NONE = new TokenScan(0, 0, 0);
    }

    record ContractScan(int sampled, int contractCalls) {
        static final ContractScan NONE = new ContractScan(0, 0);
    }
}
