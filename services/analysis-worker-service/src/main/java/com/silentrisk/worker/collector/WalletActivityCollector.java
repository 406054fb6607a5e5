package com.silentrisk.worker.collector;

/**
 * Data-collection collaborator of the risk pipeline.
 *
 * <p>Implementations raise {@link com.silentrisk.common.error.UpstreamUnavailableException}
 * when the data source cannot be reached or times out, so the task is redelivered,
 * and any other runtime exception when the data itself is unusable.
 */
public interface WalletActivityCollector {

    WalletActivity collect(String walletAddress);
}
