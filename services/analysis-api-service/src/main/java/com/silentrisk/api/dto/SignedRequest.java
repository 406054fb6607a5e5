package com.silentrisk.api.dto;

/**
 * Ownership proof fields shared by every submission endpoint.
 */
public interface SignedRequest {

    String getCommitment();

    String getWalletAddress();

    String getSignature();

    String getMessage();

    Long getTimestamp();
}
