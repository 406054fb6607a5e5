package com.silentrisk.worker.passport;

import com.silentrisk.common.config.SilentRiskProperties;
import com.silentrisk.common.security.EthereumSignatures;
import com.silentrisk.common.security.SensitiveDataMasker;
import com.silentrisk.worker.collector.EthereumRpcClient;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Issues passport claim metadata from the client's commitment.
 *
 * The nullifier hash is keccak256(commitment || 32 random bytes); the wallet
 * address is never an input.
 */
@Slf4j
@Component
public class CommitmentPassportIssuer implements PassportIssuer {

    static final int MAX_SCORE = 10_000;

    private final EthereumRpcClient rpcClient;
    private final SilentRiskProperties properties;
    private final SecureRandom secureRandom = new SecureRandom();

    public CommitmentPassportIssuer(EthereumRpcClient rpcClient, SilentRiskProperties properties) {
        this.rpcClient = rpcClient;
        this.properties = properties;
    }

    @Override
    public Passport issue(String commitment, int riskScore) {
        if (riskScore < 0 || riskScore > MAX_SCORE) {
            throw new IllegalArgumentException("Risk score out of range: " + riskScore);
        }

        byte[] commitmentBytes = EthereumSignatures.decodeHex(commitment);
        byte[] salt = new byte[32];
        secureRandom.nextBytes(salt);
        byte[] preimage = new byte[commitmentBytes.length + salt.length];
        System.arraycopy(commitmentBytes, 0, preimage, 0, commitmentBytes.length);
        System.arraycopy(salt, 0, preimage, commitmentBytes.length, salt.length);
        String nullifierHash = "0x" + Hex.toHexString(EthereumSignatures.keccak256(preimage));

        long blockHeight = rpcClient.blockNumber();

        log.info("Passport metadata created: commitment={}, blockHeight={}",
                SensitiveDataMasker.redact(commitment), blockHeight);

        return Passport.builder()
                .commitment(commitment)
                .nullifierHash(nullifierHash)
                .vaultAddress(properties.getPassport().getVaultAddress())
                .blockHeight(blockHeight)
                .riskScore(riskScore)
                .status(Passport.READY_TO_CLAIM)
                .build();
    }
}
