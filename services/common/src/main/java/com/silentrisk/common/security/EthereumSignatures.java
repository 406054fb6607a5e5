package com.silentrisk.common.security;

import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.bouncycastle.util.encoders.Hex;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SignatureException;
import java.util.Arrays;

/**
 * secp256k1 signature helpers for personal-message (EIP-191) ownership proofs.
 * Public-key recovery is delegated to web3j.
 */
public final class EthereumSignatures {

    private static final String PERSONAL_MESSAGE_PREFIX = "\u0019Ethereum Signed Message:\n";
    private static final int SIGNATURE_LENGTH = 65;

    private EthereumSignatures() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static byte[] keccak256(byte[] input) {
        Keccak.Digest256 digest = new Keccak.Digest256();
        return digest.digest(input);
    }

    /**
     * Hash of {@code "\x19Ethereum Signed Message:\n" + len(message) + message},
     * the length counted in UTF-8 bytes.
     */
    public static byte[] personalMessageHash(String message) {
        byte[] body = message.getBytes(StandardCharsets.UTF_8);
        byte[] prefix = (PERSONAL_MESSAGE_PREFIX + body.length).getBytes(StandardCharsets.UTF_8);
        byte[] payload = new byte[prefix.length + body.length];
        System.arraycopy(prefix, 0, payload, 0, prefix.length);
        System.arraycopy(body, 0, payload, prefix.length, body.length);
        return keccak256(payload);
    }

    /**
     * Recover the lower-case, 0x-prefixed address that signed {@code message}.
     *
     * @param signatureHex 65-byte {@code r || s || v} signature, hex with optional 0x prefix
     * @throws IllegalArgumentException if the signature is malformed or no key can be recovered
     */
    public static String recoverAddress(String message, String signatureHex) {
        byte[] signature = decodeHex(signatureHex);
        if (signature.length != SIGNATURE_LENGTH) {
            throw new IllegalArgumentException("Signature must be " + SIGNATURE_LENGTH + " bytes");
        }

        int v = signature[64] & 0xFF;
        int recId = v >= 27 ? v - 27 : v;
        if (recId != 0 && recId != 1) {
            throw new IllegalArgumentException("Unsupported recovery id: " + v);
        }

        Sign.SignatureData signatureData = new Sign.SignatureData(
                (byte) (27 + recId),
                Arrays.copyOfRange(signature, 0, 32),
                Arrays.copyOfRange(signature, 32, 64));
        BigInteger publicKey;
        try {
            publicKey = Sign.signedPrefixedMessageToKey(message.getBytes(StandardCharsets.UTF_8), signatureData);
        } catch (SignatureException | RuntimeException e) {
            throw new IllegalArgumentException("Unable to recover signer: " + e.getMessage(), e);
        }
        return "0x" + Keys.getAddress(publicKey);
    }

    public static byte[] decodeHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Hex value is required");
        }
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.length() % 2 != 0 || !digits.matches("[0-9a-fA-F]*")) {
            throw new IllegalArgumentException("Value is not valid hex");
        }
        return Hex.decode(digits);
    }
}
