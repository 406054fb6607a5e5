package com.silentrisk.common.security;

import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EthereumSignatures Unit Tests")
class EthereumSignaturesTest {

    private static final BigInteger PRIVATE_KEY = new BigInteger(
            "4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318", 16);

    @Test
    @DisplayName("Should compute keccak-256 of the empty input")
    void shouldComputeKeccakOfEmptyInput() {
        assertThat(Hex.toHexString(EthereumSignatures.keccak256(new byte[0])))
                .isEqualTo("c5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470");
    }

    @Test
    @DisplayName("Should hash personal messages with the EIP-191 prefix")
    void shouldHashPersonalMessage() {
        assertThat(Hex.toHexString(EthereumSignatures.personalMessageHash("Hello World")))
                .isEqualTo("a1de988600a42c4b4ab089b619297c17d53cffae5d5120d82d8a92d0bb3b78f2");
    }

    @Test
    @DisplayName("Should derive the address of private key 1")
    void shouldDeriveKnownAddress() {
        assertThat(SignatureFixtures.addressOf(BigInteger.ONE))
                .isEqualTo("0x7e5f4552091a69125d5dfcb7b8c2659029395bdf");
    }

    @Test
    @DisplayName("Should recover the signer of a published web3.js personal_sign example")
    void shouldRecoverSignerOfPublishedSignature() {
        // Given
        String signature = "0xb91467e570a6466aa9e9876cbcd013baba02900b8979d43fe208a4a4f339f5fd"
                + "6007e74cd82e037b800186422fc2da167c747ef045e5d18a5f5d4300f8e1a0291c";

        // When
        String recovered = EthereumSignatures.recoverAddress("Some data", signature);

        // Then
        assertThat(recovered).isEqualTo("0x2c7536e3605d9c16a7a3d7b1898e529396a65c23");
        assertThat(Hex.toHexString(EthereumSignatures.personalMessageHash("Some data")))
                .isEqualTo("1da44b586eb0729ff70a73c326926f6ed5a25f5b056e7f47fbc6e58d86871655");
    }

    @Test
    @DisplayName("Should sign the published example byte-for-byte")
    void shouldReproducePublishedSignature() {
        assertThat(SignatureFixtures.sign(PRIVATE_KEY, "Some data"))
                .isEqualTo("0xb91467e570a6466aa9e9876cbcd013baba02900b8979d43fe208a4a4f339f5fd"
                        + "6007e74cd82e037b800186422fc2da167c747ef045e5d18a5f5d4300f8e1a0291c");
    }

    @Test
    @DisplayName("Should recover the signer of a personal message")
    void shouldRecoverSigner() {
        // Given
        String message = "Silent Risk Analysis: test at 1700000000";
        String signature = SignatureFixtures.sign(PRIVATE_KEY, message);

        // When
        String recovered = EthereumSignatures.recoverAddress(message, signature);

        // Then
        assertThat(recovered).isEqualTo(SignatureFixtures.addressOf(PRIVATE_KEY));
    }

    @Test
    @DisplayName("Should accept recovery ids 0/1 as well as 27/28")
    void shouldAcceptRawRecoveryId() {
        // Given
        String message = "raw recovery id";
        byte[] signature = EthereumSignatures.decodeHex(SignatureFixtures.sign(PRIVATE_KEY, message));
        signature[64] = (byte) (signature[64] - 27);

        // When
        String recovered = EthereumSignatures.recoverAddress(message, Hex.toHexString(signature));

        // Then
        assertThat(recovered).isEqualTo(SignatureFixtures.addressOf(PRIVATE_KEY));
    }

    @Test
    @DisplayName("Should reject signatures of the wrong length")
    void shouldRejectShortSignature() {
        assertThatThrownBy(() -> EthereumSignatures.recoverAddress("msg", "0x" + "ab".repeat(64)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("65 bytes");
    }

    @Test
    @DisplayName("Should reject an unsupported recovery id")
    void shouldRejectBadRecoveryId() {
        String signature = SignatureFixtures.sign(PRIVATE_KEY, "msg");
        String tampered = signature.substring(0, signature.length() - 2) + "1d";

        assertThatThrownBy(() -> EthereumSignatures.recoverAddress("msg", tampered))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("recovery id");
    }

    @Test
    @DisplayName("Should reject non-hex input")
    void shouldRejectNonHex() {
        assertThatThrownBy(() -> EthereumSignatures.decodeHex("0xzz"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(EthereumSignatures.decodeHex("0x" + Hex.toHexString("ok".getBytes(StandardCharsets.UTF_8))))
                .containsExactly((byte) 'o', (byte) 'k');
    }
}
