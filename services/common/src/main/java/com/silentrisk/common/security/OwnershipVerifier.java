package com.silentrisk.common.security;

import com.silentrisk.common.config.SilentRiskProperties;
import com.silentrisk.common.error.ErrorCode;
import com.silentrisk.common.error.UnauthorizedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Locale;

/**
 * Ownership gate for analysis requests.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>freshness: {@code -maxClockSkew <= now - timestamp <= maxAge}</li>
 *   <li>the signed text equals the signing template for the lower-cased wallet
 *       and timestamp, ignoring case</li>
 *   <li>a signer can be recovered from the personal-message signature</li>
 *   <li>the recovered signer is the claimed wallet, ignoring case</li>
 * </ol>
 * Every failure raises {@link UnauthorizedException}. No state is read or written.
 *
 * @author Silent Risk Platform Team
 * @version 1.0.0
 */
@Slf4j
@Component
public class OwnershipVerifier {

    private final Clock clock;
    private final long maxAgeSeconds;
    private final long maxClockSkewSeconds;
    private final String messageTemplate;

    public OwnershipVerifier(SilentRiskProperties properties, Clock clock) {
        this.clock = clock;
        this.maxAgeSeconds = properties.getOwnership().getMaxAge().getSeconds();
        this.maxClockSkewSeconds = properties.getOwnership().getMaxClockSkew().getSeconds();
        this.messageTemplate = properties.getOwnership().getMessageTemplate();
    }

    public void verify(String walletAddress, String signature, String message, long timestamp) {
        if (walletAddress == null || signature == null || message == null) {
            throw new UnauthorizedException(ErrorCode.AUTH_SIGNATURE_INVALID, "Ownership proof is incomplete");
        }

        long age = clock.instant().getEpochSecond() - timestamp;
        if (age < -maxClockSkewSeconds) {
            throw new UnauthorizedException(ErrorCode.AUTH_TIMESTAMP_EXPIRED,
                    "Request timestamp is in the future");
        }
        if (age > maxAgeSeconds) {
            throw new UnauthorizedException(ErrorCode.AUTH_TIMESTAMP_EXPIRED,
                    "Request timestamp expired. Please sign a new message.");
        }

        if (!message.equalsIgnoreCase(expectedMessage(walletAddress, timestamp))) {
            throw new UnauthorizedException(ErrorCode.AUTH_MESSAGE_MISMATCH,
                    "Signed message does not match the expected format");
        }

        String recovered;
        try {
            recovered = EthereumSignatures.recoverAddress(message, signature);
        } catch (RuntimeException e) {
            log.debug("Signature recovery failed for wallet {}: {}",
                    SensitiveDataMasker.redact(walletAddress), e.getMessage());
            throw new UnauthorizedException(ErrorCode.AUTH_SIGNATURE_INVALID, "Malformed signature", e);
        }

        if (!recovered.equalsIgnoreCase(walletAddress)) {
            log.warn("Signature signer mismatch for wallet {}", SensitiveDataMasker.redact(walletAddress));
            throw new UnauthorizedException(ErrorCode.AUTH_SIGNATURE_INVALID,
                    "Signature does not match wallet address");
        }
    }

    /**
     * The text a wallet must sign for the given timestamp.
     */
    public String expectedMessage(String walletAddress, long timestamp) {
        return messageTemplate
                .replace("{wallet}", walletAddress.toLowerCase(Locale.ROOT))
                .replace("{timestamp}", Long.toString(timestamp));
    }
}
