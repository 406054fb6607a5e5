package com.silentrisk.common.security;

import java.util.regex.Pattern;

/**
 * Rejects wallet addresses where only opaque identifiers (task ids,
 * commitments) are allowed: cache keys and broker partition keys.
 */
public final class PrivacyGuard {

    private static final Pattern WALLET_ADDRESS_PATTERN = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private PrivacyGuard() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static boolean looksLikeWalletAddress(String value) {
        return value != null && WALLET_ADDRESS_PATTERN.matcher(value.trim()).matches();
    }

    /**
     * @throws IllegalArgumentException if {@code identifier} is blank or has the shape of a wallet address
     */
    public static String requireOpaqueIdentifier(String identifier, String usage) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException(usage + " identifier is required");
        }
        if (looksLikeWalletAddress(identifier)) {
            throw new IllegalArgumentException(usage + " must not be keyed by a wallet address");
        }
        return identifier;
    }
}
