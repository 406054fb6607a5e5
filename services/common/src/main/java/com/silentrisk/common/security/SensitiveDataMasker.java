package com.silentrisk.common.security;

import java.util.regex.Pattern;

/**
 * Utility class for redacting wallet addresses and commitments in logs
 * and user-facing messages.
 */
public final class SensitiveDataMasker {

    static final int VISIBLE_PREFIX = 10;

    private static final Pattern HEX_IDENTIFIER_PATTERN = Pattern.compile("0x[0-9a-fA-F]{40,}");

    private SensitiveDataMasker() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Redact a single identifier
     * Example: 0x7e5f4552091a69125d5dfcb7b8c2659029395bdf → 0x7e5f4552...
     */
    public static String redact(String value) {
        if (value == null) {
            return null;
        }
        if (value.length() <= VISIBLE_PREFIX) {
            return "***";
        }
        return value.substring(0, VISIBLE_PREFIX) + "...";
    }

    /**
     * Redact every address or 32-byte hash embedded in free text, such as an
     * exception message about to be logged or stored as a task message.
     */
    public static String redactIdentifiers(String text) {
        if (text == null) {
            return null;
        }
        return HEX_IDENTIFIER_PATTERN.matcher(text).replaceAll(match -> redact(match.group()));
    }
}
