package io.cronrelay.util;

import java.security.SecureRandom;

public final class Tokens {
    private static final SecureRandom RANDOM = new SecureRandom();

    private Tokens() {
    }

    /**
     * High-entropy token tagging a ledger insert so the allocated id can be read back.
     * 16 bytes => 32 hex chars.
     */
    public static String newInvocationToken() {
        return randomHex(16);
    }

    private static String randomHex(int bytes) {
        byte[] value = new byte[bytes];
        RANDOM.nextBytes(value);
        StringBuilder sb = new StringBuilder(bytes * 2);
        for (byte b : value) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
