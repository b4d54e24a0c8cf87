package com.tracebridge.trace.model;

import java.util.concurrent.ThreadLocalRandom;

/** Hex helpers and random id generation for trace and span identifiers. */
public final class TraceIds {
    public static final int TRACE_ID_BYTES = 16;
    public static final int SPAN_ID_BYTES = 8;
    public static final int TRACE_ID_HEX_LENGTH = TRACE_ID_BYTES * 2;
    public static final int SPAN_ID_HEX_LENGTH = SPAN_ID_BYTES * 2;

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private TraceIds() {}

    public static String randomTraceId() {
        return toHex(randomNonZero(TRACE_ID_BYTES));
    }

    public static String randomSpanId() {
        return toHex(randomNonZero(SPAN_ID_BYTES));
    }

    public static String toHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0F];
        }
        return new String(out);
    }

    public static byte[] fromHex(String hex) {
        if (!isLowerHex(hex) || hex.length() % 2 != 0) {
            throw new TraceContextFormatException("Not an even-length lowercase hex string: " + hex);
        }
        byte[] out = new byte[hex.length() / 2];
        for (int i = 0; i < out.length; i++) {
            out[i] = (byte) ((Character.digit(hex.charAt(i * 2), 16) << 4) | Character.digit(hex.charAt(i * 2 + 1), 16));
        }
        return out;
    }

    /** Only {@code 0-9} and {@code a-f}; uppercase is rejected. */
    public static boolean isLowerHex(String s) {
        if (s == null || s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            boolean digit = c >= '0' && c <= '9';
            boolean letter = c >= 'a' && c <= 'f';
            if (!digit && !letter) return false;
        }
        return true;
    }

    public static boolean isAllZero(String hex) {
        for (int i = 0; i < hex.length(); i++) {
            if (hex.charAt(i) != '0') return false;
        }
        return true;
    }

    private static byte[] randomNonZero(int length) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        byte[] bytes = new byte[length];
        do {
            random.nextBytes(bytes);
        } while (isZero(bytes));
        return bytes;
    }

    private static boolean isZero(byte[] bytes) {
        for (byte b : bytes) {
            if (b != 0) return false;
        }
        return true;
    }
}
