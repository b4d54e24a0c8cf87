package com.tracebridge.trace.model;

import java.util.Objects;

/**
 * Immutable W3C trace context: {@code version-traceId-spanId-flags}.
 *
 * <p>Canonical form is {@code VV-<32 hex>-<16 hex>-FF}, all lowercase, for example
 * {@code 00-cd4262a7f7adf040bdd892959cf8c4fc-4a28d39ff0e725f2-01}. Only version {@code 00} is
 * supported. Bit 0 of the flags is the sampled indicator.
 */
public final class TraceContext {
    public static final String SUPPORTED_VERSION = "00";
    public static final int FLAG_SAMPLED = 0x01;

    private static final int VERSION_HEX_LENGTH = 2;
    private static final int FLAGS_HEX_LENGTH = 2;
    private static final int CANONICAL_LENGTH = VERSION_HEX_LENGTH
            + TraceIds.TRACE_ID_HEX_LENGTH
            + TraceIds.SPAN_ID_HEX_LENGTH
            + FLAGS_HEX_LENGTH
            + 3;

    private final String version;
    private final String traceId;
    private final String spanId;
    private final int flags;

    private TraceContext(String version, String traceId, String spanId, int flags) {
        this.version = version;
        this.traceId = traceId;
        this.spanId = spanId;
        this.flags = flags;
    }

    /** Fresh trace: random trace and span ids, sampled. */
    public static TraceContext newRoot() {
        return new TraceContext(SUPPORTED_VERSION, TraceIds.randomTraceId(), TraceIds.randomSpanId(), FLAG_SAMPLED);
    }

    /**
     * Same trace and flags, new span id. The parent's span id is not part of the returned context; whoever
     * owns the child keeps it as its parent reference.
     */
    public static TraceContext child(TraceContext parent) {
        Objects.requireNonNull(parent, "parent");
        return new TraceContext(parent.version, parent.traceId, TraceIds.randomSpanId(), parent.flags);
    }

    public static TraceContext of(String traceId, String spanId, boolean sampled) {
        requireId("traceId", traceId, TraceIds.TRACE_ID_HEX_LENGTH);
        requireId("spanId", spanId, TraceIds.SPAN_ID_HEX_LENGTH);
        return new TraceContext(SUPPORTED_VERSION, traceId, spanId, sampled ? FLAG_SAMPLED : 0);
    }

    public static TraceContext parse(String value) {
        if (value == null) {
            throw new TraceContextFormatException("traceparent is missing");
        }
        if (value.length() != CANONICAL_LENGTH) {
            throw new TraceContextFormatException("traceparent has length " + value.length() + ", expected "
                    + CANONICAL_LENGTH + ": '" + value + "'");
        }
        String[] parts = value.split("-", -1);
        if (parts.length != 4) {
            throw new TraceContextFormatException("traceparent must have 4 fields: '" + value + "'");
        }
        String version = parts[0];
        String traceId = parts[1];
        String spanId = parts[2];
        String flags = parts[3];

        requireField("version", version, VERSION_HEX_LENGTH, value);
        requireField("traceId", traceId, TraceIds.TRACE_ID_HEX_LENGTH, value);
        requireField("spanId", spanId, TraceIds.SPAN_ID_HEX_LENGTH, value);
        requireField("flags", flags, FLAGS_HEX_LENGTH, value);

        if (!SUPPORTED_VERSION.equals(version)) {
            throw new TraceContextFormatException("Unsupported traceparent version '" + version + "'");
        }
        if (TraceIds.isAllZero(traceId) || TraceIds.isAllZero(spanId)) {
            throw new TraceContextFormatException("traceparent ids must not be all zero: '" + value + "'");
        }
        return new TraceContext(version, traceId, spanId, Integer.parseInt(flags, 16));
    }

    public static String format(TraceContext ctx) {
        return Objects.requireNonNull(ctx, "ctx").toString();
    }

    public String version() {
        return version;
    }

    public String traceId() {
        return traceId;
    }

    public String spanId() {
        return spanId;
    }

    public int flags() {
        return flags;
    }

    public boolean isSampled() {
        return (flags & FLAG_SAMPLED) != 0;
    }

    public byte[] traceIdBytes() {
        return TraceIds.fromHex(traceId);
    }

    public byte[] spanIdBytes() {
        return TraceIds.fromHex(spanId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraceContext other)) return false;
        return flags == other.flags
                && version.equals(other.version)
                && traceId.equals(other.traceId)
                && spanId.equals(other.spanId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, traceId, spanId, flags);
    }

    /** Canonical {@code traceparent} form. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(CANONICAL_LENGTH);
        sb.append(version).append('-').append(traceId).append('-').append(spanId).append('-');
        if (flags < 0x10) sb.append('0');
        sb.append(Integer.toHexString(flags));
        return sb.toString();
    }

    private static void requireField(String field, String text, int length, String whole) {
        if (text.length() != length || !TraceIds.isLowerHex(text)) {
            throw new TraceContextFormatException(
                    "traceparent " + field + " must be " + length + " lowercase hex chars: '" + whole + "'");
        }
    }

    private static void requireId(String field, String text, int length) {
        if (text == null || text.length() != length || !TraceIds.isLowerHex(text) || TraceIds.isAllZero(text)) {
            throw new TraceContextFormatException(field + " must be " + length + " lowercase non-zero hex chars");
        }
    }
}
