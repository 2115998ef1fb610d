package io.lakebench.api.pgbench;

import java.util.Locale;

/**
 * Query protocol the benchmark tool uses to submit statements ({@code -M}).
 */
public enum ProtocolMode {
    SIMPLE,
    EXTENDED,
    PREPARED;

    public String flagValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ProtocolMode fromString(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Protocol must be one of: simple, extended, prepared", e);
        }
    }
}
