package io.lakebench.api.pool;

import java.util.Locale;

/**
 * TLS negotiation mode, using the libpq {@code sslmode} vocabulary.
 */
public enum TlsMode {
    DISABLE("disable"),
    ALLOW("allow"),
    PREFER("prefer"),
    REQUIRE("require"),
    VERIFY_CA("verify-ca"),
    VERIFY_FULL("verify-full");

    private final String sslMode;

    TlsMode(String sslMode) {
        this.sslMode = sslMode;
    }

    /**
     * @return the value passed as {@code sslmode} to the driver or {@code PGSSLMODE} to libpq tools
     */
    public String sslMode() {
        return sslMode;
    }

    public static TlsMode fromSslMode(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TlsMode mode : values()) {
            if (mode.sslMode.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown TLS mode: " + value);
    }
}
