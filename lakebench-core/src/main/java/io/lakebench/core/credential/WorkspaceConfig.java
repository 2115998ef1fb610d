package io.lakebench.core.credential;

import java.time.Duration;
import java.util.Map;

/**
 * Connection settings for the workspace REST API that issues database credentials.
 */
public final class WorkspaceConfig {

    public static final String ENV_HOST = "DATABRICKS_HOST";
    public static final String ENV_TOKEN = "DATABRICKS_TOKEN";

    private String host;
    private String token;
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration requestTimeout = Duration.ofSeconds(30);

    private WorkspaceConfig() {}

    public static WorkspaceConfig create() {
        return new WorkspaceConfig();
    }

    public static WorkspaceConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Read host and token from the given environment map.
     *
     * @throws IllegalArgumentException if either variable is missing
     */
    public static WorkspaceConfig fromEnvironment(Map<String, String> env) {
        String host = env.get(ENV_HOST);
        String token = env.get(ENV_TOKEN);
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException(ENV_HOST + " is not set");
        }
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException(ENV_TOKEN + " is not set");
        }
        return create().host(host).token(token);
    }

    /**
     * Workspace URL. A missing scheme defaults to https; trailing slashes are dropped.
     */
    public WorkspaceConfig host(String host) {
        String normalized = host.trim();
        if (!normalized.startsWith("http://") && !normalized.startsWith("https://")) {
            normalized = "https://" + normalized;
        }
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        this.host = normalized;
        return this;
    }

    public WorkspaceConfig token(String token) {
        this.token = token;
        return this;
    }

    public WorkspaceConfig connectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        return this;
    }

    public WorkspaceConfig requestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        return this;
    }

    public String host() { return host; }
    public String token() { return token; }
    public Duration connectTimeout() { return connectTimeout; }
    public Duration requestTimeout() { return requestTimeout; }

    @Override
    public String toString() {
        return "WorkspaceConfig[host=" + host + ", token=****]";
    }
}
