package io.lakebench.core.credential;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.lakebench.api.credential.Credential;
import io.lakebench.api.credential.CredentialProvider;
import io.lakebench.api.credential.DatabaseTarget;
import io.lakebench.api.credential.InstanceIdentity;
import io.lakebench.api.credential.TargetResolver;
import io.lakebench.api.error.AuthenticationException;
import io.lakebench.api.error.ConnectivityException;
import io.lakebench.api.error.TargetNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.UUID;

/**
 * Talks to the workspace REST API: resolves database instances to their host, issues
 * short-lived database credentials and looks up the calling principal, which is the
 * database user the credentials belong to.
 */
public class WorkspaceIdentityService implements CredentialProvider, TargetResolver {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceIdentityService.class);

    static final String INSTANCES_PATH = "/api/2.0/database/instances/";
    static final String CREDENTIALS_PATH = "/api/2.0/database/credentials";
    static final String CURRENT_USER_PATH = "/api/2.0/preview/scim/v2/Me";

    private final WorkspaceConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private volatile String principal;

    public WorkspaceIdentityService(WorkspaceConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .build();
        log.info("Workspace identity service initialised for {}", config.host());
    }

    @Override
    public DatabaseTarget resolve(InstanceIdentity identity) {
        String name = identity.instanceName();
        HttpResponse<String> response;
        try {
            response = send(HttpRequest.newBuilder(uri(INSTANCES_PATH + URLEncoder.encode(name, StandardCharsets.UTF_8)))
                    .GET());
        } catch (IOException e) {
            throw new ConnectivityException("Cannot reach workspace " + config.host() + ": " + e.getMessage(), e);
        }
        if (response.statusCode() == 404) {
            throw new TargetNotFoundException(name);
        }
        if (response.statusCode() == 401 || response.statusCode() == 403) {
            throw new AuthenticationException("Workspace denied instance lookup for '" + name
                    + "' (HTTP " + response.statusCode() + ")");
        }
        if (response.statusCode() / 100 != 2) {
            throw new ConnectivityException("Instance lookup for '" + name + "' failed with HTTP "
                    + response.statusCode());
        }
        JsonNode body = parse(response.body(), ConnectivityException::new);
        String host = body.path("read_write_dns").asText(null);
        if (host == null || host.isBlank()) {
            throw new ConnectivityException("Instance '" + name + "' has no read-write endpoint yet");
        }
        DatabaseTarget target = new DatabaseTarget(host, DatabaseTarget.DEFAULT_PORT, identity.database(), principal());
        log.info("Resolved instance '{}' to {}:{}/{}", name, target.host(), target.port(), target.database());
        return target;
    }

    @Override
    public Credential acquire(InstanceIdentity identity) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("request_id", UUID.randomUUID().toString());
        request.putArray("instance_names").add(identity.instanceName());

        HttpResponse<String> response;
        try {
            response = send(HttpRequest.newBuilder(uri(CREDENTIALS_PATH))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(request.toString())));
        } catch (IOException e) {
            throw new AuthenticationException("Identity service unreachable: " + e.getMessage(), e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new AuthenticationException("Credential request for '" + identity.instanceName()
                    + "' rejected with HTTP " + response.statusCode());
        }
        JsonNode body = parse(response.body(), AuthenticationException::new);
        String token = body.path("token").asText(null);
        if (token == null || token.isEmpty()) {
            throw new AuthenticationException("Credential response for '" + identity.instanceName() + "' carries no token");
        }
        Instant expiresAt = null;
        String expiration = body.path("expiration_time").asText(null);
        if (expiration != null) {
            try {
                expiresAt = Instant.parse(expiration);
            } catch (DateTimeParseException e) {
                log.warn("Ignoring unparsable credential expiry '{}'", expiration);
            }
        }
        return new Credential(token, Instant.now(), identity.instanceName(), expiresAt);
    }

    /**
     * @return user name of the principal the workspace token belongs to, looked up once
     */
    public String principal() {
        String cached = principal;
        if (cached != null) {
            return cached;
        }
        HttpResponse<String> response;
        try {
            response = send(HttpRequest.newBuilder(uri(CURRENT_USER_PATH)).GET());
        } catch (IOException e) {
            throw new ConnectivityException("Cannot reach workspace " + config.host() + ": " + e.getMessage(), e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new AuthenticationException("Current user lookup failed with HTTP " + response.statusCode());
        }
        String userName = parse(response.body(), AuthenticationException::new).path("userName").asText(null);
        if (userName == null || userName.isBlank()) {
            throw new AuthenticationException("Workspace did not report a user name for the current principal");
        }
        principal = userName;
        return userName;
    }

    private HttpResponse<String> send(HttpRequest.Builder builder) throws IOException {
        HttpRequest request = builder
                .header("Authorization", "Bearer " + config.token())
                .header("Accept", "application/json")
                .timeout(config.requestTimeout())
                .build();
        log.debug("{} {}", request.method(), request.uri());
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while calling " + request.uri(), e);
        }
    }

    private URI uri(String path) {
        return URI.create(config.host() + path);
    }

    private <E extends RuntimeException> JsonNode parse(String body, ErrorFactory<E> errors) {
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw errors.create("Malformed response from workspace: " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface ErrorFactory<E extends RuntimeException> {
        E create(String message, Throwable cause);
    }
}
