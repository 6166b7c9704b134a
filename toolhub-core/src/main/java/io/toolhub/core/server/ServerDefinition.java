package io.toolhub.core.server;

import java.time.Duration;
import java.util.Objects;

/// Immutable description of a tool server, supplied by whoever owns persistence.
///
/// The definition is read-only to the connection layer. It is created on registration
/// and destroyed only by an explicit deregistration.
///
/// ### Contracts
/// - **Precondition**: `id`, `name` and `endpoint` are not blank
/// - **Precondition**: `timeout` is strictly positive, `maxRetries` is not negative
/// - **Postcondition**: all fields immutable after construction
///
/// For {@link ConnectionType#STDIO} servers the endpoint is the command line to launch,
/// split on whitespace.
///
/// ### Usage
/// {@snippet :
/// ServerDefinition search = ServerDefinition.builder()
///     .id("search")
///     .name("Search Server")
///     .endpoint("http://localhost:8931/mcp")
///     .timeout(Duration.ofSeconds(10))
///     .build();
/// }
///
/// @param id unique server identifier, not blank
/// @param name display name, not blank
/// @param endpoint endpoint address or command line, not blank
/// @param connectionType transport variant, not null
/// @param enabled whether registration should trigger a connect
/// @param timeout bound applied to each request against the server, positive
/// @param maxRetries failed connect attempts tolerated before giving up, not negative
public record ServerDefinition(
        String id,
        String name,
        String endpoint,
        ConnectionType connectionType,
        boolean enabled,
        Duration timeout,
        int maxRetries) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_RETRIES = 3;

    /// Compact constructor with validation.
    public ServerDefinition {
        requireText(id, "id");
        requireText(name, "name");
        requireText(endpoint, "endpoint");
        Objects.requireNonNull(connectionType, "connectionType must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
    }

    /// Returns a copy of this definition with a different enabled flag.
    ///
    /// @param enabled the new flag
    /// @return new definition, never null
    public ServerDefinition withEnabled(boolean enabled) {
        return new ServerDefinition(
                id, name, endpoint, connectionType, enabled, timeout, maxRetries);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requireText(String value, String field) {
        Objects.requireNonNull(value, field + " must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }

    /// Fluent builder; unset fields fall back to HTTP transport, enabled, 30s timeout and
    /// three retries.
    public static final class Builder {

        private String id;
        private String name;
        private String endpoint;
        private ConnectionType connectionType = ConnectionType.STREAMABLE_HTTP;
        private boolean enabled = true;
        private Duration timeout = DEFAULT_TIMEOUT;
        private int maxRetries = DEFAULT_MAX_RETRIES;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder connectionType(ConnectionType connectionType) {
            this.connectionType = connectionType;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /// Builds the definition.
        ///
        /// When no name was given, the id doubles as display name.
        ///
        /// @return validated definition, never null
        /// @throws IllegalArgumentException if the definition is malformed
        /// @throws NullPointerException if a required field is missing
        public ServerDefinition build() {
            return new ServerDefinition(
                    id,
                    name != null ? name : id,
                    endpoint,
                    connectionType,
                    enabled,
                    timeout,
                    maxRetries);
        }
    }
}
