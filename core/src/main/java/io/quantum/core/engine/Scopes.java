package io.quantum.core.engine;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * The host-owned state handed to one execution: the shared application and session stores, the
 * request attributes, and the caller's identity. Request attributes are copied, so an execution
 * never mutates the host's map.
 *
 * @param application   process-wide store shared by all requests
 * @param session       the calling user's session store
 * @param request       initial request attributes (form fields, query parameters, headers)
 * @param authenticated whether the caller is logged in
 * @param roles         roles granted to the caller
 * @param requestId     identifier used in logs and telemetry
 */
public record Scopes(
        ScopeStore application,
        ScopeStore session,
        Map<String, Object> request,
        boolean authenticated,
        Set<String> roles,
        String requestId) {

    public Scopes {
        Objects.requireNonNull(application, "application must not be null");
        Objects.requireNonNull(session, "session must not be null");
        request = request == null ? Map.of() : new HashMap<>(request);
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        requestId = requestId == null ? UUID.randomUUID().toString() : requestId;
    }

    /** Fresh, unshared application and session stores; anonymous caller. */
    public static Scopes isolated() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link Scopes}. Stores default to fresh instances. */
    public static final class Builder {
        private ScopeStore application;
        private ScopeStore session;
        private Map<String, Object> request = Map.of();
        private boolean authenticated;
        private Set<String> roles = Set.of();
        private String requestId;

        Builder() {}

        public Builder application(ScopeStore application) {
            this.application = application;
            return this;
        }

        public Builder session(ScopeStore session) {
            this.session = session;
            return this;
        }

        public Builder request(Map<String, Object> request) {
            this.request = request;
            return this;
        }

        public Builder authenticated(boolean authenticated) {
            this.authenticated = authenticated;
            return this;
        }

        public Builder roles(Set<String> roles) {
            this.roles = roles;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Scopes build() {
            return new Scopes(
                    application != null ? application : ScopeStore.application(),
                    session != null ? session : ScopeStore.session(UUID.randomUUID().toString()),
                    request,
                    authenticated,
                    roles,
                    requestId);
        }
    }
}
