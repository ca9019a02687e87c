package com.sailfish.transport;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * The fixed set of HTTP verbs a {@link Transport} exposes.
 */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE,
    PATCH,
    HEAD,
    OPTIONS;

    /**
     * @return the lower-case verb name, e.g. {@code "delete"}.
     */
    public String verb() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Invokes the operation matching this verb on the given transport.
     *
     * @param transport The transport to call.
     * @param request   The request, forwarded unchanged.
     * @return The future returned by the transport operation.
     */
    public CompletableFuture<TransportResponse> invoke(Transport transport, TransportRequest request) {
        switch (this) {
            case GET:
                return transport.get(request);
            case POST:
                return transport.post(request);
            case PUT:
                return transport.put(request);
            case DELETE:
                return transport.delete(request);
            case PATCH:
                return transport.patch(request);
            case HEAD:
                return transport.head(request);
            case OPTIONS:
                return transport.options(request);
            default:
                throw new IllegalStateException("Unsupported HTTP method: " + this);
        }
    }

    /**
     * Resolves a verb name case-insensitively.
     *
     * @param verb The verb name, e.g. "get" or "DELETE".
     * @return The matching method, or empty if the name is blank or unknown.
     */
    public static Optional<HttpMethod> fromVerb(String verb) {
        if (verb == null || verb.trim().isEmpty()) {
            return Optional.empty();
        }
        String normalized = verb.trim().toUpperCase(Locale.ROOT);
        for (HttpMethod method : values()) {
            if (method.name().equals(normalized)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }
}
