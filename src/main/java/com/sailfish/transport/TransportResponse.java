package com.sailfish.transport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A successful response delivered by a {@link Transport}.
 */
public final class TransportResponse {

    private final int status;
    private final Map<String, String> headers;
    private final Object body;

    public TransportResponse(int status, Map<String, String> headers, Object body) {
        this.status = status;
        this.headers = headers == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body;
    }

    public TransportResponse(int status, Object body) {
        this(status, null, body);
    }

    public int getStatus() {
        return status;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Object getBody() {
        return body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransportResponse that = (TransportResponse) o;
        return status == that.status && headers.equals(that.headers) && Objects.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, headers, body);
    }

    @Override
    public String toString() {
        return "TransportResponse{" +
               "status=" + status +
               ", headers=" + headers +
               '}';
    }
}
