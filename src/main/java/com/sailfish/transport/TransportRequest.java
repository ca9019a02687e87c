package com.sailfish.transport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The arguments of a single transport call.
 * The retry layer never inspects these; the same instance is handed to the
 * underlying transport on every attempt.
 */
public final class TransportRequest {

    private final String serviceGroup;
    private final String urlTemplate;
    private final Map<String, String> templateArgs;
    private final Map<String, String> queryParams;
    private final Map<String, String> headers;
    private final Object body;

    private TransportRequest(Builder builder) {
        this.serviceGroup = builder.serviceGroup;
        this.urlTemplate = builder.urlTemplate;
        this.templateArgs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.templateArgs));
        this.queryParams = Collections.unmodifiableMap(new LinkedHashMap<>(builder.queryParams));
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.body = builder.body;
    }

    public static TransportRequest of(String serviceGroup, String urlTemplate) {
        return builder(serviceGroup, urlTemplate).build();
    }

    public static Builder builder(String serviceGroup, String urlTemplate) {
        return new Builder(serviceGroup, urlTemplate);
    }

    public String getServiceGroup() {
        return serviceGroup;
    }

    public String getUrlTemplate() {
        return urlTemplate;
    }

    public Map<String, String> getTemplateArgs() {
        return templateArgs;
    }

    public Map<String, String> getQueryParams() {
        return queryParams;
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
        TransportRequest that = (TransportRequest) o;
        return serviceGroup.equals(that.serviceGroup)
                && urlTemplate.equals(that.urlTemplate)
                && templateArgs.equals(that.templateArgs)
                && queryParams.equals(that.queryParams)
                && headers.equals(that.headers)
                && Objects.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(serviceGroup, urlTemplate, templateArgs, queryParams, headers, body);
    }

    @Override
    public String toString() {
        return "TransportRequest{" +
               "serviceGroup='" + serviceGroup + '\'' +
               ", urlTemplate='" + urlTemplate + '\'' +
               ", templateArgs=" + templateArgs +
               ", queryParams=" + queryParams +
               '}';
    }

    public static final class Builder {
        private final String serviceGroup;
        private final String urlTemplate;
        private final Map<String, String> templateArgs = new LinkedHashMap<>();
        private final Map<String, String> queryParams = new LinkedHashMap<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Object body;

        private Builder(String serviceGroup, String urlTemplate) {
            this.serviceGroup = Objects.requireNonNull(serviceGroup, "serviceGroup cannot be null");
            this.urlTemplate = Objects.requireNonNull(urlTemplate, "urlTemplate cannot be null");
        }

        public Builder templateArg(String name, String value) {
            templateArgs.put(name, value);
            return this;
        }

        public Builder queryParam(String name, String value) {
            queryParams.put(name, value);
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder body(Object body) {
            this.body = body;
            return this;
        }

        public TransportRequest build() {
            return new TransportRequest(this);
        }
    }
}
