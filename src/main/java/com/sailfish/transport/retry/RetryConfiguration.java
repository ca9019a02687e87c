package com.sailfish.transport.retry;

import com.sailfish.transport.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Immutable retry settings of a {@link com.sailfish.transport.impl.RetryTransport}:
 * the delay before a batch of failed calls is resent, and a retry limit per HTTP verb.
 *
 * A verb without a policy, or with a limit of zero, is passed straight through to the
 * wrapped transport.
 *
 * <pre>{@code
 * RetryConfiguration config = RetryConfiguration.builder()
 *         .retryTimeout(Duration.ofSeconds(10))
 *         .retryLimit(HttpMethod.DELETE, 3)
 *         .build();
 * }</pre>
 */
public final class RetryConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RetryConfiguration.class);

    public static final String TIMEOUT_PROPERTY = "transport.retry.timeout.ms";
    public static final String METHOD_PROPERTY_PREFIX = "transport.retry.methods.";
    public static final String RETRY_LIMIT_SUFFIX = ".retry-limit";
    public static final String DEFAULT_RESOURCE = "transport-retry.properties";

    private static final RetryConfiguration NONE = builder().build();

    private final Duration retryTimeout;
    private final Map<HttpMethod, MethodRetryPolicy> methodPolicies;

    private RetryConfiguration(Builder builder) {
        this.retryTimeout = builder.retryTimeout;
        this.methodPolicies = Collections.unmodifiableMap(new EnumMap<>(builder.methodPolicies));
    }

    /**
     * @return a configuration with no managed verbs and a zero retry timeout.
     */
    public static RetryConfiguration none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration getRetryTimeout() {
        return retryTimeout;
    }

    public Map<HttpMethod, MethodRetryPolicy> getMethodPolicies() {
        return methodPolicies;
    }

    public Optional<MethodRetryPolicy> getPolicy(HttpMethod method) {
        return Optional.ofNullable(methodPolicies.get(method));
    }

    /**
     * @return the configured retry limit, or 0 if the verb has no policy.
     */
    public int getRetryLimit(HttpMethod method) {
        MethodRetryPolicy policy = methodPolicies.get(method);
        return policy == null ? 0 : policy.getRetryLimit();
    }

    /**
     * @return true if calls for this verb go through the retry queue.
     */
    public boolean isManaged(HttpMethod method) {
        MethodRetryPolicy policy = methodPolicies.get(method);
        return policy != null && policy.isEnabled();
    }

    /**
     * Reads a configuration from properties.
     *
     * <ul>
     *   <li>{@value #TIMEOUT_PROPERTY} - retry timeout in milliseconds, default 0</li>
     *   <li>{@code transport.retry.methods.<verb>.retry-limit} - retry limit for a verb</li>
     * </ul>
     *
     * Retry limits must be non-negative. A limit of 0 leaves the verb unmanaged; a negative
     * limit is rejected rather than treated as 0.
     *
     * @param properties The properties to read.
     * @return The parsed configuration.
     * @throws IllegalArgumentException if a value is not a number, a retry limit is negative or a verb is unknown.
     */
    public static RetryConfiguration fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties cannot be null");
        Builder builder = builder();

        String timeout = trimToNull(properties.getProperty(TIMEOUT_PROPERTY));
        if (timeout != null) {
            builder.retryTimeout(Duration.ofMillis(parseNumber(TIMEOUT_PROPERTY, timeout)));
        } else {
            log.info("Using default value for key '{}'", TIMEOUT_PROPERTY);
        }

        for (String key : properties.stringPropertyNames()) {
            if (!key.startsWith(METHOD_PROPERTY_PREFIX) || !key.endsWith(RETRY_LIMIT_SUFFIX)) {
                continue;
            }
            String verb = key.substring(METHOD_PROPERTY_PREFIX.length(), key.length() - RETRY_LIMIT_SUFFIX.length());
            HttpMethod method = HttpMethod.fromVerb(verb)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown HTTP method '" + verb + "' in key " + key));
            String value = trimToNull(properties.getProperty(key));
            if (value == null) {
                continue;
            }
            long retryLimit = parseNumber(key, value);
            if (retryLimit > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Value of '" + key + "' is too large: " + value);
            }
            builder.retryLimit(method, (int) retryLimit);
        }

        RetryConfiguration configuration = builder.build();
        log.info("Loaded retry configuration: {}", configuration);
        return configuration;
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath. The bundled file manages no verbs;
     * an application overrides it by shipping its own copy ahead of this library on the classpath.
     *
     * @throws UncheckedIOException if the resource cannot be read.
     */
    public static RetryConfiguration fromDefaultResource() {
        return fromResource(DEFAULT_RESOURCE);
    }

    /**
     * Loads a properties file from the classpath and parses it with {@link #fromProperties(Properties)}.
     *
     * @param resourceName The classpath resource, e.g. {@code "transport-retry.properties"}.
     * @throws UncheckedIOException if the resource is missing or cannot be read.
     */
    public static RetryConfiguration fromResource(String resourceName) {
        Objects.requireNonNull(resourceName, "resourceName cannot be null");
        Properties properties = new Properties();
        try (InputStream inputStream = RetryConfiguration.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (inputStream == null) {
                log.error("Cannot find resource file '{}' in classpath.", resourceName);
                throw new IOException("Cannot find resource: " + resourceName);
            }
            properties.load(new InputStreamReader(inputStream, UTF_8));
            log.info("Loaded properties from {}", resourceName);
        } catch (IOException e) {
            log.error("Error loading properties file {}", resourceName, e);
            throw new UncheckedIOException(e);
        }
        return fromProperties(properties);
    }

    private static long parseNumber(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Value of '" + key + "' is not a number: " + value, e);
        }
    }

    private static String trimToNull(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RetryConfiguration that = (RetryConfiguration) o;
        return retryTimeout.equals(that.retryTimeout) && methodPolicies.equals(that.methodPolicies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(retryTimeout, methodPolicies);
    }

    @Override
    public String toString() {
        return "RetryConfiguration{" +
               "retryTimeout=" + retryTimeout +
               ", methodPolicies=" + methodPolicies +
               '}';
    }

    public static final class Builder {
        private Duration retryTimeout = Duration.ZERO;
        private final Map<HttpMethod, MethodRetryPolicy> methodPolicies = new EnumMap<>(HttpMethod.class);

        private Builder() {
        }

        /**
         * Sets the delay before queued calls are resent. Null, zero or negative values mean "resend immediately".
         */
        public Builder retryTimeout(Duration retryTimeout) {
            this.retryTimeout = (retryTimeout != null && !retryTimeout.isNegative()) ? retryTimeout : Duration.ZERO;
            return this;
        }

        public Builder methodPolicy(HttpMethod method, MethodRetryPolicy policy) {
            if (method == null) throw new IllegalArgumentException("method cannot be null");
            if (policy == null) throw new IllegalArgumentException("policy cannot be null");
            methodPolicies.put(method, policy);
            return this;
        }

        public Builder retryLimit(HttpMethod method, int retryLimit) {
            return methodPolicy(method, MethodRetryPolicy.of(retryLimit));
        }

        public RetryConfiguration build() {
            return new RetryConfiguration(this);
        }
    }
}
