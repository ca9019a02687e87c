package com.sailfish.transport.impl;

import com.sailfish.transport.HttpMethod;
import com.sailfish.transport.Transport;
import com.sailfish.transport.TransportRequest;
import com.sailfish.transport.TransportResponse;
import com.sailfish.transport.model.PendingCall;
import com.sailfish.transport.repository.InMemoryPendingCallQueue;
import com.sailfish.transport.retry.FixedDelayRetryStrategy;
import com.sailfish.transport.retry.RetryConfiguration;
import com.sailfish.transport.retry.RetryStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PreDestroy;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wraps a {@link Transport} so that failed calls are resent after a timeout.
 *
 * Only verbs with a positive retry limit in the {@link RetryConfiguration} are managed: the
 * caller gets a new future right away, and connectivity-level failures are queued and resent
 * in batches every {@code retryTimeout} until the call succeeds or the limit is used up.
 * Failures carrying an HTTP status are returned immediately. All other verbs go straight
 * to the wrapped transport.
 *
 * <pre>{@code
 * RetryTransport transport = new RetryTransport(httpTransport, RetryConfiguration.builder()
 *         .retryTimeout(Duration.ofSeconds(10))
 *         .retryLimit(HttpMethod.DELETE, 3)
 *         .build());
 * }</pre>
 *
 * Known limitation: {@link #dispose()} drops queued and in-flight managed calls without
 * completing their futures.
 */
public class RetryTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(RetryTransport.class);

    private final Transport transport;
    private final RetryConfiguration configuration;
    private final RetryStrategy retryStrategy;
    private final RetryScheduler retryScheduler;
    private final ScheduledExecutorService ownedExecutor; // null when the executor was supplied
    private final AtomicBoolean disposed = new AtomicBoolean(false);

    public RetryTransport(Transport transport) {
        this(transport, RetryConfiguration.none());
    }

    public RetryTransport(Transport transport, RetryConfiguration configuration) {
        this(transport, configuration, null);
    }

    public RetryTransport(Transport transport,
                          RetryConfiguration configuration,
                          ScheduledExecutorService schedulerExecutor) {
        this(transport, configuration, null, schedulerExecutor);
    }

    /**
     * @param transport         The transport to wrap. Required.
     * @param configuration     Retry settings; null means no verb is managed.
     * @param retryStrategy     Failure classification; null means a {@link FixedDelayRetryStrategy} over the configuration.
     * @param schedulerExecutor Executor running the retry timer; null makes the transport create and own one.
     * @throws IllegalArgumentException if the transport is missing.
     */
    public RetryTransport(Transport transport,
                          RetryConfiguration configuration,
                          RetryStrategy retryStrategy,
                          ScheduledExecutorService schedulerExecutor) {
        if (transport == null) {
            throw new IllegalArgumentException("Missing required parameter: transport in RetryTransport");
        }
        this.transport = transport;
        this.configuration = configuration != null ? configuration : RetryConfiguration.none();
        this.retryStrategy = retryStrategy != null ? retryStrategy : new FixedDelayRetryStrategy(this.configuration);
        if (schedulerExecutor == null) {
            this.ownedExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "transport-retry-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            schedulerExecutor = this.ownedExecutor;
        } else {
            this.ownedExecutor = null;
        }
        this.retryScheduler = new RetryScheduler(new InMemoryPendingCallQueue(), schedulerExecutor,
                this.retryStrategy.getRetryDelay(), this::sendTransportCall);
        log.info("RetryTransport initialized with {}", this.configuration);
    }

    @Override
    public CompletableFuture<TransportResponse> get(TransportRequest request) {
        return call(HttpMethod.GET, request);
    }

    @Override
    public CompletableFuture<TransportResponse> post(TransportRequest request) {
        return call(HttpMethod.POST, request);
    }

    @Override
    public CompletableFuture<TransportResponse> put(TransportRequest request) {
        return call(HttpMethod.PUT, request);
    }

    @Override
    public CompletableFuture<TransportResponse> delete(TransportRequest request) {
        return call(HttpMethod.DELETE, request);
    }

    @Override
    public CompletableFuture<TransportResponse> patch(TransportRequest request) {
        return call(HttpMethod.PATCH, request);
    }

    @Override
    public CompletableFuture<TransportResponse> head(TransportRequest request) {
        return call(HttpMethod.HEAD, request);
    }

    @Override
    public CompletableFuture<TransportResponse> options(TransportRequest request) {
        return call(HttpMethod.OPTIONS, request);
    }

    /**
     * Shared handler behind every verb operation. Once disposed, every verb passes straight through
     * so a new call is never dropped by the stopped retry queue.
     */
    protected CompletableFuture<TransportResponse> call(HttpMethod method, TransportRequest request) {
        if (!configuration.isManaged(method) || disposed.get()) {
            return method.invoke(transport, request);
        }
        PendingCall call = new PendingCall(method, request);
        log.debug("Managed {} call {} created for {}", method, call.getId(), request);
        sendTransportCall(call);
        return call.getResult();
    }

    /**
     * Sends one attempt of a managed call to the wrapped transport.
     */
    protected void sendTransportCall(PendingCall call) {
        call.markInFlight();
        CompletableFuture<TransportResponse> attempt;
        try {
            attempt = Objects.requireNonNull(call.getMethod().invoke(transport, call.getRequest()),
                    "transport returned no result");
        } catch (RuntimeException e) {
            handleFailure(call, e);
            return;
        }
        attempt.whenComplete((response, failure) -> {
            if (failure == null) {
                if (call.complete(response)) {
                    log.debug("{} call {} succeeded after {} retries.", call.getMethod(), call.getId(), call.getRetryCount());
                }
            } else {
                handleFailure(call, unwrap(failure));
            }
        });
    }

    private void handleFailure(PendingCall call, Throwable failure) {
        call.setLastFailure(failure);
        if (retryStrategy.shouldRetry(call, failure)) {
            if (retryScheduler.isStopped()) {
                log.debug("{} call {} failed after disposal and was dropped.", call.getMethod(), call.getId());
                call.abandon();
            } else if (retryScheduler.schedule(call)) {
                log.warn("{} call {} failed: {}. Scheduled retry {} of {}.", call.getMethod(), call.getId(),
                        failure.getMessage(), call.getRetryCount(), configuration.getRetryLimit(call.getMethod()));
            } else {
                log.debug("{} call {} failed while disposing and was dropped.", call.getMethod(), call.getId());
            }
        } else {
            log.debug("{} call {} failed after {} retries: {}", call.getMethod(), call.getId(),
                    call.getRetryCount(), failure.toString());
            call.fail(failure);
        }
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Clears the retry queue, cancels the retry timer and disposes the wrapped transport.
     * Queued and in-flight managed calls are dropped and their futures never complete.
     * Calling this more than once is a no-op.
     */
    @Override
    @PreDestroy
    public void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            log.debug("RetryTransport already disposed.");
            return;
        }
        log.info("Disposing RetryTransport...");
        int dropped = retryScheduler.stop();
        if (dropped > 0) {
            log.warn("{} queued calls dropped without completion on dispose.", dropped);
        }
        try {
            transport.dispose();
        } finally {
            if (ownedExecutor != null) {
                ownedExecutor.shutdownNow();
            }
        }
        log.info("RetryTransport disposed.");
    }

    public RetryConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * @return the number of calls waiting for the next batch resend.
     */
    public int getPendingRetryCount() {
        return retryScheduler.getPendingCount();
    }

    public boolean isRetryScheduled() {
        return retryScheduler.isTimerActive();
    }

    public boolean isDisposed() {
        return disposed.get();
    }
}
