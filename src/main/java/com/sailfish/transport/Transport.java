package com.sailfish.transport;

import java.util.concurrent.CompletableFuture;

/**
 * An HTTP-style transport performing one request per verb.
 * Implementations own the actual network I/O.
 *
 * Each verb operation returns a future that completes normally with the response,
 * or exceptionally with the failure (typically a
 * {@link com.sailfish.transport.error.TransportException}).
 */
public interface Transport {

    CompletableFuture<TransportResponse> get(TransportRequest request);

    CompletableFuture<TransportResponse> post(TransportRequest request);

    CompletableFuture<TransportResponse> put(TransportRequest request);

    CompletableFuture<TransportResponse> delete(TransportRequest request);

    CompletableFuture<TransportResponse> patch(TransportRequest request);

    CompletableFuture<TransportResponse> head(TransportRequest request);

    CompletableFuture<TransportResponse> options(TransportRequest request);

    /**
     * Releases the resources held by this transport (sockets, pools, etc.).
     * Implementations are expected to tolerate repeated calls.
     */
    void dispose();
}
