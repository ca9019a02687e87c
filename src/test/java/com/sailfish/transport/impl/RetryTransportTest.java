package com.sailfish.transport.impl;

import com.sailfish.transport.HttpMethod;
import com.sailfish.transport.Transport;
import com.sailfish.transport.TransportRequest;
import com.sailfish.transport.TransportResponse;
import com.sailfish.transport.error.HttpStatusException;
import com.sailfish.transport.error.TransportUnreachableException;
import com.sailfish.transport.retry.RetryConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static java.util.concurrent.CompletableFuture.completedFuture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetryTransportTest {

    @Mock
    private Transport transport;
    @Mock
    private ScheduledExecutorService scheduler;
    @Mock
    private ScheduledFuture<Object> timer;

    private final Deque<Runnable> timers = new ArrayDeque<>();
    private final TransportRequest request = TransportRequest.builder("trade", "v1/orders/{OrderId}")
            .templateArg("OrderId", "42")
            .build();
    private final TransportResponse response = new TransportResponse(200, "ok");

    @BeforeEach
    void setUp() {
        lenient().doAnswer(invocation -> {
            timers.add(invocation.getArgument(0));
            return timer;
        }).when(scheduler).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    }

    @Test
    @DisplayName("Should reject a missing transport")
    void shouldRejectMissingTransport() {
        assertThatThrownBy(() -> new RetryTransport(null, RetryConfiguration.none(), scheduler))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("transport");
    }

    @Test
    @DisplayName("Should treat a null configuration as no managed verbs")
    void shouldDefaultNullConfiguration() {
        RetryTransport retryTransport = new RetryTransport(transport, null, scheduler);

        assertThat(retryTransport.getConfiguration()).isEqualTo(RetryConfiguration.none());
        assertThat(retryTransport.getConfiguration().getRetryTimeout()).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("Should pass calls for unconfigured verbs straight through")
    void shouldPassThroughUnconfiguredVerb() {
        // Given
        RetryTransport retryTransport = new RetryTransport(transport, config(100, HttpMethod.DELETE, 2), scheduler);
        CompletableFuture<TransportResponse> underlying = failed(new TransportUnreachableException("offline"));
        when(transport.get(request)).thenReturn(underlying);

        // When
        CompletableFuture<TransportResponse> result = retryTransport.get(request);

        // Then
        assertThat(result).isSameAs(underlying);
        verify(transport, times(1)).get(request);
        verifyNoInteractions(scheduler);
        assertThat(retryTransport.getPendingRetryCount()).isZero();
    }

    @Test
    @DisplayName("Should pass calls through when the retry limit is zero")
    void shouldPassThroughZeroRetryLimit() {
        RetryTransport retryTransport = new RetryTransport(transport, config(100, HttpMethod.POST, 0), scheduler);
        CompletableFuture<TransportResponse> underlying = completedFuture(response);
        when(transport.post(request)).thenReturn(underlying);

        assertThat(retryTransport.post(request)).isSameAs(underlying);
        verify(transport, times(1)).post(request);
    }

    @Test
    @DisplayName("Should complete a managed call that succeeds on the first attempt without scheduling")
    void shouldSucceedOnFirstAttempt() {
        RetryTransport retryTransport = new RetryTransport(transport, config(100, HttpMethod.PATCH, 3), scheduler);
        CompletableFuture<TransportResponse> underlying = completedFuture(response);
        when(transport.patch(request)).thenReturn(underlying);

        CompletableFuture<TransportResponse> result = retryTransport.patch(request);

        assertThat(result).isNotSameAs(underlying);
        assertThat(result).isCompletedWithValue(response);
        verifyNoInteractions(scheduler);
    }

    @Test
    @DisplayName("Should resend after each timeout and succeed on the third attempt")
    void shouldRetryAndSucceedOnThirdAttempt() {
        // Given
        RetryTransport retryTransport = new RetryTransport(transport, config(100, HttpMethod.DELETE, 2), scheduler);
        when(transport.delete(request)).thenReturn(
                failed(new TransportUnreachableException("first")),
                failed(new TransportUnreachableException("second")),
                completedFuture(response));

        // When
        CompletableFuture<TransportResponse> result = retryTransport.delete(request);

        // Then
        assertThat(result).isNotDone();
        assertThat(retryTransport.getPendingRetryCount()).isEqualTo(1);
        assertThat(retryTransport.isRetryScheduled()).isTrue();

        fireTimer();
        assertThat(result).isNotDone();

        fireTimer();
        assertThat(result).isCompletedWithValue(response);
        verify(transport, times(3)).delete(request);
        verify(scheduler, times(2)).schedule(any(Runnable.class), eq(100L), eq(TimeUnit.MILLISECONDS));
        assertThat(timers).isEmpty();
        assertThat(retryTransport.isRetryScheduled()).isFalse();
    }

    @Test
    @DisplayName("Should fail with the last failure once the retry limit is used up")
    void shouldFailAfterRetryLimit() {
        // Given
        RetryTransport retryTransport = new RetryTransport(transport, config(100, HttpMethod.DELETE, 2), scheduler);
        TransportUnreachableException last = new TransportUnreachableException("third");
        when(transport.delete(request)).thenReturn(
                failed(new TransportUnreachableException("first")),
                failed(new TransportUnreachableException("second")),
                failed(last));

        // When
        CompletableFuture<TransportResponse> result = retryTransport.delete(request);
        fireTimer();
        fireTimer();

        // Then
        assertThat(result).isCompletedExceptionally();
        assertThat(catchThrowable(result::join).getCause()).isSameAs(last);
        verify(transport, times(3)).delete(request);
        verify(scheduler, times(2)).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        assertThat(timers).isEmpty();
    }

    @Test
    @DisplayName("Should surface an HTTP status failure immediately")
    void shouldNotRetryHttpStatusFailure() {
        // Given
        RetryTransport retryTransport = new RetryTransport(transport, config(0, HttpMethod.GET, 1), scheduler);
        HttpStatusException serverError = new HttpStatusException(500, "Internal Server Error", "{}");
        when(transport.get(request)).thenReturn(failed(serverError));

        // When
        CompletableFuture<TransportResponse> result = retryTransport.get(request);

        // Then
        assertThat(catchThrowable(result::join).getCause()).isSameAs(serverError);
        assertThat(serverError.getResponseBody()).isEqualTo("{}");
        verify(transport, times(1)).get(request);
        verifyNoInteractions(scheduler);
    }

    @Test
    @DisplayName("Should surface an HTTP status failure that follows a connectivity failure")
    void shouldStopRetryingOnHttpStatusFailure() {
        RetryTransport retryTransport = new RetryTransport(transport, config(10, HttpMethod.PUT, 5), scheduler);
        HttpStatusException notFound = new HttpStatusException(404, "Not Found");
        when(transport.put(request)).thenReturn(
                failed(new TransportUnreachableException("offline")),
                failed(notFound));

        CompletableFuture<TransportResponse> result = retryTransport.put(request);
        fireTimer();

        assertThat(catchThrowable(result::join).getCause()).isSameAs(notFound);
        verify(transport, times(2)).put(request);
        assertThat(timers).isEmpty();
    }

    @Test
    @DisplayName("Should retry failures that are not transport exceptions")
    void shouldRetryForeignFailure() {
        RetryTransport retryTransport = new RetryTransport(transport, config(10, HttpMethod.HEAD, 1), scheduler);
        when(transport.head(request)).thenReturn(failed(new IOException("connection reset")), completedFuture(response));

        CompletableFuture<TransportResponse> result = retryTransport.head(request);
        fireTimer();

        assertThat(result).isCompletedWithValue(response);
        verify(transport, times(2)).head(request);
    }

    @Test
    @DisplayName("Should treat a transport that throws synchronously as a failed attempt")
    void shouldRetrySynchronousThrow() {
        RetryTransport retryTransport = new RetryTransport(transport, config(10, HttpMethod.OPTIONS, 1), scheduler);
        when(transport.options(request))
                .thenThrow(new TransportUnreachableException("socket closed"))
                .thenReturn(completedFuture(response));

        CompletableFuture<TransportResponse> result = retryTransport.options(request);

        assertThat(result).isNotDone();
        fireTimer();
        assertThat(result).isCompletedWithValue(response);
    }

    @Test
    @DisplayName("Should batch calls queued while the timer is pending and resend them in FIFO order")
    void shouldBatchQueuedCalls() {
        // Given
        RetryTransport retryTransport = new RetryTransport(transport, config(100, HttpMethod.DELETE, 1), scheduler);
        TransportRequest first = TransportRequest.of("trade", "v1/orders/1");
        TransportRequest second = TransportRequest.of("trade", "v1/orders/2");
        TransportResponse firstResponse = new TransportResponse(200, "first");
        TransportResponse secondResponse = new TransportResponse(200, "second");
        when(transport.delete(first)).thenReturn(failed(new TransportUnreachableException("a")), completedFuture(firstResponse));
        when(transport.delete(second)).thenReturn(failed(new TransportUnreachableException("b")), completedFuture(secondResponse));

        // When
        CompletableFuture<TransportResponse> firstResult = retryTransport.delete(first);
        CompletableFuture<TransportResponse> secondResult = retryTransport.delete(second);

        // Then
        verify(scheduler, times(1)).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        assertThat(retryTransport.getPendingRetryCount()).isEqualTo(2);

        fireTimer();

        assertThat(firstResult).isCompletedWithValue(firstResponse);
        assertThat(secondResult).isCompletedWithValue(secondResponse);
        InOrder order = inOrder(transport);
        order.verify(transport).delete(first);
        order.verify(transport).delete(second);
        order.verify(transport).delete(first);
        order.verify(transport).delete(second);
        assertThat(retryTransport.getPendingRetryCount()).isZero();
    }

    @Test
    @DisplayName("Should drop queued calls, cancel the timer and dispose the wrapped transport")
    void shouldDisposeQueuedCalls() {
        // Given
        RetryTransport retryTransport = new RetryTransport(transport, config(100, HttpMethod.DELETE, 2), scheduler);
        when(transport.delete(request)).thenReturn(failed(new TransportUnreachableException("offline")));
        CompletableFuture<TransportResponse> result = retryTransport.delete(request);
        assertThat(retryTransport.getPendingRetryCount()).isEqualTo(1);

        // When
        retryTransport.dispose();

        // Then
        verify(timer).cancel(false);
        verify(transport, times(1)).dispose();
        assertThat(retryTransport.getPendingRetryCount()).isZero();
        assertThat(retryTransport.isRetryScheduled()).isFalse();
        assertThat(retryTransport.isDisposed()).isTrue();

        // A timer firing despite the cancel must not resend anything
        fireTimer();
        verify(transport, times(1)).delete(request);
        assertThat(result).isNotDone();
    }

    @Test
    @DisplayName("Should not queue a failure that arrives after disposal")
    void shouldDropLateFailureAfterDispose() {
        RetryTransport retryTransport = new RetryTransport(transport, config(100, HttpMethod.DELETE, 2), scheduler);
        CompletableFuture<TransportResponse> inFlight = new CompletableFuture<>();
        when(transport.delete(request)).thenReturn(inFlight);
        CompletableFuture<TransportResponse> result = retryTransport.delete(request);

        retryTransport.dispose();
        inFlight.completeExceptionally(new TransportUnreachableException("late"));

        assertThat(result).isNotDone();
        assertThat(retryTransport.getPendingRetryCount()).isZero();
        verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    }

    @Test
    @DisplayName("Should pass managed verbs straight through once disposed")
    void shouldPassThroughAfterDispose() throws Exception {
        // Given
        RetryTransport retryTransport = new RetryTransport(transport, config(100, HttpMethod.DELETE, 2), scheduler);
        retryTransport.dispose();
        TransportUnreachableException offline = new TransportUnreachableException("offline");
        CompletableFuture<TransportResponse> underlying = failed(offline);
        when(transport.delete(request)).thenReturn(underlying);

        // When
        CompletableFuture<TransportResponse> result = retryTransport.delete(request);

        // Then
        assertThat(result).isSameAs(underlying);
        Throwable thrown = catchThrowable(() -> result.get(2, TimeUnit.SECONDS));
        assertThat(thrown).isInstanceOf(ExecutionException.class);
        assertThat(thrown.getCause()).isSameAs(offline);
        verify(transport, times(1)).delete(request);
        verifyNoInteractions(scheduler);
        assertThat(retryTransport.getPendingRetryCount()).isZero();
    }

    @Test
    @DisplayName("Should tolerate a second dispose and keep a supplied scheduler running")
    void shouldDisposeTwiceWithoutError() {
        RetryTransport retryTransport = new RetryTransport(transport, config(100, HttpMethod.DELETE, 2), scheduler);

        retryTransport.dispose();
        assertThatCode(retryTransport::dispose).doesNotThrowAnyException();

        verify(transport, times(1)).dispose();
        verify(scheduler, never()).shutdown();
        verify(scheduler, never()).shutdownNow();
    }

    private void fireTimer() {
        assertThat(timers).as("pending retry timers").isNotEmpty();
        timers.poll().run();
    }

    private static RetryConfiguration config(long timeoutMillis, HttpMethod method, int retryLimit) {
        return RetryConfiguration.builder()
                .retryTimeout(Duration.ofMillis(timeoutMillis))
                .retryLimit(method, retryLimit)
                .build();
    }

    private static CompletableFuture<TransportResponse> failed(Throwable failure) {
        CompletableFuture<TransportResponse> future = new CompletableFuture<>();
        future.completeExceptionally(failure);
        return future;
    }
}
