package com.sailfish.transport.impl;

import com.sailfish.transport.model.PendingCall;
import com.sailfish.transport.repository.PendingCallQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Owns the retry queue and the single retry timer.
 *
 * Failed calls are appended to the queue; the first one starts a timer, and every call
 * queued before it fires shares it. When the timer fires the whole queue is resent in
 * FIFO order. Calls failing again during that resend start a new timer.
 *
 * The queue and the timer reference are only touched under {@code lock}, since transport
 * futures may complete on any thread. Resends run outside the lock.
 */
public class RetryScheduler {

    private static final Logger log = LoggerFactory.getLogger(RetryScheduler.class);

    private final PendingCallQueue queue;
    private final ScheduledExecutorService schedulerExecutor;
    private final Duration retryDelay;
    private final Consumer<PendingCall> dispatcher;

    private final Object lock = new Object();
    private ScheduledFuture<?> retryTimer;
    private volatile boolean stopped;

    public RetryScheduler(PendingCallQueue queue,
                          ScheduledExecutorService schedulerExecutor,
                          Duration retryDelay,
                          Consumer<PendingCall> dispatcher) {
        this.queue = Objects.requireNonNull(queue, "queue cannot be null");
        this.schedulerExecutor = Objects.requireNonNull(schedulerExecutor, "schedulerExecutor cannot be null");
        this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay cannot be null");
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative");
        }
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher cannot be null");
        log.debug("RetryScheduler initialized with retryDelay={}", retryDelay);
    }

    /**
     * Queues a failed call for the next batch resend, incrementing its retry count.
     *
     * @param call The call whose last attempt failed.
     * @return false if the scheduler has been stopped; the call is then abandoned.
     */
    public boolean schedule(PendingCall call) {
        List<PendingCall> rejected;
        synchronized (lock) {
            if (stopped) {
                call.abandon();
                return false;
            }
            call.markPendingRetry();
            queue.add(call);
            if (retryTimer != null) {
                return true;
            }
            try {
                retryTimer = schedulerExecutor.schedule(this::runRetryCycle, retryDelay.toMillis(), TimeUnit.MILLISECONDS);
                log.debug("Retry timer started, firing in {}", retryDelay);
                return true;
            } catch (RejectedExecutionException e) {
                log.error("Scheduler executor rejected the retry timer. Failing {} queued calls.", queue.size(), e);
                rejected = queue.drainAll();
            }
        }
        for (PendingCall failed : rejected) {
            failed.fail(failed.getLastFailure());
        }
        return true;
    }

    /**
     * Cancels the timer and clears the queue. Queued calls are abandoned without completing
     * their futures, and nothing is scheduled afterwards. Safe to call more than once.
     *
     * @return the number of calls that were dropped from the queue.
     */
    public int stop() {
        List<PendingCall> dropped;
        synchronized (lock) {
            if (stopped) {
                return 0;
            }
            stopped = true;
            if (retryTimer != null) {
                retryTimer.cancel(false);
                retryTimer = null;
            }
            dropped = queue.drainAll();
        }
        dropped.forEach(PendingCall::abandon);
        log.info("RetryScheduler stopped. {} queued calls dropped.", dropped.size());
        return dropped.size();
    }

    void runRetryCycle() {
        List<PendingCall> batch;
        synchronized (lock) {
            retryTimer = null;
            if (stopped) {
                return;
            }
            batch = queue.drainAll();
        }
        log.debug("Resending {} failed transport calls.", batch.size());

        for (PendingCall call : batch) {
            if (stopped) {
                call.abandon();
                continue;
            }
            try {
                dispatcher.accept(call);
            } catch (RuntimeException e) {
                log.error("Unexpected error resending call {}: {}", call.getId(), e.getMessage(), e);
                call.fail(e);
            }
        }
    }

    public int getPendingCount() {
        synchronized (lock) {
            return queue.size();
        }
    }

    public boolean isTimerActive() {
        synchronized (lock) {
            return retryTimer != null;
        }
    }

    public boolean isStopped() {
        return stopped;
    }
}
