package com.cookapi.jobclient.client;

import com.cookapi.jobclient.model.JobInfo;
import com.cookapi.jobclient.model.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Polls a set of jobs until each reaches a terminal state, yielding every
 * job's final record as soon as it is seen completed.
 *
 * Single-threaded: {@link #hasNext()} blocks the consuming thread, sleeping
 * between polls. Records come out in completion order; jobs that complete in
 * the same poll keep the order they were requested in.
 *
 * Iteration ends when
 * <ul>
 *   <li>every job has been yielded,</li>
 *   <li>the timeout elapses ({@link #timedOut()} becomes true), or</li>
 *   <li>{@link #cancel()} / {@link #close()} is called, from any thread, or the
 *       consuming thread is interrupted.</li>
 * </ul>
 * Each poll is a complete request/response, so nothing is held open between
 * polls and abandoning the iterator leaks nothing.
 */
public class JobWaiter implements Iterator<JobInfo>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobWaiter.class);

    private final Set<UUID>       pending;
    private final Deque<JobInfo>  ready = new ArrayDeque<>();
    private final Function<List<UUID>, List<Result<JobInfo>>> poller;
    private final Duration        pollInterval;
    private final Duration        timeout;          // null = unbounded
    private final CountDownLatch  cancelled = new CountDownLatch(1);

    private long    deadlineNanos;
    private boolean started;
    private boolean timedOut;
    private int     polls;

    JobWaiter(List<UUID> jobs,
              Function<List<UUID>, List<Result<JobInfo>>> poller,
              Duration pollInterval,
              Duration timeout) {
        this.pending      = new LinkedHashSet<>(jobs);
        this.poller       = poller;
        this.pollInterval = pollInterval;
        this.timeout      = timeout;
    }

    @Override
    public boolean hasNext() {
        while (ready.isEmpty() && !pending.isEmpty() && !isCancelled() && !timedOut) {
            if (started && !pause()) break;
            poll();
        }
        return !ready.isEmpty();
    }

    @Override
    public JobInfo next() {
        if (!hasNext()) throw new NoSuchElementException();
        return ready.poll();
    }

    /**
     * The remaining records as a sequential stream. Closing the stream, or
     * short-circuiting it, stops polling.
     */
    public Stream<JobInfo> stream() {
        Spliterator<JobInfo> split = Spliterators.spliteratorUnknownSize(this,
                Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(split, false).onClose(this::cancel);
    }

    /** Blocks until iteration ends and returns everything yielded from here on. */
    public List<JobInfo> awaitAll() {
        List<JobInfo> done = new ArrayList<>();
        forEachRemaining(done::add);
        return done;
    }

    /** Stops polling. Safe to call from any thread, any number of times. */
    public void cancel() {
        cancelled.countDown();
    }

    @Override
    public void close() {
        cancel();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /** True if iteration ended because the timeout elapsed. */
    public boolean timedOut() {
        return timedOut;
    }

    /** Jobs not yet seen in a terminal state. */
    public List<UUID> pending() {
        return List.copyOf(pending);
    }

    public int pollCount() {
        return polls;
    }

    public Optional<Duration> timeout() {
        return Optional.ofNullable(timeout);
    }

    private void poll() {
        if (!started) {
            started = true;
            if (timeout != null) deadlineNanos = System.nanoTime() + timeout.toNanos();
        }
        List<UUID> ids = List.copyOf(pending);
        List<Result<JobInfo>> results = poller.apply(ids);
        polls++;

        for (int i = 0; i < ids.size(); i++) {
            UUID id = ids.get(i);
            Result<JobInfo> result = results.get(i);
            result.value()
                    .filter(JobInfo::isTerminal)
                    .ifPresent(info -> {
                        pending.remove(id);
                        ready.add(info);
                        log.debug("Job {} finished with state {}", id, info.state());
                    });
            result.error().ifPresent(reason ->
                    log.warn("Status poll for job {} failed, retrying in {}: {}", id, pollInterval, reason));
        }
    }

    /**
     * Sleep until the next poll is due.
     *
     * @return false if polling should stop (timeout, cancel, interrupt)
     */
    private boolean pause() {
        long sleepNanos = pollInterval.toNanos();
        if (timeout != null) {
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= 0) {
                timedOut = true;
                log.warn("Gave up after {} waiting on {} job(s): {}", timeout, pending.size(), pending);
                return false;
            }
            sleepNanos = Math.min(sleepNanos, remaining);
        }
        try {
            return !cancelled.await(sleepNanos, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return false;
        }
    }
}
