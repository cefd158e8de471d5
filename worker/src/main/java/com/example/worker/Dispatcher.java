package com.example.worker;

import com.example.jobstore.JobResult;
import com.example.jobstore.JobStore;
import com.example.jobstore.ScheduledJob;
import com.example.worker.http.HttpCallException;
import com.example.worker.http.HttpCallResult;
import com.example.worker.http.HttpCaller;
import com.example.worker.http.HttpMethod;
import com.example.worker.metrics.DispatchMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background worker that claims due jobs from a {@link JobStore} and fires their HTTP call.
 *
 * One poll thread claims jobs while a permit is free and hands them to a fixed pool of
 * {@code concurrency} executor threads. Each job gets exactly one attempt; its outcome is
 * recorded as completed or failed and the loop moves on. The store decides exclusivity, so any
 * number of dispatchers may share one store.
 */
public class Dispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final JobStore store;
    private final HttpCaller caller;
    private final String workerId;
    private final Duration pollInterval;
    private final int concurrency;
    private final DispatchMetrics metrics;
    private final Semaphore permits;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final ExecutorService executor;
    private final Thread poller;
    private volatile boolean shuttingDown = false;

    public Dispatcher(JobStore store, HttpCaller caller, String workerId, Duration pollInterval, int concurrency,
            DispatchMetrics metrics) {
        this(store, caller, workerId, pollInterval, concurrency, metrics, newPool(workerId, concurrency));
    }

    Dispatcher(JobStore store, HttpCaller caller, String workerId, Duration pollInterval, int concurrency,
            DispatchMetrics metrics, ExecutorService executor) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1, got: " + concurrency);
        }
        this.store = store;
        this.caller = caller;
        this.workerId = workerId;
        this.pollInterval = pollInterval;
        this.concurrency = concurrency;
        this.metrics = (metrics == null ? DispatchMetrics.noop() : metrics);
        this.permits = new Semaphore(concurrency);
        this.executor = executor;
        this.poller = new Thread(this::pollLoop, "dispatch-poller-" + workerId);
        this.poller.setDaemon(true);
    }

    private static ExecutorService newPool(String workerId, int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1, got: " + concurrency);
        }
        return Executors.newFixedThreadPool(concurrency, r -> {
            Thread t = new Thread(r, "dispatch-" + workerId);
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        poller.start();
        log.info("Dispatcher {} started (concurrency={}, pollInterval={}ms)", workerId, concurrency,
                pollInterval.toMillis());
    }

    public int inFlight() {
        return inFlight.get();
    }

    private void pollLoop() {
        while (!shuttingDown) {
            try {
                permits.acquire();
                Optional<ScheduledJob> claimed;
                try {
                    claimed = store.claimNext(workerId);
                } catch (RuntimeException e) {
                    permits.release();
                    throw e;
                }
                if (claimed.isEmpty()) {
                    permits.release();
                    Thread.sleep(pollInterval.toMillis());
                    continue;
                }
                ScheduledJob job = claimed.get();
                inFlight.incrementAndGet();
                try {
                    executor.execute(() -> {
                        try {
                            execute(job);
                        } finally {
                            inFlight.decrementAndGet();
                            permits.release();
                        }
                    });
                } catch (RejectedExecutionException e) {
                    inFlight.decrementAndGet();
                    permits.release();
                    recordFailure(job, HttpCallException.NO_RESPONSE, null,
                            "Dispatcher " + workerId + " stopped before the call started");
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Dispatcher {} poll error", workerId, e);
                try {
                    Thread.sleep(pollInterval.toMillis());
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    /**
     * Runs one claimed job to its terminal state. Never throws: every failure ends up recorded on
     * the job, or logged when the store itself is failing.
     */
    void execute(ScheduledJob job) {
        String target = job.getPayload().getTargetUrl();
        String methodName = job.getPayload().getMethod();
        long start = System.nanoTime();
        metrics.jobStarted();
        boolean success = false;
        try {
            String intent = "Calling " + methodName + " " + target;
            log.info("Job {} ({}): {}", job.getJobId(), job.getName(), intent);
            store.appendLog(job.getJobId(), intent);

            HttpMethod method = HttpMethod.parse(methodName)
                    .orElseThrow(() -> new HttpCallException("Unsupported HTTP method " + methodName, null));
            HttpCallResult result = caller.call(target, method);
            success = true;
            recordCompletion(job, result);
        } catch (HttpCallException e) {
            recordFailure(job, e.getStatus(), e.getBody(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Job {} ({}) failed unexpectedly", job.getJobId(), job.getName(), e);
            recordFailure(job, HttpCallException.NO_RESPONSE, null, String.valueOf(e.getMessage()));
        } finally {
            metrics.jobFinished(success, (System.nanoTime() - start) / 1_000_000_000.0);
        }
    }

    private void recordCompletion(ScheduledJob job, HttpCallResult result) {
        String outcome = "Call completed with status " + result.getStatus();
        log.info("Job {} ({}): {}", job.getJobId(), job.getName(), outcome);
        try {
            store.appendLog(job.getJobId(), outcome);
            store.complete(job.getJobId(), new JobResult(job.getJobId(), result.getStatus(), result.getBody()));
        } catch (RuntimeException e) {
            // the call went out, so the job is left active rather than failed
            log.error("Job {} ({}) succeeded but its completion was not recorded", job.getJobId(), job.getName(), e);
        }
    }

    private void recordFailure(ScheduledJob job, int status, String body, String reason) {
        log.warn("Job {} ({}) failed: {}", job.getJobId(), job.getName(), reason);
        try {
            store.appendLog(job.getJobId(), reason);
            store.fail(job.getJobId(), new JobResult(job.getJobId(), status, body), reason);
        } catch (RuntimeException e) {
            log.error("Could not record failure of job {}", job.getJobId(), e);
        }
    }

    /**
     * Stops claiming new jobs and waits up to {@code grace} for in-flight calls to finish.
     */
    public void shutdown(Duration grace) {
        shuttingDown = true;
        poller.interrupt();
        try {
            poller.join(5000);
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Dispatcher {} stopped with {} job(s) still running", workerId, inFlight.get());
                executor.shutdownNow();
            }
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        log.info("Dispatcher {} stopped", workerId);
    }

    @Override
    public void close() {
        shutdown(Duration.ofSeconds(30));
    }
}
