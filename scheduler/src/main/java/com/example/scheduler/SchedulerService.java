package com.example.scheduler;

import com.example.jobstore.EnqueueOptions;
import com.example.jobstore.JobPayload;
import com.example.jobstore.JobState;
import com.example.jobstore.JobStore;
import com.example.jobstore.RemoveOutcome;
import com.example.jobstore.ScheduledJob;
import com.example.worker.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Validates scheduling requests, enqueues them in the {@link JobStore} and cancels them by the
 * caller's id. Holds no state of its own; concurrent calls only meet in the store.
 */
public class SchedulerService {
    private static final Logger log = LoggerFactory.getLogger(SchedulerService.class);

    public static final String JOB_NAME_PREFIX = "HttpCall-";

    private final JobStore store;
    private final TimeResolver timeResolver;
    private final Clock clock;

    public SchedulerService(JobStore store, TimeResolver timeResolver, Clock clock) {
        this.store = store;
        this.timeResolver = timeResolver;
        this.clock = clock;
    }

    public static String jobName(String id) {
        return JOB_NAME_PREFIX + id;
    }

    /**
     * Schedules one call of {@code method} (GET when null) on {@code targetUrl} at {@code runAt}.
     *
     * @return the instant the call is scheduled for
     * @throws ScheduleValidationException when the request is rejected; the store is untouched
     */
    public Instant addJob(String id, String targetUrl, String runAt, String method) {
        requireParam("id", id);
        requireParam("targetUrl", targetUrl);
        requireParam("runAt", runAt);
        validateUrl(targetUrl);

        String normalizedMethod = (method == null ? "GET" : method.trim()).toUpperCase(Locale.ROOT);
        if (HttpMethod.parse(normalizedMethod).isEmpty()) {
            throw new ScheduleValidationException(ErrorCode.UNSUPPORTED_METHOD,
                    "Unsupported HTTP method " + normalizedMethod);
        }

        Instant scheduledFor = timeResolver.resolve(runAt);
        // resolution already checked futurity, but time moved on while we got here
        Duration delay = Duration.between(clock.instant(), scheduledFor);
        if (delay.isNegative() || delay.isZero()) {
            throw new ScheduleValidationException(ErrorCode.NON_POSITIVE_DELAY, "runAt must be in the future");
        }

        ScheduledJob job = store.enqueue(jobName(id), new JobPayload(targetUrl, normalizedMethod),
                EnqueueOptions.delayed(delay));
        log.info("Scheduled {} {} {} for {} (job {}, delay {}ms)", job.getName(), normalizedMethod, targetUrl,
                scheduledFor, job.getJobId(), delay.toMillis());
        return scheduledFor;
    }

    /**
     * Cancels every job registered under {@code id} that has not finished. Jobs a dispatcher is
     * already running cannot be cancelled and are reported in {@link RemovalResult#getFailed()}.
     */
    public RemovalResult removeJob(String id) {
        requireParam("id", id);
        String name = jobName(id);
        List<ScheduledJob> matches = store.findByName(name, JobState.NON_TERMINAL);

        int removed = 0;
        int failed = 0;
        for (ScheduledJob job : matches) {
            RemoveOutcome outcome = store.remove(job.getJobId());
            if (outcome == RemoveOutcome.REMOVED) {
                removed++;
            } else {
                log.info("Could not remove job {} ({}): {}", job.getJobId(), name, outcome);
                failed++;
            }
        }
        if (!matches.isEmpty()) {
            log.info("Removal of {}: removed={} failed={}", name, removed, failed);
        }
        return new RemovalResult(removed, failed);
    }

    private static void requireParam(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new ScheduleValidationException(ErrorCode.MISSING_PARAMETER,
                    "Missing required query parameter '" + name + "'");
        }
    }

    private static void validateUrl(String targetUrl) {
        try {
            URI uri = new URI(targetUrl);
            if (!uri.isAbsolute() || uri.getHost() == null) {
                throw new ScheduleValidationException(ErrorCode.INVALID_URL,
                        "targetUrl must be an absolute URL, got: " + targetUrl);
            }
        } catch (URISyntaxException e) {
            throw new ScheduleValidationException(ErrorCode.INVALID_URL,
                    "targetUrl must be an absolute URL, got: " + targetUrl);
        }
    }
}
