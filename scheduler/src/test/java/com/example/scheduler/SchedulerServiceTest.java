package com.example.scheduler;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import com.example.jobstore.InMemoryJobStore;
import com.example.jobstore.JobState;
import com.example.jobstore.ManualClock;
import com.example.jobstore.ScheduledJob;
import org.junit.Before;
import org.junit.Test;

public class SchedulerServiceTest {
    private static final String TARGET = "https://example.com/hook";

    private ManualClock clock;
    private InMemoryJobStore store;
    private SchedulerService service;

    @Before
    public void setUp() {
        clock = new ManualClock(Instant.parse("2030-01-01T10:00:00Z"));
        store = new InMemoryJobStore(clock);
        service = new SchedulerService(store, new TimeResolver(clock), clock);
    }

    @Test
    public void addJobEnqueuesDelayedCall() {
        Instant scheduledFor = service.addJob("a", TARGET, "23:59", null);

        assertThat(scheduledFor, is(Instant.parse("2030-01-01T23:59:00Z")));
        List<ScheduledJob> jobs = store.findByName("HttpCall-a", EnumSet.of(JobState.PENDING));
        assertThat(jobs.size(), is(1));
        ScheduledJob job = jobs.get(0);
        assertThat(job.getRunAt(), is(scheduledFor));
        assertThat(job.getPayload().getTargetUrl(), is(TARGET));
        assertThat(job.getPayload().getMethod(), is("GET"));
        assertThat(job.isRemoveOnComplete(), is(true));

        clock.advance(Duration.ofHours(13).plusMinutes(58));
        assertThat(store.claimNext("w").isPresent(), is(false));
        clock.advance(Duration.ofMinutes(1));
        assertThat(store.claimNext("w").get().getJobId(), is(job.getJobId()));
    }

    @Test
    public void methodIsNormalizedToUpperCase() {
        service.addJob("a", TARGET, "2030-06-01T12:00:00Z", "patch");
        ScheduledJob job = store.findByName("HttpCall-a", JobState.NON_TERMINAL).get(0);
        assertThat(job.getPayload().getMethod(), is("PATCH"));
    }

    @Test
    public void rejectionsLeaveStoreUntouched() {
        expect(() -> service.addJob(null, TARGET, "12:00", null), ErrorCode.MISSING_PARAMETER,
                "Missing required query parameter 'id'");
        expect(() -> service.addJob("a", "", "12:00", null), ErrorCode.MISSING_PARAMETER,
                "Missing required query parameter 'targetUrl'");
        expect(() -> service.addJob("a", TARGET, null, null), ErrorCode.MISSING_PARAMETER,
                "Missing required query parameter 'runAt'");
        expect(() -> service.addJob("a", "not a url", "12:00", null), ErrorCode.INVALID_URL,
                "targetUrl must be an absolute URL, got: not a url");
        expect(() -> service.addJob("a", "/relative/path", "12:00", null), ErrorCode.INVALID_URL,
                "targetUrl must be an absolute URL, got: /relative/path");
        expect(() -> service.addJob("a", TARGET, "12:00", "options"), ErrorCode.UNSUPPORTED_METHOD,
                "Unsupported HTTP method OPTIONS");
        expect(() -> service.addJob("a", TARGET, "2020-01-01T00:00:00Z", null), ErrorCode.PAST_RUN_AT,
                "runAt must be in the future");
        expect(() -> service.addJob("a", TARGET, "25:00", null), ErrorCode.INVALID_RUN_AT,
                "runAt must be a valid HH:mm time string");

        assertThat(store.list(EnumSet.allOf(JobState.class), 10).isEmpty(), is(true));
    }

    @Test
    public void runAtOvertakenAfterResolutionIsRejected() {
        // the resolver sees 10:00:00, the service's own read comes 5s later
        Clock steppingClock = new SteppingClock(Instant.parse("2030-01-01T10:00:00Z"), Duration.ofSeconds(5));
        SchedulerService racing = new SchedulerService(store, new TimeResolver(steppingClock), steppingClock);

        expect(() -> racing.addJob("late", TARGET, "2030-01-01T10:00:02Z", null), ErrorCode.NON_POSITIVE_DELAY,
                "runAt must be in the future");
        assertThat(store.list(EnumSet.allOf(JobState.class), 10).isEmpty(), is(true));
    }

    @Test
    public void sameIdTwiceCreatesTwoJobsAndRemoveCancelsBoth() {
        service.addJob("dup", TARGET, "12:00", null);
        service.addJob("dup", TARGET, "13:00", "POST");
        assertThat(store.findByName("HttpCall-dup", JobState.NON_TERMINAL).size(), is(2));

        RemovalResult result = service.removeJob("dup");
        assertThat(result.getRemoved(), is(2));
        assertThat(result.getFailed(), is(0));
        assertThat(result.isNotFound(), is(false));
        assertThat(store.findByName("HttpCall-dup", JobState.NON_TERMINAL).isEmpty(), is(true));
    }

    @Test
    public void activeJobIsCountedAsFailedRemoval() {
        service.addJob("x", TARGET, "10:05", null);
        service.addJob("x", TARGET, "11:00", null);
        clock.advance(Duration.ofMinutes(5));
        ScheduledJob running = store.claimNext("w").get();

        RemovalResult result = service.removeJob("x");
        assertThat(result.getRemoved(), is(1));
        assertThat(result.getFailed(), is(1));
        assertThat(store.get(running.getJobId()).get().getState(), is(JobState.ACTIVE));
    }

    @Test
    public void removingUnknownIdIsNotFound() {
        assertThat(service.removeJob("nope").isNotFound(), is(true));

        service.addJob("once", TARGET, "12:00", null);
        assertThat(service.removeJob("once").getRemoved(), is(1));
        assertThat(service.removeJob("once").isNotFound(), is(true));
    }

    @Test
    public void removeRequiresId() {
        expect(() -> service.removeJob(" "), ErrorCode.MISSING_PARAMETER, "Missing required query parameter 'id'");
    }

    @Test
    public void jobNameIsPrefixed() {
        assertThat(SchedulerService.jobName("42"), is("HttpCall-42"));
    }

    /** Moves forward by {@code step} every time it is read. */
    private static final class SteppingClock extends Clock {
        private final AtomicReference<Instant> next;
        private final Duration step;

        SteppingClock(Instant start, Duration step) {
            this.next = new AtomicReference<>(start);
            this.step = step;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            throw new UnsupportedOperationException();
        }

        @Override
        public Instant instant() {
            return next.getAndUpdate(i -> i.plus(step));
        }
    }

    private static void expect(Runnable call, ErrorCode code, String message) {
        try {
            call.run();
            fail("expected " + code);
        } catch (ScheduleValidationException e) {
            assertThat(e.getCode(), is(code));
            assertThat(e.getMessage(), is(message));
        }
    }
}
