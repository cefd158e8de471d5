package com.example.scheduler.gateway;

import com.example.jobstore.JobState;
import com.example.jobstore.JobStore;
import com.example.jobstore.ScheduledJob;
import com.example.scheduler.api.DashboardResponse;
import com.example.scheduler.api.ErrorResponse;
import com.example.scheduler.api.JobLogsResponse;
import com.example.scheduler.api.JobView;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Read-only view of the queue, mounted at {@code /}.
 *
 * <ul>
 *   <li>{@code GET /}: queue name, counts per state and the most recent pending, active and failed jobs</li>
 *   <li>{@code GET /dashboard/jobs?state=&limit=}: jobs in one state, or in all of them</li>
 *   <li>{@code GET /dashboard/jobs/<jobId>/logs}: the audit lines of one job</li>
 * </ul>
 */
public class DashboardHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(DashboardHandler.class);

    public static final String QUEUE_NAME = "ScheduledHttpQueue";
    static final int OVERVIEW_LIMIT = 20;
    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 500;

    private static final String JOBS_PATH = "/dashboard/jobs";
    private static final String LOGS_SUFFIX = "/logs";

    private final JobStore store;
    private final ObjectMapper mapper;

    public DashboardHandler(JobStore store, ObjectMapper mapper) {
        this.store = store;
        this.mapper = mapper;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            if (!"GET".equals(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().set("Allow", "GET");
                JsonResponses.respondJson(exchange, 405, new ErrorResponse("method_not_allowed"), mapper);
                return;
            }
            String path = exchange.getRequestURI().getPath();
            if ("/".equals(path)) {
                JsonResponses.respondJson(exchange, 200, overview(), mapper);
            } else if (JOBS_PATH.equals(path)) {
                listJobs(exchange, QueryParams.of(exchange.getRequestURI()));
            } else if (path.startsWith(JOBS_PATH + "/") && path.endsWith(LOGS_SUFFIX)) {
                String id = path.substring(JOBS_PATH.length() + 1, path.length() - LOGS_SUFFIX.length());
                jobLogs(exchange, id);
            } else {
                JsonResponses.respondJson(exchange, 404, new ErrorResponse("not_found"), mapper);
            }
        } catch (RuntimeException e) {
            log.error("Dashboard request {} failed", exchange.getRequestURI(), e);
            JsonResponses.respondJson(exchange, 500, new ErrorResponse("internal_error"), mapper);
        }
    }

    private DashboardResponse overview() {
        Map<String, Long> counts = new LinkedHashMap<>();
        Map<JobState, Long> raw = store.counts();
        for (JobState s : JobState.values()) {
            counts.put(s.wireName(), raw.getOrDefault(s, 0L));
        }
        Map<String, List<JobView>> jobs = new LinkedHashMap<>();
        for (JobState s : EnumSet.of(JobState.PENDING, JobState.ACTIVE, JobState.FAILED)) {
            jobs.put(s.wireName(), views(store.list(EnumSet.of(s), OVERVIEW_LIMIT)));
        }
        return new DashboardResponse(QUEUE_NAME, counts, jobs);
    }

    private void listJobs(HttpExchange exchange, QueryParams params) throws IOException {
        Set<JobState> states;
        String state = params.get("state");
        if (state == null || state.isBlank()) {
            states = EnumSet.allOf(JobState.class);
        } else {
            try {
                states = EnumSet.of(JobState.fromWireName(state));
            } catch (IllegalArgumentException e) {
                JsonResponses.respondJson(exchange, 400, new ErrorResponse("Unknown job state " + state), mapper);
                return;
            }
        }

        int limit = DEFAULT_LIMIT;
        String rawLimit = params.get("limit");
        if (rawLimit != null && !rawLimit.isBlank()) {
            try {
                limit = Integer.parseInt(rawLimit.trim());
            } catch (NumberFormatException e) {
                limit = -1;
            }
            if (limit < 1 || limit > MAX_LIMIT) {
                JsonResponses.respondJson(exchange, 400,
                        new ErrorResponse("limit must be between 1 and " + MAX_LIMIT), mapper);
                return;
            }
        }

        Map<String, List<JobView>> jobs = new LinkedHashMap<>();
        for (JobState s : states) {
            jobs.put(s.wireName(), views(store.list(EnumSet.of(s), limit)));
        }
        JsonResponses.respondJson(exchange, 200, new DashboardResponse(QUEUE_NAME, null, jobs), mapper);
    }

    private void jobLogs(HttpExchange exchange, String rawId) throws IOException {
        UUID jobId;
        try {
            jobId = UUID.fromString(rawId);
        } catch (IllegalArgumentException e) {
            JsonResponses.respondJson(exchange, 400, new ErrorResponse("Invalid job id " + rawId), mapper);
            return;
        }
        List<String> lines = store.logs(jobId);
        if (lines.isEmpty() && store.get(jobId).isEmpty()) {
            JsonResponses.respondJson(exchange, 404, new ErrorResponse("not_found"), mapper);
            return;
        }
        JsonResponses.respondJson(exchange, 200, new JobLogsResponse(jobId.toString(), lines), mapper);
    }

    private static List<JobView> views(List<ScheduledJob> jobs) {
        List<JobView> out = new ArrayList<>(jobs.size());
        for (ScheduledJob j : jobs) {
            out.add(JobView.of(j));
        }
        return out;
    }
}
