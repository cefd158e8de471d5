package com.example.scheduler;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import com.example.jobstore.InMemoryJobStore;
import com.example.jobstore.JobState;
import com.example.jobstore.ManualClock;
import com.example.jobstore.ScheduledJob;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class SchedulerGatewayTest {
    private static final String API_KEY = "test-key";
    private static final String TARGET = "https%3A%2F%2Fexample.com%2Fhook";

    private final HttpClient client = HttpClient.newHttpClient();
    private final ObjectMapper mapper = SchedulerMain.objectMapper();

    private InMemoryJobStore store;
    private HttpServer server;
    private String base;

    @Before
    public void setUp() throws Exception {
        server = start(true);
    }

    @After
    public void tearDown() {
        server.stop(0);
        store.close();
    }

    private HttpServer start(boolean dashboardAuth) throws Exception {
        ManualClock clock = new ManualClock(Instant.parse("2030-01-01T10:00:00Z"));
        store = new InMemoryJobStore(clock);
        SchedulerService service = new SchedulerService(store, new TimeResolver(clock), clock);

        Map<String, String> env = new HashMap<>();
        env.put("API_KEY_SCHEDULER", API_KEY);
        env.put("DASHBOARD_AUTH_ENABLED", String.valueOf(dashboardAuth));
        env.put("DASHBOARD_USER", "admin");
        env.put("DASHBOARD_PASSWORD", "s3cret");
        env.put("STORE_BACKEND", "memory");
        SchedulerConfig config = SchedulerConfig.fromEnv(env);

        HttpServer s = SchedulerMain.startServer(service, store, config, mapper, new CollectorRegistry(), 0);
        base = "http://localhost:" + s.getAddress().getPort();
        return s;
    }

    private HttpResponse<String> get(String path, String... headers) throws Exception {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(base + path)).GET();
        if (headers.length > 0) {
            b.headers(headers);
        }
        return client.send(b.build(), HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode json(HttpResponse<String> response) throws Exception {
        return mapper.readTree(response.body());
    }

    private static String basic(String user, String password) {
        return "Basic " + Base64.getEncoder().encodeToString((user + ":" + password).getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void addJobSchedulesWithApiKey() throws Exception {
        HttpResponse<String> r = get("/add-job?id=a&targetUrl=" + TARGET + "&runAt=12%3A00&method=post",
                "x-api-key", API_KEY);
        assertThat(r.statusCode(), is(200));
        assertThat(r.headers().firstValue("Content-Type").get(), containsString("application/json"));
        JsonNode body = json(r);
        assertThat(body.get("ok").asBoolean(), is(true));
        assertThat(body.get("scheduledFor").asText(), is("2030-01-01T12:00:00.000Z"));

        ScheduledJob job = store.findByName("HttpCall-a", JobState.NON_TERMINAL).get(0);
        assertThat(job.getPayload().getTargetUrl(), is("https://example.com/hook"));
        assertThat(job.getPayload().getMethod(), is("POST"));
    }

    @Test
    public void bearerTokenIsAccepted() throws Exception {
        HttpResponse<String> r = get("/add-job?id=b&targetUrl=" + TARGET + "&runAt=2030-01-02T00:00:00Z",
                "Authorization", "Bearer " + API_KEY);
        assertThat(r.statusCode(), is(200));
        assertThat(json(r).get("scheduledFor").asText(), is("2030-01-02T00:00:00.000Z"));
    }

    @Test
    public void missingOrWrongKeyIsUnauthorized() throws Exception {
        HttpResponse<String> none = get("/add-job?id=a&targetUrl=" + TARGET + "&runAt=12%3A00");
        assertThat(none.statusCode(), is(401));
        assertThat(json(none).get("error").asText(), is("Unauthorized"));

        HttpResponse<String> wrong = get("/delete-job?id=a", "x-api-key", "nope");
        assertThat(wrong.statusCode(), is(401));

        HttpResponse<String> notBearer = get("/delete-job?id=a", "Authorization", "Token " + API_KEY);
        assertThat(notBearer.statusCode(), is(401));

        assertThat(store.counts().get(JobState.PENDING), is(0L));
    }

    @Test
    public void validationErrorIsBadRequest() throws Exception {
        HttpResponse<String> past = get("/add-job?id=a&targetUrl=" + TARGET + "&runAt=2020-01-01T00:00:00Z",
                "x-api-key", API_KEY);
        assertThat(past.statusCode(), is(400));
        assertThat(json(past).get("error").asText(), is("runAt must be in the future"));

        HttpResponse<String> missing = get("/add-job?targetUrl=" + TARGET + "&runAt=12%3A00", "x-api-key", API_KEY);
        assertThat(missing.statusCode(), is(400));
        assertThat(json(missing).get("error").asText(), is("Missing required query parameter 'id'"));

        HttpResponse<String> noId = get("/delete-job", "x-api-key", API_KEY);
        assertThat(noId.statusCode(), is(400));
        assertThat(store.counts().get(JobState.PENDING), is(0L));
    }

    @Test
    public void onlyGetIsAllowed() throws Exception {
        HttpRequest post = HttpRequest.newBuilder(URI.create(base + "/add-job?id=a"))
                .header("x-api-key", API_KEY)
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        HttpResponse<String> r = client.send(post, HttpResponse.BodyHandlers.ofString());
        assertThat(r.statusCode(), is(405));
    }

    @Test
    public void deleteJobReportsRemovedThenNotFound() throws Exception {
        get("/add-job?id=d&targetUrl=" + TARGET + "&runAt=12%3A00", "x-api-key", API_KEY);
        get("/add-job?id=d&targetUrl=" + TARGET + "&runAt=13%3A00", "x-api-key", API_KEY);

        HttpResponse<String> first = get("/delete-job?id=d", "x-api-key", API_KEY);
        assertThat(first.statusCode(), is(200));
        JsonNode body = json(first);
        assertThat(body.get("ok").asBoolean(), is(true));
        assertThat(body.get("removed").asInt(), is(2));
        assertThat(body.get("failed").asInt(), is(0));

        HttpResponse<String> second = get("/delete-job?id=d", "x-api-key", API_KEY);
        assertThat(second.statusCode(), is(404));
        JsonNode notFound = json(second);
        assertThat(notFound.get("ok").asBoolean(), is(false));
        assertThat(notFound.get("message").asText(), is("No matching job found"));
        assertThat(notFound.has("removed"), is(false));
    }

    @Test
    public void dashboardChallengesWithoutCredentials() throws Exception {
        HttpResponse<String> r = get("/");
        assertThat(r.statusCode(), is(401));
        assertThat(r.headers().firstValue("WWW-Authenticate").get(),
                is("Basic realm=\"Scheduler Dashboard\", charset=\"UTF-8\""));
        assertThat(json(r).get("error").asText(), is("Unauthorized"));

        assertThat(get("/", "Authorization", basic("admin", "wrong")).statusCode(), is(401));
        assertThat(get("/", "Authorization", "Basic !!!not-base64").statusCode(), is(401));
    }

    @Test
    public void dashboardOverviewShowsQueue() throws Exception {
        get("/add-job?id=v&targetUrl=" + TARGET + "&runAt=12%3A00", "x-api-key", API_KEY);

        HttpResponse<String> r = get("/", "Authorization", basic("admin", "s3cret"));
        assertThat(r.statusCode(), is(200));
        JsonNode body = json(r);
        assertThat(body.get("queue").asText(), is("ScheduledHttpQueue"));
        assertThat(body.get("counts").get("pending").asLong(), is(1L));
        assertThat(body.get("counts").get("active").asLong(), is(0L));
        JsonNode pending = body.get("jobs").get("pending");
        assertThat(pending.size(), is(1));
        assertThat(pending.get(0).get("name").asText(), is("HttpCall-v"));
        assertThat(pending.get(0).get("runAt").asText(), is("2030-01-01T12:00:00Z"));
    }

    @Test
    public void dashboardListsJobsByState() throws Exception {
        get("/add-job?id=l1&targetUrl=" + TARGET + "&runAt=12%3A00", "x-api-key", API_KEY);
        get("/add-job?id=l2&targetUrl=" + TARGET + "&runAt=11%3A00", "x-api-key", API_KEY);
        String auth = basic("admin", "s3cret");

        HttpResponse<String> r = get("/dashboard/jobs?state=pending&limit=1", "Authorization", auth);
        assertThat(r.statusCode(), is(200));
        JsonNode pending = json(r).get("jobs").get("pending");
        assertThat(pending.size(), is(1));
        assertThat(pending.get(0).get("name").asText(), is("HttpCall-l2"));

        assertThat(get("/dashboard/jobs?state=bogus", "Authorization", auth).statusCode(), is(400));
        assertThat(get("/dashboard/jobs?limit=0", "Authorization", auth).statusCode(), is(400));
        assertThat(get("/nowhere", "Authorization", auth).statusCode(), is(404));
    }

    @Test
    public void dashboardShowsJobLogs() throws Exception {
        get("/add-job?id=g&targetUrl=" + TARGET + "&runAt=12%3A00", "x-api-key", API_KEY);
        UUID jobId = store.findByName("HttpCall-g", JobState.NON_TERMINAL).get(0).getJobId();
        store.appendLog(jobId, "Calling GET https://example.com/hook");
        String auth = basic("admin", "s3cret");

        HttpResponse<String> r = get("/dashboard/jobs/" + jobId + "/logs", "Authorization", auth);
        assertThat(r.statusCode(), is(200));
        JsonNode body = json(r);
        assertThat(body.get("jobId").asText(), is(jobId.toString()));
        assertThat(body.get("logs").get(0).asText(), is("Calling GET https://example.com/hook"));

        assertThat(get("/dashboard/jobs/" + UUID.randomUUID() + "/logs", "Authorization", auth).statusCode(),
                is(404));
        assertThat(get("/dashboard/jobs/not-a-uuid/logs", "Authorization", auth).statusCode(), is(400));
    }

    @Test
    public void dashboardIsOpenWhenAuthDisabled() throws Exception {
        server.stop(0);
        server = start(false);
        assertThat(get("/").statusCode(), is(200));
        assertThat(get("/add-job?id=a&targetUrl=" + TARGET + "&runAt=12%3A00").statusCode(), is(401));
    }

    @Test
    public void metricsCountSchedulingAndRequests() throws Exception {
        get("/add-job?id=m&targetUrl=" + TARGET + "&runAt=12%3A00", "x-api-key", API_KEY);
        get("/delete-job?id=m", "x-api-key", API_KEY);

        HttpResponse<String> r = get("/metrics");
        assertThat(r.statusCode(), is(200));
        assertThat(r.body(), containsString("jobs_scheduled_total 1.0"));
        assertThat(r.body(), containsString("jobs_removed_total{outcome=\"removed\",} 1.0"));
        assertThat(r.body(), containsString(
                "scheduler_http_requests_total{path=\"/add-job\",method=\"GET\",status=\"200\",} 1.0"));
    }

    @Test
    public void healthUsesStore() throws Exception {
        assertThat(get("/healthz").statusCode(), is(200));
        assertThat(get("/healthz").body(), is("OK"));
    }
}
