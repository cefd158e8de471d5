package com.example.scheduler;

import com.example.jobstore.JobStore;
import com.example.scheduler.api.AddJobResponse;
import com.example.scheduler.api.DeleteJobResponse;
import com.example.scheduler.api.ErrorResponse;
import com.example.scheduler.gateway.ApiKeyFilter;
import com.example.scheduler.gateway.BasicAuthFilter;
import com.example.scheduler.gateway.DashboardHandler;
import com.example.scheduler.gateway.GatewayMetrics;
import com.example.scheduler.gateway.JsonResponses;
import com.example.scheduler.gateway.QueryParams;
import com.example.worker.Dispatcher;
import com.example.worker.JobStores;
import com.example.worker.WorkerConfig;
import com.example.worker.http.HttpCaller;
import com.example.worker.metrics.PromDispatchMetrics;
import com.example.worker.metrics.PromStoreMetrics;
import com.example.worker.ops.OpsEndpoints;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.hotspot.DefaultExports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;

public class SchedulerMain {
    private static final Logger log = LoggerFactory.getLogger(SchedulerMain.class);
    private static volatile boolean ready = false;

    public static void main(String[] args) throws Exception {
        SchedulerConfig config = SchedulerConfig.fromSystemEnv();
        WorkerConfig workerConfig = config.getWorkerConfig();

        CollectorRegistry registry = CollectorRegistry.defaultRegistry;
        DefaultExports.initialize();
        JobStore store = JobStores.open(workerConfig, new PromStoreMetrics(registry));

        Clock clock = Clock.system(config.getTimeZone());
        SchedulerService service = new SchedulerService(store, new TimeResolver(clock), clock);

        HttpServer server = startServer(service, store, config, objectMapper(), registry, config.getPort());
        log.info("HTTP server started on port {} (timezone {})", server.getAddress().getPort(), config.getTimeZone());
        log.info("Dashboard: {}/ (auth {})", config.getPublicBaseUrl(),
                config.isDashboardAuthEnabled() ? "enabled" : "disabled");

        Dispatcher dispatcher = null;
        if (config.isDispatcherEnabled()) {
            dispatcher = new Dispatcher(store, new HttpCaller(workerConfig.getHttpCallTimeout()),
                    workerConfig.getWorkerId(), workerConfig.getPollInterval(), workerConfig.getConcurrency(),
                    new PromDispatchMetrics(registry));
            dispatcher.start();
        } else if (workerConfig.getStoreBackend() == WorkerConfig.StoreBackend.MEMORY) {
            log.warn("Dispatcher disabled with the in-memory store: scheduled jobs will never run");
        }
        ready = true;

        Dispatcher embedded = dispatcher;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown initiated");
            ready = false;
            server.stop(1);
            if (embedded != null) {
                embedded.shutdown(Duration.ofSeconds(30));
            }
            store.close();
            log.info("Shutdown complete");
        }));
    }

    static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * Binds the gateway on {@code httpPort} (0 picks a free port) and starts serving.
     */
    public static HttpServer startServer(SchedulerService service, JobStore store, SchedulerConfig config,
            ObjectMapper mapper, CollectorRegistry registry, int httpPort) throws IOException {
        GatewayMetrics metrics = new GatewayMetrics(registry);
        ApiKeyFilter apiKey = new ApiKeyFilter(config.getApiKey(), mapper);

        HttpServer server = HttpServer.create(new InetSocketAddress(httpPort), 0);
        OpsEndpoints.register(server, store, () -> ready, registry);

        HttpContext add = server.createContext("/add-job", new AddJobHandler(service, metrics, mapper));
        add.getFilters().add(metrics.requestCounter());
        add.getFilters().add(apiKey);

        HttpContext delete = server.createContext("/delete-job", new DeleteJobHandler(service, metrics, mapper));
        delete.getFilters().add(metrics.requestCounter());
        delete.getFilters().add(apiKey);

        HttpContext dashboard = server.createContext("/", new DashboardHandler(store, mapper));
        dashboard.getFilters().add(metrics.requestCounter());
        if (config.isDashboardAuthEnabled()) {
            dashboard.getFilters().add(
                    new BasicAuthFilter(config.getDashboardUser(), config.getDashboardPassword(), mapper));
        }

        server.setExecutor(Executors.newCachedThreadPool());
        server.start();
        return server;
    }

    /**
     * Shared shape of the two API endpoints: exact path, GET only, validation errors as 400.
     */
    abstract static class ApiHandler implements HttpHandler {
        private final String path;
        protected final ObjectMapper mapper;

        ApiHandler(String path, ObjectMapper mapper) {
            this.path = path;
            this.mapper = mapper;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                if (!path.equals(exchange.getRequestURI().getPath())) {
                    JsonResponses.respondJson(exchange, 404, new ErrorResponse("not_found"), mapper);
                    return;
                }
                if (!"GET".equals(exchange.getRequestMethod())) {
                    exchange.getResponseHeaders().set("Allow", "GET");
                    JsonResponses.respondJson(exchange, 405, new ErrorResponse("method_not_allowed"), mapper);
                    return;
                }
                handleGet(exchange, QueryParams.of(exchange.getRequestURI()));
            } catch (ScheduleValidationException e) {
                log.info("Rejected {}: {} ({})", path, e.getMessage(), e.getCode());
                JsonResponses.respondJson(exchange, 400, new ErrorResponse(e.getMessage()), mapper);
            } catch (RuntimeException e) {
                log.error("Request {} failed", exchange.getRequestURI(), e);
                JsonResponses.respondJson(exchange, 500, new ErrorResponse("internal_error"), mapper);
            }
        }

        abstract void handleGet(HttpExchange exchange, QueryParams params) throws IOException;
    }

    static class AddJobHandler extends ApiHandler {
        private final SchedulerService service;
        private final GatewayMetrics metrics;

        AddJobHandler(SchedulerService service, GatewayMetrics metrics, ObjectMapper mapper) {
            super("/add-job", mapper);
            this.service = service;
            this.metrics = metrics;
        }

        @Override
        void handleGet(HttpExchange exchange, QueryParams params) throws IOException {
            Instant scheduledFor = service.addJob(params.get("id"), params.get("targetUrl"), params.get("runAt"),
                    params.get("method"));
            metrics.jobScheduled();
            JsonResponses.respondJson(exchange, 200, AddJobResponse.scheduled(scheduledFor), mapper);
        }
    }

    static class DeleteJobHandler extends ApiHandler {
        private final SchedulerService service;
        private final GatewayMetrics metrics;

        DeleteJobHandler(SchedulerService service, GatewayMetrics metrics, ObjectMapper mapper) {
            super("/delete-job", mapper);
            this.service = service;
            this.metrics = metrics;
        }

        @Override
        void handleGet(HttpExchange exchange, QueryParams params) throws IOException {
            RemovalResult result = service.removeJob(params.get("id"));
            if (result.isNotFound()) {
                JsonResponses.respondJson(exchange, 404, DeleteJobResponse.notFound(), mapper);
                return;
            }
            metrics.jobsRemoved(result.getRemoved(), result.getFailed());
            JsonResponses.respondJson(exchange, 200,
                    DeleteJobResponse.removed(result.getRemoved(), result.getFailed()), mapper);
        }
    }
}
