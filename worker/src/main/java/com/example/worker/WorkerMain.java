package com.example.worker;

import com.example.jobstore.JobStore;
import com.example.worker.http.HttpCaller;
import com.example.worker.metrics.PromDispatchMetrics;
import com.example.worker.metrics.PromStoreMetrics;
import com.example.worker.ops.OpsEndpoints;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.hotspot.DefaultExports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.Executors;

/**
 * Dispatcher-only process. Run as many as needed against one Cassandra store; the store's
 * claim guarantees each job is executed by at most one of them.
 */
public class WorkerMain {
    private static final Logger log = LoggerFactory.getLogger(WorkerMain.class);
    private static volatile boolean ready = false;

    public static void main(String[] args) throws Exception {
        WorkerConfig config = WorkerConfig.fromSystemEnv();
        if (config.getStoreBackend() == WorkerConfig.StoreBackend.MEMORY) {
            throw new IllegalStateException("A standalone worker needs a shared store; STORE_BACKEND=memory only "
                    + "works with the dispatcher embedded in the scheduler");
        }

        CollectorRegistry registry = CollectorRegistry.defaultRegistry;
        DefaultExports.initialize();
        JobStore store = JobStores.open(config, new PromStoreMetrics(registry));

        Dispatcher dispatcher = new Dispatcher(store, new HttpCaller(config.getHttpCallTimeout()),
                config.getWorkerId(), config.getPollInterval(), config.getConcurrency(),
                new PromDispatchMetrics(registry));

        HttpServer server = HttpServer.create(new InetSocketAddress(config.getWorkerHttpPort()), 0);
        OpsEndpoints.register(server, store, () -> ready, registry);
        server.setExecutor(Executors.newCachedThreadPool());
        server.start();
        log.info("HTTP server started on port {} workerId={}", config.getWorkerHttpPort(), config.getWorkerId());

        dispatcher.start();
        ready = true;

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown initiated");
            ready = false;
            dispatcher.shutdown(Duration.ofSeconds(30));
            server.stop(1);
            store.close();
            log.info("Shutdown complete");
        }));
    }
}
