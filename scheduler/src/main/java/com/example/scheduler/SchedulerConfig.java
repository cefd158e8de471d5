package com.example.scheduler;

import com.example.worker.WorkerConfig;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;

/**
 * Everything the scheduler process reads from its environment. Built once at startup and
 * passed to the components that need it.
 */
public class SchedulerConfig {
    private final WorkerConfig workerConfig;
    private final String apiKey;
    private final boolean dashboardAuthEnabled;
    private final String dashboardUser;
    private final String dashboardPassword;
    private final int port;
    private final String publicBaseUrl;
    private final ZoneId timeZone;
    private final boolean dispatcherEnabled;

    private SchedulerConfig(Map<String, String> env) {
        this.workerConfig = WorkerConfig.fromEnv(env);
        this.apiKey = required(env, "API_KEY_SCHEDULER");
        this.dashboardAuthEnabled = bool(env, "DASHBOARD_AUTH_ENABLED", true);
        this.dashboardUser = dashboardAuthEnabled ? required(env, "DASHBOARD_USER") : get(env, "DASHBOARD_USER");
        this.dashboardPassword = dashboardAuthEnabled
                ? required(env, "DASHBOARD_PASSWORD")
                : get(env, "DASHBOARD_PASSWORD");
        this.port = port(env, "PORT", 3000);
        this.publicBaseUrl = orDefault(get(env, "PUBLIC_BASE_URL"), "http://localhost:" + port);
        this.timeZone = zone(get(env, "SCHEDULER_TIMEZONE"));
        this.dispatcherEnabled = bool(env, "DISPATCHER_ENABLED", true);
    }

    public static SchedulerConfig fromEnv(Map<String, String> env) {
        return new SchedulerConfig(env);
    }

    public static SchedulerConfig fromSystemEnv() {
        return new SchedulerConfig(System.getenv());
    }

    private static String get(Map<String, String> env, String key) {
        String v = env.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static String orDefault(String v, String d) {
        return v == null ? d : v;
    }

    private static String required(Map<String, String> env, String key) {
        String v = get(env, key);
        if (v == null) {
            throw new IllegalStateException("Missing required environment variable " + key);
        }
        return v;
    }

    private static boolean bool(Map<String, String> env, String key, boolean defaultValue) {
        String v = get(env, key);
        if (v == null) {
            return defaultValue;
        }
        switch (v.toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
            case "yes":
                return true;
            case "false":
            case "0":
            case "no":
                return false;
            default:
                throw new IllegalStateException(key + " must be true or false, got: " + v);
        }
    }

    private static int port(Map<String, String> env, String key, int defaultValue) {
        String v = get(env, key);
        if (v == null) {
            return defaultValue;
        }
        int p;
        try {
            p = Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " must be a port number, got: " + v, e);
        }
        if (p < 0 || p > 65535) {
            throw new IllegalStateException(key + " must be a port number, got: " + v);
        }
        return p;
    }

    private static ZoneId zone(String v) {
        if (v == null) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(v);
        } catch (DateTimeException e) {
            throw new IllegalStateException("SCHEDULER_TIMEZONE is not a valid zone id: " + v, e);
        }
    }

    public WorkerConfig getWorkerConfig() {
        return workerConfig;
    }

    public String getApiKey() {
        return apiKey;
    }

    public boolean isDashboardAuthEnabled() {
        return dashboardAuthEnabled;
    }

    public String getDashboardUser() {
        return dashboardUser;
    }

    public String getDashboardPassword() {
        return dashboardPassword;
    }

    public int getPort() {
        return port;
    }

    public String getPublicBaseUrl() {
        return publicBaseUrl;
    }

    public ZoneId getTimeZone() {
        return timeZone;
    }

    public boolean isDispatcherEnabled() {
        return dispatcherEnabled;
    }
}
