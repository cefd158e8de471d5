package com.example.scheduler.api;

import java.util.List;

public class JobLogsResponse {
    private String jobId;
    private List<String> logs;

    public JobLogsResponse() {
    }

    public JobLogsResponse(String jobId, List<String> logs) {
        this.jobId = jobId;
        this.logs = logs;
    }

    public String getJobId() {
        return jobId;
    }

    public List<String> getLogs() {
        return logs;
    }
}
