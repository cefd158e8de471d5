package com.example.scheduler.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class DashboardResponse {
    private String queue;
    private Map<String, Long> counts;
    private Map<String, List<JobView>> jobs;

    public DashboardResponse() {
    }

    public DashboardResponse(String queue, Map<String, Long> counts, Map<String, List<JobView>> jobs) {
        this.queue = queue;
        this.counts = counts;
        this.jobs = jobs;
    }

    public String getQueue() {
        return queue;
    }

    public Map<String, Long> getCounts() {
        return counts;
    }

    public Map<String, List<JobView>> getJobs() {
        return jobs;
    }
}
