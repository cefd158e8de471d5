package com.example.scheduler.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class AddJobResponse {
    // UTC with millisecond precision, e.g. 2030-01-01T23:59:00.000Z
    private static final DateTimeFormatter SCHEDULED_FOR = DateTimeFormatter
            .ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneOffset.UTC);

    private boolean ok;
    private String scheduledFor;

    public AddJobResponse() {
    }

    public AddJobResponse(boolean ok, String scheduledFor) {
        this.ok = ok;
        this.scheduledFor = scheduledFor;
    }

    public static AddJobResponse scheduled(Instant scheduledFor) {
        return new AddJobResponse(true, SCHEDULED_FOR.format(scheduledFor));
    }

    public boolean isOk() {
        return ok;
    }

    public void setOk(boolean ok) {
        this.ok = ok;
    }

    public String getScheduledFor() {
        return scheduledFor;
    }

    public void setScheduledFor(String scheduledFor) {
        this.scheduledFor = scheduledFor;
    }
}
