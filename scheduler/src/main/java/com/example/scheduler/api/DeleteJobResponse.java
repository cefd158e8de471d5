package com.example.scheduler.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeleteJobResponse {
    private boolean ok;
    private Integer removed;
    private Integer failed;
    private String message;

    public DeleteJobResponse() {
    }

    public static DeleteJobResponse removed(int removed, int failed) {
        DeleteJobResponse r = new DeleteJobResponse();
        r.ok = true;
        r.removed = removed;
        r.failed = failed;
        return r;
    }

    public static DeleteJobResponse notFound() {
        DeleteJobResponse r = new DeleteJobResponse();
        r.ok = false;
        r.message = "No matching job found";
        return r;
    }

    public boolean isOk() {
        return ok;
    }

    public void setOk(boolean ok) {
        this.ok = ok;
    }

    public Integer getRemoved() {
        return removed;
    }

    public void setRemoved(Integer removed) {
        this.removed = removed;
    }

    public Integer getFailed() {
        return failed;
    }

    public void setFailed(Integer failed) {
        this.failed = failed;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
