package com.chatintel.group.scheduler;

public record SchedulerStatus(JobStatus ingestion, JobStatus cleanup, String timezone) {

    public record JobStatus(String schedule, boolean armed, boolean enabled) {
    }
}
