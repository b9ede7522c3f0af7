package com.chatintel.group.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ScrapeStatus {
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String dbValue;

    ScrapeStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() {
        return dbValue;
    }

    public static ScrapeStatus fromDbValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.dbValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown scrape status: " + value));
    }
}
