package com.chatintel.group.output;

public record ExportResult(boolean success, String message, int count, String file) {
}
