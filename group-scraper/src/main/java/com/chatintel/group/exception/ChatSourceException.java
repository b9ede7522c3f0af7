package com.chatintel.group.exception;

/**
 * The chat bridge could not be reached or answered with an error.
 * Never retried within a scrape; the next scheduled tick is the retry.
 */
public class ChatSourceException extends RuntimeException {

    public ChatSourceException(String message) {
        super(message);
    }

    public ChatSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
