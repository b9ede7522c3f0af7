package com.chatintel.group.exception;

public class ContactLookupException extends ChatSourceException {

    public ContactLookupException(String message) {
        super(message);
    }

    public ContactLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
