package com.chatintel.group.exception;

public class NotAGroupException extends RuntimeException {

    public NotAGroupException(String chatId) {
        super("Chat " + chatId + " is not a group");
    }
}
