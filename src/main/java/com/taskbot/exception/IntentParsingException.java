package com.taskbot.exception;

public class IntentParsingException extends AssistantException {

    public IntentParsingException(String message) {
        super(message);
    }

    public IntentParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
