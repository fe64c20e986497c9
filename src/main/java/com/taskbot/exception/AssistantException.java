package com.taskbot.exception;

/**
 * Base of the failures whose message is shown to the sender.
 */
public abstract class AssistantException extends RuntimeException {

    protected AssistantException(String message) {
        super(message);
    }

    protected AssistantException(String message, Throwable cause) {
        super(message, cause);
    }
}
