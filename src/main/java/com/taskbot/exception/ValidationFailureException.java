package com.taskbot.exception;

public class ValidationFailureException extends AssistantException {

    public ValidationFailureException(String message) {
        super(message);
    }
}
