package com.taskbot.exception;

public class PersistenceFailureException extends AssistantException {

    public PersistenceFailureException(String message) {
        super(message);
    }
}
