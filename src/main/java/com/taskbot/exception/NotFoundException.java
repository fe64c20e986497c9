package com.taskbot.exception;

public class NotFoundException extends AssistantException {

    private final String reference;

    public NotFoundException(String reference, String message) {
        super(message);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
