package com.taskbot.exception;

/**
 * Outbound message could not be handed to the provider. Not shown to users.
 */
public class MessageDeliveryException extends RuntimeException {

    public MessageDeliveryException(String message) {
        super(message);
    }

    public MessageDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
