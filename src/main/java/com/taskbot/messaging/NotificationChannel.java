package com.taskbot.messaging;

/**
 * Outbound text channel.
 */
public interface NotificationChannel {

    boolean isConfigured();

    /**
     * @param address canonical sender key or a transport address of the recipient
     * @throws com.taskbot.exception.MessageDeliveryException when the provider rejects the message or is unreachable
     */
    DeliveryReceipt send(String address, String text);
}
