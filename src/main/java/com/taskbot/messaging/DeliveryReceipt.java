package com.taskbot.messaging;

public record DeliveryReceipt(String sid, String status) {
}
