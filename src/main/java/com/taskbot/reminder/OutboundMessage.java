package com.taskbot.reminder;

/**
 * Text prepared inside a transaction and sent after it.
 */
record OutboundMessage(String reference, String address, String text) {
}
