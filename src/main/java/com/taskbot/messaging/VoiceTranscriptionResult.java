package com.taskbot.messaging;

public record VoiceTranscriptionResult(
        String text,
        String mediaUrl,
        String contentType,
        int sizeBytes
) {
}
