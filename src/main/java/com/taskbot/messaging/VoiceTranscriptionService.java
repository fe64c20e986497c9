package com.taskbot.messaging;

public interface VoiceTranscriptionService {

    VoiceTranscriptionResult transcribe(String mediaUrl, String contentType);
}
