package com.taskbot.messaging;

import com.taskbot.config.AiProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.util.Locale;
import java.util.Map;

/**
 * Downloads a Twilio voice note and transcribes it with the OpenAI audio API.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiWhisperTranscriptionService implements VoiceTranscriptionService {

    private final RestClient twilioRestClient;
    private final RestClient openAiRestClient;
    private final AiProperties aiProperties;

    @Override
    public VoiceTranscriptionResult transcribe(String mediaUrl, String contentType) {
        if (!aiProperties.hasOpenAiKey()) {
            throw new IllegalStateException("OPENAI_API_KEY is empty. Voice transcription is disabled.");
        }
        if (mediaUrl == null || mediaUrl.isBlank()) {
            throw new IllegalStateException("Voice note has no media URL.");
        }

        byte[] audio = download(mediaUrl);
        String text = transcribeAudio(audio, contentType);
        return new VoiceTranscriptionResult(text, mediaUrl, contentType, audio.length);
    }

    private byte[] download(String mediaUrl) {
        try {
            byte[] bytes = twilioRestClient.get()
                    .uri(URI.create(mediaUrl))
                    .retrieve()
                    .body(byte[].class);
            if (bytes == null || bytes.length == 0) {
                throw new IllegalStateException("Downloaded voice note is empty.");
            }
            return bytes;
        } catch (RestClientException e) {
            throw new IllegalStateException("Twilio media download error: " + e.getMessage(), e);
        }
    }

    private String transcribeAudio(byte[] audio, String contentType) {
        String fileName = "voice." + extension(contentType);
        ByteArrayResource file = new ByteArrayResource(audio) {
            @Override
            public String getFilename() {
                return fileName;
            }
        };
        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("file", file);
        form.add("model", aiProperties.resolveTranscriptionModel());
        form.add("language", "en");

        try {
            Map<?, ?> response = openAiRestClient.post()
                    .uri("/v1/audio/transcriptions")
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(form)
                    .retrieve()
                    .body(Map.class);
            Object text = response == null ? null : response.get("text");
            if (!(text instanceof String transcript) || transcript.isBlank()) {
                throw new IllegalStateException("Transcription returned empty result.");
            }
            log.info("Voice note transcribed. contentType={}, sizeBytes={}, textLength={}",
                    contentType, audio.length, transcript.length());
            return transcript.trim();
        } catch (RestClientException e) {
            throw new IllegalStateException("OpenAI transcription error: " + e.getMessage(), e);
        }
    }

    static String extension(String contentType) {
        if (contentType == null) {
            return "ogg";
        }
        String type = contentType.toLowerCase(Locale.ROOT);
        if (type.contains("mpeg") || type.contains("mp3")) {
            return "mp3";
        }
        if (type.contains("mp4") || type.contains("m4a") || type.contains("aac")) {
            return "m4a";
        }
        if (type.contains("wav")) {
            return "wav";
        }
        if (type.contains("webm")) {
            return "webm";
        }
        return "ogg";
    }
}
