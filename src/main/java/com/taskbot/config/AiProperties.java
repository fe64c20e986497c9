package com.taskbot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.ai")
public record AiProperties(
        String openaiApiKey,
        String openaiModel,
        String openaiBaseUrl,
        String transcriptionModel,
        Duration timeout
) {
    public boolean hasOpenAiKey() {
        return openaiApiKey != null && !openaiApiKey.isBlank();
    }

    public String resolveModel() {
        return openaiModel == null || openaiModel.isBlank() ? "gpt-4o-mini" : openaiModel;
    }

    public String resolveTranscriptionModel() {
        return transcriptionModel == null || transcriptionModel.isBlank() ? "whisper-1" : transcriptionModel;
    }

    public String resolveBaseUrl() {
        return openaiBaseUrl == null || openaiBaseUrl.isBlank() ? "https://api.openai.com" : openaiBaseUrl;
    }

    public Duration resolveTimeout() {
        return timeout == null || timeout.isZero() || timeout.isNegative() ? Duration.ofSeconds(15) : timeout;
    }
}
