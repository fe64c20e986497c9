package com.taskbot.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.whatsapp")
public record WhatsAppProperties(
        String accountSid,
        String authToken,
        @NotBlank String fromNumber,
        @NotBlank String apiBase,
        @NotBlank String webhookPath,
        boolean validateSignature,
        String publicWebhookUrl,
        Integer processingThreads,
        Integer processingQueueCapacity
) {
    public boolean hasCredentials() {
        return accountSid != null && !accountSid.isBlank() && authToken != null && !authToken.isBlank();
    }

    public boolean hasPublicWebhookUrl() {
        return publicWebhookUrl != null && !publicWebhookUrl.isBlank();
    }
}
