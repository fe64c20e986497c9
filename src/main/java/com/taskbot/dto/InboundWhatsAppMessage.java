package com.taskbot.dto;

import java.util.Locale;

/**
 * Fields of a Twilio WhatsApp webhook call.
 */
public record InboundWhatsAppMessage(
        String from,
        String to,
        String body,
        int numMedia,
        String mediaUrl,
        String mediaContentType,
        String messageSid,
        String profileName
) {
    public boolean isVoiceNote() {
        return numMedia > 0
                && mediaUrl != null && !mediaUrl.isBlank()
                && mediaContentType != null
                && mediaContentType.toLowerCase(Locale.ROOT).startsWith("audio/");
    }
}
