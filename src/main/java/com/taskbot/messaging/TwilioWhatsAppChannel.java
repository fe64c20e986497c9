package com.taskbot.messaging;

import com.taskbot.config.WhatsAppProperties;
import com.taskbot.exception.MessageDeliveryException;
import com.taskbot.util.CommandNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Sends WhatsApp texts through the Twilio Messages API.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TwilioWhatsAppChannel implements NotificationChannel {

    static final int MAX_BODY_LENGTH = 1600;

    private final RestClient twilioRestClient;
    private final WhatsAppProperties properties;

    @Override
    public boolean isConfigured() {
        return properties.hasCredentials();
    }

    @Override
    public DeliveryReceipt send(String address, String text) {
        if (!isConfigured()) {
            throw new MessageDeliveryException("Twilio credentials are not configured.");
        }
        String to = CommandNormalizer.whatsappAddress(address);
        if (to == null) {
            throw new MessageDeliveryException("Recipient address is empty.");
        }
        String from = CommandNormalizer.whatsappAddress(properties.fromNumber());

        DeliveryReceipt receipt = null;
        for (String part : split(text == null ? "" : text)) {
            receipt = post(from, to, part);
        }
        return receipt;
    }

    private DeliveryReceipt post(String from, String to, String body) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("From", from);
        form.add("To", to);
        form.add("Body", body);
        try {
            Map<?, ?> response = twilioRestClient.post()
                    .uri("/2010-04-01/Accounts/{sid}/Messages.json", properties.accountSid())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(Map.class);
            String sid = response == null ? null : asString(response.get("sid"));
            String status = response == null ? null : asString(response.get("status"));
            log.info("WhatsApp message sent. to={}, sid={}, status={}, length={}", to, sid, status, body.length());
            return new DeliveryReceipt(sid, status);
        } catch (RestClientException e) {
            throw new MessageDeliveryException("Twilio send failed: " + e.getMessage(), e);
        }
    }

    static List<String> split(String text) {
        List<String> parts = new ArrayList<>();
        String remaining = text;
        while (remaining.length() > MAX_BODY_LENGTH) {
            int cut = remaining.lastIndexOf('\n', MAX_BODY_LENGTH);
            if (cut <= 0) {
                cut = MAX_BODY_LENGTH;
            }
            parts.add(remaining.substring(0, cut));
            remaining = remaining.substring(cut).stripLeading();
        }
        parts.add(remaining);
        return parts;
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
