package com.taskbot.messaging;

import com.taskbot.config.WhatsAppProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Map;
import java.util.TreeMap;

/**
 * Checks {@code X-Twilio-Signature}: base64 HMAC-SHA1 of the webhook URL followed by every POST
 * parameter name and value in name order, keyed with the account auth token.
 */
@Component
@RequiredArgsConstructor
public class TwilioSignatureValidator {

    private static final String ALGORITHM = "HmacSHA1";

    private final WhatsAppProperties properties;

    public boolean isEnabled() {
        return properties.validateSignature();
    }

    public boolean isValid(String requestUrl, Map<String, String> params, String signature) {
        if (signature == null || signature.isBlank() || properties.authToken() == null || properties.authToken().isBlank()) {
            return false;
        }
        String url = properties.hasPublicWebhookUrl() ? properties.publicWebhookUrl() : requestUrl;
        String expected = sign(url, params, properties.authToken());
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                signature.trim().getBytes(StandardCharsets.UTF_8));
    }

    static String sign(String url, Map<String, String> params, String authToken) {
        StringBuilder data = new StringBuilder(url == null ? "" : url);
        new TreeMap<>(params).forEach((name, value) -> data.append(name).append(value == null ? "" : value));
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(authToken.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return Base64.getEncoder().encodeToString(mac.doFinal(data.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA1 is not available", e);
        }
    }
}
