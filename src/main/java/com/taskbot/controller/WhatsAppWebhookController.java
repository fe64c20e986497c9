package com.taskbot.controller;

import com.taskbot.dto.InboundWhatsAppMessage;
import com.taskbot.messaging.TwilioSignatureValidator;
import com.taskbot.messaging.WhatsAppBotService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Twilio inbound webhook. Acknowledges at once and processes the message on the update executor.
 */
@Slf4j
@RestController
@RequestMapping("${app.whatsapp.webhook-path:/api/whatsapp/webhook}")
public class WhatsAppWebhookController {

    static final String EMPTY_TWIML = "<?xml version=\"1.0\" encoding=\"UTF-8\"?><Response></Response>";

    private final WhatsAppBotService whatsAppBotService;
    private final TwilioSignatureValidator signatureValidator;
    private final Executor whatsappUpdateExecutor;

    public WhatsAppWebhookController(WhatsAppBotService whatsAppBotService,
                                     TwilioSignatureValidator signatureValidator,
                                     @Qualifier("whatsappUpdateExecutor") Executor whatsappUpdateExecutor) {
        this.whatsAppBotService = whatsAppBotService;
        this.signatureValidator = signatureValidator;
        this.whatsappUpdateExecutor = whatsappUpdateExecutor;
    }

    @PostMapping(consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE, produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> webhook(
            @RequestHeader(value = "X-Twilio-Signature", required = false) String signature,
            @RequestParam Map<String, String> params,
            HttpServletRequest request
    ) {
        if (signatureValidator.isEnabled()
                && !signatureValidator.isValid(request.getRequestURL().toString(), params, signature)) {
            log.warn("Rejected WhatsApp webhook: invalid signature. hasSignature={}", signature != null);
            return ResponseEntity.status(403).build();
        }

        InboundWhatsAppMessage message = toMessage(params);
        log.info("Accepted WhatsApp webhook. sid={}, hasBody={}, numMedia={}",
                message.messageSid(), message.body() != null && !message.body().isBlank(), message.numMedia());
        try {
            whatsappUpdateExecutor.execute(() -> whatsAppBotService.handleInbound(message));
        } catch (RejectedExecutionException e) {
            log.error("WhatsApp update queue is full, message dropped. sid={}", message.messageSid());
        }
        return ResponseEntity.ok().contentType(MediaType.APPLICATION_XML).body(EMPTY_TWIML);
    }

    static InboundWhatsAppMessage toMessage(Map<String, String> params) {
        return new InboundWhatsAppMessage(
                param(params, "From", "from"),
                param(params, "To", "to"),
                param(params, "Body", "body"),
                parseCount(param(params, "NumMedia", "numMedia")),
                param(params, "MediaUrl0", "mediaUrl0"),
                param(params, "MediaContentType0", "mediaContentType0"),
                param(params, "MessageSid", "messageSid"),
                param(params, "ProfileName", "profileName"));
    }

    private static String param(Map<String, String> params, String name, String camelName) {
        String value = params.get(name);
        return value != null ? value : params.get(camelName);
    }

    private static int parseCount(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
