package com.taskbot.messaging;

import com.taskbot.action.ActionDispatcher;
import com.taskbot.action.ActionResult;
import com.taskbot.config.AssistantProperties;
import com.taskbot.conversation.ConversationOutcome;
import com.taskbot.conversation.ConversationService;
import com.taskbot.domain.model.User;
import com.taskbot.dto.InboundWhatsAppMessage;
import com.taskbot.exception.AssistantException;
import com.taskbot.exception.MessageDeliveryException;
import com.taskbot.parsing.Intent;
import com.taskbot.parsing.MessageUnderstandingService;
import com.taskbot.repository.UserRepository;
import com.taskbot.util.CommandNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Handles one inbound WhatsApp message end to end: identify the sender, continue or start a command,
 * run the action and reply. Never throws.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WhatsAppBotService {

    private final UserRepository userRepository;
    private final VoiceTranscriptionService voiceTranscriptionService;
    private final ConversationService conversationService;
    private final MessageUnderstandingService messageUnderstandingService;
    private final ActionDispatcher actionDispatcher;
    private final NotificationChannel notificationChannel;
    private final MessageTemplates templates;
    private final AssistantProperties assistantProperties;

    public void handleInbound(InboundWhatsAppMessage message) {
        String sender = message == null ? null : CommandNormalizer.senderKey(message.from());
        if (sender == null) {
            log.warn("Skip WhatsApp message without sender.");
            return;
        }
        log.info("Handle WhatsApp message. sender={}, sid={}, hasBody={}, numMedia={}",
                sender, message.messageSid(), message.body() != null && !message.body().isBlank(), message.numMedia());

        try {
            process(sender, message);
        } catch (AssistantException e) {
            log.info("Action rejected. sender={}, error={}, message={}", sender, e.getClass().getSimpleName(), e.getMessage());
            reply(sender, templates.error(e.getMessage()));
        } catch (Exception e) {
            log.error("WhatsApp message processing failed. sender={}, error={}", sender, e.getMessage(), e);
            reply(sender, templates.genericError());
        }
    }

    private void process(String sender, InboundWhatsAppMessage message) {
        List<String> variants = CommandNormalizer.addressVariants(sender);
        Optional<User> found = userRepository.findFirstByWhatsappNumberInOrPhoneIn(variants, variants);
        if (found.isEmpty()) {
            log.info("Unregistered WhatsApp sender. sender={}", sender);
            reply(sender, templates.notRegistered());
            return;
        }
        User user = found.get();
        if (!user.isActive()) {
            reply(sender, templates.accountInactive());
            return;
        }
        if (!user.isNotificationsEnabled()) {
            reply(sender, templates.notificationsDisabled());
            return;
        }

        String text = message.body();
        if (message.isVoiceNote()) {
            try {
                VoiceTranscriptionResult result = voiceTranscriptionService.transcribe(message.mediaUrl(), message.mediaContentType());
                text = result.text();
                reply(sender, templates.voiceReceived(text));
            } catch (Exception e) {
                log.error("Voice transcription failed. sender={}, error={}", sender, e.getMessage(), e);
                reply(sender, templates.voiceFailure());
                return;
            }
        }
        if (text == null || text.isBlank()) {
            reply(sender, templates.notUnderstood());
            return;
        }

        if (assistantProperties.isCancelKeyword(text)) {
            boolean cancelled = conversationService.cancel(sender);
            reply(sender, cancelled ? templates.actionCancelled() : templates.nothingToCancel());
            return;
        }

        ConversationOutcome outcome = conversationService.resume(sender, text);
        if (outcome instanceof ConversationOutcome.NoPending) {
            Intent intent = messageUnderstandingService.decide(text, user);
            log.info("Message understood. sender={}, kind={}, slots={}", sender, intent.kind(), intent.slots().keySet());
            outcome = conversationService.begin(sender, user.getId(), intent);
        }

        if (outcome instanceof ConversationOutcome.Prompt prompt) {
            reply(sender, prompt.text());
        } else if (outcome instanceof ConversationOutcome.Complete complete) {
            ActionResult result = actionDispatcher.dispatch(user, complete.intent());
            reply(sender, result.reply());
            for (ActionResult.Notice notice : result.notices()) {
                reply(notice.address(), notice.text());
            }
        }
    }

    private void reply(String address, String text) {
        if (!notificationChannel.isConfigured()) {
            log.warn("WhatsApp channel not configured, reply dropped. to={}", address);
            return;
        }
        try {
            notificationChannel.send(address, text);
        } catch (MessageDeliveryException e) {
            log.error("WhatsApp reply failed. to={}, error={}", address, e.getMessage(), e);
        }
    }
}
