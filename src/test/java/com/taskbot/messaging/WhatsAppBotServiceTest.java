package com.taskbot.messaging;

import com.taskbot.action.ActionDispatcher;
import com.taskbot.action.ActionResult;
import com.taskbot.config.AssistantProperties;
import com.taskbot.conversation.ConversationOutcome;
import com.taskbot.conversation.ConversationService;
import com.taskbot.domain.model.User;
import com.taskbot.dto.InboundWhatsAppMessage;
import com.taskbot.exception.MessageDeliveryException;
import com.taskbot.exception.ValidationFailureException;
import com.taskbot.parsing.Intent;
import com.taskbot.parsing.IntentKind;
import com.taskbot.parsing.MessageUnderstandingService;
import com.taskbot.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WhatsAppBotServiceTest {

    private static final String SENDER = "923001111111";
    private static final List<String> VARIANTS = List.of(SENDER, "03001111111");

    @Mock
    private UserRepository userRepository;

    @Mock
    private VoiceTranscriptionService voiceTranscriptionService;

    @Mock
    private ConversationService conversationService;

    @Mock
    private MessageUnderstandingService messageUnderstandingService;

    @Mock
    private ActionDispatcher actionDispatcher;

    @Mock
    private NotificationChannel notificationChannel;

    private WhatsAppBotService service;
    private User user;

    @BeforeEach
    void setUp() {
        AssistantProperties properties = new AssistantProperties("TaskBot", "Asia/Karachi", null, null, null, null);
        service = new WhatsAppBotService(userRepository, voiceTranscriptionService, conversationService,
                messageUnderstandingService, actionDispatcher, notificationChannel, new MessageTemplates(properties), properties);
        user = new User();
        user.setId(UUID.randomUUID());
        user.setFirstName("Ali");
        user.setOrganizationId("acme");
        user.setWhatsappNumber(SENDER);
    }

    @Test
    void unregisteredSenderIsToldToRegister() {
        when(notificationChannel.isConfigured()).thenReturn(true);
        when(userRepository.findFirstByWhatsappNumberInOrPhoneIn(VARIANTS, VARIANTS)).thenReturn(Optional.empty());

        service.handleInbound(text("show my tasks"));

        verify(notificationChannel).send(eq(SENDER), contains("Registration Required"));
        verifyNoInteractions(conversationService, actionDispatcher);
    }

    @Test
    void inactiveAccountIsRejected() {
        user.setActive(false);
        when(notificationChannel.isConfigured()).thenReturn(true);
        when(userRepository.findFirstByWhatsappNumberInOrPhoneIn(VARIANTS, VARIANTS)).thenReturn(Optional.of(user));

        service.handleInbound(text("show my tasks"));

        verify(notificationChannel).send(eq(SENDER), contains("Account Inactive"));
        verifyNoInteractions(conversationService);
    }

    @Test
    void cancelKeywordDropsPendingConversation() {
        when(notificationChannel.isConfigured()).thenReturn(true);
        when(userRepository.findFirstByWhatsappNumberInOrPhoneIn(VARIANTS, VARIANTS)).thenReturn(Optional.of(user));
        when(conversationService.cancel(SENDER)).thenReturn(true);

        service.handleInbound(text(" Cancel "));

        verify(notificationChannel).send(eq(SENDER), contains("The pending action has been cancelled."));
        verify(conversationService, never()).resume(anyString(), anyString());
    }

    @Test
    void missingDetailsArePromptedWithoutRunningAction() {
        Intent intent = Intent.of(IntentKind.SET_REMINDER, "remind me");
        when(notificationChannel.isConfigured()).thenReturn(true);
        when(userRepository.findFirstByWhatsappNumberInOrPhoneIn(VARIANTS, VARIANTS)).thenReturn(Optional.of(user));
        when(conversationService.resume(SENDER, "remind me")).thenReturn(new ConversationOutcome.NoPending());
        when(messageUnderstandingService.decide("remind me", user)).thenReturn(intent);
        when(conversationService.begin(SENDER, user.getId(), intent))
                .thenReturn(new ConversationOutcome.Prompt("When should I remind you?"));

        service.handleInbound(text("remind me"));

        verify(notificationChannel).send(SENDER, "When should I remind you?");
        verifyNoInteractions(actionDispatcher);
    }

    @Test
    void completedIntentRepliesAndDeliversNotices() {
        Intent intent = Intent.of(IntentKind.CREATE_TASK, "assign task to Sara: audit");
        when(notificationChannel.isConfigured()).thenReturn(true);
        when(userRepository.findFirstByWhatsappNumberInOrPhoneIn(VARIANTS, VARIANTS)).thenReturn(Optional.of(user));
        when(conversationService.resume(anyString(), anyString())).thenReturn(new ConversationOutcome.NoPending());
        when(messageUnderstandingService.decide(anyString(), eq(user))).thenReturn(intent);
        when(conversationService.begin(SENDER, user.getId(), intent)).thenReturn(new ConversationOutcome.Complete(intent));
        when(actionDispatcher.dispatch(user, intent))
                .thenReturn(ActionResult.reply("Task Assigned").withNotice("923009999999", "New Task Assignment"));

        service.handleInbound(text("assign task to Sara: audit"));

        verify(notificationChannel).send(SENDER, "Task Assigned");
        verify(notificationChannel).send("923009999999", "New Task Assignment");
    }

    @Test
    void pendingConversationIsResumedBeforeParsing() {
        Intent intent = Intent.of(IntentKind.SET_REMINDER, "remind me");
        when(notificationChannel.isConfigured()).thenReturn(true);
        when(userRepository.findFirstByWhatsappNumberInOrPhoneIn(VARIANTS, VARIANTS)).thenReturn(Optional.of(user));
        when(conversationService.resume(SENDER, "at 5pm")).thenReturn(new ConversationOutcome.Complete(intent));
        when(actionDispatcher.dispatch(user, intent)).thenReturn(ActionResult.reply("Reminder Set"));

        service.handleInbound(text("at 5pm"));

        verify(notificationChannel).send(SENDER, "Reminder Set");
        verifyNoInteractions(messageUnderstandingService);
    }

    @Test
    void rejectedActionIsReportedToSender() {
        Intent intent = Intent.of(IntentKind.CREATE_TASK, "create task: ab");
        when(notificationChannel.isConfigured()).thenReturn(true);
        when(userRepository.findFirstByWhatsappNumberInOrPhoneIn(VARIANTS, VARIANTS)).thenReturn(Optional.of(user));
        when(conversationService.resume(anyString(), anyString())).thenReturn(new ConversationOutcome.NoPending());
        when(messageUnderstandingService.decide(anyString(), eq(user))).thenReturn(intent);
        when(conversationService.begin(SENDER, user.getId(), intent)).thenReturn(new ConversationOutcome.Complete(intent));
        when(actionDispatcher.dispatch(user, intent))
                .thenThrow(new ValidationFailureException("Task title must be at least 3 characters."));

        service.handleInbound(text("create task: ab"));

        verify(notificationChannel).send(eq(SENDER), contains("Task title must be at least 3 characters."));
    }

    @Test
    void unexpectedFailureGetsGenericReply() {
        when(notificationChannel.isConfigured()).thenReturn(true);
        when(userRepository.findFirstByWhatsappNumberInOrPhoneIn(VARIANTS, VARIANTS))
                .thenThrow(new IllegalStateException("connection refused"));

        service.handleInbound(text("show my tasks"));

        verify(notificationChannel).send(eq(SENDER), contains("Something went wrong"));
    }

    @Test
    void voiceNoteIsTranscribedThenHandledAsText() {
        Intent intent = Intent.of(IntentKind.HELP, "help");
        when(notificationChannel.isConfigured()).thenReturn(true);
        when(userRepository.findFirstByWhatsappNumberInOrPhoneIn(VARIANTS, VARIANTS)).thenReturn(Optional.of(user));
        when(voiceTranscriptionService.transcribe("https://media.test/1", "audio/ogg"))
                .thenReturn(new VoiceTranscriptionResult("help", "https://media.test/1", "audio/ogg", 2048));
        when(conversationService.resume(SENDER, "help")).thenReturn(new ConversationOutcome.NoPending());
        when(messageUnderstandingService.decide("help", user)).thenReturn(intent);
        when(conversationService.begin(SENDER, user.getId(), intent)).thenReturn(new ConversationOutcome.Complete(intent));
        when(actionDispatcher.dispatch(user, intent)).thenReturn(ActionResult.reply("Available Commands"));

        service.handleInbound(voice());

        verify(notificationChannel).send(eq(SENDER), contains("Transcription: \"help\""));
        verify(notificationChannel).send(SENDER, "Available Commands");
    }

    @Test
    void failedTranscriptionStopsProcessing() {
        when(notificationChannel.isConfigured()).thenReturn(true);
        when(userRepository.findFirstByWhatsappNumberInOrPhoneIn(VARIANTS, VARIANTS)).thenReturn(Optional.of(user));
        when(voiceTranscriptionService.transcribe(anyString(), anyString()))
                .thenThrow(new IllegalStateException("whisper down"));

        service.handleInbound(voice());

        verify(notificationChannel).send(eq(SENDER), contains("Could not transcribe your voice note."));
        verifyNoInteractions(conversationService, messageUnderstandingService);
    }

    @Test
    void replyFailureIsNotPropagated() {
        when(notificationChannel.isConfigured()).thenReturn(true);
        when(userRepository.findFirstByWhatsappNumberInOrPhoneIn(VARIANTS, VARIANTS)).thenReturn(Optional.empty());
        doThrow(new MessageDeliveryException("provider down")).when(notificationChannel).send(anyString(), anyString());

        assertThatCode(() -> service.handleInbound(text("hi"))).doesNotThrowAnyException();
    }

    @Test
    void repliesAreDroppedWhenChannelIsNotConfigured() {
        when(notificationChannel.isConfigured()).thenReturn(false);
        when(userRepository.findFirstByWhatsappNumberInOrPhoneIn(VARIANTS, VARIANTS)).thenReturn(Optional.empty());

        service.handleInbound(text("hi"));

        verify(notificationChannel, never()).send(any(), any());
    }

    @Test
    void messageWithoutSenderIsIgnored() {
        service.handleInbound(new InboundWhatsAppMessage(null, null, "hi", 0, null, null, "SM1", null));

        verifyNoInteractions(userRepository, notificationChannel);
    }

    private static InboundWhatsAppMessage text(String body) {
        return new InboundWhatsAppMessage("whatsapp:+" + SENDER, "whatsapp:+14155238886", body, 0, null, null, "SM1", "Ali");
    }

    private static InboundWhatsAppMessage voice() {
        return new InboundWhatsAppMessage("whatsapp:+" + SENDER, "whatsapp:+14155238886", null, 1,
                "https://media.test/1", "audio/ogg", "SM2", "Ali");
    }
}
