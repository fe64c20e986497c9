package com.taskbot.controller;

import com.taskbot.dto.InboundWhatsAppMessage;
import com.taskbot.messaging.TwilioSignatureValidator;
import com.taskbot.messaging.WhatsAppBotService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class WhatsAppWebhookControllerTest {

    private static final String PATH = "/api/whatsapp/webhook";

    @Mock
    private WhatsAppBotService whatsAppBotService;

    @Mock
    private TwilioSignatureValidator signatureValidator;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        WhatsAppWebhookController controller = new WhatsAppWebhookController(whatsAppBotService, signatureValidator, Runnable::run);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .addPlaceholderValue("app.whatsapp.webhook-path", PATH)
                .build();
    }

    @Test
    void acceptedWebhookAnswersWithEmptyTwimlAndHandsOffMessage() throws Exception {
        when(signatureValidator.isEnabled()).thenReturn(false);

        mockMvc.perform(post(PATH)
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("From", "whatsapp:+923001111111")
                        .param("Body", "show my tasks")
                        .param("NumMedia", "0")
                        .param("MessageSid", "SM1"))
                .andExpect(status().isOk())
                .andExpect(content().string(WhatsAppWebhookController.EMPTY_TWIML));

        ArgumentCaptor<InboundWhatsAppMessage> message = ArgumentCaptor.forClass(InboundWhatsAppMessage.class);
        verify(whatsAppBotService).handleInbound(message.capture());
        assertThat(message.getValue().from()).isEqualTo("whatsapp:+923001111111");
        assertThat(message.getValue().body()).isEqualTo("show my tasks");
    }

    @Test
    void invalidSignatureIsForbidden() throws Exception {
        when(signatureValidator.isEnabled()).thenReturn(true);
        when(signatureValidator.isValid(anyString(), anyMap(), any())).thenReturn(false);

        mockMvc.perform(post(PATH)
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .header("X-Twilio-Signature", "forged")
                        .param("From", "whatsapp:+923001111111")
                        .param("Body", "hi"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(whatsAppBotService);
    }

    @Test
    void fullQueueStillAcknowledges() throws Exception {
        WhatsAppWebhookController controller = new WhatsAppWebhookController(whatsAppBotService, signatureValidator,
                command -> {
                    throw new RejectedExecutionException("queue full");
                });
        MockMvc rejecting = MockMvcBuilders.standaloneSetup(controller)
                .addPlaceholderValue("app.whatsapp.webhook-path", PATH)
                .build();
        when(signatureValidator.isEnabled()).thenReturn(false);

        rejecting.perform(post(PATH)
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("From", "whatsapp:+923001111111")
                        .param("Body", "hi"))
                .andExpect(status().isOk());

        verifyNoInteractions(whatsAppBotService);
    }

    @Test
    void voiceNoteParamsAreMapped() {
        InboundWhatsAppMessage message = WhatsAppWebhookController.toMessage(Map.of(
                "From", "whatsapp:+923001111111",
                "NumMedia", "1",
                "MediaUrl0", "https://media.test/1",
                "MediaContentType0", "audio/ogg; codecs=opus",
                "ProfileName", "Ali"));

        assertThat(message.numMedia()).isEqualTo(1);
        assertThat(message.isVoiceNote()).isTrue();
        assertThat(message.profileName()).isEqualTo("Ali");
    }

    @Test
    void camelCaseParamsAndBadMediaCountAreTolerated() {
        InboundWhatsAppMessage message = WhatsAppWebhookController.toMessage(Map.of(
                "from", "whatsapp:+923001111111",
                "body", "help",
                "numMedia", "many"));

        assertThat(message.from()).isEqualTo("whatsapp:+923001111111");
        assertThat(message.body()).isEqualTo("help");
        assertThat(message.numMedia()).isZero();
        assertThat(message.isVoiceNote()).isFalse();
    }
}
