package com.taskbot.messaging;

import com.taskbot.config.WhatsAppProperties;
import com.taskbot.exception.MessageDeliveryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class TwilioWhatsAppChannelTest {

    private static final String MESSAGES_URL = "https://api.twilio.test/2010-04-01/Accounts/AC123/Messages.json";

    private MockRestServiceServer server;
    private TwilioWhatsAppChannel channel;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://api.twilio.test");
        server = MockRestServiceServer.bindTo(builder).build();
        channel = new TwilioWhatsAppChannel(builder.build(), properties("AC123", "token"));
    }

    @Test
    void sendPostsFormWithWhatsAppAddresses() {
        server.expect(requestTo(MESSAGES_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().formDataContains(Map.of(
                        "From", "whatsapp:+14155238886",
                        "To", "whatsapp:+923001111111",
                        "Body", "hello")))
                .andRespond(withSuccess("{\"sid\":\"SM42\",\"status\":\"queued\"}", MediaType.APPLICATION_JSON));

        DeliveryReceipt receipt = channel.send("923001111111", "hello");

        assertThat(receipt.sid()).isEqualTo("SM42");
        assertThat(receipt.status()).isEqualTo("queued");
        server.verify();
    }

    @Test
    void providerErrorBecomesDeliveryException() {
        server.expect(requestTo(MESSAGES_URL))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"code\":21211,\"message\":\"Invalid 'To' Phone Number\"}"));

        assertThatThrownBy(() -> channel.send("923001111111", "hello"))
                .isInstanceOf(MessageDeliveryException.class)
                .hasMessageStartingWith("Twilio send failed");
    }

    @Test
    void sendWithoutCredentialsFails() {
        TwilioWhatsAppChannel unconfigured = new TwilioWhatsAppChannel(RestClient.create(), properties(null, null));

        assertThat(unconfigured.isConfigured()).isFalse();
        assertThatThrownBy(() -> unconfigured.send("923001111111", "hello"))
                .isInstanceOf(MessageDeliveryException.class);
    }

    @Test
    void longTextIsSplitOnLineBreaks() {
        String line = "x".repeat(99) + "\n";
        String text = line.repeat(20);

        List<String> parts = TwilioWhatsAppChannel.split(text);

        assertThat(parts).hasSize(2);
        assertThat(parts).allSatisfy(part -> assertThat(part.length()).isLessThanOrEqualTo(1600));
        assertThat(parts.get(0)).endsWith("x");
        assertThat(String.join("\n", parts).replace("\n", "")).isEqualTo(text.replace("\n", ""));
    }

    @Test
    void textWithoutLineBreaksIsCutAtLimit() {
        List<String> parts = TwilioWhatsAppChannel.split("y".repeat(3500));

        assertThat(parts).extracting(String::length).containsExactly(1600, 1600, 300);
    }

    private static WhatsAppProperties properties(String sid, String token) {
        return new WhatsAppProperties(sid, token, "+14155238886", "https://api.twilio.test",
                "/api/whatsapp/webhook", false, null, null, null);
    }
}
