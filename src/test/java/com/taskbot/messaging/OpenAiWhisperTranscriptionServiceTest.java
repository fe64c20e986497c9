package com.taskbot.messaging;

import com.taskbot.config.AiProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAiWhisperTranscriptionServiceTest {

    private static final String MEDIA_URL = "https://api.twilio.test/2010-04-01/Accounts/AC123/Messages/MM1/Media/ME1";

    private MockRestServiceServer twilio;
    private MockRestServiceServer openAi;
    private OpenAiWhisperTranscriptionService service;

    @BeforeEach
    void setUp() {
        RestClient.Builder twilioBuilder = RestClient.builder().baseUrl("https://api.twilio.test");
        RestClient.Builder openAiBuilder = RestClient.builder().baseUrl("https://api.openai.test");
        twilio = MockRestServiceServer.bindTo(twilioBuilder).build();
        openAi = MockRestServiceServer.bindTo(openAiBuilder).build();
        service = new OpenAiWhisperTranscriptionService(twilioBuilder.build(), openAiBuilder.build(),
                new AiProperties("sk-test", null, "https://api.openai.test", null, null));
    }

    @Test
    void voiceNoteIsDownloadedAndTranscribed() {
        twilio.expect(requestTo(MEDIA_URL))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(new byte[]{1, 2, 3, 4}, MediaType.parseMediaType("audio/ogg")));
        openAi.expect(requestTo("https://api.openai.test/v1/audio/transcriptions"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{\"text\":\" remind me at 5pm to call Ahmed \"}", MediaType.APPLICATION_JSON));

        VoiceTranscriptionResult result = service.transcribe(MEDIA_URL, "audio/ogg");

        assertThat(result.text()).isEqualTo("remind me at 5pm to call Ahmed");
        assertThat(result.sizeBytes()).isEqualTo(4);
        twilio.verify();
        openAi.verify();
    }

    @Test
    void emptyTranscriptFails() {
        twilio.expect(requestTo(MEDIA_URL))
                .andRespond(withSuccess(new byte[]{1, 2}, MediaType.parseMediaType("audio/ogg")));
        openAi.expect(requestTo("https://api.openai.test/v1/audio/transcriptions"))
                .andRespond(withSuccess("{\"text\":\"  \"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> service.transcribe(MEDIA_URL, "audio/ogg"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Transcription returned empty result.");
    }

    @Test
    void failedDownloadIsReported() {
        twilio.expect(requestTo(MEDIA_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> service.transcribe(MEDIA_URL, "audio/ogg"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Twilio media download error");
    }

    @Test
    void missingApiKeyDisablesTranscription() {
        OpenAiWhisperTranscriptionService disabled = new OpenAiWhisperTranscriptionService(RestClient.create(),
                RestClient.create(), new AiProperties(null, null, null, null, null));

        assertThatThrownBy(() -> disabled.transcribe(MEDIA_URL, "audio/ogg"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("OPENAI_API_KEY");
    }

    @Test
    void fileExtensionFollowsContentType() {
        assertThat(OpenAiWhisperTranscriptionService.extension("audio/mpeg")).isEqualTo("mp3");
        assertThat(OpenAiWhisperTranscriptionService.extension("audio/mp4")).isEqualTo("m4a");
        assertThat(OpenAiWhisperTranscriptionService.extension("audio/ogg; codecs=opus")).isEqualTo("ogg");
        assertThat(OpenAiWhisperTranscriptionService.extension(null)).isEqualTo("ogg");
    }
}
