package com.taskbot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
public class WhatsAppConfig {

    @Bean
    RestClient twilioRestClient(WhatsAppProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(10));
        requestFactory.setReadTimeout(Duration.ofSeconds(30));
        RestClient.Builder builder = RestClient.builder()
                .baseUrl(properties.apiBase())
                .requestFactory(requestFactory);
        if (properties.hasCredentials()) {
            builder.defaultHeaders(headers -> headers.setBasicAuth(properties.accountSid(), properties.authToken()));
        }
        return builder.build();
    }

    @Bean
    RestClient openAiRestClient(AiProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.resolveTimeout());
        requestFactory.setReadTimeout(properties.resolveTimeout());
        RestClient.Builder builder = RestClient.builder()
                .baseUrl(properties.resolveBaseUrl())
                .requestFactory(requestFactory);
        if (properties.hasOpenAiKey()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.openaiApiKey());
        }
        return builder.build();
    }
}
