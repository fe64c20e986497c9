package com.taskbot.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({
        WhatsAppProperties.class,
        AiProperties.class,
        ReminderProperties.class,
        AssistantProperties.class
})
public class AssistantConfig {

    @Bean
    Clock assistantClock(AssistantProperties properties) {
        return Clock.system(properties.resolveZone());
    }
}
