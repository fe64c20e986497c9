package com.taskbot.config;

import com.taskbot.reminder.ReminderDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ReminderDispatcherStarter implements ApplicationRunner {

    private final WhatsAppProperties whatsAppProperties;
    private final ReminderProperties reminderProperties;
    private final AiProperties aiProperties;
    private final ReminderDispatcher reminderDispatcher;

    @Override
    public void run(ApplicationArguments args) {
        log.info("WhatsApp config: fromNumber={}, webhookPath={}, hasCredentials={}, validateSignature={}, hasPublicWebhookUrl={}, openAiFallback={}",
                whatsAppProperties.fromNumber(),
                whatsAppProperties.webhookPath(),
                whatsAppProperties.hasCredentials(),
                whatsAppProperties.validateSignature(),
                whatsAppProperties.hasPublicWebhookUrl(),
                aiProperties.hasOpenAiKey());

        if (!reminderProperties.enabled()) {
            log.info("Reminder dispatcher disabled by configuration.");
            return;
        }
        reminderDispatcher.start();
    }
}
