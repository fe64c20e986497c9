package com.taskbot.parsing;

import com.taskbot.domain.model.User;
import com.taskbot.exception.IntentParsingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Rule table first; the OpenAI interpreter is consulted only for messages no rule recognizes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageUnderstandingService {

    private final RuleBasedIntentParser ruleBasedIntentParser;
    private final OpenAiIntentInterpreter openAiIntentInterpreter;

    public Intent decide(String sourceText, User user) {
        Intent intent = ruleBasedIntentParser.parse(sourceText);
        if (!intent.isUnknown() || sourceText == null || sourceText.isBlank()) {
            return intent;
        }
        if (!openAiIntentInterpreter.isEnabled()) {
            return intent;
        }
        try {
            return openAiIntentInterpreter.interpret(sourceText.trim(), user);
        } catch (IntentParsingException e) {
            log.warn("OpenAI intent detection failed, keeping rule result. error={}", e.getMessage());
            return intent;
        }
    }
}
