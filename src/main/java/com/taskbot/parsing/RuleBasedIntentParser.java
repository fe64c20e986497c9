package com.taskbot.parsing;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class RuleBasedIntentParser {

    private final IntentRuleTable ruleTable;
    private final Clock clock;

    public Intent parse(String text) {
        if (text == null || text.isBlank()) {
            return Intent.unknown(text);
        }
        String trimmed = text.trim().replaceAll("\\s+", " ");
        IntentRule.Input input = new IntentRule.Input(trimmed, trimmed.toLowerCase(Locale.ROOT), ZonedDateTime.now(clock));
        for (IntentRule rule : ruleTable.rules()) {
            Optional<Intent> intent = rule.apply(input);
            if (intent.isPresent()) {
                log.debug("Rule matched. rule={}, kind={}", rule.name(), intent.get().kind());
                return intent.get();
            }
        }
        return Intent.unknown(trimmed);
    }
}
