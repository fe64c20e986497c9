package com.taskbot.parsing;

import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.function.Function;

/**
 * One entry of the ordered rule table. A rule either produces an intent or declines so later rules run.
 */
public record IntentRule(String name, Function<Input, Optional<Intent>> matcher) {

    public record Input(String text, String lower, ZonedDateTime now) {
    }

    public Optional<Intent> apply(Input input) {
        return matcher.apply(input);
    }
}
