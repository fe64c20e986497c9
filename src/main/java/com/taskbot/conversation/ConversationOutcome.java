package com.taskbot.conversation;

import com.taskbot.parsing.Intent;

/**
 * Result of starting or resuming a multi-turn command.
 */
public interface ConversationOutcome {

    record NoPending() implements ConversationOutcome {
    }

    record Prompt(String text) implements ConversationOutcome {
    }

    record Complete(Intent intent) implements ConversationOutcome {
    }
}
