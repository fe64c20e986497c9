package com.taskbot.conversation;

import com.taskbot.config.AssistantProperties;
import com.taskbot.domain.model.PendingConversation;
import com.taskbot.messaging.MessageTemplates;
import com.taskbot.parsing.Intent;
import com.taskbot.parsing.IntentKind;
import com.taskbot.parsing.Slot;
import com.taskbot.parsing.TimeExpressionParser;
import com.taskbot.repository.PendingConversationRepository;
import com.taskbot.util.CommandNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Keeps a partially specified command per sender until every required slot is filled.
 * Callers dispatch a {@link ConversationOutcome.Complete} only after the returning call has committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationService {

    private static final Pattern TASK_REFERENCE_PATTERN =
            Pattern.compile("(?i)\\b(?:[a-z]{2,10}-?)?\\d{4}-\\d{1,6}\\b");
    private static final Pattern REMINDER_REFERENCE_PATTERN =
            Pattern.compile("(?i)\\b(?:rem|mtg)-?\\d{4}-\\d{1,6}\\b");
    private static final Pattern PERCENT_PATTERN = Pattern.compile("^\\s*\\d{1,3}\\s*%?\\s*$");

    private final PendingConversationRepository repository;
    private final AssistantProperties properties;
    private final TimeExpressionParser timeExpressionParser;
    private final MessageTemplates templates;
    private final Clock clock;

    @Transactional
    public ConversationOutcome begin(String sender, UUID ownerId, Intent intent) {
        List<String> missing = intent.missing(SlotRequirements.required(intent.kind()));
        if (missing.isEmpty()) {
            return new ConversationOutcome.Complete(intent);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        PendingConversation conversation = repository.findForUpdate(sender).orElseGet(PendingConversation::new);
        conversation.setSender(sender);
        conversation.setOwnerId(ownerId);
        conversation.setKind(intent.kind());
        conversation.setCollected(new LinkedHashMap<>(intent.slots()));
        conversation.setMissing(new ArrayList<>(missing));
        conversation.setOriginalText(intent.originalText());
        String prompt = buildPrompt(intent, missing.get(0));
        conversation.setLastPrompt(prompt);
        conversation.setExpiresAt(now.plus(properties.resolveConversationTtl()));
        repository.save(conversation);

        log.info("Conversation started. sender={}, kind={}, missing={}", sender, intent.kind(), missing);
        return new ConversationOutcome.Prompt(prompt);
    }

    @Transactional
    public ConversationOutcome resume(String sender, String reply) {
        Optional<PendingConversation> found = repository.findForUpdate(sender);
        if (found.isEmpty()) {
            return new ConversationOutcome.NoPending();
        }

        PendingConversation conversation = found.get();
        ZonedDateTime now = ZonedDateTime.now(clock);
        if (conversation.isExpired(now.toOffsetDateTime())) {
            repository.delete(conversation);
            log.info("Pending conversation expired. sender={}, kind={}", sender, conversation.getKind());
            return new ConversationOutcome.NoPending();
        }

        IntentKind kind = conversation.getKind();
        Intent intent = new Intent(kind, conversation.getCollected(), Map.of(), conversation.getOriginalText());
        String answer = reply == null ? "" : reply.trim();
        if (!answer.isEmpty()) {
            String slot = chooseSlot(conversation.getMissing(), answer, now);
            intent = merge(intent, slot, answer, now);
        }

        List<String> stillMissing = intent.missing(SlotRequirements.required(kind));
        if (stillMissing.isEmpty()) {
            repository.delete(conversation);
            log.info("Conversation completed. sender={}, kind={}", sender, kind);
            return new ConversationOutcome.Complete(intent);
        }

        String prompt = buildPrompt(intent, stillMissing.get(0));
        conversation.setCollected(new LinkedHashMap<>(intent.slots()));
        conversation.setMissing(new ArrayList<>(stillMissing));
        conversation.setLastPrompt(prompt);
        conversation.setExpiresAt(now.toOffsetDateTime().plus(properties.resolveConversationTtl()));
        repository.save(conversation);
        log.info("Conversation still incomplete. sender={}, kind={}, missing={}", sender, kind, stillMissing);
        return new ConversationOutcome.Prompt(prompt);
    }

    @Transactional
    public boolean cancel(String sender) {
        Optional<PendingConversation> found = repository.findById(sender);
        if (found.isEmpty()) {
            return false;
        }
        repository.delete(found.get());
        log.info("Conversation cancelled. sender={}, kind={}", sender, found.get().getKind());
        return true;
    }

    @Scheduled(fixedDelayString = "${app.assistant.purge-interval:60000}")
    @Transactional
    public void purgeExpired() {
        int removed = repository.deleteExpired(OffsetDateTime.now(clock));
        if (removed > 0) {
            log.info("Purged expired conversations. count={}", removed);
        }
    }

    /**
     * Picks the slot a reply answers. A single missing slot takes the reply as is; otherwise the
     * reply's shape decides, falling back to the first missing slot.
     */
    String chooseSlot(List<String> missing, String reply, ZonedDateTime now) {
        if (missing.size() == 1) {
            return missing.get(0);
        }
        if (missing.contains(Slot.REMINDER_TIME) && timeExpressionParser.looksLikeTime(reply, now)) {
            return Slot.REMINDER_TIME;
        }
        if (missing.contains(Slot.STATUS) && CommandNormalizer.status(reply) != null) {
            return Slot.STATUS;
        }
        if (missing.contains(Slot.REMINDER_ID) && REMINDER_REFERENCE_PATTERN.matcher(reply).find()) {
            return Slot.REMINDER_ID;
        }
        if (missing.contains(Slot.TASK_ID) && TASK_REFERENCE_PATTERN.matcher(reply).find()) {
            return Slot.TASK_ID;
        }
        if (missing.contains(Slot.PROGRESS) && PERCENT_PATTERN.matcher(reply).matches()) {
            return Slot.PROGRESS;
        }
        return missing.get(0);
    }

    private Intent merge(Intent intent, String slot, String answer, ZonedDateTime now) {
        if (Slot.REMINDER_TIME.equals(slot) || Slot.DEADLINE.equals(slot)) {
            Optional<OffsetDateTime> time = timeExpressionParser.resolve(answer, now);
            if (time.isEmpty()) {
                return intent.withRejected(slot, answer);
            }
            return intent.withSlot(slot, time.get().toString());
        }
        return intent.withSlot(slot, answer);
    }

    private String buildPrompt(Intent intent, String slot) {
        String question = SlotRequirements.prompt(intent.kind(), slot);
        String rejected = intent.rejected().get(slot);
        if (rejected != null) {
            question = SlotRequirements.correction(slot, rejected) + "\n\n" + question;
        }
        return templates.prompt(question);
    }
}
