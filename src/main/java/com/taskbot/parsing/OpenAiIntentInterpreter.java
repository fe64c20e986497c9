package com.taskbot.parsing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskbot.config.AiProperties;
import com.taskbot.domain.model.User;
import com.taskbot.exception.IntentParsingException;
import com.taskbot.util.JsonObjectExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fallback parser backed by the OpenAI chat completions API. Used only when no rule matched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiIntentInterpreter {

    private static final DateTimeFormatter PROMPT_TIME_FMT =
            DateTimeFormatter.ofPattern("EEEE, d MMMM yyyy HH:mm", Locale.ENGLISH);

    private static final Map<String, String> FILTER_SLOTS = Map.of(
            "status", Slot.STATUS_FILTER,
            "priority", Slot.PRIORITY_FILTER,
            "overdue", Slot.OVERDUE_FILTER,
            "period", Slot.PERIOD);

    private final RestClient openAiRestClient;
    private final AiProperties aiProperties;
    private final ObjectMapper objectMapper;
    private final TimeExpressionParser timeExpressionParser;
    private final Clock clock;

    public boolean isEnabled() {
        return aiProperties.hasOpenAiKey();
    }

    /**
     * @throws IntentParsingException when the API is unreachable, answers with an error, or returns malformed JSON
     */
    public Intent interpret(String text, User user) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        Map<String, Object> payload = Map.of(
                "model", aiProperties.resolveModel(),
                "messages", List.of(
                        Map.of("role", "system", "content", buildSystemPrompt(user, now)),
                        Map.of("role", "user", "content", text)),
                "temperature", 0.2,
                "max_tokens", 500);

        Map<?, ?> response;
        try {
            response = openAiRestClient.post()
                    .uri("/v1/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(Map.class);
        } catch (RestClientException e) {
            throw new IntentParsingException("OpenAI request failed: " + e.getMessage(), e);
        }

        String content = extractContent(response);
        String json = JsonObjectExtractor.firstObject(content);
        if (json == null) {
            log.info("OpenAI reply had no JSON object. textLength={}", text.length());
            return Intent.unknown(text);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IntentParsingException("OpenAI returned malformed JSON: " + e.getOriginalMessage(), e);
        }
        Intent intent = toIntent(root, text, now);
        log.info("OpenAI parsed message. kind={}, slots={}", intent.kind(), intent.slots().keySet());
        return intent;
    }

    Intent toIntent(JsonNode root, String text, ZonedDateTime now) {
        IntentKind kind = IntentKind.fromWireName(textOrNull(root, "action"));
        Map<String, String> slots = new LinkedHashMap<>();
        Map<String, String> rejected = new LinkedHashMap<>();

        for (String name : Slot.ALL) {
            String value = textOrNull(root, name);
            if (value == null) {
                continue;
            }
            if (Slot.DEADLINE.equals(name) || Slot.REMINDER_TIME.equals(name)) {
                Optional<OffsetDateTime> resolved = timeExpressionParser.resolve(value, now);
                if (resolved.isPresent()) {
                    slots.put(name, resolved.get().toString());
                } else {
                    rejected.put(name, value);
                }
            } else {
                slots.put(name, value);
            }
        }

        JsonNode filters = root.path("filters");
        if (filters.isObject()) {
            FILTER_SLOTS.forEach((field, slot) -> {
                String value = textOrNull(filters, field);
                if (value != null && !"false".equalsIgnoreCase(value)) {
                    slots.put(slot, value);
                }
            });
        }

        boolean numericProgress = root.path(Slot.PROGRESS).isNumber()
                || (root.path(Slot.PROGRESS).isTextual() && root.path(Slot.PROGRESS).asText().trim().matches("\\d+\\s*%?"));
        if (slots.containsKey(Slot.TASK_ID) && slots.containsKey(Slot.STATUS) && numericProgress) {
            kind = IntentKind.UPDATE_STATUS_AND_PROGRESS;
        }
        return new Intent(kind, slots, rejected, text);
    }

    private String buildSystemPrompt(User user, ZonedDateTime now) {
        String role = user == null || user.getRole() == null ? "employee" : user.getRole().name().toLowerCase(Locale.ROOT);
        String name = user == null ? "User" : user.displayName();
        return "You are a task management assistant for a WhatsApp bot. Parse the user's message and extract the intended action.\n"
                + "Return ONLY one JSON object with the fields:\n"
                + "action (one of createTask, assignTask, updateTaskStatus, updateTaskProgress, updateTaskStatusAndProgress, "
                + "addTaskUpdate, reportBlocker, cancelTask, viewTask, listTasks, listDeadlines, setReminder, scheduleMeeting, "
                + "listReminders, listMeetings, cancelReminder, status, help, welcome, unknown),\n"
                + "taskId (like TASK-2026-0001), reminderId (like REM-2026-0001 or MTG-2026-0001), title, description, "
                + "priority (low, medium, high, critical), deadline (ISO-8601 local date-time), "
                + "status (pending, in-progress, completed, blocked, cancelled), progress (0-100 number), "
                + "assigneeName, message, blocker, reminderTime (ISO-8601 local date-time), reminderTitle, reminderMessage, "
                + "meetingSubject, meetingWith, meetingLocation, filters (status, priority, overdue, period).\n"
                + "Only include fields that are relevant to the action.\n"
                + "User's role: " + role + "\n"
                + "User's name: " + name + "\n"
                + "Current local date and time: " + now.format(PROMPT_TIME_FMT) + " (" + now.getZone() + "). "
                + "Resolve relative dates such as 'tomorrow' or 'next friday' against it.";
    }

    private String extractContent(Map<?, ?> response) {
        if (response == null) {
            return null;
        }
        Object choicesObj = response.get("choices");
        if (!(choicesObj instanceof List<?> choices) || choices.isEmpty()) {
            return null;
        }
        if (!(choices.get(0) instanceof Map<?, ?> first)) {
            return null;
        }
        if (!(first.get("message") instanceof Map<?, ?> message)) {
            return null;
        }
        return message.get("content") instanceof String content ? content : null;
    }

    private String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text.trim();
    }
}
