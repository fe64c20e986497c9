package com.taskbot.parsing;

import com.taskbot.domain.enums.TaskPriority;
import com.taskbot.util.CommandNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A recognized command. Slot values are normalized on construction; values that cannot be normalized
 * are moved to {@code rejected} so the caller can ask for them again.
 */
public record Intent(
        IntentKind kind,
        Map<String, String> slots,
        Map<String, String> rejected,
        String originalText
) {

    public Intent {
        kind = kind == null ? IntentKind.UNKNOWN : kind;
        Map<String, String> normalized = new LinkedHashMap<>();
        Map<String, String> invalid = new LinkedHashMap<>(rejected == null ? Map.of() : rejected);
        if (slots != null) {
            for (Map.Entry<String, String> entry : slots.entrySet()) {
                String raw = entry.getValue() == null ? null : entry.getValue().trim();
                if (entry.getKey() == null || raw == null || raw.isEmpty()) {
                    continue;
                }
                String value = normalizeSlot(entry.getKey(), raw);
                if (value == null) {
                    invalid.put(entry.getKey(), raw);
                } else {
                    normalized.put(entry.getKey(), value);
                    invalid.remove(entry.getKey());
                }
            }
        }
        slots = Collections.unmodifiableMap(normalized);
        rejected = Collections.unmodifiableMap(invalid);
    }

    public static Intent of(IntentKind kind, Map<String, String> slots, String originalText) {
        return new Intent(kind, slots, Map.of(), originalText);
    }

    public static Intent of(IntentKind kind, String originalText) {
        return new Intent(kind, Map.of(), Map.of(), originalText);
    }

    public static Intent unknown(String originalText) {
        return of(IntentKind.UNKNOWN, originalText);
    }

    public boolean isUnknown() {
        return kind == IntentKind.UNKNOWN;
    }

    public String slot(String name) {
        return slots.get(name);
    }

    public boolean has(String name) {
        return slots.containsKey(name);
    }

    public Integer progress() {
        String value = slots.get(Slot.PROGRESS);
        return value == null ? null : Integer.valueOf(value);
    }

    public Intent withSlot(String name, String value) {
        Map<String, String> merged = new LinkedHashMap<>(slots);
        merged.put(name, value);
        Map<String, String> stillRejected = new LinkedHashMap<>(rejected);
        stillRejected.remove(name);
        return new Intent(kind, merged, stillRejected, originalText);
    }

    public Intent withRejected(String name, String rawValue) {
        Map<String, String> remaining = new LinkedHashMap<>(slots);
        remaining.remove(name);
        Map<String, String> invalid = new LinkedHashMap<>(rejected);
        invalid.put(name, rawValue);
        return new Intent(kind, remaining, invalid, originalText);
    }

    public Intent withKind(IntentKind newKind) {
        return new Intent(newKind, slots, rejected, originalText);
    }

    public List<String> missing(List<String> required) {
        List<String> missing = new ArrayList<>();
        for (String name : required) {
            if (!slots.containsKey(name)) {
                missing.add(name);
            }
        }
        return missing;
    }

    private static String normalizeSlot(String name, String raw) {
        return switch (name) {
            case Slot.STATUS, Slot.STATUS_FILTER -> CommandNormalizer.statusWireName(raw);
            case Slot.PROGRESS -> {
                Integer progress = CommandNormalizer.progress(raw);
                yield progress == null ? null : String.valueOf(progress);
            }
            case Slot.TASK_ID -> CommandNormalizer.taskReference(raw);
            case Slot.REMINDER_ID -> CommandNormalizer.reminderReference(raw);
            case Slot.PRIORITY, Slot.PRIORITY_FILTER -> {
                TaskPriority priority = CommandNormalizer.priority(raw);
                yield priority == null ? null : priority.wireName();
            }
            default -> raw;
        };
    }
}
