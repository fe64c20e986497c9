package com.taskbot.util;

import com.taskbot.domain.enums.TaskPriority;
import com.taskbot.domain.enums.TaskStatus;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class CommandNormalizer {

    public static final String TASK_PREFIX = "TASK-";
    public static final String REMINDER_PREFIX = "REM-";
    public static final String MEETING_PREFIX = "MTG-";

    private static final Pattern TRANSPORT_PREFIX = Pattern.compile("^whatsapp:", Pattern.CASE_INSENSITIVE);
    private static final Pattern ADDRESS_NOISE = Pattern.compile("[\\s\\-()]");
    private static final Pattern LETTER_PREFIX = Pattern.compile("^[A-Z]{2,10}-.*");
    private static final Pattern GLUED_TASK_PREFIX = Pattern.compile("^TASK(\\d.*)");
    private static final BigInteger PROGRESS_FLOOR = BigInteger.ZERO;
    private static final BigInteger PROGRESS_CEILING = BigInteger.valueOf(100);
    private static final Pattern INTEGER = Pattern.compile("^[+-]?\\d+$");

    private static final Map<String, TaskStatus> STATUS_SYNONYMS = Map.ofEntries(
            Map.entry("pending", TaskStatus.PENDING),
            Map.entry("todo", TaskStatus.PENDING),
            Map.entry("to do", TaskStatus.PENDING),
            Map.entry("to-do", TaskStatus.PENDING),
            Map.entry("not started", TaskStatus.PENDING),
            Map.entry("open", TaskStatus.PENDING),
            Map.entry("in-progress", TaskStatus.IN_PROGRESS),
            Map.entry("in progress", TaskStatus.IN_PROGRESS),
            Map.entry("inprogress", TaskStatus.IN_PROGRESS),
            Map.entry("in_progress", TaskStatus.IN_PROGRESS),
            Map.entry("started", TaskStatus.IN_PROGRESS),
            Map.entry("start", TaskStatus.IN_PROGRESS),
            Map.entry("working", TaskStatus.IN_PROGRESS),
            Map.entry("ongoing", TaskStatus.IN_PROGRESS),
            Map.entry("wip", TaskStatus.IN_PROGRESS),
            Map.entry("blocked", TaskStatus.BLOCKED),
            Map.entry("block", TaskStatus.BLOCKED),
            Map.entry("stuck", TaskStatus.BLOCKED),
            Map.entry("on hold", TaskStatus.BLOCKED),
            Map.entry("completed", TaskStatus.COMPLETED),
            Map.entry("complete", TaskStatus.COMPLETED),
            Map.entry("done", TaskStatus.COMPLETED),
            Map.entry("finished", TaskStatus.COMPLETED),
            Map.entry("finish", TaskStatus.COMPLETED),
            Map.entry("closed", TaskStatus.COMPLETED),
            Map.entry("cancelled", TaskStatus.CANCELLED),
            Map.entry("canceled", TaskStatus.CANCELLED),
            Map.entry("cancel", TaskStatus.CANCELLED)
    );

    private CommandNormalizer() {
    }

    /**
     * Canonical sender key: no transport prefix, no formatting characters, no leading plus.
     */
    public static String senderKey(String rawAddress) {
        if (rawAddress == null) {
            return null;
        }
        String key = TRANSPORT_PREFIX.matcher(rawAddress.trim()).replaceFirst("");
        key = ADDRESS_NOISE.matcher(key).replaceAll("");
        if (key.startsWith("+")) {
            key = key.substring(1);
        }
        return key.isEmpty() ? null : key;
    }

    /**
     * Lookup variants for a sender key. Numbers stored in local format ({@code 03xx...}) still match an
     * international {@code 92...} sender, and the other way round.
     */
    public static List<String> addressVariants(String senderKey) {
        List<String> variants = new ArrayList<>();
        if (senderKey == null || senderKey.isBlank()) {
            return variants;
        }
        variants.add(senderKey);
        if (senderKey.startsWith("92") && senderKey.length() > 2) {
            variants.add("0" + senderKey.substring(2));
        } else if (senderKey.startsWith("0") && !senderKey.startsWith("00") && senderKey.length() > 1) {
            variants.add("92" + senderKey.substring(1));
        }
        return variants;
    }

    public static String whatsappAddress(String senderKey) {
        if (senderKey == null || senderKey.isBlank()) {
            return null;
        }
        String key = senderKey(senderKey);
        return "whatsapp:+" + key;
    }

    public static TaskStatus status(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        return STATUS_SYNONYMS.get(normalized);
    }

    public static String statusWireName(String raw) {
        TaskStatus status = status(raw);
        return status == null ? null : status.wireName();
    }

    public static TaskPriority priority(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("urgent")) {
            return TaskPriority.CRITICAL;
        }
        if (normalized.equals("normal")) {
            return TaskPriority.MEDIUM;
        }
        return TaskPriority.fromWireName(normalized);
    }

    public static String taskReference(String raw) {
        return reference(raw, TASK_PREFIX);
    }

    public static String reminderReference(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim().toUpperCase(Locale.ROOT);
        if (value.startsWith(REMINDER_PREFIX) || value.startsWith(MEETING_PREFIX)) {
            return value;
        }
        return reference(value, REMINDER_PREFIX);
    }

    private static String reference(String raw, String prefix) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", "");
        if (TASK_PREFIX.equals(prefix)) {
            Matcher glued = GLUED_TASK_PREFIX.matcher(value);
            if (glued.matches()) {
                return TASK_PREFIX + glued.group(1);
            }
        }
        if (LETTER_PREFIX.matcher(value).matches()) {
            return value;
        }
        return prefix + value;
    }

    public static int clampProgress(int value) {
        return Math.max(0, Math.min(100, value));
    }

    /**
     * Parses {@code "50"}, {@code "50%"} or {@code " 120 % "} into a clamped percentage, or null when not numeric.
     */
    public static Integer progress(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        if (value.endsWith("%")) {
            value = value.substring(0, value.length() - 1).trim();
        }
        if (value.contains(".")) {
            value = value.substring(0, value.indexOf('.'));
        }
        if (!INTEGER.matcher(value).matches()) {
            return null;
        }
        BigInteger parsed = new BigInteger(value);
        return clampProgress(parsed.max(PROGRESS_FLOOR).min(PROGRESS_CEILING).intValue());
    }
}
