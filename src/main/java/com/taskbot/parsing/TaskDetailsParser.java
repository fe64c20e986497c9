package com.taskbot.parsing;

import com.taskbot.domain.enums.TaskPriority;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits the body of a create/assign command into title, description, priority and deadline.
 */
@Component
public class TaskDetailsParser {

    private static final Pattern PRIORITY_LABELLED = Pattern.compile(
            "\\bpriority\\s*[:\\s]?\\s*(low|medium|high|critical|urgent)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern PRIORITY_TRAILING = Pattern.compile(
            "\\b(low|medium|high|critical|urgent)\\s+priority\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern DEADLINE_DATE = Pattern.compile(
            "\\b(?:due|by|deadline)\\s*[:\\s]?\\s*(\\d{1,2})[/\\-](\\d{1,2})[/\\-](\\d{2,4})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEADLINE_RELATIVE = Pattern.compile(
            "\\b(?:due|by|deadline)\\s*[:\\s]?\\s*(today|tomorrow|next\\s+week|next\\s+month)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEADLINE_WEEKDAY = Pattern.compile(
            "\\b(?:due|by|deadline)\\s*[:\\s]?\\s*(?:on\\s+|next\\s+)?(monday|tuesday|wednesday|thursday|friday|saturday|sunday)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final int MIN_LEADING_CLAUSE = 10;
    private static final int MIN_DESCRIPTION = 20;

    public record TaskDetails(String title, String description, TaskPriority priority, OffsetDateTime deadline) {
    }

    public TaskDetails parse(String text, ZonedDateTime now) {
        String title = text == null ? "" : text.trim();
        TaskPriority priority = null;
        OffsetDateTime deadline = null;

        Matcher priorityMatch = PRIORITY_LABELLED.matcher(title);
        if (!priorityMatch.find()) {
            priorityMatch = PRIORITY_TRAILING.matcher(title);
            if (!priorityMatch.find()) {
                priorityMatch = null;
            }
        }
        if (priorityMatch != null) {
            String raw = priorityMatch.group(1).toLowerCase(Locale.ROOT);
            priority = raw.equals("urgent") ? TaskPriority.CRITICAL : TaskPriority.fromWireName(raw);
            title = cut(title, priorityMatch);
        }

        Matcher date = DEADLINE_DATE.matcher(title);
        Matcher relative = DEADLINE_RELATIVE.matcher(title);
        Matcher weekday = DEADLINE_WEEKDAY.matcher(title);
        if (date.find()) {
            deadline = explicitDate(date.group(1), date.group(2), date.group(3), now);
            title = cut(title, date);
        } else if (relative.find()) {
            deadline = relativeDeadline(relative.group(1), now);
            title = cut(title, relative);
        } else if (weekday.find()) {
            deadline = weekdayDeadline(weekday.group(1), now);
            title = cut(title, weekday);
        }

        title = cleanTitle(title);

        String description = null;
        int comma = title.indexOf(',');
        if (comma > MIN_LEADING_CLAUSE) {
            String afterComma = title.substring(comma + 1).trim();
            if (afterComma.length() > MIN_DESCRIPTION) {
                description = afterComma;
                title = title.substring(0, comma).trim();
            }
        }

        return new TaskDetails(title, description, priority, deadline);
    }

    private OffsetDateTime explicitDate(String day, String month, String year, ZonedDateTime now) {
        int resolvedYear = Integer.parseInt(year);
        if (resolvedYear < 100) {
            resolvedYear += 2000;
        }
        try {
            LocalDate date = LocalDate.of(resolvedYear, Integer.parseInt(month), Integer.parseInt(day));
            return endOfDay(date, now);
        } catch (DateTimeException e) {
            return null;
        }
    }

    private OffsetDateTime relativeDeadline(String raw, ZonedDateTime now) {
        String value = raw.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        return switch (value) {
            case "today" -> endOfDay(now.toLocalDate(), now);
            case "tomorrow" -> now.plusDays(1).toOffsetDateTime();
            case "next week" -> now.plusWeeks(1).toOffsetDateTime();
            case "next month" -> now.plusMonths(1).toOffsetDateTime();
            default -> null;
        };
    }

    private OffsetDateTime weekdayDeadline(String raw, ZonedDateTime now) {
        DayOfWeek target = DayOfWeek.valueOf(raw.toUpperCase(Locale.ROOT));
        int daysUntil = target.getValue() - now.getDayOfWeek().getValue();
        if (daysUntil <= 0) {
            daysUntil += 7;
        }
        return now.plusDays(daysUntil).toOffsetDateTime();
    }

    private OffsetDateTime endOfDay(LocalDate date, ZonedDateTime now) {
        return date.atTime(LocalTime.of(23, 59, 59)).atZone(now.getZone()).toOffsetDateTime();
    }

    private String cut(String text, Matcher matcher) {
        return text.substring(0, matcher.start()) + text.substring(matcher.end());
    }

    private String cleanTitle(String title) {
        return title.replaceAll("\\s+", " ")
                .replaceAll("\\s*,(\\s*,)+", ",")
                .replaceAll("\\s+,", ",")
                .replaceAll("^[\\s,]+|[\\s,.]+$", "")
                .trim();
    }
}
