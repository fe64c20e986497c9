package com.taskbot.parsing;

import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves reminder and meeting times such as "at 3pm tomorrow", "in 30 minutes", "friday 10:30" or
 * "15 jan at 2pm" against a reference instant.
 */
@Component
public class TimeExpressionParser {

    private static final LocalTime DEFAULT_TIME = LocalTime.of(9, 0);

    private static final Pattern RELATIVE = Pattern.compile(
            "\\bin\\s+(\\d{1,4}|an?|one)\\s*(minutes?|mins?|hours?|hrs?|days?)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DAY_WORD = Pattern.compile(
            "\\b(?:on\\s+)?(today|tonight|tomorrow|(?:next\\s+)?(?:monday|tuesday|wednesday|thursday|friday|saturday|sunday))\\b",
            Pattern.CASE_INSENSITIVE);
    // a yearless d/m pair is a date only after on, by or due
    private static final Pattern NUMERIC_DATE = Pattern.compile(
            "\\b(?:on\\s+)?(\\d{1,2})[/\\-](\\d{1,2})[/\\-](\\d{2,4})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMERIC_DATE_NO_YEAR = Pattern.compile(
            "\\b(?:on|by|due)\\s+(\\d{1,2})[/\\-](\\d{1,2})\\b(?![/\\-]\\d)", Pattern.CASE_INSENSITIVE);
    private static final Pattern DAY_MONTH = Pattern.compile(
            "\\b(?:on\\s+)?(?:the\\s+)?(\\d{1,2})(?:st|nd|rd|th)?(?:\\s+of)?\\s+(jan|feb|mar|apr|may|jun|jul|aug|sep|sept|oct|nov|dec)[a-z]*\\.?(?:\\s+(\\d{4}))?\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern MONTH_DAY = Pattern.compile(
            "\\b(?:on\\s+)?(jan|feb|mar|apr|may|jun|jul|aug|sep|sept|oct|nov|dec)[a-z]*\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?(?:,?\\s+(\\d{4}))?\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CLOCK_12H = Pattern.compile(
            "\\b(?:at\\s+)?(\\d{1,2})(?:[:.](\\d{2}))?\\s*(a\\.?m\\.?|p\\.?m\\.?)(?=\\W|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CLOCK_24H = Pattern.compile(
            "\\b(?:at\\s+)?([01]?\\d|2[0-3]):([0-5]\\d)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern NAMED_TIME = Pattern.compile(
            "\\b(?:at\\s+)?(noon|midday|midnight)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ISO_DATE_TIME = Pattern.compile(
            "\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}(?::\\d{2}(?:\\.\\d+)?)?(?:Z|[+-]\\d{2}:?\\d{2})?");

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
            Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
            Map.entry("sep", 9), Map.entry("sept", 9), Map.entry("oct", 10), Map.entry("nov", 11),
            Map.entry("dec", 12));

    public record Extraction(OffsetDateTime time, String remainder) {
    }

    public Optional<OffsetDateTime> resolve(String text, ZonedDateTime now) {
        return extract(text, now).map(Extraction::time);
    }

    public boolean looksLikeTime(String text, ZonedDateTime now) {
        return resolve(text, now).isPresent();
    }

    /**
     * Finds a time expression in {@code text} and returns the resolved instant together with the text
     * that is left once the expression is removed.
     */
    public Optional<Extraction> extract(String text, ZonedDateTime now) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String source = text.trim();

        Matcher iso = ISO_DATE_TIME.matcher(source);
        if (iso.find()) {
            OffsetDateTime parsed = parseIso(iso.group(), now);
            if (parsed != null) {
                return Optional.of(new Extraction(parsed, cleanup(source.substring(0, iso.start()) + " " + source.substring(iso.end()))));
            }
        }

        Matcher relative = RELATIVE.matcher(source);
        if (relative.find()) {
            long amount = parseAmount(relative.group(1));
            String unit = relative.group(2).toLowerCase(Locale.ROOT);
            ZonedDateTime resolved;
            if (unit.startsWith("d")) {
                resolved = now.plusDays(amount);
            } else if (unit.startsWith("h")) {
                resolved = now.plusHours(amount);
            } else {
                resolved = now.plusMinutes(amount);
            }
            return Optional.of(new Extraction(resolved.withNano(0).toOffsetDateTime(), cleanup(remove(source, relative))));
        }

        String remainder = source;
        LocalDate date = null;
        boolean explicitDate = false;

        Matcher dayMonth = DAY_MONTH.matcher(remainder);
        Matcher monthDay = MONTH_DAY.matcher(remainder);
        Matcher numeric = NUMERIC_DATE.matcher(remainder);
        Matcher numericNoYear = NUMERIC_DATE_NO_YEAR.matcher(remainder);
        if (dayMonth.find()) {
            date = monthDate(now, Integer.parseInt(dayMonth.group(1)), dayMonth.group(2), dayMonth.group(3));
            remainder = remove(remainder, dayMonth);
            explicitDate = true;
        } else if (monthDay.find()) {
            date = monthDate(now, Integer.parseInt(monthDay.group(2)), monthDay.group(1), monthDay.group(3));
            remainder = remove(remainder, monthDay);
            explicitDate = true;
        } else if (numeric.find()) {
            date = numericDate(now, numeric.group(1), numeric.group(2), numeric.group(3));
            remainder = remove(remainder, numeric);
            explicitDate = true;
        } else if (numericNoYear.find()) {
            date = numericDate(now, numericNoYear.group(1), numericNoYear.group(2), null);
            remainder = remove(remainder, numericNoYear);
            explicitDate = true;
        }

        String dayWord = null;
        if (date == null) {
            Matcher day = DAY_WORD.matcher(remainder);
            if (day.find()) {
                dayWord = day.group(1).toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
                date = dayWordDate(now, dayWord);
                remainder = remove(remainder, day);
            }
        }

        LocalTime time = null;
        Matcher twelve = CLOCK_12H.matcher(remainder);
        if (twelve.find()) {
            time = twelveHour(twelve.group(1), twelve.group(2), twelve.group(3));
            if (time != null) {
                remainder = remove(remainder, twelve);
            }
        }
        if (time == null) {
            Matcher twentyFour = CLOCK_24H.matcher(remainder);
            if (twentyFour.find()) {
                time = LocalTime.of(Integer.parseInt(twentyFour.group(1)), Integer.parseInt(twentyFour.group(2)));
                remainder = remove(remainder, twentyFour);
            }
        }
        if (time == null) {
            Matcher named = NAMED_TIME.matcher(remainder);
            if (named.find()) {
                time = named.group(1).equalsIgnoreCase("midnight") ? LocalTime.MIDNIGHT : LocalTime.NOON;
                remainder = remove(remainder, named);
            }
        }

        if (date == null && time == null) {
            return Optional.empty();
        }
        if (date == null) {
            date = now.toLocalDate();
            if (!date.atTime(time).atZone(now.getZone()).isAfter(now)) {
                date = date.plusDays(1);
            }
        }
        if (time == null) {
            time = "tonight".equals(dayWord) ? LocalTime.of(20, 0) : DEFAULT_TIME;
        }
        if (explicitDate && date.isBefore(now.toLocalDate()) && !hasYear(source)) {
            date = date.plusYears(1);
        }

        OffsetDateTime resolved = date.atTime(time).atZone(now.getZone()).toOffsetDateTime();
        return Optional.of(new Extraction(resolved, cleanup(remainder)));
    }

    private OffsetDateTime parseIso(String value, ZonedDateTime now) {
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException ignored) {
            // local form, interpreted in the operating zone
        }
        try {
            return LocalDateTime.parse(value).atZone(now.getZone()).toOffsetDateTime();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private long parseAmount(String raw) {
        String value = raw.toLowerCase(Locale.ROOT);
        if (value.equals("a") || value.equals("an") || value.equals("one")) {
            return 1;
        }
        return Long.parseLong(value);
    }

    private LocalDate dayWordDate(ZonedDateTime now, String dayWord) {
        LocalDate today = now.toLocalDate();
        if (dayWord.equals("today") || dayWord.equals("tonight")) {
            return today;
        }
        if (dayWord.equals("tomorrow")) {
            return today.plusDays(1);
        }
        String name = dayWord.startsWith("next ") ? dayWord.substring(5) : dayWord;
        DayOfWeek target = DayOfWeek.valueOf(name.toUpperCase(Locale.ROOT));
        int daysUntil = target.getValue() - today.getDayOfWeek().getValue();
        if (daysUntil <= 0) {
            daysUntil += 7;
        }
        return today.plusDays(daysUntil);
    }

    private LocalDate monthDate(ZonedDateTime now, int day, String monthName, String year) {
        Integer month = MONTHS.get(monthName.toLowerCase(Locale.ROOT));
        if (month == null) {
            return null;
        }
        int resolvedYear = year == null ? now.getYear() : Integer.parseInt(year);
        try {
            return LocalDate.of(resolvedYear, month, day);
        } catch (DateTimeException e) {
            return null;
        }
    }

    // day/month order, the way dates are written locally
    private LocalDate numericDate(ZonedDateTime now, String day, String month, String year) {
        int resolvedYear = now.getYear();
        if (year != null) {
            resolvedYear = Integer.parseInt(year);
            if (resolvedYear < 100) {
                resolvedYear += 2000;
            }
        }
        try {
            return LocalDate.of(resolvedYear, Integer.parseInt(month), Integer.parseInt(day));
        } catch (DateTimeException e) {
            return null;
        }
    }

    private LocalTime twelveHour(String hourRaw, String minuteRaw, String meridiem) {
        int hour = Integer.parseInt(hourRaw);
        int minute = minuteRaw == null ? 0 : Integer.parseInt(minuteRaw);
        if (hour < 1 || hour > 12 || minute > 59) {
            return null;
        }
        boolean pm = meridiem.toLowerCase(Locale.ROOT).startsWith("p");
        if (hour == 12) {
            hour = pm ? 12 : 0;
        } else if (pm) {
            hour += 12;
        }
        return LocalTime.of(hour, minute);
    }

    private boolean hasYear(String source) {
        return source.matches("(?s).*\\b\\d{4}\\b.*");
    }

    private String remove(String text, Matcher matcher) {
        return text.substring(0, matcher.start()) + " " + text.substring(matcher.end());
    }

    private String cleanup(String text) {
        return text.replaceAll("\\s+", " ")
                .replaceAll("\\s+([,.!?])", "$1")
                .replaceAll("(?i)\\s+(?:at|on|by)\\s*$", "")
                .replaceAll("^[\\s,]+|[\\s,]+$", "")
                .trim();
    }
}
