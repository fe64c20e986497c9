package com.taskbot.parsing;

import com.taskbot.domain.enums.TaskPriority;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered rule table used by {@link RuleBasedIntentParser}. Position in {@link #rules()} is precedence:
 * the first rule that produces an intent wins.
 */
@Component
public class IntentRuleTable {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final String REF = "([A-Z]{2,10}-\\d{4}-\\d+)";
    private static final String REF_OR_NUMBER = "((?:[A-Z]{2,10}-)?\\d{4}-\\d+)";
    private static final String SEP = "(?:\\s*:\\s*|\\s+)";
    private static final String STATUS_WORDS =
            "completed|complete|done|finished|in[- ]?progress|started|working|blocked|stuck|pending|todo|cancelled|canceled|on hold";

    private static final Pattern ANY_REF = Pattern.compile(REF, FLAGS);
    private static final Pattern PERCENT = Pattern.compile("\\b(\\d+)\\s*%");
    private static final Pattern STATUS_KEYWORD = Pattern.compile(
            "\\b(completed|done|finished|in[- ]?progress|started|blocked|pending|cancelled|canceled)\\b", FLAGS);
    private static final Pattern UPDATE_STATUS_WORD = Pattern.compile(
            "\\b(completed|done|in[- ]?progress|blocked|pending)\\b", FLAGS);
    private static final Pattern BARE_PERCENTAGE = Pattern.compile("^\\d+\\s*%?$");

    private static final Set<String> HELP_WORDS = Set.of("help", "commands", "?", "menu", "/help");
    private static final Set<String> WELCOME_WORDS = Set.of(
            "hi", "hello", "hey", "start", "/start", "good morning", "good afternoon", "good evening");
    private static final Set<String> STATUS_WORDS_SUMMARY = Set.of("status", "summary", "dashboard", "my status");

    private static final Pattern LIST_TASKS = Pattern.compile("\\btasks\\b", FLAGS);
    private static final Pattern LIST_DEADLINES = Pattern.compile("\\b(?:deadlines|due dates)\\b", FLAGS);
    private static final Pattern LIST_REMINDERS = Pattern.compile("\\breminders\\b", FLAGS);
    private static final Pattern LIST_MEETINGS = Pattern.compile("\\bmeetings\\b", FLAGS);

    private static final Pattern VIEW_TASK = Pattern.compile(
            "^(?:show|view|get|open|details?(?:\\s+(?:of|for))?)\\s+(?:me\\s+)?(?:the\\s+)?(?:task\\s+)?" + REF + "\\s*[?.!]?$", FLAGS);

    private static final Pattern CREATE_CALLED = Pattern.compile(
            "^(?:create|new|add)\\s+(?:a\\s+)?(?:new\\s+)?task\\s+(?:called|named|titled)\\s*:?\\s*(.+)$", FLAGS);
    private static final Pattern CREATE_TASK = Pattern.compile(
            "^(?:create|new|add)\\s+(?:a\\s+)?(?:new\\s+)?task(?:\\s*[:\\-]\\s*|\\s+)(.+)$", FLAGS);
    private static final Pattern CREATE_TASK_SHORT = Pattern.compile("^task\\s*:\\s*(.+)$", FLAGS);
    private static final Pattern FOR_ASSIGNEE = Pattern.compile("^for\\s+[^:]+:", FLAGS);

    private static final Pattern ASSIGN_TITLE_FIRST = Pattern.compile(
            "^(?:assign|create)\\s+(?:a\\s+)?task\\s*[:\\-]?\\s*(.+?)\\s+to\\s+(.+)$", FLAGS);
    private static final Pattern ASSIGN_BARE = Pattern.compile(
            "^assign\\s+(?!task\\b)(.+?)\\s+to\\s+(.+)$", FLAGS);
    private static final Pattern ASSIGN_ASSIGNEE_FIRST = Pattern.compile(
            "^(?:create|new)\\s+(?:a\\s+)?task\\s+for\\s+(.+?)\\s*:\\s*(.+)$", FLAGS);

    private static final Pattern CANCEL_REMINDER = Pattern.compile(
            "^(?:cancel|delete|remove)\\s+(?:my\\s+|the\\s+)?(reminder|meeting)(?:\\s+#?([A-Z0-9][A-Z0-9-]*))?\\s*[.!]?$", FLAGS);
    private static final Pattern CANCEL_REMINDER_BY_REF = Pattern.compile(
            "^(?:cancel|delete|remove)\\s+((?:REM|MTG)-\\d{4}-\\d+)\\s*$", FLAGS);
    private static final Pattern REMIND_ME = Pattern.compile(
            "^(?:please\\s+)?remind\\s+me\\s+(?:to\\s+|about\\s+|of\\s+|that\\s+)?(.+)$", FLAGS);
    private static final Pattern SET_REMINDER = Pattern.compile(
            "^(?:set|add|create)\\s+(?:a\\s+)?(?:new\\s+)?reminder\\b\\s*(?::\\s*|for\\s+|to\\s+|about\\s+)?(.*)$", FLAGS);
    private static final Pattern SCHEDULE_MEETING = Pattern.compile(
            "^(?:schedule|book|set\\s+up|arrange|plan|create|add)\\s+(?:a\\s+)?(?:new\\s+)?meeting\\b\\s*:?\\s*(.*)$", FLAGS);
    private static final Pattern MEETING_WITH = Pattern.compile(
            "\\bwith\\s+(.+?)(?=\\s+(?:about|regarding|re|on|for|in|at)\\b|,|$)", FLAGS);
    private static final Pattern MEETING_SUBJECT = Pattern.compile(
            "\\b(?:about|regarding|re|for|on)\\s*:?\\s+(.+?)(?=\\s+(?:with|in|at)\\b|,|$)", FLAGS);
    private static final Pattern MEETING_LOCATION = Pattern.compile(
            "\\b(?:in|at)\\s+(?:the\\s+)?(.+?)(?=\\s+(?:with|about|regarding)\\b|,|$)", FLAGS);
    private static final Pattern LEADING_FILLER = Pattern.compile("^(?:to|about|that|of)\\s+", FLAGS);

    private static final Pattern STATUS_TRAILING = Pattern.compile(
            "^(?:task\\s+)?" + REF + "\\s+(?:is\\s+)?(?:now\\s+)?(" + STATUS_WORDS + ")\\s*[.!]?$", FLAGS);
    private static final Pattern STATUS_VERB_FIRST = Pattern.compile(
            "^(?:mark|set|update|change)\\s+(?:task\\s+)?" + REF + SEP + "(?:status\\s+)?(?:as\\s+|to\\s+)?(" + STATUS_WORDS + ")\\s*[.!]?$", FLAGS);
    private static final Pattern STATUS_IMPERATIVE = Pattern.compile(
            "^(complete|finish|start|block|reopen)\\s+(?:task\\s+)?" + REF + "\\s*[.!]?$", FLAGS);
    private static final Pattern CANCEL_TASK = Pattern.compile(
            "^(?:cancel|delete|remove)\\s+(?:the\\s+)?(?:task\\s+)?" + REF + "\\s*[.!]?$", FLAGS);

    private static final Pattern PROGRESS_TRAILING = Pattern.compile(
            "^(?:task\\s+)?" + REF_OR_NUMBER + SEP + "(?:progress\\s+)?(?:is\\s+|at\\s+|to\\s+)?(\\d+)\\s*%?\\s*$", FLAGS);
    private static final Pattern PROGRESS_VERB_FIRST = Pattern.compile(
            "^(?:update|set)\\s+(?:task\\s+)?" + REF_OR_NUMBER + SEP + "(?:progress\\s+)?(?:to\\s+)?(\\d+)\\s*%?\\s*$", FLAGS);
    private static final Pattern PROGRESS_LEADING = Pattern.compile(
            "^progress\\s+(?:of\\s+|for\\s+)?(?:task\\s+)?" + REF_OR_NUMBER + SEP + "(?:is\\s+|to\\s+|at\\s+)?(\\d+)\\s*%?\\s*$", FLAGS);

    private static final Pattern UPDATE_AFTER_REF = Pattern.compile(
            "^(?:update\\s+)?(?:task\\s+)?" + REF + SEP + "(.+)$", FLAGS);
    private static final Pattern UPDATE_KEYWORD_FIRST = Pattern.compile(
            "^(?:add\\s+)?(?:an?\\s+)?(?:update|comment|note)\\s+(?:to\\s+|on\\s+|for\\s+)?(?:task\\s+)?" + REF + SEP + "(.+)$", FLAGS);

    private static final Pattern BLOCKED_AFTER_REF = Pattern.compile(
            "^(?:task\\s+)?" + REF + "\\s+(?:is\\s+)?blocked(?:\\s*:\\s*|\\s+by\\s+|\\s+because\\s+(?:of\\s+)?|\\s+)(.+)$", FLAGS);
    private static final Pattern BLOCKER_FIRST = Pattern.compile(
            "^blocker\\s+(?:for\\s+|on\\s+)?(?:task\\s+)?" + REF + SEP + "(.+)$", FLAGS);

    private final TaskDetailsParser taskDetailsParser;
    private final TimeExpressionParser timeExpressionParser;
    private final List<IntentRule> rules;

    public IntentRuleTable(TaskDetailsParser taskDetailsParser, TimeExpressionParser timeExpressionParser) {
        this.taskDetailsParser = taskDetailsParser;
        this.timeExpressionParser = timeExpressionParser;
        this.rules = List.of(
                new IntentRule("combined-status-progress", this::combinedStatusProgress),
                new IntentRule("help", in -> exact(in, HELP_WORDS, IntentKind.HELP)),
                new IntentRule("welcome", in -> exact(in, WELCOME_WORDS, IntentKind.WELCOME)),
                new IntentRule("status-summary", in -> exact(in, STATUS_WORDS_SUMMARY, IntentKind.STATUS)),
                new IntentRule("list-tasks", this::listTasks),
                new IntentRule("list-deadlines", in -> listPhrase(in, LIST_DEADLINES, IntentKind.LIST_DEADLINES)),
                new IntentRule("list-reminders", in -> listPhrase(in, LIST_REMINDERS, IntentKind.LIST_REMINDERS)),
                new IntentRule("list-meetings", this::listMeetings),
                new IntentRule("view-task", this::viewTask),
                new IntentRule("create-task", this::createTask),
                new IntentRule("assign-task", this::assignTask),
                new IntentRule("cancel-reminder", this::cancelReminder),
                new IntentRule("set-reminder", this::setReminder),
                new IntentRule("schedule-meeting", this::scheduleMeeting),
                new IntentRule("update-status", this::updateStatus),
                new IntentRule("cancel-task", this::cancelTask),
                new IntentRule("update-progress", this::updateProgress),
                new IntentRule("add-update", this::addUpdate),
                new IntentRule("report-blocker", this::reportBlocker)
        );
    }

    public List<IntentRule> rules() {
        return rules;
    }

    private Optional<Intent> combinedStatusProgress(IntentRule.Input in) {
        Matcher ref = ANY_REF.matcher(in.text());
        if (!ref.find() || isReminderReference(ref.group(1))) {
            return Optional.empty();
        }
        Matcher progress = PERCENT.matcher(in.text());
        Matcher status = STATUS_KEYWORD.matcher(in.text());
        if (!progress.find() || !status.find()) {
            return Optional.empty();
        }
        return intent(IntentKind.UPDATE_STATUS_AND_PROGRESS, in,
                Slot.TASK_ID, ref.group(1),
                Slot.STATUS, status.group(1),
                Slot.PROGRESS, progress.group(1));
    }

    private Optional<Intent> exact(IntentRule.Input in, Set<String> words, IntentKind kind) {
        String normalized = in.lower().replaceAll("[!.]+$", "").trim();
        return words.contains(normalized) ? Optional.of(Intent.of(kind, in.text())) : Optional.empty();
    }

    private Optional<Intent> listTasks(IntentRule.Input in) {
        if (!isQueryLike(in) || !LIST_TASKS.matcher(in.lower()).find()) {
            return Optional.empty();
        }
        String lower = in.lower();
        Map<String, String> slots = new LinkedHashMap<>();
        String status = null;
        if (lower.contains("pending")) {
            status = "pending";
        }
        if (lower.contains("in-progress") || lower.contains("in progress")) {
            status = "in-progress";
        }
        if (lower.contains("completed") || lower.contains("done")) {
            status = "completed";
        }
        if (lower.contains("blocked")) {
            status = "blocked";
        }
        slots.put(Slot.STATUS_FILTER, status);
        if (lower.contains("high priority")) {
            slots.put(Slot.PRIORITY_FILTER, TaskPriority.HIGH.wireName());
        }
        if (lower.contains("critical")) {
            slots.put(Slot.PRIORITY_FILTER, TaskPriority.CRITICAL.wireName());
        }
        if (lower.contains("overdue")) {
            slots.put(Slot.OVERDUE_FILTER, "true");
        }
        return Optional.of(Intent.of(IntentKind.LIST_TASKS, slots, in.text()));
    }

    private Optional<Intent> listPhrase(IntentRule.Input in, Pattern phrase, IntentKind kind) {
        if (!isQueryLike(in) || !phrase.matcher(in.lower()).find()) {
            return Optional.empty();
        }
        return Optional.of(Intent.of(kind, in.text()));
    }

    private Optional<Intent> listMeetings(IntentRule.Input in) {
        if (!isQueryLike(in) || !LIST_MEETINGS.matcher(in.lower()).find()) {
            return Optional.empty();
        }
        String lower = in.lower();
        String period = "today";
        if (lower.contains("tomorrow")) {
            period = "tomorrow";
        } else if (lower.contains("week")) {
            period = "week";
        } else if (lower.contains("all") || lower.contains("upcoming")) {
            period = "all";
        }
        return intent(IntentKind.LIST_MEETINGS, in, Slot.PERIOD, period);
    }

    private Optional<Intent> viewTask(IntentRule.Input in) {
        Matcher m = VIEW_TASK.matcher(in.text());
        if (!m.matches() || isReminderReference(m.group(1))) {
            return Optional.empty();
        }
        return intent(IntentKind.VIEW_TASK, in, Slot.TASK_ID, m.group(1));
    }

    private Optional<Intent> createTask(IntentRule.Input in) {
        String body = null;
        Matcher called = CREATE_CALLED.matcher(in.text());
        Matcher create = CREATE_TASK.matcher(in.text());
        Matcher shortForm = CREATE_TASK_SHORT.matcher(in.text());
        if (called.matches()) {
            body = called.group(1);
        } else if (create.matches()) {
            body = create.group(1);
            if (FOR_ASSIGNEE.matcher(body.trim()).find()) {
                return Optional.empty();
            }
        } else if (shortForm.matches()) {
            body = shortForm.group(1);
        }
        if (body == null) {
            return Optional.empty();
        }
        TaskDetailsParser.TaskDetails details = taskDetailsParser.parse(body, in.now());
        return Optional.of(Intent.of(IntentKind.CREATE_TASK, detailSlots(details), in.text()));
    }

    private Optional<Intent> assignTask(IntentRule.Input in) {
        String title;
        String assigneePart;
        Matcher titleFirst = ASSIGN_TITLE_FIRST.matcher(in.text());
        Matcher bare = ASSIGN_BARE.matcher(in.text());
        Matcher assigneeFirst = ASSIGN_ASSIGNEE_FIRST.matcher(in.text());
        if (assigneeFirst.matches()) {
            assigneePart = assigneeFirst.group(1);
            title = assigneeFirst.group(2);
        } else if (titleFirst.matches()) {
            title = titleFirst.group(1);
            assigneePart = titleFirst.group(2);
        } else if (bare.matches() && !ANY_REF.matcher(bare.group(1)).find()) {
            title = bare.group(1);
            assigneePart = bare.group(2);
        } else {
            return Optional.empty();
        }

        String assignee = assigneePart.trim();
        String extra = "";
        int comma = assignee.indexOf(',');
        if (comma > 0) {
            extra = assignee.substring(comma + 1).trim();
            assignee = assignee.substring(0, comma).trim();
        }
        assignee = assignee.replaceAll("[.!]+$", "").trim();

        String detailText = extra.isEmpty() ? title : title + ", " + extra;
        TaskDetailsParser.TaskDetails details = taskDetailsParser.parse(detailText, in.now());
        Map<String, String> slots = detailSlots(details);
        slots.put(Slot.ASSIGNEE_NAME, assignee);
        return Optional.of(Intent.of(IntentKind.ASSIGN_TASK, slots, in.text()));
    }

    private Optional<Intent> cancelReminder(IntentRule.Input in) {
        Matcher byRef = CANCEL_REMINDER_BY_REF.matcher(in.text());
        if (byRef.matches()) {
            return intent(IntentKind.CANCEL_REMINDER, in, Slot.REMINDER_ID, byRef.group(1));
        }
        Matcher m = CANCEL_REMINDER.matcher(in.text());
        if (!m.matches()) {
            return Optional.empty();
        }
        String id = m.group(2);
        if (id != null && "meeting".equalsIgnoreCase(m.group(1)) && !isReminderReference(id)) {
            id = "MTG-" + id;
        }
        return intent(IntentKind.CANCEL_REMINDER, in, Slot.REMINDER_ID, id);
    }

    private Optional<Intent> setReminder(IntentRule.Input in) {
        String body;
        Matcher remindMe = REMIND_ME.matcher(in.text());
        Matcher setReminder = SET_REMINDER.matcher(in.text());
        if (remindMe.matches()) {
            body = remindMe.group(1);
        } else if (setReminder.matches()) {
            body = setReminder.group(1);
        } else {
            return Optional.empty();
        }

        Map<String, String> slots = new LinkedHashMap<>();
        String title = body;
        Optional<TimeExpressionParser.Extraction> time = timeExpressionParser.extract(body, in.now());
        if (time.isPresent()) {
            slots.put(Slot.REMINDER_TIME, time.get().time().toString());
            title = time.get().remainder();
        }
        title = LEADING_FILLER.matcher(title.trim()).replaceFirst("").trim();
        slots.put(Slot.REMINDER_TITLE, title);
        slots.put(Slot.REMINDER_MESSAGE, title);
        return Optional.of(Intent.of(IntentKind.SET_REMINDER, slots, in.text()));
    }

    private Optional<Intent> scheduleMeeting(IntentRule.Input in) {
        Matcher m = SCHEDULE_MEETING.matcher(in.text());
        if (!m.matches()) {
            return Optional.empty();
        }
        String rest = m.group(1).trim();
        Map<String, String> slots = new LinkedHashMap<>();

        Optional<TimeExpressionParser.Extraction> time = timeExpressionParser.extract(rest, in.now());
        if (time.isPresent()) {
            slots.put(Slot.REMINDER_TIME, time.get().time().toString());
            rest = time.get().remainder();
        }

        Matcher with = MEETING_WITH.matcher(rest);
        if (with.find()) {
            slots.put(Slot.MEETING_WITH, with.group(1).trim());
            rest = (rest.substring(0, with.start()) + " " + rest.substring(with.end())).trim();
        }
        Matcher subject = MEETING_SUBJECT.matcher(rest);
        if (subject.find()) {
            slots.put(Slot.MEETING_SUBJECT, subject.group(1).trim());
            rest = (rest.substring(0, subject.start()) + " " + rest.substring(subject.end())).trim();
        }
        Matcher location = MEETING_LOCATION.matcher(rest);
        if (location.find()) {
            slots.put(Slot.MEETING_LOCATION, location.group(1).trim());
            rest = (rest.substring(0, location.start()) + " " + rest.substring(location.end())).trim();
        }
        rest = rest.replaceAll("^[\\s,:]+|[\\s,.]+$", "").trim();
        if (!slots.containsKey(Slot.MEETING_SUBJECT) && !rest.isEmpty()) {
            slots.put(Slot.MEETING_SUBJECT, rest);
        }
        return Optional.of(Intent.of(IntentKind.SCHEDULE_MEETING, slots, in.text()));
    }

    private Optional<Intent> updateStatus(IntentRule.Input in) {
        Matcher trailing = STATUS_TRAILING.matcher(in.text());
        if (trailing.matches() && !isReminderReference(trailing.group(1))) {
            return intent(IntentKind.UPDATE_STATUS, in, Slot.TASK_ID, trailing.group(1), Slot.STATUS, trailing.group(2));
        }
        Matcher verbFirst = STATUS_VERB_FIRST.matcher(in.text());
        if (verbFirst.matches() && !isReminderReference(verbFirst.group(1))) {
            return intent(IntentKind.UPDATE_STATUS, in, Slot.TASK_ID, verbFirst.group(1), Slot.STATUS, verbFirst.group(2));
        }
        Matcher imperative = STATUS_IMPERATIVE.matcher(in.text());
        if (imperative.matches() && !isReminderReference(imperative.group(2))) {
            String status = switch (imperative.group(1).toLowerCase(Locale.ROOT)) {
                case "complete", "finish" -> "completed";
                case "start" -> "in-progress";
                case "block" -> "blocked";
                default -> "pending";
            };
            return intent(IntentKind.UPDATE_STATUS, in, Slot.TASK_ID, imperative.group(2), Slot.STATUS, status);
        }
        return Optional.empty();
    }

    private Optional<Intent> cancelTask(IntentRule.Input in) {
        Matcher m = CANCEL_TASK.matcher(in.text());
        if (!m.matches() || isReminderReference(m.group(1))) {
            return Optional.empty();
        }
        return intent(IntentKind.CANCEL_TASK, in, Slot.TASK_ID, m.group(1));
    }

    private Optional<Intent> updateProgress(IntentRule.Input in) {
        for (Pattern pattern : List.of(PROGRESS_TRAILING, PROGRESS_VERB_FIRST, PROGRESS_LEADING)) {
            Matcher m = pattern.matcher(in.text());
            if (m.matches() && !isReminderReference(m.group(1))) {
                return intent(IntentKind.UPDATE_PROGRESS, in, Slot.TASK_ID, m.group(1), Slot.PROGRESS, m.group(2));
            }
        }
        return Optional.empty();
    }

    private Optional<Intent> addUpdate(IntentRule.Input in) {
        for (Pattern pattern : List.of(UPDATE_AFTER_REF, UPDATE_KEYWORD_FIRST)) {
            Matcher m = pattern.matcher(in.text());
            if (!m.matches() || isReminderReference(m.group(1))) {
                continue;
            }
            String message = m.group(2).trim();
            if (BARE_PERCENTAGE.matcher(message).matches() || UPDATE_STATUS_WORD.matcher(message).find()) {
                continue;
            }
            return intent(IntentKind.ADD_UPDATE, in, Slot.TASK_ID, m.group(1), Slot.MESSAGE, message);
        }
        return Optional.empty();
    }

    private Optional<Intent> reportBlocker(IntentRule.Input in) {
        for (Pattern pattern : List.of(BLOCKED_AFTER_REF, BLOCKER_FIRST)) {
            Matcher m = pattern.matcher(in.text());
            if (m.matches() && !isReminderReference(m.group(1))) {
                return intent(IntentKind.REPORT_BLOCKER, in, Slot.TASK_ID, m.group(1), Slot.BLOCKER, m.group(2).trim());
            }
        }
        return Optional.empty();
    }

    private boolean isQueryLike(IntentRule.Input in) {
        return !in.text().contains(":") && !ANY_REF.matcher(in.text()).find();
    }

    private boolean isReminderReference(String reference) {
        String upper = reference.toUpperCase(Locale.ROOT);
        return upper.startsWith("REM-") || upper.startsWith("MTG-");
    }

    private Map<String, String> detailSlots(TaskDetailsParser.TaskDetails details) {
        Map<String, String> slots = new LinkedHashMap<>();
        slots.put(Slot.TITLE, details.title());
        slots.put(Slot.DESCRIPTION, details.description());
        slots.put(Slot.PRIORITY, details.priority() == null ? null : details.priority().wireName());
        slots.put(Slot.DEADLINE, details.deadline() == null ? null : details.deadline().toString());
        return slots;
    }

    private Optional<Intent> intent(IntentKind kind, IntentRule.Input in, String... pairs) {
        Map<String, String> slots = new LinkedHashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            slots.put(pairs[i], pairs[i + 1]);
        }
        return Optional.of(Intent.of(kind, slots, in.text()));
    }
}
