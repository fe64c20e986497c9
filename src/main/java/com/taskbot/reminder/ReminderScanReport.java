package com.taskbot.reminder;

import java.time.OffsetDateTime;

public record ReminderScanReport(
        OffsetDateTime ranAt,
        boolean skipped,
        String skipReason,
        int deadlineRemindersSent,
        int personalRemindersSent,
        int digestsSent
) {
    public static ReminderScanReport skipped(OffsetDateTime ranAt, String reason) {
        return new ReminderScanReport(ranAt, true, reason, 0, 0, 0);
    }
}
