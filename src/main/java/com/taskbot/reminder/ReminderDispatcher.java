package com.taskbot.reminder;

import com.taskbot.config.ReminderProperties;
import com.taskbot.messaging.NotificationChannel;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the deadline, personal reminder and digest scans on a fixed delay. Scans never overlap.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReminderDispatcher {

    private final ThreadPoolTaskScheduler reminderTaskScheduler;
    private final ReminderProperties properties;
    private final NotificationChannel notificationChannel;
    private final TaskDeadlineNotifier taskDeadlineNotifier;
    private final PersonalReminderNotifier personalReminderNotifier;
    private final DailyDigestNotifier dailyDigestNotifier;
    private final Clock clock;

    private final AtomicBoolean scanning = new AtomicBoolean(false);
    private ScheduledFuture<?> future;

    public synchronized boolean start() {
        if (!notificationChannel.isConfigured()) {
            log.warn("Reminder dispatcher not started: WhatsApp channel is not configured.");
            return false;
        }
        if (future != null) {
            log.info("Reminder dispatcher already running.");
            return false;
        }
        future = reminderTaskScheduler.scheduleWithFixedDelay(this::tick, properties.resolveTickInterval());
        log.info("Reminder dispatcher started. interval={}, leadTimes={}",
                properties.resolveTickInterval(), properties.resolveLeadTimes());
        return true;
    }

    @PreDestroy
    public synchronized void stop() {
        if (future == null) {
            return;
        }
        future.cancel(false);
        future = null;
        log.info("Reminder dispatcher stopped.");
    }

    public synchronized boolean isRunning() {
        return future != null;
    }

    void tick() {
        try {
            runOnce();
        } catch (Exception e) {
            log.error("Reminder scan failed. error={}", e.getMessage(), e);
        }
    }

    public ReminderScanReport runOnce() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (!notificationChannel.isConfigured()) {
            return ReminderScanReport.skipped(now, "WhatsApp channel is not configured");
        }
        if (!scanning.compareAndSet(false, true)) {
            log.info("Previous reminder scan still running, skipping tick.");
            return ReminderScanReport.skipped(now, "Previous scan still running");
        }
        try {
            int deadlines = taskDeadlineNotifier.scan(now);
            int personal = personalReminderNotifier.scan(now);
            int digests = dailyDigestNotifier.runIfDue(now);
            if (deadlines + personal + digests > 0) {
                log.info("Reminder scan done. deadlineReminders={}, personalReminders={}, digests={}",
                        deadlines, personal, digests);
            }
            return new ReminderScanReport(now, false, null, deadlines, personal, digests);
        } finally {
            scanning.set(false);
        }
    }
}
