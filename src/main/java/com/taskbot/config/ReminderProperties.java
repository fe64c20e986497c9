package com.taskbot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.LocalTime;
import java.util.Comparator;
import java.util.List;

@ConfigurationProperties(prefix = "app.reminders")
public record ReminderProperties(
        boolean enabled,
        Duration tickInterval,
        Duration dueLookback,
        Duration leadTimeWindow,
        List<LeadTime> leadTimes,
        boolean digestEnabled,
        String digestTime
) {

    public record LeadTime(int minutes, String label) {
    }

    public Duration resolveTickInterval() {
        return tickInterval == null || tickInterval.isZero() ? Duration.ofSeconds(60) : tickInterval;
    }

    public Duration resolveDueLookback() {
        return dueLookback == null ? Duration.ofMinutes(5) : dueLookback;
    }

    public Duration resolveLeadTimeWindow() {
        return leadTimeWindow == null ? Duration.ofSeconds(30) : leadTimeWindow;
    }

    /**
     * Configured lead times, longest first. Falls back to 1 day / 4 hours / 1 hour / 30 minutes.
     */
    public List<LeadTime> resolveLeadTimes() {
        if (leadTimes == null || leadTimes.isEmpty()) {
            return List.of(
                    new LeadTime(1440, "1 day"),
                    new LeadTime(240, "4 hours"),
                    new LeadTime(60, "1 hour"),
                    new LeadTime(30, "30 minutes"));
        }
        return leadTimes.stream()
                .sorted(Comparator.comparingInt(LeadTime::minutes).reversed())
                .toList();
    }

    public LocalTime resolveDigestTime() {
        if (digestTime == null || digestTime.isBlank()) {
            return LocalTime.of(10, 30);
        }
        return LocalTime.parse(digestTime.trim());
    }
}
