package com.taskbot.config;

import com.taskbot.domain.enums.UserRole;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

@ConfigurationProperties(prefix = "app.assistant")
public record AssistantProperties(
        String brand,
        String timezone,
        Duration conversationTtl,
        List<String> cancelKeywords,
        String adminToken,
        Set<UserRole> managerRoles
) {
    public String resolveBrand() {
        return brand == null || brand.isBlank() ? "TaskBot" : brand.trim();
    }

    public ZoneId resolveZone() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.of("Asia/Karachi");
        }
        return ZoneId.of(timezone.trim());
    }

    public Duration resolveConversationTtl() {
        return conversationTtl == null || conversationTtl.isZero() ? Duration.ofMinutes(5) : conversationTtl;
    }

    public boolean isCancelKeyword(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        List<String> keywords = cancelKeywords == null || cancelKeywords.isEmpty()
                ? List.of("cancel", "abort", "nevermind", "never mind")
                : cancelKeywords;
        return keywords.stream().anyMatch(k -> k.trim().equalsIgnoreCase(normalized));
    }

    public boolean hasAdminToken() {
        return adminToken != null && !adminToken.isBlank();
    }

    public boolean isManager(UserRole role) {
        return role != null && resolveManagerRoles().contains(role);
    }

    public Set<UserRole> resolveManagerRoles() {
        if (managerRoles == null || managerRoles.isEmpty()) {
            return Arrays.stream(UserRole.values())
                    .filter(UserRole::isManager)
                    .collect(Collectors.toCollection(() -> EnumSet.noneOf(UserRole.class)));
        }
        return EnumSet.copyOf(managerRoles);
    }
}
