package com.taskbot.controller;

import com.taskbot.config.AssistantProperties;
import com.taskbot.config.ReminderProperties;
import com.taskbot.dto.SendTestRequest;
import com.taskbot.exception.MessageDeliveryException;
import com.taskbot.messaging.DeliveryReceipt;
import com.taskbot.messaging.MessageTemplates;
import com.taskbot.messaging.NotificationChannel;
import com.taskbot.reminder.DailyDigestNotifier;
import com.taskbot.reminder.ReminderDispatcher;
import com.taskbot.reminder.ReminderScanReport;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/whatsapp")
public class WhatsAppAdminController {

    private final NotificationChannel notificationChannel;
    private final ReminderDispatcher reminderDispatcher;
    private final DailyDigestNotifier dailyDigestNotifier;
    private final ReminderProperties reminderProperties;
    private final AssistantProperties assistantProperties;
    private final MessageTemplates templates;
    private final Clock clock;

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status(
            @RequestHeader(value = "X-Admin-Token", required = false) String adminToken) {
        if (!authorized(adminToken)) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        List<String> leadTimes = reminderProperties.resolveLeadTimes().stream()
                .map(ReminderProperties.LeadTime::label)
                .toList();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("configured", notificationChannel.isConfigured());
        body.put("dispatcherRunning", reminderDispatcher.isRunning());
        body.put("leadTimes", leadTimes);
        body.put("digestEnabled", reminderProperties.digestEnabled());
        body.put("digestTime", reminderProperties.resolveDigestTime().toString());
        body.put("timezone", assistantProperties.resolveZone().getId());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/trigger-reminders")
    public ResponseEntity<ReminderScanReport> triggerReminders(
            @RequestHeader(value = "X-Admin-Token", required = false) String adminToken) {
        if (!authorized(adminToken)) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        ReminderScanReport report = reminderDispatcher.runOnce();
        log.info("Manual reminder scan. report={}", report);
        return ResponseEntity.ok(report);
    }

    @PostMapping("/trigger-digest")
    public ResponseEntity<Map<String, Object>> triggerDigest(
            @RequestHeader(value = "X-Admin-Token", required = false) String adminToken) {
        if (!authorized(adminToken)) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        if (!notificationChannel.isConfigured()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("success", false, "error", "WhatsApp channel is not configured"));
        }
        int sent = dailyDigestNotifier.sendDigest(OffsetDateTime.now(clock));
        return ResponseEntity.ok(Map.of("success", true, "sent", sent));
    }

    @PostMapping("/send-test")
    public ResponseEntity<Map<String, Object>> sendTest(
            @RequestHeader(value = "X-Admin-Token", required = false) String adminToken,
            @Valid @RequestBody SendTestRequest request) {
        if (!authorized(adminToken)) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        if (!notificationChannel.isConfigured()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("success", false, "error", "WhatsApp channel is not configured"));
        }
        try {
            DeliveryReceipt receipt = notificationChannel.send(request.phoneNumber(), templates.testMessage(request.message()));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("sid", receipt == null ? null : receipt.sid());
            body.put("status", receipt == null ? null : receipt.status());
            return ResponseEntity.ok(body);
        } catch (MessageDeliveryException e) {
            log.error("Test message failed. to={}, error={}", request.phoneNumber(), e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(Map.of("success", false, "error", e.getMessage()));
        }
    }

    private boolean authorized(String adminToken) {
        return !assistantProperties.hasAdminToken() || assistantProperties.adminToken().equals(adminToken);
    }
}
