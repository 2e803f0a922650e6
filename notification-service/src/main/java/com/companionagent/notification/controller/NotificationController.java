package com.companionagent.notification.controller;

import com.companionagent.common.model.CritiqueReviewNotification;
import com.companionagent.notification.sender.SlackWebhookSender;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/notify")
public class NotificationController {

    private final SlackWebhookSender slackSender;

    public NotificationController(SlackWebhookSender slackSender) {
        this.slackSender = slackSender;
    }

    @PostMapping("/critique")
    public ResponseEntity<Void> notifyCritique(@RequestBody CritiqueReviewNotification notification) {
        if (notification.turnId() == null || notification.turnId().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        slackSender.sendCritique(notification);
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
