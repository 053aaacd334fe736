package com.dbmaster.controller;

import com.dbmaster.model.Notification;
import com.dbmaster.model.NotificationPreferences;
import com.dbmaster.notification.NotificationService;
import com.dbmaster.web.CurrentUser;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/notifications")
public class NotificationController {

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping
    public ResponseEntity<List<Notification>> list(
            @CurrentUser String userId,
            @RequestParam(value = "limit", required = false, defaultValue = "50") int limit) {
        return ResponseEntity.ok(notificationService.listForOwner(userId, limit));
    }

    @PostMapping("/{notificationId}/read")
    public ResponseEntity<Notification> markRead(@CurrentUser String userId, @PathVariable("notificationId") String notificationId) {
        return ResponseEntity.ok(notificationService.markRead(userId, notificationId));
    }

    @GetMapping("/preferences")
    public ResponseEntity<NotificationPreferences> getPreferences(@CurrentUser String userId) {
        return ResponseEntity.ok(notificationService.getPreferences(userId));
    }

    @PutMapping("/preferences")
    public ResponseEntity<NotificationPreferences> updatePreferences(
            @CurrentUser String userId,
            @RequestBody NotificationPreferences preferences) {
        return ResponseEntity.ok(notificationService.updatePreferences(userId, preferences));
    }
}
