package com.carrental.controller;

import com.carrental.model.Notification;
import com.carrental.model.User;
import com.carrental.repository.UserRepository;
import com.carrental.service.NotificationService;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Controller
@RequestMapping("/notifications")
public class NotificationsController {

    private final NotificationService notificationService;
    private final UserRepository userRepository;

    public NotificationsController(NotificationService notificationService, UserRepository userRepository) {
        this.notificationService = notificationService;
        this.userRepository = userRepository;
    }

    private User currentUser(Authentication authentication) {
        return userRepository.findByUsername(authentication.getName()).orElseThrow();
    }

    @GetMapping
    @ResponseBody
    public List<Notification> list(Authentication authentication) {
        return notificationService.listFor(currentUser(authentication));
    }

    @PostMapping("/{id}/read")
    @ResponseBody
    public Map<String, Object> markRead(@PathVariable Long id, Authentication authentication) {
        return Map.of("success", notificationService.markAsRead(id, currentUser(authentication)));
    }

    @PostMapping("/read-all")
    @ResponseBody
    public Map<String, Object> markAllRead(Authentication authentication) {
        int updated = notificationService.markAllAsRead(currentUser(authentication));
        return Map.of("success", true, "updated", updated);
    }

    @GetMapping("/unread-count")
    @ResponseBody
    public Map<String, Object> unreadCount(Authentication authentication) {
        return Map.of("count", notificationService.unreadCount(currentUser(authentication)));
    }
}
