package com.carrental.service;

import com.carrental.model.Notification;
import com.carrental.model.NotificationType;
import com.carrental.model.User;
import com.carrental.repository.NotificationRepository;
import com.carrental.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Service
public class NotificationService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationRepository notificationRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    public NotificationService(NotificationRepository notificationRepository,
                               UserRepository userRepository,
                               Clock clock) {
        this.notificationRepository = notificationRepository;
        this.userRepository = userRepository;
        this.clock = clock;
    }

    @Transactional
    public Notification create(User user, String title, String message, NotificationType type) {
        Notification n = new Notification();
        n.setUser(user);
        n.setTitle(title);
        n.setMessage(message);
        n.setType(type != null ? type : NotificationType.INFO);
        n.setRead(false);
        n.setCreatedAt(LocalDateTime.now(clock));
        return notificationRepository.save(n);
    }

    /** Sends the same notification to every staff member and manager. */
    @Transactional
    public int notifyStaff(String title, String message, NotificationType type) {
        List<User> staff = userRepository.findByRoleInOrderByCreatedAtDesc(
                List.of(User.ROLE_STAFF, User.ROLE_MANAGER));
        staff.forEach(u -> create(u, title, message, type));
        logger.info("Notified {} staff members: {}", staff.size(), title);
        return staff.size();
    }

    @Transactional(readOnly = true)
    public List<Notification> listFor(User user) {
        return notificationRepository.findByUserIdOrderByCreatedAtDesc(user.getId());
    }

    /** Marks one of the user's own notifications read. False when it does not exist or belongs to someone else. */
    @Transactional
    public boolean markAsRead(Long notificationId, User user) {
        return notificationRepository.findByIdAndUserId(notificationId, user.getId())
                .map(n -> {
                    n.setRead(true);
                    notificationRepository.save(n);
                    return true;
                })
                .orElse(false);
    }

    @Transactional
    public int markAllAsRead(User user) {
        List<Notification> unread = notificationRepository.findByUserIdAndReadFalse(user.getId());
        unread.forEach(n -> n.setRead(true));
        notificationRepository.saveAll(unread);
        return unread.size();
    }

    @Transactional(readOnly = true)
    public long unreadCount(User user) {
        return notificationRepository.countByUserIdAndReadFalse(user.getId());
    }
}
