package com.carrental.service;

import com.carrental.dto.RegistrationForm;
import com.carrental.dto.UserRowDto;
import com.carrental.exception.BusinessException;
import com.carrental.exception.NotFoundException;
import com.carrental.model.Appointment;
import com.carrental.model.AppointmentStatus;
import com.carrental.model.User;
import com.carrental.repository.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Stream;

/**
 * Registration and user administration for staff (customers) and managers (everyone).
 */
@Service
public class AccountService {

    private static final Logger logger = LoggerFactory.getLogger(AccountService.class);

    static final int MIN_PASSWORD_LENGTH = 6;

    private final UserRepository userRepository;
    private final AppointmentRepository appointmentRepository;
    private final ReviewRepository reviewRepository;
    private final FavoriteRepository favoriteRepository;
    private final NotificationRepository notificationRepository;
    private final PasswordEncoder passwordEncoder;
    private final EmailService emailService;
    private final Clock clock;

    public AccountService(UserRepository userRepository,
                          AppointmentRepository appointmentRepository,
                          ReviewRepository reviewRepository,
                          FavoriteRepository favoriteRepository,
                          NotificationRepository notificationRepository,
                          PasswordEncoder passwordEncoder,
                          EmailService emailService,
                          Clock clock) {
        this.userRepository = userRepository;
        this.appointmentRepository = appointmentRepository;
        this.reviewRepository = reviewRepository;
        this.favoriteRepository = favoriteRepository;
        this.notificationRepository = notificationRepository;
        this.passwordEncoder = passwordEncoder;
        this.emailService = emailService;
        this.clock = clock;
    }

    public User getById(Long id) {
        return userRepository.findById(id).orElseThrow(() -> NotFoundException.of("User", id));
    }

    public User getByUsername(String username) {
        return userRepository.findByUsername(username)
                .orElseThrow(() -> new NotFoundException("User not found: " + username));
    }

    /**
     * Problems with a password, empty when it is acceptable: at least 6 characters with a digit,
     * a lower-case and an upper-case letter.
     */
    public static List<String> passwordProblems(String password) {
        List<String> problems = new ArrayList<>();
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            problems.add("Password must be at least 6 characters long.");
            return problems;
        }
        if (password.chars().noneMatch(Character::isDigit)) problems.add("Password must contain a digit.");
        if (password.chars().noneMatch(Character::isLowerCase)) problems.add("Password must contain a lower-case letter.");
        if (password.chars().noneMatch(Character::isUpperCase)) problems.add("Password must contain an upper-case letter.");
        return problems;
    }

    @Transactional
    public User registerCustomer(RegistrationForm form) {
        User user = createUser(form, User.ROLE_CUSTOMER);
        emailService.sendWelcomeEmail(user.getUsername(), user.getFullName());
        return user;
    }

    @Transactional
    public User createStaff(RegistrationForm form) {
        return createUser(form, User.ROLE_STAFF);
    }

    private User createUser(RegistrationForm form, String role) {
        String email = form.getEmail() == null ? "" : form.getEmail().trim().toLowerCase(Locale.ROOT);
        if (email.isEmpty()) {
            throw new BusinessException("Email is required.");
        }
        if (userRepository.existsByUsernameIgnoreCase(email)) {
            throw new BusinessException("An account with this email already exists.");
        }
        List<String> problems = passwordProblems(form.getPassword());
        if (!problems.isEmpty()) {
            throw new BusinessException(String.join(" ", problems));
        }
        if (form.getConfirmPassword() != null && !form.getConfirmPassword().equals(form.getPassword())) {
            throw new BusinessException("Passwords do not match.");
        }

        User u = new User();
        u.setUsername(email);
        u.setPassword(passwordEncoder.encode(form.getPassword()));
        u.setRole(role);
        u.setEnabled(true);
        u.setFirstName(form.getFirstName());
        u.setLastName(form.getLastName());
        u.setPhone(form.getPhone());
        u.setCreatedAt(LocalDateTime.now(clock));
        User saved = userRepository.save(u);
        logger.info("Registered {} account {}", role, email);
        return saved;
    }

    @Transactional
    public User updateProfilePicture(User user, String url) {
        user.setProfilePictureUrl(url);
        return userRepository.save(user);
    }

    @Transactional
    public User toggleEnabled(Long userId, User actor) {
        User u = getById(userId);
        if (u.getId().equals(actor.getId())) {
            throw new BusinessException("You cannot disable your own account.");
        }
        u.setEnabled(!u.isEnabled());
        logger.info("User {} enabled -> {} (by {})", u.getUsername(), u.isEnabled(), actor.getUsername());
        return userRepository.save(u);
    }

    @Transactional
    public User toggleCustomerEnabled(Long userId, User actor) {
        requireRole(getById(userId), User.ROLE_CUSTOMER, "Only customer accounts can be managed here.");
        return toggleEnabled(userId, actor);
    }

    @Transactional
    public User toggleStaffEnabled(Long userId, User actor) {
        requireRole(getById(userId), User.ROLE_STAFF, "Only staff accounts can be managed here.");
        return toggleEnabled(userId, actor);
    }

    private static void requireRole(User u, String role, String message) {
        if (!role.equals(u.getRole())) {
            throw new BusinessException(message);
        }
    }

    /**
     * Deletes a user with their reviews, favorites and notifications. Their bookings stay, detached
     * from the account, with the customer snapshot intact.
     */
    @Transactional
    public void deleteUser(Long userId, User actor) {
        User u = getById(userId);
        if (u.getId().equals(actor.getId())) {
            throw new BusinessException("You cannot delete your own account.");
        }
        reviewRepository.deleteAll(reviewRepository.findByUserId(userId));
        favoriteRepository.deleteAll(favoriteRepository.findByUserIdOrderByCreatedAtDesc(userId));
        notificationRepository.deleteAll(notificationRepository.findByUserIdOrderByCreatedAtDesc(userId));
        List<Appointment> bookings = appointmentRepository.findByCustomerId(userId);
        bookings.forEach(a -> a.setCustomer(null));
        appointmentRepository.saveAll(bookings);
        userRepository.delete(u);
        logger.info("User {} deleted by {}", u.getUsername(), actor.getUsername());
    }

    /** Only deletes staff accounts. */
    @Transactional
    public void deleteStaff(Long userId, User actor) {
        requireRole(getById(userId), User.ROLE_STAFF, "Only staff accounts can be removed here.");
        deleteUser(userId, actor);
    }

    public List<UserRowDto> listStaff() {
        return rows(userRepository.findByRoleInOrderByCreatedAtDesc(List.of(User.ROLE_STAFF, User.ROLE_MANAGER)).stream());
    }

    public List<UserRowDto> listCustomers(String search) {
        return rows(userRepository.findByRoleOrderByCreatedAtDesc(User.ROLE_CUSTOMER).stream()
                .filter(u -> matches(u, search)));
    }

    /** All users filtered by search text, role and status ("active" / "inactive"). */
    public List<UserRowDto> listUsers(String search, String role, String status) {
        Stream<User> stream = userRepository.findAllByOrderByCreatedAtDesc().stream()
                .filter(u -> matches(u, search));
        if (role != null && !role.isBlank() && !"All".equalsIgnoreCase(role)) {
            stream = stream.filter(u -> role.trim().equalsIgnoreCase(u.getRole()));
        }
        if ("active".equalsIgnoreCase(status)) {
            stream = stream.filter(User::isEnabled);
        } else if ("inactive".equalsIgnoreCase(status)) {
            stream = stream.filter(u -> !u.isEnabled());
        }
        return rows(stream);
    }

    public Map<String, Object> customerDetails(Long userId) {
        User u = getById(userId);
        List<Appointment> bookings = appointmentRepository.findByCustomerId(userId);
        BigDecimal spent = bookings.stream()
                .filter(a -> a.getStatus() == AppointmentStatus.CONFIRMED || a.getStatus() == AppointmentStatus.COMPLETED)
                .map(a -> a.getTotalPrice() != null ? a.getTotalPrice() : BigDecimal.ZERO)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("user", new UserRowDto(u, bookings.size()));
        details.put("totalBookings", bookings.size());
        details.put("completedBookings", bookings.stream().filter(a -> a.getStatus() == AppointmentStatus.COMPLETED).count());
        details.put("cancelledBookings", bookings.stream().filter(a -> a.getStatus() == AppointmentStatus.CANCELLED).count());
        details.put("totalSpent", spent);
        return details;
    }

    private List<UserRowDto> rows(Stream<User> users) {
        return users.map(u -> new UserRowDto(u, appointmentRepository.countByCustomerId(u.getId()))).toList();
    }

    private static boolean matches(User u, String search) {
        if (search == null || search.isBlank()) return true;
        String q = search.trim().toLowerCase(Locale.ROOT);
        return (u.getUsername() != null && u.getUsername().toLowerCase(Locale.ROOT).contains(q))
                || u.getFullName().toLowerCase(Locale.ROOT).contains(q)
                || (u.getPhone() != null && u.getPhone().contains(q));
    }
}
