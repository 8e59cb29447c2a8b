package com.carrental.service;

import com.carrental.exception.BusinessException;
import com.carrental.exception.NotFoundException;
import com.carrental.model.*;
import com.carrental.repository.AppointmentRepository;
import com.carrental.repository.CarRepository;
import com.carrental.repository.ReviewRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class ReviewService {

    private static final Logger logger = LoggerFactory.getLogger(ReviewService.class);

    static final int MAX_COMMENT_LENGTH = 1000;

    private final ReviewRepository reviewRepository;
    private final CarRepository carRepository;
    private final AppointmentRepository appointmentRepository;
    private final NotificationService notificationService;
    private final Clock clock;

    public ReviewService(ReviewRepository reviewRepository,
                         CarRepository carRepository,
                         AppointmentRepository appointmentRepository,
                         NotificationService notificationService,
                         Clock clock) {
        this.reviewRepository = reviewRepository;
        this.carRepository = carRepository;
        this.appointmentRepository = appointmentRepository;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    public Review getById(Long id) {
        return reviewRepository.findById(id).orElseThrow(() -> NotFoundException.of("Review", id));
    }

    public List<Review> listApproved(Long carId) {
        return carId == null
                ? reviewRepository.findByApprovedTrueOrderByCreatedAtDesc()
                : reviewRepository.findByCarIdAndApprovedTrueOrderByCreatedAtDesc(carId);
    }

    /** Staff moderation list: All, Pending or Approved. */
    public List<Review> listForModeration(String status) {
        if ("Pending".equalsIgnoreCase(status)) return reviewRepository.findByApprovedOrderByCreatedAtDesc(false);
        if ("Approved".equalsIgnoreCase(status)) return reviewRepository.findByApprovedOrderByCreatedAtDesc(true);
        return reviewRepository.findAllByOrderByCreatedAtDesc();
    }

    /** Average approved rating rounded to one decimal, 0 when the car has no approved reviews. */
    public BigDecimal averageRating(Long carId) {
        Double avg = reviewRepository.averageApprovedRating(carId);
        return avg == null ? BigDecimal.ZERO : BigDecimal.valueOf(avg).setScale(1, RoundingMode.HALF_UP);
    }

    public long reviewCount(Long carId) {
        return reviewRepository.countByCarIdAndApprovedTrue(carId);
    }

    /** carId -> average approved rating. Cars without reviews are absent. */
    public Map<Long, Double> averageRatingsByCar() {
        Map<Long, Double> result = new HashMap<>();
        for (Object[] row : reviewRepository.averageApprovedRatingsByCar()) {
            result.put((Long) row[0], ((Number) row[1]).doubleValue());
        }
        return result;
    }

    public boolean hasCompletedRental(User user, Long carId) {
        return appointmentRepository.existsByCarIdAndCustomerIdAndStatus(carId, user.getId(), AppointmentStatus.COMPLETED);
    }

    public Optional<Review> findOwn(User user, Long carId) {
        return reviewRepository.findByCarIdAndUserId(carId, user.getId());
    }

    @Transactional
    public Review create(User user, Long carId, int rating, String comment) {
        Car car = carRepository.findById(carId).orElseThrow(() -> NotFoundException.of("Car", carId));
        if (!hasCompletedRental(user, carId)) {
            throw new BusinessException("You can only review vehicles you have rented and returned.");
        }
        if (findOwn(user, carId).isPresent()) {
            throw new BusinessException("You have already reviewed this vehicle. You can edit your existing review.");
        }
        checkContent(rating, comment);

        Review r = new Review();
        r.setCar(car);
        r.setUser(user);
        r.setRating(rating);
        r.setComment(comment);
        r.setApproved(false);
        r.setCreatedAt(LocalDateTime.now(clock));
        Review saved = reviewRepository.save(r);
        logger.info("Review {} submitted by {} for car {}", saved.getId(), user.getUsername(), carId);

        notificationService.notifyStaff("New Review Pending Approval",
                user.getFullName() + " reviewed " + car.getDisplayName() + " (" + rating + "/5).",
                NotificationType.INFO);
        return saved;
    }

    /** Edits the author's own review. The edit must be approved again. */
    @Transactional
    public Review edit(Long reviewId, User user, int rating, String comment) {
        Review r = getById(reviewId);
        if (!r.getUser().getId().equals(user.getId())) {
            throw new AccessDeniedException("You can only edit your own reviews.");
        }
        checkContent(rating, comment);
        r.setRating(rating);
        r.setComment(comment);
        r.setApproved(false);
        r.setUpdatedAt(LocalDateTime.now(clock));
        return reviewRepository.save(r);
    }

    @Transactional
    public Review setApproved(Long reviewId, boolean approved) {
        Review r = getById(reviewId);
        r.setApproved(approved);
        r.setUpdatedAt(LocalDateTime.now(clock));
        reviewRepository.save(r);
        if (approved) {
            notificationService.create(r.getUser(), "Review Approved",
                    "Your review of " + r.getCar().getDisplayName() + " is now visible.", NotificationType.SUCCESS);
        }
        return r;
    }

    /** Authors delete their own reviews; staff and managers may delete any. */
    @Transactional
    public void delete(Long reviewId, User actor) {
        Review r = getById(reviewId);
        if (!actor.isStaffOrManager() && !r.getUser().getId().equals(actor.getId())) {
            throw new AccessDeniedException("You can only delete your own reviews.");
        }
        reviewRepository.delete(r);
        logger.info("Review {} deleted by {}", reviewId, actor.getUsername());
    }

    private static void checkContent(int rating, String comment) {
        if (rating < 1 || rating > 5) {
            throw new BusinessException("Rating must be between 1 and 5.");
        }
        if (comment != null && comment.length() > MAX_COMMENT_LENGTH) {
            throw new BusinessException("Comment cannot exceed 1000 characters.");
        }
    }
}
