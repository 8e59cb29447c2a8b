package com.carrental.service;

import com.carrental.dto.AppointmentRowDto;
import com.carrental.dto.BookingRequest;
import com.carrental.dto.PriceQuote;
import com.carrental.dto.TimeSlot;
import com.carrental.exception.BookingException;
import com.carrental.exception.NotFoundException;
import com.carrental.model.*;
import com.carrental.repository.AppointmentRepository;
import com.carrental.repository.CarRepository;
import com.carrental.repository.PaymentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.*;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class AppointmentService {

    private static final Logger logger = LoggerFactory.getLogger(AppointmentService.class);

    static final Duration PAST_GRACE = Duration.ofMinutes(5);
    static final Duration MIN_RENTAL = Duration.ofHours(1);
    static final int DEFAULT_SLOT_WINDOW_DAYS = 30;

    private static final DateTimeFormatter MESSAGE_FORMAT =
            DateTimeFormatter.ofPattern("MMM dd, yyyy HH:mm", Locale.ENGLISH);

    private final AppointmentRepository appointmentRepository;
    private final CarRepository carRepository;
    private final PaymentRepository paymentRepository;
    private final PromotionService promotionService;
    private final SubscriptionService subscriptionService;
    private final PricingService pricingService;
    private final CancelPolicyService cancelPolicyService;
    private final NotificationService notificationService;
    private final EmailService emailService;
    private final Clock clock;

    public AppointmentService(AppointmentRepository appointmentRepository,
                              CarRepository carRepository,
                              PaymentRepository paymentRepository,
                              PromotionService promotionService,
                              SubscriptionService subscriptionService,
                              PricingService pricingService,
                              CancelPolicyService cancelPolicyService,
                              NotificationService notificationService,
                              EmailService emailService,
                              Clock clock) {
        this.appointmentRepository = appointmentRepository;
        this.carRepository = carRepository;
        this.paymentRepository = paymentRepository;
        this.promotionService = promotionService;
        this.subscriptionService = subscriptionService;
        this.pricingService = pricingService;
        this.cancelPolicyService = cancelPolicyService;
        this.notificationService = notificationService;
        this.emailService = emailService;
        this.clock = clock;
    }

    // ---------------- Queries ----------------

    public Appointment getById(Long id) {
        return appointmentRepository.findById(id).orElseThrow(() -> NotFoundException.of("Appointment", id));
    }

    public List<Appointment> getAll() {
        return appointmentRepository.findAllByOrderByCreatedAtDesc();
    }

    /** Non-cancelled bookings touching [from, to], earliest first. */
    public List<Appointment> getByDateRange(LocalDateTime from, LocalDateTime to) {
        return appointmentRepository.findActiveInRange(from, to);
    }

    public boolean isCarAvailable(Long carId, LocalDateTime start, LocalDateTime end, Long excludeAppointmentId) {
        Car car = carId == null ? null : carRepository.findById(carId).orElse(null);
        if (car == null || !car.isAvailable()) return false;
        return appointmentRepository.findOverlapping(carId, start, end, excludeAppointmentId).isEmpty();
    }

    public PriceQuote quote(Long carId, LocalDateTime start, LocalDateTime end, Long promotionId, Long subscriptionId) {
        Car car = carId == null ? null : carRepository.findById(carId).orElse(null);
        if (car == null) return PriceQuote.zero();
        Promotion promotion = promotionService.findById(promotionId).orElse(null);
        Subscription subscription = subscriptionService.findById(subscriptionId).orElse(null);
        return pricingService.quote(car, start, end, promotion, subscription);
    }

    public BigDecimal calculatePrice(Long carId, LocalDateTime start, LocalDateTime end, Long promotionId, Long subscriptionId) {
        return quote(carId, start, end, promotionId, subscriptionId).getTotalPrice();
    }

    /**
     * Free windows of a vehicle inside [from, to]. Defaults to the next 30 days.
     */
    public List<TimeSlot> availableTimeSlots(Long carId, LocalDateTime from, LocalDateTime to) {
        LocalDateTime windowStart = from != null ? from : LocalDate.now(clock).atStartOfDay();
        LocalDateTime windowEnd = to != null ? to : windowStart.plusDays(DEFAULT_SLOT_WINDOW_DAYS);

        Car car = carId == null ? null : carRepository.findById(carId).orElse(null);
        if (car == null || !car.isAvailable()) return List.of();

        List<TimeSlot> busy = appointmentRepository.findOverlapping(carId, windowStart, windowEnd, null).stream()
                .map(a -> new TimeSlot(a.getStartDate(), a.getEndDate()))
                .toList();
        return freeSlots(busy, windowStart, windowEnd);
    }

    /**
     * Gaps in [from, to] not covered by any busy interval. Busy intervals may overlap each other.
     */
    static List<TimeSlot> freeSlots(List<TimeSlot> busy, LocalDateTime from, LocalDateTime to) {
        List<TimeSlot> free = new ArrayList<>();
        if (from == null || to == null || !from.isBefore(to)) return free;

        List<TimeSlot> sorted = new ArrayList<>(busy);
        sorted.sort(Comparator.comparing(TimeSlot::getStart));

        LocalDateTime cursor = from;
        for (TimeSlot b : sorted) {
            if (!cursor.isBefore(to)) break;
            if (b.getStart().isAfter(cursor)) {
                LocalDateTime gapEnd = b.getStart().isBefore(to) ? b.getStart() : to;
                free.add(new TimeSlot(cursor, gapEnd));
            }
            // cursor only moves forward so nested or overlapping bookings merge
            if (b.getEnd().isAfter(cursor)) {
                cursor = b.getEnd();
            }
        }
        if (cursor.isBefore(to)) {
            free.add(new TimeSlot(cursor, to));
        }
        return free;
    }

    // ---------------- Create / update ----------------

    @Transactional
    public Appointment create(BookingRequest request, User customer) {
        List<String> errors = new ArrayList<>();

        Car car = null;
        if (request.getCarId() == null) {
            errors.add("Please select a vehicle to continue with your booking.");
        } else {
            car = carRepository.findById(request.getCarId()).orElse(null);
            if (car == null) {
                errors.add("The selected vehicle does not exist.");
            } else if (!car.isAvailable()) {
                errors.add("The selected vehicle is currently not available for booking.");
            }
        }
        validateDates(request.getStartDate(), request.getEndDate(), errors);
        if (!errors.isEmpty()) {
            throw new BookingException(errors);
        }

        LocalDateTime start = request.getStartDate();
        LocalDateTime end = request.getEndDate();

        List<Appointment> conflicts = appointmentRepository.findOverlapping(car.getId(), start, end, null);
        if (!conflicts.isEmpty()) {
            Appointment first = conflicts.get(0);
            throw new BookingException(car.getDisplayName()
                    + " is not available for the selected dates. It's already booked from "
                    + first.getStartDate().format(MESSAGE_FORMAT) + " to " + first.getEndDate().format(MESSAGE_FORMAT)
                    + ". Please choose different dates or check the available time slots.");
        }

        // An inactive or unknown membership is dropped rather than failing the booking
        Subscription subscription = subscriptionService.findById(request.getSubscriptionId())
                .filter(Subscription::isActive)
                .orElse(null);

        Promotion promotion = null;
        if (request.getPromotionCode() != null && !request.getPromotionCode().isBlank()) {
            PromotionService.Validation v = promotionService.validateCode(request.getPromotionCode(), car.isElectric());
            if (!v.isValid()) {
                throw new BookingException(v.getMessage());
            }
            promotion = v.getPromotion();
        }

        // Price before redeeming so the last allowed use still gets its discount
        PriceQuote quote = pricingService.quote(car, start, end, promotion, subscription);

        Appointment a = new Appointment();
        a.setCar(car);
        a.setCustomer(customer);
        a.setCustomerName(customer.getFullName());
        a.setCustomerEmail(customer.getUsername());
        a.setCustomerPhone(customer.getPhone());
        a.setStartDate(start);
        a.setEndDate(end);
        a.setSpecialRequests(request.getSpecialRequests());
        a.setStatus(AppointmentStatus.PENDING);
        a.setPromotion(promotion);
        a.setSubscription(subscription);
        a.setTotalPrice(quote.getTotalPrice());
        a.setDiscountAmount(quote.getDiscountAmountOrNull());
        a.setCreatedAt(LocalDateTime.now(clock));

        Appointment saved = appointmentRepository.save(a);
        if (promotion != null) {
            promotionService.redeem(promotion);
        }
        logger.info("Created appointment {} for car {} by {} ({} - {})",
                saved.getId(), car.getId(), customer.getUsername(), start, end);

        notificationService.create(customer, "Booking Created",
                "Your booking for " + car.getDisplayName() + " from " + start.format(MESSAGE_FORMAT)
                        + " to " + end.format(MESSAGE_FORMAT) + " has been created. Please complete payment to confirm.",
                NotificationType.INFO);
        emailService.sendEmail(customer.getUsername(), "Booking received #" + saved.getId(),
                "Hi " + customer.getFullName() + ",\n\n"
                        + "We received your booking for " + car.getDisplayName() + ".\n"
                        + "Pickup: " + start.format(MESSAGE_FORMAT) + "\n"
                        + "Return: " + end.format(MESSAGE_FORMAT) + "\n"
                        + "Total: RM " + quote.getTotalPrice() + "\n");
        return saved;
    }

    void validateDates(LocalDateTime start, LocalDateTime end, List<String> errors) {
        if (start == null) errors.add("Please select a pickup date and time.");
        if (end == null) errors.add("Please select a return date and time.");
        if (start == null || end == null) return;

        LocalDateTime earliest = LocalDateTime.now(clock).minus(PAST_GRACE);
        if (!end.isAfter(start)) {
            errors.add("Return date must be after pickup date.");
        }
        if (start.isBefore(earliest)) {
            errors.add("Pickup date cannot be in the past.");
        }
        if (end.isBefore(earliest)) {
            errors.add("Return date cannot be in the past.");
        }
        if (end.isAfter(start) && Duration.between(start, end).compareTo(MIN_RENTAL) < 0) {
            errors.add("Minimum rental duration is 1 hour.");
        }
    }

    /** Re-prices an edited booking with the promotion it was booked with and its subscription. */
    @Transactional
    public Appointment update(Appointment appointment) {
        PriceQuote quote = pricingService.requote(appointment.getCar(), appointment.getStartDate(),
                appointment.getEndDate(), appointment.getPromotion(), appointment.getSubscription());
        appointment.setTotalPrice(quote.getTotalPrice());
        appointment.setDiscountAmount(quote.getDiscountAmountOrNull());
        appointment.setUpdatedAt(LocalDateTime.now(clock));
        return appointmentRepository.save(appointment);
    }

    /** Staff move a booking to new dates; the vehicle must be free apart from this booking. */
    @Transactional
    public Appointment reschedule(Long id, LocalDateTime start, LocalDateTime end) {
        Appointment a = getById(id);
        List<String> errors = new ArrayList<>();
        validateDates(start, end, errors);
        if (!errors.isEmpty()) throw new BookingException(errors);
        if (!isCarAvailable(a.getCar().getId(), start, end, a.getId())) {
            throw new BookingException(a.getCar().getDisplayName()
                    + " is not available for the selected dates.");
        }
        a.setStartDate(start);
        a.setEndDate(end);
        return update(a);
    }

    @Transactional
    public void delete(Long id) {
        Appointment a = getById(id);
        List<Payment> payments = paymentRepository.findByAppointmentId(id);
        paymentRepository.deleteAll(payments);
        appointmentRepository.delete(a);
        logger.info("Deleted appointment {} with {} payment(s)", id, payments.size());
    }

    // ---------------- Customer actions ----------------

    /**
     * Cancels a customer's own booking.
     *
     * @return true when the cancellation was free (full refund)
     */
    @Transactional
    public boolean cancel(Long id, User customer) {
        Appointment a = getById(id);
        if (!a.isOwnedBy(customer)) {
            throw new AccessDeniedException("You can only cancel your own bookings.");
        }
        if (a.getStatus() == AppointmentStatus.CANCELLED) {
            throw new BookingException("This booking is already cancelled.");
        }
        if (a.getStatus() == AppointmentStatus.COMPLETED) {
            throw new BookingException("Completed bookings cannot be cancelled.");
        }

        boolean free = cancelPolicyService.isFreeCancellation(a, clock);
        a.setStatus(AppointmentStatus.CANCELLED);
        a.setUpdatedAt(LocalDateTime.now(clock));
        appointmentRepository.save(a);

        paymentRepository.findFirstByAppointmentIdAndStatus(a.getId(), PaymentStatus.COMPLETED).ifPresent(p -> {
            p.setStatus(free ? PaymentStatus.REFUNDED : PaymentStatus.PARTIALLY_REFUNDED);
            p.setUpdatedAt(LocalDateTime.now(clock));
            paymentRepository.save(p);
        });

        notificationService.create(customer, "Booking Cancelled",
                "Your booking for " + a.getCar().getDisplayName() + " has been cancelled."
                        + (free ? " A full refund will be processed." : " A cancellation fee may apply."),
                NotificationType.WARNING);
        logger.info("Appointment {} cancelled by customer (free={})", id, free);
        return free;
    }

    /** Vehicle of one of the customer's earlier bookings, used to pre-fill a new booking form. */
    public Car rebook(Long id, User customer) {
        Appointment a = getById(id);
        if (!a.isOwnedBy(customer)) {
            throw new AccessDeniedException("You can only rebook your own bookings.");
        }
        return a.getCar();
    }

    /**
     * Customer's bookings for one of the tabs: Active, History or All.
     */
    public List<AppointmentRowDto> listForCustomer(User customer, String view) {
        String v = view == null ? "Active" : view;
        List<Appointment> all = appointmentRepository.findByCustomerOrderByCreatedAtDesc(customer);
        List<Appointment> filtered = switch (v.toLowerCase(Locale.ROOT)) {
            case "history" -> all.stream()
                    .filter(a -> a.getStatus() == AppointmentStatus.COMPLETED || a.getStatus() == AppointmentStatus.CANCELLED)
                    .toList();
            case "all" -> all;
            default -> all.stream()
                    .filter(a -> a.getStatus() != AppointmentStatus.CANCELLED)
                    .toList();
        };
        return toRows(filtered);
    }

    public Optional<Payment> latestPayment(Long appointmentId) {
        return paymentRepository.findFirstByAppointmentIdOrderByPaymentDateDesc(appointmentId);
    }

    // ---------------- Staff ----------------

    public List<AppointmentRowDto> listForStaff(String status, String search) {
        List<Appointment> list = (status == null || status.isBlank() || "All".equalsIgnoreCase(status))
                ? appointmentRepository.findAllByOrderByCreatedAtDesc()
                : appointmentRepository.findByStatusOrderByCreatedAtDesc(AppointmentStatus.parse(status));

        if (search != null && !search.isBlank()) {
            String term = search.trim().toLowerCase(Locale.ROOT);
            list = list.stream().filter(a -> matches(a, term)).toList();
        }
        return toRows(list);
    }

    private static boolean matches(Appointment a, String term) {
        return contains(a.getCustomerName(), term)
                || contains(a.getCustomerEmail(), term)
                || contains(a.getCar().getDisplayName(), term)
                || String.valueOf(a.getId()).equals(term);
    }

    private static boolean contains(String value, String term) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(term);
    }

    @Transactional
    public Appointment updateStatus(Long id, AppointmentStatus newStatus) {
        Appointment a = getById(id);
        AppointmentStatus old = a.getStatus();
        if (old == newStatus) return a;

        a.setStatus(newStatus);
        a.setUpdatedAt(LocalDateTime.now(clock));
        appointmentRepository.save(a);
        logger.info("Appointment {} status {} -> {}", id, old, newStatus);

        User customer = a.getCustomer();
        String carName = a.getCar().getDisplayName();

        if (newStatus == AppointmentStatus.CANCELLED) {
            Optional<Payment> paid = paymentRepository.findFirstByAppointmentIdAndStatus(a.getId(), PaymentStatus.COMPLETED);
            paid.ifPresent(p -> {
                p.setStatus(PaymentStatus.REFUNDED);
                p.setUpdatedAt(LocalDateTime.now(clock));
                paymentRepository.save(p);
                if (customer != null) {
                    notificationService.create(customer, "Refund Processed",
                            "A refund of RM " + p.getAmount() + " for your booking of " + carName + " has been processed.",
                            NotificationType.INFO);
                }
            });
        }

        if (customer != null) {
            notificationService.create(customer, "Booking " + newStatus.getLabel(),
                    statusMessage(newStatus, carName), notificationTypeFor(newStatus));
        }
        return a;
    }

    /** Applies one status to many bookings; unknown ids are skipped. Returns how many changed. */
    @Transactional
    public int batchUpdateStatus(Collection<Long> ids, AppointmentStatus status) {
        int updated = 0;
        for (Long id : ids) {
            if (appointmentRepository.existsById(id)) {
                updateStatus(id, status);
                updated++;
            }
        }
        return updated;
    }

    static String statusMessage(AppointmentStatus status, String carName) {
        return switch (status) {
            case CONFIRMED -> "Your booking for " + carName + " has been confirmed.";
            case COMPLETED -> "Your rental of " + carName + " is complete. We'd love to hear about it, please leave a review!";
            case CANCELLED -> "Your booking for " + carName + " has been cancelled.";
            case PENDING -> "Your booking for " + carName + " is pending confirmation.";
        };
    }

    static NotificationType notificationTypeFor(AppointmentStatus status) {
        return switch (status) {
            case CONFIRMED, COMPLETED -> NotificationType.SUCCESS;
            case CANCELLED -> NotificationType.DANGER;
            default -> NotificationType.INFO;
        };
    }

    static String calendarColor(AppointmentStatus status) {
        return switch (status) {
            case CONFIRMED -> "#28a745";
            case PENDING -> "#ffc107";
            case COMPLETED -> "#17a2b8";
            default -> "#6c757d";
        };
    }

    public List<Map<String, Object>> calendarEvents(LocalDateTime from, LocalDateTime to) {
        return getByDateRange(from, to).stream().map(a -> {
            Map<String, Object> event = new LinkedHashMap<>();
            event.put("id", a.getId());
            event.put("title", a.getCar().getMake() + " " + a.getCar().getModel() + " - " + a.getCustomerName());
            event.put("start", a.getStartDate());
            event.put("end", a.getEndDate());
            event.put("status", a.getStatus().name());
            event.put("color", calendarColor(a.getStatus()));
            return event;
        }).toList();
    }

    List<AppointmentRowDto> toRows(List<Appointment> appointments) {
        if (appointments.isEmpty()) return List.of();
        List<Long> ids = appointments.stream().map(Appointment::getId).toList();
        Map<Long, Payment> latest = paymentRepository.findByAppointmentIdIn(ids).stream()
                .collect(Collectors.toMap(
                        p -> p.getAppointment().getId(),
                        Function.identity(),
                        (p1, p2) -> p1.getPaymentDate().isAfter(p2.getPaymentDate()) ? p1 : p2));
        return appointments.stream()
                .map(a -> new AppointmentRowDto(a, latest.get(a.getId())))
                .toList();
    }
}
