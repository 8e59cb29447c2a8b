package com.carrental.service;

import com.carrental.exception.BusinessException;
import com.carrental.exception.NotFoundException;
import com.carrental.model.*;
import com.carrental.repository.AppointmentRepository;
import com.carrental.repository.PaymentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Simulated payments. Recording a payment drives the booking status: a completed payment confirms a
 * pending booking, a failed or refunded one sends a confirmed booking back to pending.
 */
@Service
public class PaymentService {

    private static final Logger logger = LoggerFactory.getLogger(PaymentService.class);

    static final Set<String> METHODS = Set.of(Payment.METHOD_CREDIT_CARD, Payment.METHOD_DEBIT_CARD, Payment.METHOD_PAYPAL);

    private final PaymentRepository paymentRepository;
    private final AppointmentRepository appointmentRepository;
    private final NotificationService notificationService;
    private final Clock clock;

    public PaymentService(PaymentRepository paymentRepository,
                          AppointmentRepository appointmentRepository,
                          NotificationService notificationService,
                          Clock clock) {
        this.paymentRepository = paymentRepository;
        this.appointmentRepository = appointmentRepository;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    public Payment getById(Long id) {
        return paymentRepository.findById(id).orElseThrow(() -> NotFoundException.of("Payment", id));
    }

    /** Payment details for its owner, staff or managers. */
    public Payment getForViewer(Long id, User viewer) {
        Payment p = getById(id);
        if (!viewer.isStaffOrManager() && !p.getAppointment().isOwnedBy(viewer)) {
            throw new AccessDeniedException("You cannot view this payment.");
        }
        return p;
    }

    public List<Payment> listForCustomer(User customer) {
        return paymentRepository.findByAppointmentCustomerIdOrderByPaymentDateDesc(customer.getId());
    }

    public List<Payment> listAll() {
        return paymentRepository.findAllByOrderByPaymentDateDesc();
    }

    @Transactional
    public Payment create(Long appointmentId, String method, String transactionId, User customer) {
        Appointment a = appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> NotFoundException.of("Appointment", appointmentId));
        if (!a.isOwnedBy(customer)) {
            throw new AccessDeniedException("You can only pay for your own bookings.");
        }
        if (a.getStatus() == AppointmentStatus.CANCELLED) {
            throw new BusinessException("This booking has been cancelled.");
        }
        if (paymentRepository.existsByAppointmentIdAndStatus(a.getId(), PaymentStatus.COMPLETED)) {
            throw new BusinessException("This booking has already been paid.");
        }
        if (method == null || !METHODS.contains(method)) {
            throw new BusinessException("Please choose a valid payment method.");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Payment p = new Payment();
        p.setAppointment(a);
        p.setPaymentMethod(method);
        p.setAmount(a.getTotalPrice());
        p.setPaymentDate(now);

        boolean hasTransaction = transactionId != null && !transactionId.isBlank();
        if (Payment.METHOD_CREDIT_CARD.equals(method) || hasTransaction) {
            p.setStatus(PaymentStatus.COMPLETED);
            p.setTransactionId(hasTransaction ? transactionId.trim() : UUID.randomUUID().toString());
            if (a.getStatus() == AppointmentStatus.PENDING) {
                a.setStatus(AppointmentStatus.CONFIRMED);
                a.setUpdatedAt(now);
                appointmentRepository.save(a);
            }
        } else {
            p.setStatus(PaymentStatus.PENDING);
        }
        Payment saved = paymentRepository.save(p);
        logger.info("Payment {} for appointment {}: {} {}", saved.getId(), a.getId(), method, saved.getStatus());

        notificationService.create(customer, "Payment Received",
                "We received your payment of RM " + saved.getAmount() + " for " + a.getCar().getDisplayName() + "."
                        + (saved.getStatus() == PaymentStatus.COMPLETED ? " Your booking is confirmed." : " It is awaiting processing."),
                NotificationType.SUCCESS);
        return saved;
    }

    /** Staff override of a payment's status. */
    @Transactional
    public Payment updateStatus(Long paymentId, PaymentStatus status) {
        Payment p = getById(paymentId);
        LocalDateTime now = LocalDateTime.now(clock);
        p.setStatus(status);
        p.setUpdatedAt(now);
        paymentRepository.save(p);

        Appointment a = p.getAppointment();
        User customer = a.getCustomer();
        String carName = a.getCar().getDisplayName();

        if (status == PaymentStatus.COMPLETED) {
            if (a.getStatus() == AppointmentStatus.PENDING) {
                moveTo(a, AppointmentStatus.CONFIRMED, now);
                notify(customer, "Booking Confirmed",
                        "Your payment was processed and your booking for " + carName + " is confirmed.",
                        NotificationType.SUCCESS);
            } else if (a.getStatus() == AppointmentStatus.CONFIRMED && a.getEndDate().isBefore(now)) {
                moveTo(a, AppointmentStatus.COMPLETED, now);
                notify(customer, "Booking Completed",
                        "Your rental of " + carName + " is complete. We'd love to hear about it, please leave a review!",
                        NotificationType.SUCCESS);
            }
        } else if (status == PaymentStatus.FAILED || status == PaymentStatus.REFUNDED) {
            if (a.getStatus() == AppointmentStatus.CONFIRMED) {
                moveTo(a, AppointmentStatus.PENDING, now);
                notify(customer, "Payment Issue",
                        "There was an issue with the payment for " + carName + ". Your booking is pending again.",
                        NotificationType.WARNING);
            }
        }
        logger.info("Payment {} status set to {}; appointment {} is {}", paymentId, status, a.getId(), a.getStatus());
        return p;
    }

    private void moveTo(Appointment a, AppointmentStatus status, LocalDateTime now) {
        a.setStatus(status);
        a.setUpdatedAt(now);
        appointmentRepository.save(a);
    }

    private void notify(User customer, String title, String message, NotificationType type) {
        if (customer != null) {
            notificationService.create(customer, title, message, type);
        }
    }
}
