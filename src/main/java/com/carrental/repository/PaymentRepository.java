package com.carrental.repository;

import com.carrental.model.Payment;
import com.carrental.model.PaymentStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface PaymentRepository extends JpaRepository<Payment, Long> {
    Optional<Payment> findFirstByAppointmentIdOrderByPaymentDateDesc(Long appointmentId);
    Optional<Payment> findFirstByAppointmentIdAndStatus(Long appointmentId, PaymentStatus status);
    boolean existsByAppointmentIdAndStatus(Long appointmentId, PaymentStatus status);

    List<Payment> findByAppointmentId(Long appointmentId);
    List<Payment> findByAppointmentIdIn(Collection<Long> appointmentIds);
    List<Payment> findByAppointmentCustomerIdOrderByPaymentDateDesc(Long customerId);
    List<Payment> findAllByOrderByPaymentDateDesc();
}
