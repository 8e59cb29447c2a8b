package com.carrental.dto;

import com.carrental.model.Payment;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public class PaymentRowDto {
    private final Long id;
    private final Long appointmentId;
    private final String carName;
    private final String customerEmail;
    private final String paymentMethod;
    private final BigDecimal amount;
    private final String status;
    private final String transactionId;
    private final LocalDateTime paymentDate;

    public PaymentRowDto(Payment p) {
        this.id = p.getId();
        this.appointmentId = p.getAppointment().getId();
        this.carName = p.getAppointment().getCar().getDisplayName();
        this.customerEmail = p.getAppointment().getCustomerEmail();
        this.paymentMethod = p.getPaymentMethod();
        this.amount = p.getAmount();
        this.status = p.getStatus().name();
        this.transactionId = p.getTransactionId();
        this.paymentDate = p.getPaymentDate();
    }

    public Long getId() { return id; }
    public Long getAppointmentId() { return appointmentId; }
    public String getCarName() { return carName; }
    public String getCustomerEmail() { return customerEmail; }
    public String getPaymentMethod() { return paymentMethod; }
    public BigDecimal getAmount() { return amount; }
    public String getStatus() { return status; }
    public String getTransactionId() { return transactionId; }
    public LocalDateTime getPaymentDate() { return paymentDate; }
}
