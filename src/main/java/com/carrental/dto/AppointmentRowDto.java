package com.carrental.dto;

import com.carrental.model.Appointment;
import com.carrental.model.Payment;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public class AppointmentRowDto {
    private Long id;
    private Long carId;
    private String carName;
    private String customerName;
    private String customerEmail;
    private String customerPhone;
    private LocalDateTime startDate;
    private LocalDateTime endDate;
    private String status;
    private BigDecimal totalPrice;
    private BigDecimal discountAmount;

    // Latest payment, if any
    private String paymentStatus;
    private String paymentMethod;

    private LocalDateTime createdAt;

    public AppointmentRowDto() {}

    public AppointmentRowDto(Appointment a, Payment payment) {
        this.id = a.getId();
        this.carId = a.getCar().getId();
        this.carName = a.getCar().getDisplayName();
        this.customerName = a.getCustomerName();
        this.customerEmail = a.getCustomerEmail();
        this.customerPhone = a.getCustomerPhone();
        this.startDate = a.getStartDate();
        this.endDate = a.getEndDate();
        this.status = a.getStatus().name();
        this.totalPrice = a.getTotalPrice();
        this.discountAmount = a.getDiscountAmount();
        this.createdAt = a.getCreatedAt();
        if (payment != null) {
            this.paymentStatus = payment.getStatus().name();
            this.paymentMethod = payment.getPaymentMethod();
        }
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Long getCarId() { return carId; }
    public void setCarId(Long carId) { this.carId = carId; }

    public String getCarName() { return carName; }
    public void setCarName(String carName) { this.carName = carName; }

    public String getCustomerName() { return customerName; }
    public void setCustomerName(String customerName) { this.customerName = customerName; }

    public String getCustomerEmail() { return customerEmail; }
    public void setCustomerEmail(String customerEmail) { this.customerEmail = customerEmail; }

    public String getCustomerPhone() { return customerPhone; }
    public void setCustomerPhone(String customerPhone) { this.customerPhone = customerPhone; }

    public LocalDateTime getStartDate() { return startDate; }
    public void setStartDate(LocalDateTime startDate) { this.startDate = startDate; }

    public LocalDateTime getEndDate() { return endDate; }
    public void setEndDate(LocalDateTime endDate) { this.endDate = endDate; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public BigDecimal getTotalPrice() { return totalPrice; }
    public void setTotalPrice(BigDecimal totalPrice) { this.totalPrice = totalPrice; }

    public BigDecimal getDiscountAmount() { return discountAmount; }
    public void setDiscountAmount(BigDecimal discountAmount) { this.discountAmount = discountAmount; }

    public String getPaymentStatus() { return paymentStatus; }
    public void setPaymentStatus(String paymentStatus) { this.paymentStatus = paymentStatus; }

    public String getPaymentMethod() { return paymentMethod; }
    public void setPaymentMethod(String paymentMethod) { this.paymentMethod = paymentMethod; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
}
