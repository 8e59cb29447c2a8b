package com.carrental.it;

import com.carrental.model.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/** Unsaved entities for integration tests. */
final class Fixtures {

    private Fixtures() {}

    static User user(String email, String role) {
        User u = new User();
        u.setUsername(email);
        u.setPassword("{noop}pw");
        u.setRole(role);
        u.setEnabled(true);
        u.setFirstName("Test");
        u.setLastName(role.charAt(0) + role.substring(1).toLowerCase());
        return u;
    }

    static Car car(String make, String model, String plate, String dailyRate) {
        Car c = new Car();
        c.setMake(make);
        c.setModel(model);
        c.setYear(2024);
        c.setLicensePlate(plate);
        c.setColor("White");
        c.setDailyRate(new BigDecimal(dailyRate));
        c.setFuelType(Car.FUEL_GAS);
        c.setState("Kuala Lumpur");
        c.setAvailable(true);
        return c;
    }

    static Car ev(String make, String model, String plate, String dailyRate) {
        Car c = car(make, model, plate, dailyRate);
        c.setFuelType(Car.FUEL_ELECTRIC);
        c.setElectric(true);
        c.setBatteryCapacity(60);
        c.setRange(420);
        c.setChargingTime(45);
        return c;
    }

    static Appointment appointment(Car car, User customer, LocalDateTime start, LocalDateTime end,
                                   AppointmentStatus status, String total) {
        Appointment a = new Appointment();
        a.setCar(car);
        a.setCustomer(customer);
        a.setCustomerName(customer == null ? "Walk-in" : customer.getFullName());
        a.setCustomerEmail(customer == null ? null : customer.getUsername());
        a.setStartDate(start);
        a.setEndDate(end);
        a.setStatus(status);
        a.setTotalPrice(new BigDecimal(total));
        return a;
    }

    static Payment payment(Appointment a, String method, PaymentStatus status, LocalDateTime at) {
        Payment p = new Payment();
        p.setAppointment(a);
        p.setPaymentMethod(method);
        p.setAmount(a.getTotalPrice());
        p.setStatus(status);
        p.setTransactionId("TX-" + a.getId());
        p.setPaymentDate(at);
        return p;
    }

    static Promotion promotion(String code, String percent, LocalDateTime from, LocalDateTime to) {
        Promotion p = new Promotion();
        p.setName(code + " promo");
        p.setCode(code);
        p.setDiscountPercentage(new BigDecimal(percent));
        p.setStartDate(from);
        p.setEndDate(to);
        p.setActive(true);
        return p;
    }
}
