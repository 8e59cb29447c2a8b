package com.carrental.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "car")
@Getter
@Setter
public class Car {

    public static final String FUEL_GAS = "Gas";
    public static final String FUEL_ELECTRIC = "Electric";
    public static final String FUEL_HYBRID = "Hybrid";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 50)
    private String make;

    @Column(nullable = false, length = 50)
    private String model;

    @Column(name = "model_year", nullable = false)
    private int year;

    @Column(name = "license_plate", nullable = false, unique = true, length = 20)
    private String licensePlate;

    @Column(length = 30)
    private String color;

    @Column(name = "daily_rate", nullable = false, precision = 10, scale = 2)
    private BigDecimal dailyRate;

    // Gas, Electric, Hybrid
    @Column(name = "fuel_type", length = 20)
    private String fuelType = FUEL_GAS;

    @Column(length = 500)
    private String description;

    @Column(name = "image_url", length = 500)
    private String imageUrl;

    @Column(name = "is_electric")
    private boolean electric;

    @Column(name = "is_available")
    private boolean available = true;

    @Column(length = 100)
    private String state = "Kuala Lumpur";

    @Column(length = 100)
    private String city;

    @Column(name = "location_address", length = 200)
    private String locationAddress;

    @ManyToOne
    @JoinColumn(name = "category_id")
    private Category category;

    // EV specifics, null for combustion vehicles
    @Column(name = "battery_capacity_kwh")
    private Integer batteryCapacity;

    @Column(name = "range_km")
    private Integer range;

    @Column(name = "charging_time_minutes")
    private Integer chargingTime;

    @Column(name = "created_at")
    private LocalDateTime createdAt = LocalDateTime.now();

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public String getDisplayName() {
        return year + " " + make + " " + model + " - " + licensePlate;
    }
}
