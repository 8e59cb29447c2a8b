package com.carrental.dto;

import com.carrental.model.Car;

import java.math.BigDecimal;
import java.util.List;

public class CarDetails {
    private final Car car;
    private final List<ReviewRowDto> reviews;
    private final BigDecimal averageRating;
    private final long reviewCount;
    private final List<TimeSlot> freeSlots;

    public CarDetails(Car car,
                      List<ReviewRowDto> reviews,
                      BigDecimal averageRating,
                      long reviewCount,
                      List<TimeSlot> freeSlots) {
        this.car = car;
        this.reviews = reviews;
        this.averageRating = averageRating;
        this.reviewCount = reviewCount;
        this.freeSlots = freeSlots;
    }

    public Car getCar() { return car; }
    public List<ReviewRowDto> getReviews() { return reviews; }
    public BigDecimal getAverageRating() { return averageRating; }
    public long getReviewCount() { return reviewCount; }
    public List<TimeSlot> getFreeSlots() { return freeSlots; }
}
