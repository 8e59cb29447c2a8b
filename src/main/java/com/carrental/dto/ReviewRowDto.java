package com.carrental.dto;

import com.carrental.model.Review;

import java.time.LocalDateTime;

public class ReviewRowDto {
    private final Long id;
    private final Long carId;
    private final String carName;
    private final Long userId;
    private final String userName;
    private final int rating;
    private final String comment;
    private final boolean approved;
    private final LocalDateTime createdAt;
    private final LocalDateTime updatedAt;

    public ReviewRowDto(Review r) {
        this.id = r.getId();
        this.carId = r.getCar().getId();
        this.carName = r.getCar().getDisplayName();
        this.userId = r.getUser().getId();
        this.userName = r.getUser().getFullName();
        this.rating = r.getRating();
        this.comment = r.getComment();
        this.approved = r.isApproved();
        this.createdAt = r.getCreatedAt();
        this.updatedAt = r.getUpdatedAt();
    }

    public Long getId() { return id; }
    public Long getCarId() { return carId; }
    public String getCarName() { return carName; }
    public Long getUserId() { return userId; }
    public String getUserName() { return userName; }
    public int getRating() { return rating; }
    public String getComment() { return comment; }
    public boolean isApproved() { return approved; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }
}
