package com.carrental.dto;

import com.carrental.model.User;

import java.time.LocalDateTime;

public class UserRowDto {
    private final Long id;
    private final String email;
    private final String fullName;
    private final String phone;
    private final String role;
    private final boolean enabled;
    private final LocalDateTime createdAt;
    private final long bookingCount;

    public UserRowDto(User u, long bookingCount) {
        this.id = u.getId();
        this.email = u.getUsername();
        this.fullName = u.getFullName();
        this.phone = u.getPhone();
        this.role = u.getRole();
        this.enabled = u.isEnabled();
        this.createdAt = u.getCreatedAt();
        this.bookingCount = bookingCount;
    }

    public Long getId() { return id; }
    public String getEmail() { return email; }
    public String getFullName() { return fullName; }
    public String getPhone() { return phone; }
    public String getRole() { return role; }
    public boolean isEnabled() { return enabled; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public long getBookingCount() { return bookingCount; }
}
