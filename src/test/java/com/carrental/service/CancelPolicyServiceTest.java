package com.carrental.service;

import com.carrental.model.Appointment;
import org.junit.jupiter.api.Test;

import java.time.*;

import static org.assertj.core.api.Assertions.assertThat;

class CancelPolicyServiceTest {

    private final ZoneId zone = ZoneId.of("Asia/Kuala_Lumpur");
    private final Clock clock = Clock.fixed(ZonedDateTime.of(2025, 3, 3, 9, 0, 0, 0, zone).toInstant(), zone);
    private final CancelPolicyService policy = new CancelPolicyService();

    private Appointment startingAt(LocalDateTime start) {
        Appointment a = new Appointment();
        a.setStartDate(start);
        a.setEndDate(start.plusDays(1));
        return a;
    }

    @Test
    void freeWhenPickupIsAtLeast48HoursAway() {
        LocalDateTime now = LocalDateTime.now(clock);
        assertThat(policy.isFreeCancellation(startingAt(now.plusHours(48)), clock)).isTrue();
        assertThat(policy.isFreeCancellation(startingAt(now.plusDays(10)), clock)).isTrue();
    }

    @Test
    void feeMayApplyInsideThe48HourWindow() {
        LocalDateTime now = LocalDateTime.now(clock);
        assertThat(policy.isFreeCancellation(startingAt(now.plusHours(47).plusMinutes(59)), clock)).isFalse();
        assertThat(policy.isFreeCancellation(startingAt(now.plusHours(2)), clock)).isFalse();
    }
}
