package com.carrental.service;

import com.carrental.model.Appointment;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.*;

@Service
@RequiredArgsConstructor
public class CancelPolicyService {

    static final int FREE_CANCEL_HOURS = 48;

    /** True when pickup is at least 48 hours away, which earns a full refund. */
    public boolean isFreeCancellation(Appointment appointment, Clock clock) {
        LocalDateTime start = appointment.getStartDate();
        if (start == null) return true;

        LocalDateTime now = LocalDateTime.now(clock);
        Duration diff = Duration.between(now, start);
        return diff.toHours() >= FREE_CANCEL_HOURS;
    }
}
