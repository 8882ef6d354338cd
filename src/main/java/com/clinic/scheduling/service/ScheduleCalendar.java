package com.clinic.scheduling.service;

import com.clinic.scheduling.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * The clinic's notion of "now". Everything that rejects past dates goes through here.
 */
@Component
public class ScheduleCalendar {

    private final Clock clock;

    public ScheduleCalendar(Clock clock) {
        this.clock = clock;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    public boolean isPast(LocalDateTime instant) {
        return instant.isBefore(now());
    }

    public void requireFuture(LocalDateTime instant, String message) {
        if (isPast(instant)) {
            throw new ValidationException(message);
        }
    }
}
