package com.clinic.scheduling.service;

import com.clinic.scheduling.dto.SlotGenerationSpec;
import com.clinic.scheduling.exception.ValidationException;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Expands a generation spec into back-to-back candidate slots for every day of the range.
 * A trailing segment shorter than the duration is dropped. Pure; touches no storage.
 */
public final class SlotPlanner {

    public record PlannedSlot(LocalDate date, LocalTime startTime, LocalTime endTime) {
    }

    private SlotPlanner() {
    }

    public static List<PlannedSlot> plan(SlotGenerationSpec spec) {
        validate(spec);
        List<PlannedSlot> slots = new ArrayList<>();
        for (LocalDate date = spec.startDate(); !date.isAfter(spec.endDate()); date = date.plusDays(1)) {
            slots.addAll(planDay(date, spec.startTime(), spec.endTime(), spec.durationMinutes()));
        }
        return slots;
    }

    static List<PlannedSlot> planDay(LocalDate date, LocalTime start, LocalTime end, int durationMinutes) {
        List<PlannedSlot> slots = new ArrayList<>();
        // compare in minutes of the day so that a window ending at 23:59 cannot wrap past midnight
        long endMinute = end.toSecondOfDay() / 60;
        for (long m = start.toSecondOfDay() / 60; m + durationMinutes <= endMinute; m += durationMinutes) {
            LocalTime slotStart = LocalTime.ofSecondOfDay(m * 60);
            slots.add(new PlannedSlot(date, slotStart, slotStart.plusMinutes(durationMinutes)));
        }
        return slots;
    }

    static void validate(SlotGenerationSpec spec) {
        if (spec.doctorId() == null) {
            throw new ValidationException("doctorId is required.");
        }
        if (spec.deliveryMode() == null) {
            throw new ValidationException("deliveryMode is required.");
        }
        if (spec.startDate() == null || spec.endDate() == null || spec.startTime() == null || spec.endTime() == null) {
            throw new ValidationException("startDate, endDate, startTime and endTime are required.");
        }
        if (spec.durationMinutes() <= 0) {
            throw new ValidationException("durationMinutes must be positive.");
        }
        if (!spec.startTime().isBefore(spec.endTime())) {
            throw new ValidationException("startTime must be before endTime.");
        }
        if (spec.endDate().isBefore(spec.startDate())) {
            throw new ValidationException("endDate must not be before startDate.");
        }
    }
}
