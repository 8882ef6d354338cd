package com.clinic.scheduling.dto;

import com.clinic.scheduling.entity.DeliveryMode;

import java.time.LocalDate;
import java.time.LocalTime;

public record SlotGenerationSpec(
        Long doctorId,
        DeliveryMode deliveryMode,
        LocalDate startDate,
        LocalDate endDate,
        LocalTime startTime,
        LocalTime endTime,
        int durationMinutes
) {
}
