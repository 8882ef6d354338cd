package com.clinic.scheduling.dto;

import com.clinic.scheduling.entity.AppointmentSlot;
import com.clinic.scheduling.entity.DeliveryMode;

import java.time.LocalDate;
import java.time.LocalTime;

public record SlotView(
        Long id,
        Long doctorId,
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime,
        int durationMinutes,
        DeliveryMode deliveryMode,
        AppointmentSlot.Status status
) {
    public static SlotView from(AppointmentSlot slot) {
        return new SlotView(
                slot.getId(),
                slot.getDoctor().getId(),
                slot.getSlotDate(),
                slot.getStartTime(),
                slot.getEndTime(),
                slot.getDurationMinutes(),
                slot.getDeliveryMode(),
                slot.getStatus()
        );
    }
}
