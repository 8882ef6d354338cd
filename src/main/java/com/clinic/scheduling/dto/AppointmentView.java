package com.clinic.scheduling.dto;

import com.clinic.scheduling.entity.Appointment;
import com.clinic.scheduling.entity.AppointmentSlot;
import com.clinic.scheduling.entity.DeliveryMode;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

public record AppointmentView(
        Long id,
        String name,
        Long slotId,
        Long doctorId,
        Long patientId,
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime,
        Long institutionId,
        Long specialtyId,
        Appointment.Urgency urgency,
        String visitType,
        DeliveryMode deliveryMode,
        Appointment.Status status,
        Long createdBy,
        Instant createdAt
) {
    public static AppointmentView from(Appointment a) {
        AppointmentSlot slot = a.getSlot();
        return new AppointmentView(
                a.getId(),
                a.getName(),
                slot.getId(),
                a.getDoctor().getId(),
                a.getPatientId(),
                slot.getSlotDate(),
                slot.getStartTime(),
                slot.getEndTime(),
                a.getInstitutionId(),
                a.getSpecialtyId(),
                a.getUrgency(),
                a.getVisitType(),
                a.getDeliveryMode(),
                a.getStatus(),
                a.getCreatedBy(),
                a.getCreatedAt()
        );
    }
}
