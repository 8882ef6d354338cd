package com.clinic.scheduling.dto;

import com.clinic.scheduling.entity.Appointment;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class UpdateAppointmentRequest {
    private String appointmentDate;
    private Appointment.Status status;
}
