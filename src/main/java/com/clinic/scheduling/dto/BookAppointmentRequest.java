package com.clinic.scheduling.dto;

import com.clinic.scheduling.entity.Appointment;
import com.clinic.scheduling.entity.DeliveryMode;
import lombok.*;

/**
 * Either {@code slotId}, or {@code doctorId} with {@code appointmentDate} ({@code yyyy-MM-dd HH:mm[:ss]}).
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BookAppointmentRequest {
    private Long slotId;
    private Long doctorId;
    private String appointmentDate;
    private Long institutionId;
    private Long specialtyId;
    private Appointment.Urgency urgency;
    private String visitType;
    private DeliveryMode deliveryMode;
    private Appointment.Status status;
}
