package com.clinic.scheduling.auth;

import com.clinic.scheduling.entity.Appointment;
import com.clinic.scheduling.entity.Doctor;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Ownership rules for appointments, kept apart from the state transitions.
 * <ul>
 *   <li>the creator may read, update and delete</li>
 *   <li>the assigned doctor may read and update, never delete</li>
 *   <li>everyone else is denied</li>
 * </ul>
 */
@Component
public class AppointmentAccessPolicy {

    public AccessDecision decide(CallerIdentity caller, Appointment appointment, AppointmentAction action) {
        if (caller == null || caller.userId() == null || appointment == null) {
            return AccessDecision.DENY;
        }
        if (Objects.equals(caller.userId(), appointment.getCreatedBy())) {
            return AccessDecision.ALLOW;
        }
        if (action != AppointmentAction.DELETE && isAssignedDoctor(caller, appointment.getDoctor())) {
            return AccessDecision.ALLOW;
        }
        return AccessDecision.DENY;
    }

    private static boolean isAssignedDoctor(CallerIdentity caller, Doctor doctor) {
        return doctor != null && doctor.getUserId() != null && doctor.getUserId().equals(caller.userId());
    }
}
