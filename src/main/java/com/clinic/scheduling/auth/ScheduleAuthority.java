package com.clinic.scheduling.auth;

import com.clinic.scheduling.dto.CancelScope;
import com.clinic.scheduling.entity.Doctor;
import com.clinic.scheduling.exception.ForbiddenException;
import com.clinic.scheduling.exception.ValidationException;
import com.clinic.scheduling.repository.AppointmentSlotRepository;
import com.clinic.scheduling.repository.DoctorRepository;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Role checks for schedule management. Doctors act on their own schedule only, admins on any.
 * Patients never manage slots.
 */
@Component
public class ScheduleAuthority {

    private final DoctorRepository doctorRepository;
    private final AppointmentSlotRepository slotRepository;

    public ScheduleAuthority(DoctorRepository doctorRepository, AppointmentSlotRepository slotRepository) {
        this.doctorRepository = doctorRepository;
        this.slotRepository = slotRepository;
    }

    /**
     * The doctor whose schedule the caller is about to change. A doctor may omit the id.
     */
    public Long doctorFor(CallerIdentity caller, Long requestedDoctorId) {
        if (caller.isAdmin()) {
            if (requestedDoctorId == null) {
                throw new ValidationException("doctorId is required.");
            }
            return requestedDoctorId;
        }
        Long own = ownDoctorId(caller);
        if (requestedDoctorId != null && !requestedDoctorId.equals(own)) {
            throw new ForbiddenException("User " + caller.userId() + " may only manage their own schedule.");
        }
        return own;
    }

    /**
     * Unknown ids pass here and are reported as missing by the operation itself.
     */
    public void requireSlotAccess(CallerIdentity caller, Collection<Long> slotIds) {
        if (caller.isAdmin() || slotIds == null) {
            return;
        }
        Long own = ownDoctorId(caller);
        for (Long slotId : slotIds) {
            slotRepository.findDoctorIdById(slotId).ifPresent(doctorId -> {
                if (!doctorId.equals(own)) {
                    throw new ForbiddenException("Slot " + slotId + " belongs to another doctor.");
                }
            });
        }
    }

    public CancelScope cancelScope(CallerIdentity caller, Long requestedDoctorId) {
        if (caller.isAdmin()) {
            return requestedDoctorId == null ? CancelScope.allDoctors() : CancelScope.doctor(requestedDoctorId);
        }
        return CancelScope.doctor(doctorFor(caller, requestedDoctorId));
    }

    private Long ownDoctorId(CallerIdentity caller) {
        if (!caller.isDoctor()) {
            throw new ForbiddenException("Only doctors and administrators may manage schedules.");
        }
        return doctorRepository.findByUserId(caller.userId())
                .map(Doctor::getId)
                .orElseThrow(() -> new ForbiddenException("User " + caller.userId() + " has no doctor profile."));
    }
}
