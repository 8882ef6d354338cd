package com.clinic.scheduling.service;

import com.clinic.scheduling.auth.AppointmentAccessPolicy;
import com.clinic.scheduling.auth.AppointmentAction;
import com.clinic.scheduling.auth.CallerIdentity;
import com.clinic.scheduling.dto.AppointmentChanges;
import com.clinic.scheduling.dto.AppointmentMetadata;
import com.clinic.scheduling.dto.AppointmentView;
import com.clinic.scheduling.dto.SlotTarget;
import com.clinic.scheduling.entity.Appointment;
import com.clinic.scheduling.entity.AppointmentSlot;
import com.clinic.scheduling.entity.DeliveryMode;
import com.clinic.scheduling.entity.Doctor;
import com.clinic.scheduling.entity.SlotAuditEntry;
import com.clinic.scheduling.exception.ForbiddenException;
import com.clinic.scheduling.exception.InvalidStateException;
import com.clinic.scheduling.exception.NotFoundException;
import com.clinic.scheduling.exception.SlotConflictException;
import com.clinic.scheduling.exception.SlotUnavailableException;
import com.clinic.scheduling.exception.UnauthenticatedException;
import com.clinic.scheduling.exception.ValidationException;
import com.clinic.scheduling.repository.AppointmentRepository;
import com.clinic.scheduling.repository.AppointmentSlotRepository;
import com.clinic.scheduling.repository.DoctorRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Binds appointments to slots.
 * <p>
 * The FREE to BOOKED transition is a conditional update on the slot row, so of two concurrent
 * bookings of one slot exactly one wins and the other fails fast with {@link SlotUnavailableException}.
 * The conditional update clears the persistence context; entities are re-read after it.
 */
@Service
public class BookingService {

    private static final Logger log = LoggerFactory.getLogger(BookingService.class);

    private final AppointmentSlotRepository slotRepository;
    private final AppointmentRepository appointmentRepository;
    private final DoctorRepository doctorRepository;
    private final AppointmentAccessPolicy accessPolicy;
    private final SlotAuditService auditService;
    private final ScheduleCalendar calendar;
    private final int legacySlotMinutes;

    public BookingService(AppointmentSlotRepository slotRepository,
                          AppointmentRepository appointmentRepository,
                          DoctorRepository doctorRepository,
                          AppointmentAccessPolicy accessPolicy,
                          SlotAuditService auditService,
                          ScheduleCalendar calendar,
                          @Value("${scheduling.legacy-slot-minutes:30}") int legacySlotMinutes) {
        this.slotRepository = slotRepository;
        this.appointmentRepository = appointmentRepository;
        this.doctorRepository = doctorRepository;
        this.accessPolicy = accessPolicy;
        this.auditService = auditService;
        this.calendar = calendar;
        this.legacySlotMinutes = legacySlotMinutes;
    }

    // =========================================================
    // BOOK
    // =========================================================
    @Transactional
    public AppointmentView book(SlotTarget target, CallerIdentity caller, AppointmentMetadata metadata) {
        requireCaller(caller);
        AppointmentMetadata meta = metadata != null ? metadata : AppointmentMetadata.defaults();
        if (meta.status() == Appointment.Status.CANCELLED) {
            throw new ValidationException("A new appointment cannot start out cancelled.");
        }

        Long slotId = target.isBySlotId() ? target.getSlotId() : resolveSlot(target, meta, caller);

        AppointmentSlot slot = slotRepository.findById(slotId).orElseThrow(() -> NotFoundException.slot(slotId));
        if (slot.getStatus() != AppointmentSlot.Status.FREE) {
            throw new SlotUnavailableException(slotId, "Slot " + slotId + " is no longer available.");
        }
        calendar.requireFuture(slot.startsAt(), "Cannot book an appointment in the past.");
        if (meta.deliveryMode() != null && meta.deliveryMode() != slot.getDeliveryMode()) {
            throw new ValidationException("Slot " + slotId + " is offered as " + slot.getDeliveryMode()
                    + ", not " + meta.deliveryMode() + ".");
        }

        claim(slotId, slot.getDoctor().getId(), caller.userId());

        AppointmentSlot booked = slotRepository.findById(slotId).orElseThrow(() -> NotFoundException.slot(slotId));
        Appointment appointment = Appointment.builder()
                .name(newAppointmentName())
                .slot(booked)
                .doctor(booked.getDoctor())
                .patientId(caller.userId())
                .institutionId(meta.institutionId())
                .specialtyId(meta.specialtyId())
                .urgency(meta.urgency() != null ? meta.urgency() : Appointment.Urgency.NORMAL)
                .visitType(StringUtils.defaultIfBlank(meta.visitType(), "general"))
                .deliveryMode(booked.getDeliveryMode())
                .status(meta.status() != null ? meta.status() : Appointment.Status.CONFIRMED)
                .createdBy(caller.userId())
                .build();
        appointment = appointmentRepository.save(appointment);

        log.info("Booked appointment {}: slot={}, doctor={}, patient={}, at={}",
                appointment.getId(), slotId, booked.getDoctor().getId(), caller.userId(), booked.startsAt());
        return AppointmentView.from(appointment);
    }

    /**
     * Finds the doctor's free slot starting at the requested instant, or creates one when nothing
     * of the doctor's overlaps it. Holds the doctor's schedule lock like slot generation does.
     */
    private Long resolveSlot(SlotTarget target, AppointmentMetadata meta, CallerIdentity caller) {
        if (target.getDoctorId() == null || target.getStartsAt() == null) {
            throw new ValidationException("Either slotId or doctorId with appointmentDate is required.");
        }
        LocalDateTime startsAt = target.getStartsAt();
        calendar.requireFuture(startsAt, "Cannot book an appointment in the past.");

        Doctor doctor = doctorRepository.findByIdForUpdate(target.getDoctorId())
                .orElseThrow(() -> NotFoundException.doctor(target.getDoctorId()));
        if (!doctor.isActive()) {
            throw new InvalidStateException("Doctor " + doctor.getId() + " is not active.");
        }

        LocalDate date = startsAt.toLocalDate();
        LocalTime start = startsAt.toLocalTime();
        Optional<AppointmentSlot> free = slotRepository.findFirstByDoctorIdAndSlotDateAndStartTimeAndStatus(
                doctor.getId(), date, start, AppointmentSlot.Status.FREE);
        if (free.isPresent()) {
            return free.get().getId();
        }

        LocalTime end = start.plusMinutes(legacySlotMinutes);
        if (!end.isAfter(start)) {
            throw new ValidationException("An appointment must end on the day it starts.");
        }
        boolean occupied = slotRepository
                .findByDoctorIdAndSlotDateBetweenAndStatusNotOrderBySlotDateAscStartTimeAsc(
                        doctor.getId(), date, date, AppointmentSlot.Status.CANCELLED)
                .stream()
                .anyMatch(s -> s.overlaps(date, start, end));
        if (occupied) {
            throw new SlotUnavailableException(null, "Doctor " + doctor.getId() + " is not available at " + startsAt + ".");
        }

        AppointmentSlot slot = slotRepository.save(AppointmentSlot.builder()
                .doctor(doctor)
                .slotDate(date)
                .startTime(start)
                .endTime(end)
                .durationMinutes(legacySlotMinutes)
                .deliveryMode(meta.deliveryMode() != null ? meta.deliveryMode() : DeliveryMode.PHYSICAL)
                .status(AppointmentSlot.Status.FREE)
                .build());
        auditService.record(slot, SlotAuditEntry.Action.CREATED, "created on demand for a booking", caller.userId());
        log.info("Created slot {} for doctor {} at {} to satisfy a booking", slot.getId(), doctor.getId(), startsAt);
        return slot.getId();
    }

    // =========================================================
    // READ
    // =========================================================
    @Transactional(readOnly = true)
    public AppointmentView getAppointment(Long appointmentId, CallerIdentity caller) {
        requireCaller(caller);
        Appointment appointment = appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> NotFoundException.appointment(appointmentId));
        authorize(caller, appointment, AppointmentAction.READ);
        return AppointmentView.from(appointment);
    }

    /**
     * Patients (and admins) see what they booked, doctors see what was booked with them.
     */
    @Transactional(readOnly = true)
    public List<AppointmentView> listAppointments(CallerIdentity caller, LocalDate date) {
        requireCaller(caller);
        List<Appointment> appointments;
        if (caller.isDoctor()) {
            Doctor doctor = doctorRepository.findByUserId(caller.userId())
                    .orElseThrow(() -> new NotFoundException("No doctor profile is linked to user " + caller.userId() + "."));
            appointments = date == null
                    ? appointmentRepository.findByDoctor(doctor.getId())
                    : appointmentRepository.findByDoctorOnDate(doctor.getId(), date);
        } else {
            appointments = date == null
                    ? appointmentRepository.findByCreator(caller.userId())
                    : appointmentRepository.findByCreatorOnDate(caller.userId(), date);
        }
        return appointments.stream().map(AppointmentView::from).toList();
    }

    // =========================================================
    // UPDATE
    // =========================================================
    @Transactional
    public AppointmentView update(Long appointmentId, CallerIdentity caller, AppointmentChanges changes) {
        requireCaller(caller);
        if (changes == null || changes.isEmpty()) {
            throw new ValidationException("Nothing to update.");
        }
        if (changes.appointmentDate() != null && changes.status() == Appointment.Status.CANCELLED) {
            throw new ValidationException("Rescheduling and cancelling must be separate requests.");
        }

        Appointment appointment = lockAppointment(appointmentId);
        authorize(caller, appointment, AppointmentAction.UPDATE);
        if (appointment.isCancelled()) {
            throw new InvalidStateException("Appointment " + appointmentId + " is cancelled.");
        }

        Long doctorId = appointment.getDoctor().getId();
        Long currentSlotId = appointment.getSlot().getId();
        LocalDateTime currentStart = appointment.getSlot().startsAt();
        Appointment.Status currentStatus = appointment.getStatus();

        Long targetSlotId = currentSlotId;
        if (changes.appointmentDate() != null && !changes.appointmentDate().equals(currentStart)) {
            targetSlotId = retarget(appointmentId, doctorId, currentSlotId, currentStart,
                    changes.appointmentDate(), caller.userId());
        }

        Appointment.Status newStatus = currentStatus;
        if (changes.status() != null && changes.status() != currentStatus) {
            if (!currentStatus.canMoveTo(changes.status())) {
                throw new InvalidStateException("Appointment " + appointmentId + " cannot go from "
                        + currentStatus + " back to " + changes.status() + ".");
            }
            if (changes.status() == Appointment.Status.CANCELLED) {
                releaseUnlessPast(currentSlotId, doctorId, currentStart,
                        "appointment " + appointmentId + " cancelled", caller.userId());
            }
            newStatus = changes.status();
        }

        Appointment fresh = appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> NotFoundException.appointment(appointmentId));
        if (!Objects.equals(targetSlotId, currentSlotId)) {
            Long claimedId = targetSlotId;
            AppointmentSlot claimed = slotRepository.findById(claimedId).orElseThrow(() -> NotFoundException.slot(claimedId));
            fresh.setSlot(claimed);
            fresh.setDeliveryMode(claimed.getDeliveryMode());
        }
        fresh.setStatus(newStatus);
        fresh = appointmentRepository.save(fresh);

        log.info("Updated appointment {} by user {}: slot {} -> {}, status {} -> {}",
                appointmentId, caller.userId(), currentSlotId, targetSlotId, currentStatus, newStatus);
        return AppointmentView.from(fresh);
    }

    /**
     * Release the current slot and claim the doctor's free slot starting at {@code newStart}.
     */
    private Long retarget(Long appointmentId, Long doctorId, Long currentSlotId, LocalDateTime currentStart,
                          LocalDateTime newStart, Long actorId) {
        calendar.requireFuture(newStart, "Cannot move an appointment into the past.");
        if (calendar.isPast(currentStart)) {
            throw new InvalidStateException("Appointment " + appointmentId + " is in the past and cannot be moved.");
        }
        AppointmentSlot target = slotRepository.findFirstByDoctorIdAndSlotDateAndStartTimeAndStatus(
                        doctorId, newStart.toLocalDate(), newStart.toLocalTime(), AppointmentSlot.Status.FREE)
                .orElseThrow(() -> new SlotConflictException("Doctor " + doctorId + " has no free slot at " + newStart + "."));
        Long targetId = target.getId();

        release(currentSlotId, doctorId, "appointment " + appointmentId + " moved to slot " + targetId, actorId);
        claim(targetId, doctorId, actorId);
        return targetId;
    }

    // =========================================================
    // DELETE
    // =========================================================
    @Transactional
    public AppointmentView delete(Long appointmentId, CallerIdentity caller) {
        requireCaller(caller);
        Appointment appointment = lockAppointment(appointmentId);
        authorize(caller, appointment, AppointmentAction.DELETE);
        if (appointment.isCancelled()) {
            throw new NotFoundException("Appointment " + appointmentId + " is already cancelled.");
        }

        AppointmentSlot slot = appointment.getSlot();
        if (calendar.isPast(slot.startsAt())) {
            throw new InvalidStateException("Appointment " + appointmentId + " is in the past; its slot cannot be released.");
        }
        release(slot.getId(), appointment.getDoctor().getId(),
                "appointment " + appointmentId + " deleted", caller.userId());

        Appointment fresh = appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> NotFoundException.appointment(appointmentId));
        fresh.setStatus(Appointment.Status.CANCELLED);
        fresh = appointmentRepository.save(fresh);

        log.info("Deleted appointment {} by user {}; slot {} released", appointmentId, caller.userId(), fresh.getSlot().getId());
        return AppointmentView.from(fresh);
    }

    // =========================================================
    // SLOT TRANSITIONS
    // =========================================================
    private void claim(Long slotId, Long doctorId, Long actorId) {
        int updated;
        try {
            updated = slotRepository.compareAndSetStatus(slotId, AppointmentSlot.Status.FREE, AppointmentSlot.Status.BOOKED);
        } catch (ConcurrencyFailureException e) {
            log.warn("Slot {} is locked by a concurrent transaction: {}", slotId, e.getMessage());
            throw new SlotUnavailableException(slotId, "Slot " + slotId + " is being booked by someone else.");
        }
        if (updated == 0) {
            log.warn("Slot {} was claimed concurrently", slotId);
            throw new SlotUnavailableException(slotId, "Slot " + slotId + " is no longer available.");
        }
        auditService.record(slotId, doctorId, SlotAuditEntry.Action.BOOKED, null, actorId);
    }

    private boolean release(Long slotId, Long doctorId, String reason, Long actorId) {
        int updated = slotRepository.compareAndSetStatus(slotId, AppointmentSlot.Status.BOOKED, AppointmentSlot.Status.FREE);
        if (updated == 0) {
            log.warn("Slot {} was not booked; nothing to release ({})", slotId, reason);
            return false;
        }
        auditService.record(slotId, doctorId, SlotAuditEntry.Action.RELEASED, reason, actorId);
        return true;
    }

    private void releaseUnlessPast(Long slotId, Long doctorId, LocalDateTime startsAt, String reason, Long actorId) {
        if (calendar.isPast(startsAt)) {
            log.info("Slot {} lies in the past and stays booked ({})", slotId, reason);
            return;
        }
        release(slotId, doctorId, reason, actorId);
    }

    // =========================================================
    // HELPERS
    // =========================================================
    /**
     * Locks the appointment's slot row before the appointment row, the same order slot
     * cancellation uses, so the two never wait on each other.
     */
    private Appointment lockAppointment(Long appointmentId) {
        Long slotId = appointmentRepository.findSlotIdById(appointmentId)
                .orElseThrow(() -> NotFoundException.appointment(appointmentId));
        try {
            slotRepository.findByIdForUpdate(slotId);
        } catch (ConcurrencyFailureException e) {
            log.warn("Slot {} is locked by a concurrent transaction: {}", slotId, e.getMessage());
            throw new SlotUnavailableException(slotId, "Slot " + slotId + " is being changed by someone else.");
        }
        Appointment appointment = appointmentRepository.findByIdForUpdate(appointmentId)
                .orElseThrow(() -> NotFoundException.appointment(appointmentId));
        if (!slotId.equals(appointment.getSlot().getId())) {
            throw new SlotUnavailableException(slotId, "Appointment " + appointmentId + " was moved concurrently; query it again.");
        }
        return appointment;
    }

    private void authorize(CallerIdentity caller, Appointment appointment, AppointmentAction action) {
        if (!accessPolicy.decide(caller, appointment, action).allowed()) {
            throw new ForbiddenException("User " + caller.userId() + " may not "
                    + action.name().toLowerCase(Locale.ENGLISH) + " appointment " + appointment.getId() + ".");
        }
    }

    private static void requireCaller(CallerIdentity caller) {
        if (caller == null || caller.userId() == null) {
            throw new UnauthenticatedException("Missing caller identity.");
        }
    }

    private String newAppointmentName() {
        return "APP " + calendar.today().getYear() + "/" + UUID.randomUUID().toString().replace("-", "").substring(0, 6);
    }
}
