package com.clinic.scheduling.service;

import com.clinic.scheduling.dto.CancelScope;
import com.clinic.scheduling.dto.CancellationResult;
import com.clinic.scheduling.dto.SlotView;
import com.clinic.scheduling.entity.Appointment;
import com.clinic.scheduling.entity.AppointmentSlot;
import com.clinic.scheduling.entity.DeliveryMode;
import com.clinic.scheduling.entity.SlotAuditEntry;
import com.clinic.scheduling.exception.InvalidStateException;
import com.clinic.scheduling.exception.NotFoundException;
import com.clinic.scheduling.exception.SlotConflictException;
import com.clinic.scheduling.exception.ValidationException;
import com.clinic.scheduling.repository.AppointmentRepository;
import com.clinic.scheduling.repository.AppointmentSlotRepository;
import com.clinic.scheduling.repository.DoctorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Changes existing slots in place: shift, cancel, convert delivery mode.
 * Slot ids survive every change, so bound appointments follow their slot.
 */
@Service
public class SlotModificationService {

    private static final Logger log = LoggerFactory.getLogger(SlotModificationService.class);

    private final AppointmentSlotRepository slotRepository;
    private final AppointmentRepository appointmentRepository;
    private final DoctorRepository doctorRepository;
    private final SlotAuditService auditService;
    private final ScheduleCalendar calendar;

    public SlotModificationService(AppointmentSlotRepository slotRepository,
                                   AppointmentRepository appointmentRepository,
                                   DoctorRepository doctorRepository,
                                   SlotAuditService auditService,
                                   ScheduleCalendar calendar) {
        this.slotRepository = slotRepository;
        this.appointmentRepository = appointmentRepository;
        this.doctorRepository = doctorRepository;
        this.auditService = auditService;
        this.calendar = calendar;
    }

    // =========================================================
    // SHIFT
    // =========================================================

    /**
     * Moves one slot to a new start, keeping its duration, id, state and bound appointment.
     * Nothing changes when the move would overlap another live slot of the same doctor.
     */
    @Transactional
    public SlotView shift(Long slotId, LocalDate newDate, LocalTime newTime, Long actorId) {
        if (newDate == null || newTime == null) {
            throw new ValidationException("Both date and time are required to shift a slot.");
        }
        Long doctorId = slotRepository.findDoctorIdById(slotId).orElseThrow(() -> NotFoundException.slot(slotId));
        lockDoctor(doctorId);
        AppointmentSlot slot = slotRepository.findByIdForUpdate(slotId).orElseThrow(() -> NotFoundException.slot(slotId));

        if (slot.isCancelled()) {
            throw new InvalidStateException("Slot " + slotId + " is cancelled.");
        }
        if (calendar.isPast(slot.startsAt())) {
            throw new InvalidStateException("Slot " + slotId + " is in the past and cannot be moved.");
        }
        LocalDateTime target = LocalDateTime.of(newDate, newTime);
        calendar.requireFuture(target, "Slots cannot be moved into the past.");
        LocalTime newEnd = endOf(newTime, slot.getDurationMinutes());

        if (target.equals(slot.startsAt())) {
            return SlotView.from(slot);
        }

        boolean conflict = slotRepository
                .findByDoctorIdAndSlotDateBetweenAndStatusNotOrderBySlotDateAscStartTimeAsc(
                        doctorId, newDate, newDate, AppointmentSlot.Status.CANCELLED)
                .stream()
                .anyMatch(s -> !s.getId().equals(slotId) && s.overlaps(newDate, newTime, newEnd));
        if (conflict) {
            throw new SlotConflictException("Slot " + slotId + " cannot move to " + target
                    + ": it would overlap another slot of doctor " + doctorId + ".");
        }

        String detail = slot.startsAt() + " -> " + target;
        slot.setSlotDate(newDate);
        slot.setStartTime(newTime);
        slot.setEndTime(newEnd);
        slot = slotRepository.save(slot);
        auditService.record(slot, SlotAuditEntry.Action.SHIFTED, detail, actorId);

        log.info("Shifted slot {} of doctor {}: {}", slotId, doctorId, detail);
        return SlotView.from(slot);
    }

    /**
     * Moves every live slot a doctor has on {@code date} to {@code newDate}. With a start time the
     * slots are laid out back to back from it in their current order, otherwise each keeps its time.
     * Either all slots move or none does.
     */
    @Transactional
    public List<SlotView> shiftByDate(Long doctorId, LocalDate date, LocalDate newDate, LocalTime newStartTime, Long actorId) {
        if (doctorId == null || date == null || newDate == null) {
            throw new ValidationException("doctorId, date and newDate are required.");
        }
        lockDoctor(doctorId);
        List<AppointmentSlot> slots = slotRepository.findByDoctorAndDateForUpdate(doctorId, date, AppointmentSlot.Status.CANCELLED);
        if (slots.isEmpty()) {
            return List.of();
        }
        for (AppointmentSlot s : slots) {
            if (calendar.isPast(s.startsAt())) {
                throw new InvalidStateException("Slot " + s.getId() + " is in the past and cannot be moved.");
            }
        }

        List<LocalTime> starts = new ArrayList<>();
        LocalTime cursor = newStartTime;
        for (AppointmentSlot s : slots) {
            LocalTime start = newStartTime != null ? cursor : s.getStartTime();
            calendar.requireFuture(LocalDateTime.of(newDate, start), "Slots cannot be moved into the past.");
            LocalTime end = endOf(start, s.getDurationMinutes());
            starts.add(start);
            cursor = end;
        }

        Set<Long> moving = slots.stream().map(AppointmentSlot::getId).collect(Collectors.toSet());
        List<AppointmentSlot> others = slotRepository
                .findByDoctorIdAndSlotDateBetweenAndStatusNotOrderBySlotDateAscStartTimeAsc(
                        doctorId, newDate, newDate, AppointmentSlot.Status.CANCELLED)
                .stream()
                .filter(s -> !moving.contains(s.getId()))
                .toList();
        for (int i = 0; i < slots.size(); i++) {
            LocalTime start = starts.get(i);
            LocalTime end = start.plusMinutes(slots.get(i).getDurationMinutes());
            for (AppointmentSlot other : others) {
                if (other.overlaps(newDate, start, end)) {
                    throw new SlotConflictException("Moving slot " + slots.get(i).getId() + " to " + newDate + " " + start
                            + " would overlap slot " + other.getId() + ".");
                }
            }
        }

        List<SlotView> moved = new ArrayList<>();
        for (int i = 0; i < slots.size(); i++) {
            AppointmentSlot slot = slots.get(i);
            LocalTime start = starts.get(i);
            String detail = slot.startsAt() + " -> " + LocalDateTime.of(newDate, start);
            slot.setSlotDate(newDate);
            slot.setStartTime(start);
            slot.setEndTime(start.plusMinutes(slot.getDurationMinutes()));
            auditService.record(slot, SlotAuditEntry.Action.SHIFTED, detail, actorId);
            moved.add(SlotView.from(slot));
        }
        slotRepository.saveAll(slots);

        log.info("Shifted {} slots of doctor {} from {} to {}", slots.size(), doctorId, date, newDate);
        return moved;
    }

    // =========================================================
    // CANCEL
    // =========================================================

    /**
     * Cancels the given slots and cascades to their live appointments. Already cancelled slots
     * are left alone and not counted. Unknown ids fail the whole request.
     */
    @Transactional
    public CancellationResult cancel(Collection<Long> slotIds, Long actorId) {
        if (slotIds == null || slotIds.isEmpty()) {
            throw new ValidationException("At least one slot id is required.");
        }
        Set<Long> ids = new LinkedHashSet<>(slotIds);
        List<AppointmentSlot> slots = slotRepository.findAllByIdForUpdate(ids);
        if (slots.size() != ids.size()) {
            Set<Long> found = slots.stream().map(AppointmentSlot::getId).collect(Collectors.toSet());
            ids.removeAll(found);
            throw new NotFoundException("Unknown slot ids: " + ids + ".");
        }
        return cancelAll(slots, "cancelled by id", actorId);
    }

    @Transactional
    public CancellationResult cancelByDate(LocalDate date, CancelScope scope, Long actorId) {
        if (date == null) {
            throw new ValidationException("date is required.");
        }
        List<AppointmentSlot> slots;
        if (scope == null || scope.coversAllDoctors()) {
            slots = slotRepository.findByDateForUpdate(date, AppointmentSlot.Status.CANCELLED);
        } else {
            if (!doctorRepository.existsById(scope.doctorId())) {
                throw NotFoundException.doctor(scope.doctorId());
            }
            slots = slotRepository.findByDoctorAndDateForUpdate(scope.doctorId(), date, AppointmentSlot.Status.CANCELLED);
        }
        return cancelAll(slots, "cancelled with all slots of " + date, actorId);
    }

    private CancellationResult cancelAll(List<AppointmentSlot> slots, String reason, Long actorId) {
        List<AppointmentSlot> live = slots.stream().filter(s -> !s.isCancelled()).toList();
        if (live.isEmpty()) {
            return new CancellationResult(0, 0);
        }
        List<Long> liveIds = live.stream().map(AppointmentSlot::getId).toList();

        List<Appointment> appointments = appointmentRepository.findBySlotIdInAndStatusNot(liveIds, Appointment.Status.CANCELLED);
        appointments.forEach(a -> a.setStatus(Appointment.Status.CANCELLED));
        appointmentRepository.saveAll(appointments);

        live.forEach(s -> s.setStatus(AppointmentSlot.Status.CANCELLED));
        slotRepository.saveAll(live);
        auditService.recordAll(live, SlotAuditEntry.Action.CANCELLED, reason, actorId);

        log.info("Cancelled {} slots {} and {} appointments ({})", live.size(), liveIds, appointments.size(), reason);
        return new CancellationResult(live.size(), appointments.size());
    }

    // =========================================================
    // CONVERT
    // =========================================================
    @Transactional
    public SlotView convert(Long slotId, DeliveryMode mode, Long actorId) {
        if (mode == null) {
            throw new ValidationException("deliveryMode is required.");
        }
        AppointmentSlot slot = slotRepository.findByIdForUpdate(slotId).orElseThrow(() -> NotFoundException.slot(slotId));
        if (slot.isCancelled()) {
            throw new InvalidStateException("Slot " + slotId + " is cancelled and cannot be converted.");
        }
        if (slot.getDeliveryMode() == mode) {
            return SlotView.from(slot);
        }

        DeliveryMode previous = slot.getDeliveryMode();
        slot.setDeliveryMode(mode);
        slot = slotRepository.save(slot);
        appointmentRepository.findFirstBySlotIdAndStatusNot(slotId, Appointment.Status.CANCELLED)
                .ifPresent(a -> {
                    a.setDeliveryMode(mode);
                    appointmentRepository.save(a);
                });
        auditService.record(slot, SlotAuditEntry.Action.CONVERTED, previous + " -> " + mode, actorId);

        log.info("Converted slot {} from {} to {}", slotId, previous, mode);
        return SlotView.from(slot);
    }

    // =========================================================
    // HELPERS
    // =========================================================
    private void lockDoctor(Long doctorId) {
        doctorRepository.findByIdForUpdate(doctorId).orElseThrow(() -> NotFoundException.doctor(doctorId));
    }

    private static LocalTime endOf(LocalTime start, int durationMinutes) {
        LocalTime end = start.plusMinutes(durationMinutes);
        if (!end.isAfter(start)) {
            throw new ValidationException("A slot starting at " + start + " would run past midnight.");
        }
        return end;
    }
}
