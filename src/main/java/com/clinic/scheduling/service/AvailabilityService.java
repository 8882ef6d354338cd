package com.clinic.scheduling.service;

import com.clinic.scheduling.dto.DoctorView;
import com.clinic.scheduling.dto.SlotFilter;
import com.clinic.scheduling.dto.SlotView;
import com.clinic.scheduling.entity.AppointmentSlot;
import com.clinic.scheduling.exception.NotFoundException;
import com.clinic.scheduling.exception.ValidationException;
import com.clinic.scheduling.repository.AppointmentSlotRepository;
import com.clinic.scheduling.repository.DoctorRepository;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only views over the slot table. Every call reads committed rows, nothing is cached.
 */
@Service
@Transactional(readOnly = true)
public class AvailabilityService {

    private final AppointmentSlotRepository slotRepository;
    private final DoctorRepository doctorRepository;
    private final ScheduleCalendar calendar;

    public AvailabilityService(AppointmentSlotRepository slotRepository,
                               DoctorRepository doctorRepository,
                               ScheduleCalendar calendar) {
        this.slotRepository = slotRepository;
        this.doctorRepository = doctorRepository;
        this.calendar = calendar;
    }

    /**
     * Every slot of the doctor on that date, cancelled ones included, by start time.
     */
    public List<SlotView> searchSlots(Long doctorId, LocalDate date) {
        requireDoctor(doctorId);
        return slotRepository.findByDoctorIdAndSlotDateOrderByStartTimeAsc(doctorId, date).stream()
                .map(SlotView::from)
                .toList();
    }

    /**
     * Free slots of every active doctor listing the specialty, ordered by date then start time.
     * {@code from} defaults to today; without {@code to} the search is open-ended.
     */
    public List<SlotView> searchBySpecialty(Long specialtyId, LocalDate from, LocalDate to) {
        LocalDate start = from != null ? from : calendar.today();
        if (to != null && to.isBefore(start)) {
            throw new ValidationException("'to' must not be before 'from'.");
        }
        List<AppointmentSlot> slots = to == null
                ? slotRepository.findBySpecialtyFrom(specialtyId, AppointmentSlot.Status.FREE, start)
                : slotRepository.findBySpecialty(specialtyId, AppointmentSlot.Status.FREE, start, to);
        return slots.stream()
                .map(SlotView::from)
                .toList();
    }

    public List<SlotView> checkSlots(Long doctorId, SlotFilter filter) {
        requireDoctor(doctorId);
        Specification<AppointmentSlot> spec = (root, query, cb) -> cb.equal(root.get("doctor").get("id"), doctorId);
        if (filter.date() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("slotDate"), filter.date()));
        }
        if (filter.deliveryMode() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("deliveryMode"), filter.deliveryMode()));
        }
        if (filter.status() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), filter.status()));
        }
        return slotRepository.findAll(spec, Sort.by("slotDate", "startTime")).stream()
                .map(SlotView::from)
                .toList();
    }

    public List<DoctorView> listDoctors(Long specialtyId) {
        var doctors = specialtyId == null
                ? doctorRepository.findByActiveTrueOrderByName()
                : doctorRepository.findActiveBySpecialty(specialtyId);
        return doctors.stream().map(DoctorView::from).toList();
    }

    public Long doctorIdForUser(Long userId) {
        return doctorRepository.findByUserId(userId)
                .orElseThrow(() -> new NotFoundException("No doctor profile is linked to user " + userId + "."))
                .getId();
    }

    private void requireDoctor(Long doctorId) {
        if (doctorId == null || !doctorRepository.existsById(doctorId)) {
            throw NotFoundException.doctor(doctorId);
        }
    }
}
