package com.clinic.scheduling.service;

import com.clinic.scheduling.dto.GenerationResult;
import com.clinic.scheduling.dto.SlotGenerationSpec;
import com.clinic.scheduling.entity.AppointmentSlot;
import com.clinic.scheduling.entity.Doctor;
import com.clinic.scheduling.entity.SlotAuditEntry;
import com.clinic.scheduling.exception.InvalidStateException;
import com.clinic.scheduling.exception.NotFoundException;
import com.clinic.scheduling.exception.ValidationException;
import com.clinic.scheduling.repository.AppointmentSlotRepository;
import com.clinic.scheduling.repository.DoctorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Bulk slot generation. Candidates that would overlap a live slot of the doctor are skipped,
 * everything else is inserted in one transaction while holding the doctor's schedule lock.
 */
@Service
public class SlotGenerationService {

    private static final Logger log = LoggerFactory.getLogger(SlotGenerationService.class);

    private final DoctorRepository doctorRepository;
    private final AppointmentSlotRepository slotRepository;
    private final SlotAuditService auditService;
    private final ScheduleCalendar calendar;
    private final int maxDays;

    public SlotGenerationService(DoctorRepository doctorRepository,
                                 AppointmentSlotRepository slotRepository,
                                 SlotAuditService auditService,
                                 ScheduleCalendar calendar,
                                 @Value("${scheduling.generation.max-days:366}") int maxDays) {
        this.doctorRepository = doctorRepository;
        this.slotRepository = slotRepository;
        this.auditService = auditService;
        this.calendar = calendar;
        this.maxDays = maxDays;
    }

    @Transactional
    public GenerationResult generate(SlotGenerationSpec spec, Long actorId) {
        SlotPlanner.validate(spec);
        if (spec.startDate().isBefore(calendar.today())) {
            throw new ValidationException("Slots cannot be generated in the past.");
        }
        long days = ChronoUnit.DAYS.between(spec.startDate(), spec.endDate()) + 1;
        if (days > maxDays) {
            throw new ValidationException("A generation range may span at most " + maxDays + " days.");
        }
        List<SlotPlanner.PlannedSlot> planned = SlotPlanner.plan(spec);

        Doctor doctor = doctorRepository.findByIdForUpdate(spec.doctorId())
                .orElseThrow(() -> NotFoundException.doctor(spec.doctorId()));
        if (!doctor.isActive()) {
            throw new InvalidStateException("Doctor " + doctor.getId() + " is not active.");
        }

        LocalDateTime now = calendar.now();
        Map<LocalDate, List<AppointmentSlot>> liveByDate = slotRepository
                .findByDoctorIdAndSlotDateBetweenAndStatusNotOrderBySlotDateAscStartTimeAsc(
                        doctor.getId(), spec.startDate(), spec.endDate(), AppointmentSlot.Status.CANCELLED)
                .stream()
                .collect(Collectors.groupingBy(AppointmentSlot::getSlotDate));

        List<AppointmentSlot> toCreate = new ArrayList<>();
        int skipped = 0;
        for (SlotPlanner.PlannedSlot p : planned) {
            if (LocalDateTime.of(p.date(), p.startTime()).isBefore(now)) {
                continue;
            }
            boolean taken = liveByDate.getOrDefault(p.date(), List.of()).stream()
                    .anyMatch(s -> s.overlaps(p.date(), p.startTime(), p.endTime()));
            if (taken) {
                skipped++;
                continue;
            }
            toCreate.add(AppointmentSlot.builder()
                    .doctor(doctor)
                    .slotDate(p.date())
                    .startTime(p.startTime())
                    .endTime(p.endTime())
                    .durationMinutes(spec.durationMinutes())
                    .deliveryMode(spec.deliveryMode())
                    .status(AppointmentSlot.Status.FREE)
                    .build());
        }

        List<AppointmentSlot> saved = slotRepository.saveAll(toCreate);
        auditService.recordAll(saved, SlotAuditEntry.Action.CREATED, "generated " + spec.deliveryMode(), actorId);

        log.info("Generated {} slots for doctor {} between {} and {} ({} skipped as overlapping)",
                saved.size(), doctor.getId(), spec.startDate(), spec.endDate(), skipped);
        return new GenerationResult(saved.size(), skipped);
    }
}
