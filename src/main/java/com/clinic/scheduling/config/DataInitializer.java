package com.clinic.scheduling.config;

import com.clinic.scheduling.dto.GenerationResult;
import com.clinic.scheduling.dto.SlotGenerationSpec;
import com.clinic.scheduling.entity.DeliveryMode;
import com.clinic.scheduling.entity.Doctor;
import com.clinic.scheduling.repository.DoctorRepository;
import com.clinic.scheduling.service.ScheduleCalendar;
import com.clinic.scheduling.service.SlotGenerationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

/**
 * Idempotent demo seeder: inserts doctors if none exist, then generates a week of
 * morning (physical) and afternoon (telemedicine) slots. Overlapping slots are skipped, so re-runs are safe.
 */
@Component
@ConditionalOnProperty(name = "scheduling.seed.enabled", havingValue = "true")
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private static final int SLOT_MINUTES = 30;

    private final DoctorRepository doctorRepository;
    private final SlotGenerationService generationService;
    private final ScheduleCalendar calendar;

    public DataInitializer(DoctorRepository doctorRepository,
                           SlotGenerationService generationService,
                           ScheduleCalendar calendar) {
        this.doctorRepository = doctorRepository;
        this.generationService = generationService;
        this.calendar = calendar;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void seed() {
        List<Doctor> doctors = doctorRepository.findByActiveTrueOrderByName();
        if (doctors.isEmpty()) {
            log.info("Seeding doctors...");
            doctors = doctorRepository.saveAll(List.of(
                    Doctor.builder().userId(1001L).name("Dr. Sarah Johnson").specialtyIds(Set.of(1L)).build(),
                    Doctor.builder().userId(1002L).name("Dr. Michael Chen").specialtyIds(Set.of(2L)).build(),
                    Doctor.builder().userId(1003L).name("Dr. Emily Davis").specialtyIds(Set.of(1L, 3L)).build()
            ));
        }

        LocalDate from = calendar.today();
        LocalDate to = from.plusDays(6);
        int created = 0;
        for (Doctor d : doctors) {
            created += generate(d, from, to, LocalTime.of(9, 0), LocalTime.of(13, 0), DeliveryMode.PHYSICAL);
            created += generate(d, from, to, LocalTime.of(14, 0), LocalTime.of(18, 0), DeliveryMode.TELEMEDICINE);
        }
        log.info("DataInitializer: doctors={}, new slots={} ({} to {})", doctors.size(), created, from, to);
    }

    private int generate(Doctor doctor, LocalDate from, LocalDate to, LocalTime start, LocalTime end, DeliveryMode mode) {
        GenerationResult result = generationService.generate(
                new SlotGenerationSpec(doctor.getId(), mode, from, to, start, end, SLOT_MINUTES), null);
        return result.createdCount();
    }
}
