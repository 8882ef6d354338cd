package com.clinic.scheduling.service;

import com.clinic.scheduling.dto.GenerationResult;
import com.clinic.scheduling.dto.SlotGenerationSpec;
import com.clinic.scheduling.entity.AppointmentSlot;
import com.clinic.scheduling.entity.DeliveryMode;
import com.clinic.scheduling.entity.Doctor;
import com.clinic.scheduling.entity.SlotAuditEntry;
import com.clinic.scheduling.exception.InvalidStateException;
import com.clinic.scheduling.exception.NotFoundException;
import com.clinic.scheduling.exception.ValidationException;
import com.clinic.scheduling.repository.AppointmentSlotRepository;
import com.clinic.scheduling.repository.DoctorRepository;
import com.clinic.scheduling.repository.SlotAuditEntryRepository;
import com.clinic.scheduling.support.FixedClockConfig;
import com.clinic.scheduling.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Transactional
@Import(FixedClockConfig.class)
class SlotGenerationServiceTest {

    private static final LocalDate APRIL_11 = LocalDate.of(2025, 4, 11);

    @Autowired
    private SlotGenerationService generationService;
    @Autowired
    private DoctorRepository doctorRepository;
    @Autowired
    private AppointmentSlotRepository slotRepository;
    @Autowired
    private SlotAuditEntryRepository auditRepository;

    private Doctor doctor;

    @BeforeEach
    void setUp() {
        doctor = TestData.doctor(doctorRepository, 712L, "Dr. Twelve", 1L);
    }

    private SlotGenerationSpec spec(LocalDate from, LocalDate to, String start, String end, int minutes) {
        return new SlotGenerationSpec(doctor.getId(), DeliveryMode.PHYSICAL, from, to,
                LocalTime.parse(start), LocalTime.parse(end), minutes);
    }

    @Test
    void shouldCreateNineTwentyMinuteSlots() {
        GenerationResult result = generationService.generate(spec(APRIL_11, APRIL_11, "10:00", "13:00", 20), 712L);

        assertThat(result.createdCount()).isEqualTo(9);
        assertThat(result.skippedCount()).isZero();
        List<AppointmentSlot> slots = slotRepository.findByDoctorIdAndSlotDateOrderByStartTimeAsc(doctor.getId(), APRIL_11);
        assertThat(slots).extracting(AppointmentSlot::getStartTime)
                .containsExactly(
                        LocalTime.of(10, 0), LocalTime.of(10, 20), LocalTime.of(10, 40),
                        LocalTime.of(11, 0), LocalTime.of(11, 20), LocalTime.of(11, 40),
                        LocalTime.of(12, 0), LocalTime.of(12, 20), LocalTime.of(12, 40));
        assertThat(slots).allSatisfy(s -> {
            assertThat(s.getStatus()).isEqualTo(AppointmentSlot.Status.FREE);
            assertThat(s.getDurationMinutes()).isEqualTo(20);
            assertThat(s.getDeliveryMode()).isEqualTo(DeliveryMode.PHYSICAL);
        });
    }

    @Test
    void shouldSkipEverythingOnRerun() {
        generationService.generate(spec(APRIL_11, APRIL_11, "10:00", "13:00", 20), 712L);

        GenerationResult again = generationService.generate(spec(APRIL_11, APRIL_11, "10:00", "13:00", 20), 712L);

        assertThat(again.createdCount()).isZero();
        assertThat(again.skippedCount()).isEqualTo(9);
        assertThat(slotRepository.findByDoctorIdAndSlotDateOrderByStartTimeAsc(doctor.getId(), APRIL_11)).hasSize(9);
    }

    @Test
    void shouldNeverLeaveOverlappingLiveSlots() {
        generationService.generate(spec(APRIL_11, APRIL_11, "10:00", "12:00", 30), 712L);
        GenerationResult shiftedGrid = generationService.generate(spec(APRIL_11, APRIL_11, "09:00", "13:00", 45), 712L);

        // 09:00 and 12:00 fit, the candidates at 09:45, 10:30 and 11:15 hit the existing grid
        assertThat(shiftedGrid.createdCount()).isEqualTo(2);
        assertThat(shiftedGrid.skippedCount()).isEqualTo(3);

        List<AppointmentSlot> live = slotRepository.findByDoctorIdAndSlotDateBetweenAndStatusNotOrderBySlotDateAscStartTimeAsc(
                doctor.getId(), APRIL_11, APRIL_11, AppointmentSlot.Status.CANCELLED);
        for (int i = 1; i < live.size(); i++) {
            assertThat(live.get(i).getStartTime()).isAfterOrEqualTo(live.get(i - 1).getEndTime());
        }
    }

    @Test
    void shouldIgnoreCancelledSlotsWhenCheckingOverlap() {
        TestData.slot(slotRepository, doctor, APRIL_11, "10:00", 30, DeliveryMode.PHYSICAL, AppointmentSlot.Status.CANCELLED);

        GenerationResult result = generationService.generate(spec(APRIL_11, APRIL_11, "10:00", "11:00", 30), 712L);

        assertThat(result.createdCount()).isEqualTo(2);
        assertThat(result.skippedCount()).isZero();
    }

    @Test
    void shouldDropCandidatesThatAlreadyStartedToday() {
        LocalDate today = LocalDate.of(2025, 4, 10);

        GenerationResult result = generationService.generate(spec(today, today, "07:00", "10:00", 30), 712L);

        assertThat(result.createdCount()).isEqualTo(4);
        assertThat(slotRepository.findByDoctorIdAndSlotDateOrderByStartTimeAsc(doctor.getId(), today))
                .extracting(AppointmentSlot::getStartTime)
                .first()
                .isEqualTo(LocalTime.of(8, 0));
    }

    @Test
    void shouldAuditEveryCreatedSlot() {
        generationService.generate(spec(APRIL_11, APRIL_11, "10:00", "11:00", 30), 712L);

        Long first = TestData.slotIdAt(slotRepository, doctor.getId(), APRIL_11, "10:00");
        assertThat(auditRepository.findBySlotIdOrderByIdAsc(first))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.getAction()).isEqualTo(SlotAuditEntry.Action.CREATED);
                    assertThat(e.getActorId()).isEqualTo(712L);
                    assertThat(e.getDoctorId()).isEqualTo(doctor.getId());
                });
    }

    @Test
    void shouldRejectPastStartDate() {
        assertThatThrownBy(() -> generationService.generate(
                spec(LocalDate.of(2025, 4, 9), APRIL_11, "10:00", "13:00", 20), 712L))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRejectOversizedRange() {
        assertThatThrownBy(() -> generationService.generate(
                spec(APRIL_11, APRIL_11.plusDays(400), "10:00", "13:00", 20), 712L))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("366");
    }

    @Test
    @Timeout(5)
    void shouldRejectCenturiesLongRangeBeforePlanningIt() {
        assertThatThrownBy(() -> generationService.generate(
                spec(APRIL_11, APRIL_11.plusYears(400), "00:00", "23:59", 1), 712L))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("366");
        assertThat(slotRepository.findByDoctorIdAndSlotDateOrderByStartTimeAsc(doctor.getId(), APRIL_11)).isEmpty();
    }

    @Test
    void shouldRejectUnknownOrInactiveDoctor() {
        SlotGenerationSpec unknown = new SlotGenerationSpec(-1L, DeliveryMode.PHYSICAL, APRIL_11, APRIL_11,
                LocalTime.of(10, 0), LocalTime.of(11, 0), 30);
        assertThatThrownBy(() -> generationService.generate(unknown, 712L)).isInstanceOf(NotFoundException.class);

        doctor.setActive(false);
        doctorRepository.saveAndFlush(doctor);
        assertThatThrownBy(() -> generationService.generate(spec(APRIL_11, APRIL_11, "10:00", "11:00", 30), 712L))
                .isInstanceOf(InvalidStateException.class);
    }
}
