package com.clinic.scheduling.repository;

import com.clinic.scheduling.entity.AppointmentSlot;
import com.clinic.scheduling.entity.DeliveryMode;
import com.clinic.scheduling.entity.Doctor;
import com.clinic.scheduling.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class AppointmentSlotRepositoryTest {

    private static final LocalDate DAY = LocalDate.of(2025, 4, 11);

    @Autowired
    private AppointmentSlotRepository slotRepository;
    @Autowired
    private DoctorRepository doctorRepository;

    private Doctor doctor;
    private AppointmentSlot slot;

    @BeforeEach
    void setUp() {
        doctor = TestData.doctor(doctorRepository, 500L, "Dr. Repo", 4L);
        slot = TestData.slot(slotRepository, doctor, DAY, "10:00", 30, DeliveryMode.PHYSICAL, AppointmentSlot.Status.FREE);
    }

    @Test
    void shouldClaimOnlyFromExpectedStatus() {
        Long version = slotRepository.findById(slot.getId()).orElseThrow().getVersion();

        assertThat(slotRepository.compareAndSetStatus(slot.getId(), AppointmentSlot.Status.FREE, AppointmentSlot.Status.BOOKED))
                .isEqualTo(1);
        assertThat(slotRepository.compareAndSetStatus(slot.getId(), AppointmentSlot.Status.FREE, AppointmentSlot.Status.BOOKED))
                .isZero();

        AppointmentSlot reloaded = slotRepository.findById(slot.getId()).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(AppointmentSlot.Status.BOOKED);
        assertThat(reloaded.getVersion()).isEqualTo(version + 1);
    }

    @Test
    void shouldResolveDoctorOfSlot() {
        assertThat(slotRepository.findDoctorIdById(slot.getId())).contains(doctor.getId());
        assertThat(slotRepository.findDoctorIdById(-1L)).isEmpty();
    }

    @Test
    void shouldLockOnlyLiveSlotsOfDay() {
        TestData.slot(slotRepository, doctor, DAY, "11:00", 30, DeliveryMode.PHYSICAL, AppointmentSlot.Status.CANCELLED);
        TestData.slot(slotRepository, doctor, DAY.plusDays(1), "10:00", 30, DeliveryMode.PHYSICAL, AppointmentSlot.Status.FREE);

        List<AppointmentSlot> live = slotRepository.findByDoctorAndDateForUpdate(doctor.getId(), DAY, AppointmentSlot.Status.CANCELLED);

        assertThat(live).extracting(AppointmentSlot::getId).containsExactly(slot.getId());
        assertThat(slotRepository.findByDateForUpdate(DAY, AppointmentSlot.Status.CANCELLED)).hasSize(1);
    }

    @Test
    void shouldSearchFreeSlotsBySpecialty() {
        TestData.slot(slotRepository, doctor, DAY, "09:00", 30, DeliveryMode.TELEMEDICINE, AppointmentSlot.Status.BOOKED);

        assertThat(slotRepository.findBySpecialty(4L, AppointmentSlot.Status.FREE, DAY, DAY))
                .extracting(AppointmentSlot::getId)
                .containsExactly(slot.getId());
        assertThat(slotRepository.findBySpecialty(5L, AppointmentSlot.Status.FREE, DAY, DAY)).isEmpty();
    }
}
