package com.clinic.scheduling.service;

import com.clinic.scheduling.auth.CallerIdentity;
import com.clinic.scheduling.dto.AppointmentMetadata;
import com.clinic.scheduling.dto.AppointmentView;
import com.clinic.scheduling.dto.SlotTarget;
import com.clinic.scheduling.entity.Appointment;
import com.clinic.scheduling.entity.AppointmentSlot;
import com.clinic.scheduling.entity.DeliveryMode;
import com.clinic.scheduling.entity.Doctor;
import com.clinic.scheduling.exception.SlotUnavailableException;
import com.clinic.scheduling.repository.AppointmentRepository;
import com.clinic.scheduling.repository.AppointmentSlotRepository;
import com.clinic.scheduling.repository.DoctorRepository;
import com.clinic.scheduling.repository.SlotAuditEntryRepository;
import com.clinic.scheduling.support.FixedClockConfig;
import com.clinic.scheduling.support.TestData;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs without a test transaction: each booking commits on its own thread.
 */
@SpringBootTest
@Import(FixedClockConfig.class)
class BookingConcurrencyTest {

    @Autowired
    private BookingService bookingService;
    @Autowired
    private DoctorRepository doctorRepository;
    @Autowired
    private AppointmentSlotRepository slotRepository;
    @Autowired
    private AppointmentRepository appointmentRepository;
    @Autowired
    private SlotAuditEntryRepository auditRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @AfterEach
    void cleanUp() {
        appointmentRepository.deleteAll();
        auditRepository.deleteAll();
        slotRepository.deleteAll();
        doctorRepository.deleteAll();
    }

    @Test
    void shouldLetExactlyOneOfTwoConcurrentBookingsWin() throws Exception {
        Doctor doctor = TestData.doctor(doctorRepository, 900L, "Dr. Race", 1L);
        Long slotId = TestData.slot(slotRepository, doctor, LocalDate.of(2025, 4, 11), "10:00", 30,
                DeliveryMode.PHYSICAL, AppointmentSlot.Status.FREE).getId();

        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<Future<AppointmentView>> futures = new ArrayList<>();
        try {
            for (long patient = 1; patient <= 2; patient++) {
                CallerIdentity caller = CallerIdentity.patient(patient);
                Callable<AppointmentView> attempt = () -> {
                    start.await();
                    return bookingService.book(SlotTarget.slot(slotId), caller, AppointmentMetadata.defaults());
                };
                futures.add(pool.submit(attempt));
            }
            start.countDown();

            int won = 0;
            int lost = 0;
            for (Future<AppointmentView> f : futures) {
                try {
                    AppointmentView view = f.get(10, TimeUnit.SECONDS);
                    assertThat(view.status()).isEqualTo(Appointment.Status.CONFIRMED);
                    won++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(SlotUnavailableException.class);
                    lost++;
                }
            }

            assertThat(won).isEqualTo(1);
            assertThat(lost).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }

        assertThat(slotRepository.findById(slotId).orElseThrow().getStatus()).isEqualTo(AppointmentSlot.Status.BOOKED);
        assertThat(appointmentRepository.countBySlotIdAndStatusNot(slotId, Appointment.Status.CANCELLED)).isEqualTo(1);
    }

    @Test
    void shouldWaitForSlotLockBeforeLockingAppointmentOnDelete() throws Exception {
        Doctor doctor = TestData.doctor(doctorRepository, 901L, "Dr. Order", 1L);
        Long slotId = TestData.slot(slotRepository, doctor, LocalDate.of(2025, 4, 11), "11:00", 30,
                DeliveryMode.PHYSICAL, AppointmentSlot.Status.FREE).getId();
        CallerIdentity owner = CallerIdentity.patient(1L);
        Long appointmentId = bookingService.book(SlotTarget.slot(slotId), owner, AppointmentMetadata.defaults()).id();

        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        CountDownLatch slotLocked = new CountDownLatch(1);
        CountDownLatch unlockSlot = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> holder = pool.submit(() -> tx.executeWithoutResult(status -> {
                slotRepository.findByIdForUpdate(slotId).orElseThrow();
                slotLocked.countDown();
                try {
                    unlockSlot.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertThat(slotLocked.await(5, TimeUnit.SECONDS)).isTrue();

            Future<AppointmentView> deletion = pool.submit(() -> bookingService.delete(appointmentId, owner));
            Thread.sleep(300);

            // the pending delete is parked on the slot row and has not locked the appointment yet
            Long lockedId = tx.execute(status -> appointmentRepository.findByIdForUpdate(appointmentId).orElseThrow().getId());
            assertThat(lockedId).isEqualTo(appointmentId);

            unlockSlot.countDown();
            holder.get(5, TimeUnit.SECONDS);
            assertThat(deletion.get(5, TimeUnit.SECONDS).status()).isEqualTo(Appointment.Status.CANCELLED);
        } finally {
            unlockSlot.countDown();
            pool.shutdownNow();
        }

        assertThat(slotRepository.findById(slotId).orElseThrow().getStatus()).isEqualTo(AppointmentSlot.Status.FREE);
    }
}
