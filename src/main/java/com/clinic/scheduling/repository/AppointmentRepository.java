package com.clinic.scheduling.repository;

import com.clinic.scheduling.entity.Appointment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    Optional<Appointment> findFirstBySlotIdAndStatusNot(Long slotId, Appointment.Status status);

    List<Appointment> findBySlotIdInAndStatusNot(Collection<Long> slotIds, Appointment.Status status);

    long countBySlotIdAndStatusNot(Long slotId, Appointment.Status status);

    @Query("SELECT a.slot.id FROM Appointment a WHERE a.id = :id")
    Optional<Long> findSlotIdById(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Appointment a WHERE a.id = :id")
    Optional<Appointment> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT a FROM Appointment a JOIN FETCH a.slot s "
            + "WHERE a.createdBy = :userId ORDER BY s.slotDate DESC, s.startTime DESC")
    List<Appointment> findByCreator(@Param("userId") Long userId);

    @Query("SELECT a FROM Appointment a JOIN FETCH a.slot s "
            + "WHERE a.createdBy = :userId AND s.slotDate = :date ORDER BY s.startTime DESC")
    List<Appointment> findByCreatorOnDate(@Param("userId") Long userId, @Param("date") LocalDate date);

    @Query("SELECT a FROM Appointment a JOIN FETCH a.slot s "
            + "WHERE a.doctor.id = :doctorId ORDER BY s.slotDate DESC, s.startTime DESC")
    List<Appointment> findByDoctor(@Param("doctorId") Long doctorId);

    @Query("SELECT a FROM Appointment a JOIN FETCH a.slot s "
            + "WHERE a.doctor.id = :doctorId AND s.slotDate = :date ORDER BY s.startTime DESC")
    List<Appointment> findByDoctorOnDate(@Param("doctorId") Long doctorId, @Param("date") LocalDate date);
}
