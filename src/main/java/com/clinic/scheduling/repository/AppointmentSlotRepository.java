package com.clinic.scheduling.repository;

import com.clinic.scheduling.entity.AppointmentSlot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AppointmentSlotRepository extends JpaRepository<AppointmentSlot, Long>,
        JpaSpecificationExecutor<AppointmentSlot> {

    List<AppointmentSlot> findByDoctorIdAndSlotDateOrderByStartTimeAsc(Long doctorId, LocalDate slotDate);

    List<AppointmentSlot> findByDoctorIdAndSlotDateBetweenAndStatusNotOrderBySlotDateAscStartTimeAsc(
            Long doctorId,
            LocalDate from,
            LocalDate to,
            AppointmentSlot.Status status
    );

    Optional<AppointmentSlot> findFirstByDoctorIdAndSlotDateAndStartTimeAndStatus(
            Long doctorId,
            LocalDate slotDate,
            LocalTime startTime,
            AppointmentSlot.Status status
    );

    @Query("SELECT s FROM AppointmentSlot s JOIN s.doctor d JOIN d.specialtyIds sp "
            + "WHERE sp = :specialtyId AND d.active = true AND s.status = :status "
            + "AND s.slotDate BETWEEN :from AND :to "
            + "ORDER BY s.slotDate ASC, s.startTime ASC, d.id ASC")
    List<AppointmentSlot> findBySpecialty(@Param("specialtyId") Long specialtyId,
                                          @Param("status") AppointmentSlot.Status status,
                                          @Param("from") LocalDate from,
                                          @Param("to") LocalDate to);

    @Query("SELECT s FROM AppointmentSlot s JOIN s.doctor d JOIN d.specialtyIds sp "
            + "WHERE sp = :specialtyId AND d.active = true AND s.status = :status "
            + "AND s.slotDate >= :from "
            + "ORDER BY s.slotDate ASC, s.startTime ASC, d.id ASC")
    List<AppointmentSlot> findBySpecialtyFrom(@Param("specialtyId") Long specialtyId,
                                              @Param("status") AppointmentSlot.Status status,
                                              @Param("from") LocalDate from);

    @Query("SELECT s.doctor.id FROM AppointmentSlot s WHERE s.id = :id")
    Optional<Long> findDoctorIdById(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM AppointmentSlot s WHERE s.id = :id")
    Optional<AppointmentSlot> findByIdForUpdate(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM AppointmentSlot s WHERE s.id IN :ids ORDER BY s.id")
    List<AppointmentSlot> findAllByIdForUpdate(@Param("ids") Collection<Long> ids);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM AppointmentSlot s WHERE s.slotDate = :date AND s.status <> :excluded ORDER BY s.id")
    List<AppointmentSlot> findByDateForUpdate(@Param("date") LocalDate date,
                                              @Param("excluded") AppointmentSlot.Status excluded);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM AppointmentSlot s WHERE s.doctor.id = :doctorId AND s.slotDate = :date "
            + "AND s.status <> :excluded ORDER BY s.startTime, s.id")
    List<AppointmentSlot> findByDoctorAndDateForUpdate(@Param("doctorId") Long doctorId,
                                                       @Param("date") LocalDate date,
                                                       @Param("excluded") AppointmentSlot.Status excluded);

    /**
     * Compare-and-set on the slot status. Returns 1 when this caller won the transition, 0 otherwise.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE AppointmentSlot s SET s.status = :to, s.version = s.version + 1 "
            + "WHERE s.id = :id AND s.status = :from")
    int compareAndSetStatus(@Param("id") Long id,
                            @Param("from") AppointmentSlot.Status from,
                            @Param("to") AppointmentSlot.Status to);
}
