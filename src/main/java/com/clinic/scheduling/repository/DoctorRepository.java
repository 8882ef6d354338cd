package com.clinic.scheduling.repository;

import com.clinic.scheduling.entity.Doctor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

public interface DoctorRepository extends JpaRepository<Doctor, Long> {

    List<Doctor> findByActiveTrueOrderByName();

    Optional<Doctor> findByUserId(Long userId);

    @Query("SELECT d FROM Doctor d JOIN d.specialtyIds sp WHERE sp = :specialtyId AND d.active = true ORDER BY d.name")
    List<Doctor> findActiveBySpecialty(@Param("specialtyId") Long specialtyId);

    /**
     * Serializes schedule writes (generation, shifts, synthesized slots) for one doctor.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM Doctor d WHERE d.id = :id")
    Optional<Doctor> findByIdForUpdate(@Param("id") Long id);
}
