package com.clinic.scheduling.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

@Entity
@Table(name = "appointment_slot", indexes = {
    @Index(name = "idx_slot_doctor_date", columnList = "doctor_id, slot_date"),
    @Index(name = "idx_slot_date_status", columnList = "slot_date, status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AppointmentSlot {

    /**
     * CANCELLED is terminal: a cancelled slot is never freed again.
     */
    public enum Status { FREE, BOOKED, CANCELLED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "doctor_id", nullable = false)
    private Doctor doctor;

    @Column(name = "slot_date", nullable = false)
    private LocalDate slotDate;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Enumerated(EnumType.STRING)
    @Column(name = "delivery_mode", nullable = false, length = 20)
    private DeliveryMode deliveryMode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Status status = Status.FREE;

    @Version
    private Long version;

    public LocalDateTime startsAt() {
        return LocalDateTime.of(slotDate, startTime);
    }

    public boolean isCancelled() {
        return status == Status.CANCELLED;
    }

    /** Half-open interval overlap on the same date. */
    public boolean overlaps(LocalDate date, LocalTime start, LocalTime end) {
        return slotDate.equals(date) && startTime.isBefore(end) && start.isBefore(endTime);
    }
}
