package com.clinic.scheduling.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "appointment", indexes = {
    @Index(name = "idx_appointment_slot", columnList = "slot_id"),
    @Index(name = "idx_appointment_created_by", columnList = "created_by"),
    @Index(name = "idx_appointment_doctor", columnList = "doctor_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Appointment {

    /**
     * Moves forward only: FREE, then CONFIRMED, then CANCELLED.
     */
    public enum Status {
        FREE, CONFIRMED, CANCELLED;

        public boolean canMoveTo(Status next) {
            return next.ordinal() >= ordinal();
        }
    }

    /** Triage level attached by the booking patient. */
    public enum Urgency { NORMAL, URGENT, EMERGENCY }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 30)
    private String name;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "slot_id", nullable = false)
    private AppointmentSlot slot;

    /** Always the slot's doctor; kept for queries by doctor. */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "doctor_id", nullable = false)
    private Doctor doctor;

    @Column(name = "patient_id", nullable = false)
    private Long patientId;

    @Column(name = "institution_id")
    private Long institutionId;

    @Column(name = "specialty_id")
    private Long specialtyId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Urgency urgency = Urgency.NORMAL;

    @Column(name = "visit_type", nullable = false, length = 40)
    @Builder.Default
    private String visitType = "general";

    @Enumerated(EnumType.STRING)
    @Column(name = "delivery_mode", nullable = false, length = 20)
    private DeliveryMode deliveryMode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Status status = Status.CONFIRMED;

    @Column(name = "created_by", nullable = false, updatable = false)
    private Long createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isCancelled() {
        return status == Status.CANCELLED;
    }
}
