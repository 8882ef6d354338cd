package com.clinic.scheduling.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "slot_audit_entry", indexes = {
    @Index(name = "idx_slot_audit_slot", columnList = "slot_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SlotAuditEntry {

    public enum Action { CREATED, BOOKED, RELEASED, SHIFTED, CANCELLED, CONVERTED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "slot_id", nullable = false)
    private Long slotId;

    @Column(name = "doctor_id", nullable = false)
    private Long doctorId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Action action;

    @Column(length = 255)
    private String detail;

    /** Null for system-initiated changes. */
    @Column(name = "actor_id")
    private Long actorId;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    @PrePersist
    protected void onCreate() {
        if (recordedAt == null) recordedAt = Instant.now();
    }
}
