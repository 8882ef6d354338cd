package com.clinic.scheduling.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.HashSet;
import java.util.Set;

/**
 * Local mirror of a health professional profile owned by the party store.
 * Slots and appointments reference it; the scheduler never edits it.
 */
@Entity
@Table(name = "doctor")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Doctor {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Authenticated user acting as this doctor. */
    @Column(name = "user_id", unique = true)
    private Long userId;

    @Column(nullable = false, length = 100)
    private String name;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "doctor_specialty", joinColumns = @JoinColumn(name = "doctor_id"))
    @Column(name = "specialty_id", nullable = false)
    @Builder.Default
    private Set<Long> specialtyIds = new HashSet<>();

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;
}
