package com.clinic.scheduling.dto;

import com.clinic.scheduling.entity.Doctor;

import java.util.Set;
import java.util.TreeSet;

public record DoctorView(Long id, String name, Set<Long> specialtyIds) {

    public static DoctorView from(Doctor d) {
        return new DoctorView(d.getId(), d.getName(), new TreeSet<>(d.getSpecialtyIds()));
    }
}
