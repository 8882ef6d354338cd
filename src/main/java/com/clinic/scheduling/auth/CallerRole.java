package com.clinic.scheduling.auth;

public enum CallerRole {
    PATIENT,
    DOCTOR,
    ADMIN
}
