package com.clinic.scheduling.auth;

public enum AppointmentAction {
    READ,
    UPDATE,
    DELETE
}
