package com.clinic.scheduling.auth;

/**
 * Identity asserted by the upstream authentication gate. Trusted as-is.
 */
public record CallerIdentity(Long userId, CallerRole role) {

    public static CallerIdentity patient(Long userId) {
        return new CallerIdentity(userId, CallerRole.PATIENT);
    }

    public static CallerIdentity doctor(Long userId) {
        return new CallerIdentity(userId, CallerRole.DOCTOR);
    }

    public static CallerIdentity admin(Long userId) {
        return new CallerIdentity(userId, CallerRole.ADMIN);
    }

    public boolean isAdmin() {
        return role == CallerRole.ADMIN;
    }

    public boolean isDoctor() {
        return role == CallerRole.DOCTOR;
    }
}
