package com.clinic.scheduling.auth;

public enum AccessDecision {
    ALLOW,
    DENY;

    public boolean allowed() {
        return this == ALLOW;
    }
}
