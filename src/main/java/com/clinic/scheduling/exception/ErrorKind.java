package com.clinic.scheduling.exception;

/**
 * Failure categories surfaced to callers. Only {@link #SLOT_UNAVAILABLE} is worth an automatic
 * retry, and only against a freshly queried slot.
 */
public enum ErrorKind {
    VALIDATION,
    NOT_FOUND,
    FORBIDDEN,
    SLOT_UNAVAILABLE,
    SLOT_CONFLICT,
    INVALID_STATE,
    UNAUTHENTICATED
}
