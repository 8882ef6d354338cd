package com.clinic.scheduling.entity;

/**
 * How a consultation takes place. Shared by slots and the appointments bound to them.
 */
public enum DeliveryMode {
    PHYSICAL,
    TELEMEDICINE
}
