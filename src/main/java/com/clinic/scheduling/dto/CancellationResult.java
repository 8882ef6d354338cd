package com.clinic.scheduling.dto;

/**
 * @param cancelledCount slots that actually changed state; already cancelled ones are not counted
 * @param appointmentsCancelled live appointments cascaded to cancelled
 */
public record CancellationResult(int cancelledCount, int appointmentsCancelled) {
}
