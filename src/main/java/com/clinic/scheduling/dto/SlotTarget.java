package com.clinic.scheduling.dto;

import java.time.LocalDateTime;

/**
 * What a booking points at: a concrete slot, or a doctor and start instant that the
 * booking manager resolves to a slot (creating one when the doctor is free then).
 */
public final class SlotTarget {

    private final Long slotId;
    private final Long doctorId;
    private final LocalDateTime startsAt;

    private SlotTarget(Long slotId, Long doctorId, LocalDateTime startsAt) {
        this.slotId = slotId;
        this.doctorId = doctorId;
        this.startsAt = startsAt;
    }

    public static SlotTarget slot(Long slotId) {
        return new SlotTarget(slotId, null, null);
    }

    public static SlotTarget doctorAt(Long doctorId, LocalDateTime startsAt) {
        return new SlotTarget(null, doctorId, startsAt);
    }

    public boolean isBySlotId() {
        return slotId != null;
    }

    public Long getSlotId() {
        return slotId;
    }

    public Long getDoctorId() {
        return doctorId;
    }

    public LocalDateTime getStartsAt() {
        return startsAt;
    }

    @Override
    public String toString() {
        return isBySlotId() ? "slot " + slotId : "doctor " + doctorId + " at " + startsAt;
    }
}
