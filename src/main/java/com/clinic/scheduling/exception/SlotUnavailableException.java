package com.clinic.scheduling.exception;

/**
 * The slot was claimed by someone else first. Callers should re-query availability
 * and retry against a different slot, never the same id.
 */
public class SlotUnavailableException extends SchedulingException {

    private final Long slotId;

    public SlotUnavailableException(Long slotId, String message) {
        super(ErrorKind.SLOT_UNAVAILABLE, message);
        this.slotId = slotId;
    }

    public Long getSlotId() {
        return slotId;
    }
}
