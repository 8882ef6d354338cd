package com.clinic.scheduling.dto;

import com.clinic.scheduling.entity.SlotAuditEntry;

import java.time.Instant;

public record AuditEntryView(SlotAuditEntry.Action action, String detail, Long actorId, Instant recordedAt) {

    public static AuditEntryView from(SlotAuditEntry e) {
        return new AuditEntryView(e.getAction(), e.getDetail(), e.getActorId(), e.getRecordedAt());
    }
}
