package com.clinic.scheduling.service;

import com.clinic.scheduling.dto.AuditEntryView;
import com.clinic.scheduling.entity.AppointmentSlot;
import com.clinic.scheduling.entity.SlotAuditEntry;
import com.clinic.scheduling.exception.NotFoundException;
import com.clinic.scheduling.repository.AppointmentSlotRepository;
import com.clinic.scheduling.repository.SlotAuditEntryRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

/**
 * Append-only history of slot transitions, written in the caller's transaction so an entry
 * exists exactly when the change it describes was committed.
 */
@Service
public class SlotAuditService {

    private final SlotAuditEntryRepository auditRepository;
    private final AppointmentSlotRepository slotRepository;

    public SlotAuditService(SlotAuditEntryRepository auditRepository, AppointmentSlotRepository slotRepository) {
        this.auditRepository = auditRepository;
        this.slotRepository = slotRepository;
    }

    @Transactional
    public void record(Long slotId, Long doctorId, SlotAuditEntry.Action action, String detail, Long actorId) {
        auditRepository.save(SlotAuditEntry.builder()
                .slotId(slotId)
                .doctorId(doctorId)
                .action(action)
                .detail(detail)
                .actorId(actorId)
                .build());
    }

    @Transactional
    public void record(AppointmentSlot slot, SlotAuditEntry.Action action, String detail, Long actorId) {
        record(slot.getId(), slot.getDoctor().getId(), action, detail, actorId);
    }

    @Transactional
    public void recordAll(Collection<AppointmentSlot> slots, SlotAuditEntry.Action action, String detail, Long actorId) {
        List<SlotAuditEntry> entries = slots.stream()
                .map(s -> SlotAuditEntry.builder()
                        .slotId(s.getId())
                        .doctorId(s.getDoctor().getId())
                        .action(action)
                        .detail(detail)
                        .actorId(actorId)
                        .build())
                .toList();
        auditRepository.saveAll(entries);
    }

    @Transactional(readOnly = true)
    public List<AuditEntryView> history(Long slotId) {
        if (!slotRepository.existsById(slotId)) {
            throw NotFoundException.slot(slotId);
        }
        return auditRepository.findBySlotIdOrderByIdAsc(slotId).stream()
                .map(AuditEntryView::from)
                .toList();
    }
}
