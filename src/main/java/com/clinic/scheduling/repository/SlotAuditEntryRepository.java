package com.clinic.scheduling.repository;

import com.clinic.scheduling.entity.SlotAuditEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SlotAuditEntryRepository extends JpaRepository<SlotAuditEntry, Long> {
    List<SlotAuditEntry> findBySlotIdOrderByIdAsc(Long slotId);
}
