package com.municipality.wastecollection.service;

import com.municipality.wastecollection.dto.AuditEvent;
import com.municipality.wastecollection.model.AuditEntry;
import com.municipality.wastecollection.model.AuditedEntity;
import com.municipality.wastecollection.repository.AuditEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Append-only audit log of entity changes. Entries are written from the {@link AuditEvent}s
 * the owning services publish after each committed change.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditTrailService {

    private final AuditEntryRepository auditEntryRepository;

    @EventListener
    public void onAuditEvent(AuditEvent event) {
        AuditEntry entry = new AuditEntry(UUID.randomUUID().toString(), event.getActorId(), event.getAction(),
                event.getEntityType(), event.getEntityId(), event.getOldValues(), event.getNewValues(),
                event.getOccurredAt(), event.getOccurredAt().toLocalDate());
        auditEntryRepository.save(entry);
        log.debug("📝 {} {} {}", event.getAction(), event.getEntityType(), event.getEntityId());
    }

    /**
     * Every recorded change of one entity, oldest first.
     */
    public List<AuditEntry> getHistory(AuditedEntity entityType, String entityId) {
        return auditEntryRepository.findByEntityTypeAndEntityIdOrderByCreatedAtAsc(entityType, entityId);
    }

    public List<AuditEntry> getEntriesOn(LocalDate date) {
        return auditEntryRepository.findByActionDateOrderByCreatedAtAsc(date);
    }
}
