package com.municipality.wastecollection.repository;

import com.municipality.wastecollection.model.AuditEntry;
import com.municipality.wastecollection.model.AuditedEntity;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface AuditEntryRepository extends MongoRepository<AuditEntry, String> {

    List<AuditEntry> findByEntityTypeAndEntityIdOrderByCreatedAtAsc(AuditedEntity entityType, String entityId);

    List<AuditEntry> findByActionDateOrderByCreatedAtAsc(LocalDate actionDate);
}
