package com.alert.triage.persistence.repository;

import com.alert.triage.persistence.entity.AuditEntryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

/**
 * Repository for audit entries. Filtered reads go through specifications built by the audit log.
 */
@Repository
public interface AuditEntryRepository extends JpaRepository<AuditEntryEntity, Long>,
        JpaSpecificationExecutor<AuditEntryEntity> {
}
