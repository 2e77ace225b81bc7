package com.auditra.compliance.trail;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

@Repository
public interface AuditTrailEntryRepository extends JpaRepository<AuditTrailEntry, Long>, JpaSpecificationExecutor<AuditTrailEntry> {
}
