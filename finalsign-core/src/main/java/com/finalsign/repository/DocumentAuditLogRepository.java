package com.finalsign.repository;

import com.finalsign.model.entity.DocumentAuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface DocumentAuditLogRepository extends JpaRepository<DocumentAuditLog, UUID> {

    List<DocumentAuditLog> findByDocumentIdOrderByCreatedAtAsc(UUID documentId);

    List<DocumentAuditLog> findByTemplateIdOrderByCreatedAtAsc(UUID templateId);
}
