package com.finalsign.repository;

import com.finalsign.model.entity.FormSubmission;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FormSubmissionRepository extends JpaRepository<FormSubmission, UUID> {

    Optional<FormSubmission> findByDocumentIdAndDocumentSignerIdAndFieldId(UUID documentId,
            UUID documentSignerId, UUID fieldId);

    List<FormSubmission> findByDocumentId(UUID documentId);

    List<FormSubmission> findByDocumentIdAndDocumentSignerId(UUID documentId, UUID documentSignerId);

    long countByDocumentId(UUID documentId);
}
