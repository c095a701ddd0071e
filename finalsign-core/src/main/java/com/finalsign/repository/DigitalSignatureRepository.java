package com.finalsign.repository;

import com.finalsign.model.entity.DigitalSignature;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface DigitalSignatureRepository extends JpaRepository<DigitalSignature, UUID> {

    boolean existsByDocumentIdAndDocumentSignerId(UUID documentId, UUID documentSignerId);

    List<DigitalSignature> findByDocumentId(UUID documentId);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE DigitalSignature s SET s.finalDocumentHash = :finalHash WHERE s.documentId = :documentId")
    int stampFinalHash(UUID documentId, String finalHash);
}
