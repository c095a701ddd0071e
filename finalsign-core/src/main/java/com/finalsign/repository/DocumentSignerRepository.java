package com.finalsign.repository;

import com.finalsign.model.entity.DocumentSigner;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DocumentSignerRepository extends JpaRepository<DocumentSigner, UUID> {

    List<DocumentSigner> findByDocumentIdOrderByOrderAsc(UUID documentId);

    Optional<DocumentSigner> findByAccessToken(String accessToken);

    boolean existsByAccessToken(String accessToken);
}
