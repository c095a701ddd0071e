package com.finalsign.repository;

import com.finalsign.model.entity.Template;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TemplateRepository extends JpaRepository<Template, UUID> {

    Optional<Template> findByIdAndWorkspaceIdAndActiveTrue(UUID id, UUID workspaceId);

    List<Template> findByWorkspaceIdAndActiveTrueOrderByCreatedAtDesc(UUID workspaceId);
}
