package com.finalsign.repository;

import com.finalsign.model.entity.TemplateField;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TemplateFieldRepository extends JpaRepository<TemplateField, UUID> {

    List<TemplateField> findByTemplateIdOrderByNameAsc(UUID templateId);

    List<TemplateField> findByTemplateIdAndSignerId(UUID templateId, UUID signerId);

    long countByTemplateId(UUID templateId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM TemplateField f WHERE f.templateId = :templateId")
    int deleteAllByTemplateId(UUID templateId);
}
