package com.finalsign.repository;

import com.finalsign.model.entity.TemplateSigner;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TemplateSignerRepository extends JpaRepository<TemplateSigner, UUID> {

    List<TemplateSigner> findByTemplateIdOrderByOrderAsc(UUID templateId);

    long countByTemplateId(UUID templateId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM TemplateSigner s WHERE s.templateId = :templateId")
    int deleteAllByTemplateId(UUID templateId);
}
