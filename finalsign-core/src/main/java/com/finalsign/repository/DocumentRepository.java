package com.finalsign.repository;

import com.finalsign.model.DocumentStatus;
import com.finalsign.model.entity.Document;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {

    /**
     * Row-locks the document for the rest of the transaction. Every write path that can
     * lead to completion goes through this lock so that concurrent signers serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM Document d WHERE d.id = :id")
    Optional<Document> findByIdForUpdate(UUID id);

    Optional<Document> findByIdAndWorkspaceId(UUID id, UUID workspaceId);

    List<Document> findByWorkspaceIdOrderByCreatedAtDesc(UUID workspaceId);

    /**
     * Compare-and-set of the status column. Returns 0 when another transaction already
     * moved the document away from {@code expected}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Document d SET d.status = :target, " +
            "d.finalContent.bucket = :bucket, d.finalContent.key = :key, " +
            "d.finalContent.contentHash = :finalHash, d.finalContent.size = :size, " +
            "d.finalContent.mimeType = :mimeType, d.completedAt = :completedAt, d.updatedAt = :completedAt " +
            "WHERE d.id = :id AND d.status = :expected")
    int compareAndComplete(UUID id, DocumentStatus expected, DocumentStatus target, String bucket, String key,
            String finalHash, Long size, String mimeType, OffsetDateTime completedAt);

    default int markCompleted(UUID id, String bucket, String key, String finalHash, Long size,
            String mimeType, OffsetDateTime completedAt) {
        return compareAndComplete(id, DocumentStatus.IN_PROGRESS, DocumentStatus.COMPLETED,
                bucket, key, finalHash, size, mimeType, completedAt);
    }

    @Query("SELECT d.id FROM Document d WHERE d.status IN :statuses AND d.expiresAt <= :now")
    List<UUID> findOverdueIds(Collection<DocumentStatus> statuses, OffsetDateTime now);
}
