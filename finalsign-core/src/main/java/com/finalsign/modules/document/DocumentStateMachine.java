package com.finalsign.modules.document;

import com.finalsign.exception.ConflictException;
import com.finalsign.exception.DocumentClosedException;
import com.finalsign.model.DocumentStatus;
import com.finalsign.model.entity.Document;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Legal document status transitions. Every status write goes through
 * {@link #transition}; terminal documents reject all of them.
 */
@Slf4j
@Component
public class DocumentStateMachine {

    private static final Map<DocumentStatus, Set<DocumentStatus>> TRANSITIONS = new EnumMap<>(DocumentStatus.class);

    static {
        TRANSITIONS.put(DocumentStatus.DRAFT, EnumSet.of(
                DocumentStatus.SCHEDULED, DocumentStatus.SENT, DocumentStatus.EXPIRED, DocumentStatus.CANCELLED));
        TRANSITIONS.put(DocumentStatus.SCHEDULED, EnumSet.of(
                DocumentStatus.SENT, DocumentStatus.EXPIRED, DocumentStatus.CANCELLED));
        TRANSITIONS.put(DocumentStatus.SENT, EnumSet.of(
                DocumentStatus.IN_PROGRESS, DocumentStatus.EXPIRED, DocumentStatus.CANCELLED));
        TRANSITIONS.put(DocumentStatus.IN_PROGRESS, EnumSet.of(
                DocumentStatus.COMPLETED, DocumentStatus.EXPIRED, DocumentStatus.CANCELLED));
        TRANSITIONS.put(DocumentStatus.COMPLETED, EnumSet.noneOf(DocumentStatus.class));
        TRANSITIONS.put(DocumentStatus.EXPIRED, EnumSet.noneOf(DocumentStatus.class));
        TRANSITIONS.put(DocumentStatus.CANCELLED, EnumSet.noneOf(DocumentStatus.class));
    }

    public boolean canTransition(DocumentStatus from, DocumentStatus to) {
        return TRANSITIONS.getOrDefault(from, Collections.emptySet()).contains(to);
    }

    public Set<DocumentStatus> nonTerminal() {
        EnumSet<DocumentStatus> open = EnumSet.noneOf(DocumentStatus.class);
        for (DocumentStatus status : DocumentStatus.values()) {
            if (!status.isTerminal()) {
                open.add(status);
            }
        }
        return open;
    }

    /**
     * Moves the entity to {@code target}. The caller persists it.
     *
     * @throws DocumentClosedException if the document is already terminal
     * @throws ConflictException       for any other illegal transition
     */
    public void transition(Document document, DocumentStatus target) {
        DocumentStatus current = document.getStatus();
        if (current.isTerminal()) {
            throw new DocumentClosedException(document.getId(), current);
        }
        if (!canTransition(current, target)) {
            throw new ConflictException("ILLEGAL_TRANSITION", "Document " + document.getId()
                    + " cannot move from " + current.getValue() + " to " + target.getValue());
        }
        document.setStatus(target);
        log.info("Document {} status {} -> {}", document.getId(), current.getValue(), target.getValue());
    }

    /**
     * Recipients may fill fields and sign only once the document has been distributed and
     * while it is still open.
     */
    public void requireAcceptsSubmissions(Document document) {
        DocumentStatus status = document.getStatus();
        if (status.isTerminal()) {
            throw new DocumentClosedException(document.getId(), status);
        }
        if (!status.acceptsSubmissions()) {
            throw new ConflictException("DOCUMENT_NOT_SENT", "Document " + document.getId()
                    + " has not been sent to recipients yet");
        }
    }

    /**
     * Marks first recipient interaction.
     */
    public void markStarted(Document document) {
        if (document.getStatus() == DocumentStatus.SENT) {
            transition(document, DocumentStatus.IN_PROGRESS);
        }
    }
}
