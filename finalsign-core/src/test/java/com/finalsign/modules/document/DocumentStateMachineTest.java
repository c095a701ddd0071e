package com.finalsign.modules.document;

import com.finalsign.exception.ConflictException;
import com.finalsign.exception.DocumentClosedException;
import com.finalsign.model.DocumentStatus;
import com.finalsign.model.entity.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DocumentStateMachineTest {

    private final DocumentStateMachine stateMachine = new DocumentStateMachine();

    private static Document document(DocumentStatus status) {
        return Document.builder().id(UUID.randomUUID()).status(status).build();
    }

    @Test
    void forwardPath() {
        Document document = document(DocumentStatus.DRAFT);

        stateMachine.transition(document, DocumentStatus.SENT);
        stateMachine.markStarted(document);
        stateMachine.transition(document, DocumentStatus.COMPLETED);

        assertEquals(DocumentStatus.COMPLETED, document.getStatus());
    }

    @Test
    void scheduledDocumentsCanBeSent() {
        Document document = document(DocumentStatus.SCHEDULED);

        stateMachine.transition(document, DocumentStatus.SENT);

        assertEquals(DocumentStatus.SENT, document.getStatus());
    }

    @ParameterizedTest
    @EnumSource(value = DocumentStatus.class, names = {"COMPLETED", "EXPIRED", "CANCELLED"})
    @DisplayName("terminal documents accept no transition at all")
    void terminalIsFinal(DocumentStatus terminal) {
        for (DocumentStatus target : DocumentStatus.values()) {
            Document document = document(terminal);
            assertFalse(stateMachine.canTransition(terminal, target));
            assertThrows(DocumentClosedException.class, () -> stateMachine.transition(document, target));
            assertEquals(terminal, document.getStatus());
        }
    }

    @ParameterizedTest
    @EnumSource(value = DocumentStatus.class, names = {"DRAFT", "SCHEDULED", "SENT", "IN_PROGRESS"})
    void openDocumentsCanBeCancelledOrExpired(DocumentStatus open) {
        assertTrue(stateMachine.canTransition(open, DocumentStatus.CANCELLED));
        assertTrue(stateMachine.canTransition(open, DocumentStatus.EXPIRED));
    }

    @Test
    @DisplayName("completion is only reachable from in_progress")
    void completionRequiresProgress() {
        Document document = document(DocumentStatus.SENT);

        ConflictException e = assertThrows(ConflictException.class,
                () -> stateMachine.transition(document, DocumentStatus.COMPLETED));

        assertEquals("ILLEGAL_TRANSITION", e.getErrorCode());
        assertFalse(e instanceof DocumentClosedException);
        assertEquals(DocumentStatus.SENT, document.getStatus());
    }

    @Test
    void noGoingBackwards() {
        assertFalse(stateMachine.canTransition(DocumentStatus.IN_PROGRESS, DocumentStatus.SENT));
        assertFalse(stateMachine.canTransition(DocumentStatus.SENT, DocumentStatus.DRAFT));
        assertFalse(stateMachine.canTransition(DocumentStatus.SENT, DocumentStatus.SCHEDULED));
    }

    @Test
    void submissionsNeedADistributedDocument() {
        ConflictException notSent = assertThrows(ConflictException.class,
                () -> stateMachine.requireAcceptsSubmissions(document(DocumentStatus.DRAFT)));
        assertEquals("DOCUMENT_NOT_SENT", notSent.getErrorCode());

        assertThrows(DocumentClosedException.class,
                () -> stateMachine.requireAcceptsSubmissions(document(DocumentStatus.EXPIRED)));

        assertDoesNotThrow(() -> stateMachine.requireAcceptsSubmissions(document(DocumentStatus.SENT)));
        assertDoesNotThrow(() -> stateMachine.requireAcceptsSubmissions(document(DocumentStatus.IN_PROGRESS)));
    }

    @Test
    void markStartedLeavesInProgressAlone() {
        Document document = document(DocumentStatus.IN_PROGRESS);

        stateMachine.markStarted(document);

        assertEquals(DocumentStatus.IN_PROGRESS, document.getStatus());
    }

    @Test
    void nonTerminalStatuses() {
        assertEquals(EnumSet.of(DocumentStatus.DRAFT, DocumentStatus.SCHEDULED, DocumentStatus.SENT,
                DocumentStatus.IN_PROGRESS), stateMachine.nonTerminal());
    }
}
