package com.finalsign.modules.notification;

import com.finalsign.modules.notification.event.DocumentCompletedEvent;
import com.finalsign.modules.notification.event.DocumentSentEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Hands lifecycle events to the {@link NotificationGateway} once the publishing
 * transaction has committed. Runs on the notification executor; delivery failures are
 * logged and dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationDispatcher {

    private final NotificationGateway gateway;

    @Async("notificationExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onDocumentSent(DocumentSentEvent event) {
        try {
            gateway.documentSent(event);
        } catch (RuntimeException e) {
            log.error("Failed to deliver sent notification for document {}: {}",
                    event.documentId(), e.getMessage(), e);
        }
    }

    @Async("notificationExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onDocumentCompleted(DocumentCompletedEvent event) {
        try {
            gateway.documentCompleted(event);
        } catch (RuntimeException e) {
            log.error("Failed to deliver completion notification for document {}: {}",
                    event.documentId(), e.getMessage(), e);
        }
    }
}
