package com.finalsign.modules.notification;

import com.finalsign.modules.notification.event.DocumentCompletedEvent;
import com.finalsign.modules.notification.event.DocumentSentEvent;
import com.finalsign.modules.notification.event.RecipientInvitation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default gateway until a delivery integration is wired in. Writes one log line per
 * outgoing message.
 */
@Slf4j
@Component
public class LoggingNotificationGateway implements NotificationGateway {

    @Override
    public void documentSent(DocumentSentEvent event) {
        for (RecipientInvitation recipient : event.recipients()) {
            log.info("[NOTIFY] Signing invitation for document {} ('{}') to {} (order {}, token={})",
                    event.documentId(), event.documentName(), recipient.email(), recipient.order(),
                    recipient.accessToken());
        }
    }

    @Override
    public void documentCompleted(DocumentCompletedEvent event) {
        log.info("[NOTIFY] Document {} ('{}') completed at {} (hash={}); notifying owner {} and {} recipients",
                event.documentId(), event.documentName(), event.completedAt(), event.finalDocumentHash(),
                event.createdBy(), event.recipientEmails().size());
    }
}
