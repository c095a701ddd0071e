package com.finalsign.modules.notification;

import com.finalsign.modules.notification.event.DocumentCompletedEvent;
import com.finalsign.modules.notification.event.DocumentSentEvent;

/**
 * Outbound seam to the notification collaborator (e-mail, in-app). Delivery is outside
 * the signing core; implementations may throw, callers never wait on them.
 */
public interface NotificationGateway {

    void documentSent(DocumentSentEvent event);

    void documentCompleted(DocumentCompletedEvent event);
}
