package com.finalsign.modules.notification;

import com.finalsign.modules.notification.event.DocumentCompletedEvent;
import com.finalsign.modules.notification.event.DocumentSentEvent;
import com.finalsign.modules.notification.event.RecipientInvitation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationDispatcherTest {

    @Mock
    private NotificationGateway gateway;

    @InjectMocks
    private NotificationDispatcher dispatcher;

    private final DocumentSentEvent sent = new DocumentSentEvent(UUID.randomUUID(), "Lease", UUID.randomUUID(),
            UUID.randomUUID(), List.of(new RecipientInvitation(1, "tenant@example.com", "Tenant", "token")));

    @Test
    void forwardsEvents() {
        DocumentCompletedEvent completed = new DocumentCompletedEvent(UUID.randomUUID(), "Lease", UUID.randomUUID(),
                UUID.randomUUID(), "f".repeat(64), OffsetDateTime.now(), List.of("tenant@example.com"));

        dispatcher.onDocumentSent(sent);
        dispatcher.onDocumentCompleted(completed);

        verify(gateway).documentSent(sent);
        verify(gateway).documentCompleted(completed);
    }

    @Test
    void deliveryFailuresDoNotPropagate() {
        doThrow(new IllegalStateException("smtp down")).when(gateway).documentSent(sent);

        assertDoesNotThrow(() -> dispatcher.onDocumentSent(sent));
    }
}
