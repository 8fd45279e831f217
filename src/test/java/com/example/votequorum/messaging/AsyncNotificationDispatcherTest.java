package com.example.votequorum.messaging;

import com.example.votequorum.model.NotificationEvent;
import com.example.votequorum.model.NotificationEventType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AsyncNotificationDispatcherTest {

    @Mock
    private NotificationSink delegate;

    private AsyncNotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new AsyncNotificationDispatcher(delegate, "test-coordinator");
    }

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    private static NotificationEvent event() {
        return NotificationEvent.forElection(NotificationEventType.ELECTION_STATUS, "e-1", "open", Map.of());
    }

    @Test
    @DisplayName("Should deliver events to the delegate off the caller's thread")
    void shouldDeliver() {
        NotificationEvent event = event();

        dispatcher.publish("election_e-1", event);

        verify(delegate, timeout(2000)).publish("election_e-1", event);
    }

    @Test
    @DisplayName("Should swallow and count delegate failures")
    void shouldNotPropagateFailures() {
        doThrow(new IllegalStateException("transport down")).when(delegate).publish(any(), any());

        assertDoesNotThrow(() -> dispatcher.publish("admin_dashboard", event()));

        verify(delegate, timeout(2000)).publish(eq("admin_dashboard"), any());
        dispatcher.shutdown();
        assertEquals(1, dispatcher.getFailedCount());
        assertEquals(0, dispatcher.getDeliveredCount());
    }

    @Test
    @DisplayName("Should skip events without a topic")
    void shouldSkipMissingTopic() {
        dispatcher.publish(null, event());
        dispatcher.shutdown();

        verifyNoInteractions(delegate);
    }

    @Test
    @DisplayName("Should name topics after votes, elections and the admin channel")
    void shouldFormatTopics() {
        assertEquals("vote_v-1", NotificationTopics.vote("v-1"));
        assertEquals("election_e-1", NotificationTopics.election("e-1"));
        assertEquals("admin_dashboard", NotificationTopics.ADMIN_DASHBOARD);
    }
}
