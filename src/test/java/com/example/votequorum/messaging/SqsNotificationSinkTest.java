package com.example.votequorum.messaging;

import com.example.votequorum.model.JsonPayloadSerializer;
import com.example.votequorum.model.NotificationEvent;
import com.example.votequorum.model.NotificationEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.CreateQueueRequest;
import software.amazon.awssdk.services.sqs.model.CreateQueueResponse;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlResponse;
import software.amazon.awssdk.services.sqs.model.QueueDoesNotExistException;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;
import software.amazon.awssdk.services.sqs.model.SqsException;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SqsNotificationSinkTest {

    private static final String QUEUE_URL = "http://localhost:9324/000000000000/vote-consensus-notifications";

    @Mock
    private SqsClient sqsClient;

    private SqsNotificationSink sink;

    @BeforeEach
    void setUp() {
        sink = new SqsNotificationSink(sqsClient, "vote-consensus-notifications", "test-coordinator");
        lenient().when(sqsClient.sendMessage(any(SendMessageRequest.class)))
            .thenReturn(SendMessageResponse.builder().messageId("msg-1").build());
    }

    private static NotificationEvent finalized() {
        return new NotificationEvent(NotificationEventType.FINALIZED, "vote-1", "election-1", 1,
            "Vote verified", Instant.parse("2024-05-01T10:00:00Z"), null);
    }

    @Test
    @DisplayName("Should send the event as JSON with topic and type attributes")
    void shouldSendEventWithAttributes() {
        when(sqsClient.getQueueUrl(any(GetQueueUrlRequest.class)))
            .thenReturn(GetQueueUrlResponse.builder().queueUrl(QUEUE_URL).build());

        sink.publish("vote_vote-1", finalized());

        ArgumentCaptor<SendMessageRequest> captor = ArgumentCaptor.forClass(SendMessageRequest.class);
        verify(sqsClient).sendMessage(captor.capture());
        SendMessageRequest request = captor.getValue();
        assertEquals(QUEUE_URL, request.queueUrl());
        assertEquals("vote_vote-1",
            request.messageAttributes().get(SqsNotificationSink.TOPIC_ATTRIBUTE).stringValue());
        assertEquals("finalized",
            request.messageAttributes().get(SqsNotificationSink.EVENT_TYPE_ATTRIBUTE).stringValue());
        assertEquals(finalized(), JsonPayloadSerializer.deserializeEvent(request.messageBody()));
        assertEquals(1, sink.getMessagesSent());
    }

    @Test
    @DisplayName("Should look the queue up only once")
    void shouldCacheQueueUrl() {
        when(sqsClient.getQueueUrl(any(GetQueueUrlRequest.class)))
            .thenReturn(GetQueueUrlResponse.builder().queueUrl(QUEUE_URL).build());

        sink.publish("vote_vote-1", finalized());
        sink.publish("election_election-1", finalized());

        verify(sqsClient, times(1)).getQueueUrl(any(GetQueueUrlRequest.class));
        assertEquals(2, sink.getMessagesSent());
    }

    @Test
    @DisplayName("Should create the queue when it does not exist")
    void shouldCreateMissingQueue() {
        when(sqsClient.getQueueUrl(any(GetQueueUrlRequest.class)))
            .thenThrow(QueueDoesNotExistException.builder().message("missing").build());
        when(sqsClient.createQueue(any(CreateQueueRequest.class)))
            .thenReturn(CreateQueueResponse.builder().queueUrl(QUEUE_URL).build());

        assertEquals(QUEUE_URL, sink.resolveQueueUrl());

        ArgumentCaptor<CreateQueueRequest> captor = ArgumentCaptor.forClass(CreateQueueRequest.class);
        verify(sqsClient).createQueue(captor.capture());
        assertEquals("vote-consensus-notifications", captor.getValue().queueName());
    }

    @Test
    @DisplayName("Should propagate send failures to the caller")
    void shouldPropagateSendFailure() {
        when(sqsClient.getQueueUrl(any(GetQueueUrlRequest.class)))
            .thenReturn(GetQueueUrlResponse.builder().queueUrl(QUEUE_URL).build());
        when(sqsClient.sendMessage(any(SendMessageRequest.class)))
            .thenThrow(SqsException.builder().message("throttled").build());

        assertThrows(SqsException.class, () -> sink.publish("vote_vote-1", finalized()));
        assertEquals(0, sink.getMessagesSent());
    }

    @Test
    @DisplayName("Should close the client")
    void shouldCloseClient() {
        sink.close();

        verify(sqsClient).close();
    }
}
