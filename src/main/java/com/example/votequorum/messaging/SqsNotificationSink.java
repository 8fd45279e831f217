package com.example.votequorum.messaging;

import com.example.votequorum.config.ConsensusConfig;
import com.example.votequorum.logging.StructuredLogger;
import com.example.votequorum.model.JsonPayloadSerializer;
import com.example.votequorum.model.NotificationEvent;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.CreateQueueRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;
import software.amazon.awssdk.services.sqs.model.QueueAttributeName;
import software.amazon.awssdk.services.sqs.model.QueueDoesNotExistException;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Publishes notification events to one SQS queue. The topic travels as a message attribute so
 * downstream consumers (websocket fan-out, dashboards) can route without parsing the body.
 */
public class SqsNotificationSink implements NotificationSink {
    
    static final String TOPIC_ATTRIBUTE = "Topic";
    static final String EVENT_TYPE_ATTRIBUTE = "EventType";
    
    private static final Duration CONNECTION_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration READ_TIMEOUT = Duration.ofSeconds(60);
    
    private final SqsClient sqsClient;
    private final String queueName;
    private final StructuredLogger logger;
    private final AtomicInteger messagesSent = new AtomicInteger(0);
    private volatile String queueUrl;
    
    public SqsNotificationSink(SqsClient sqsClient, String queueName, String coordinatorId) {
        this.sqsClient = sqsClient;
        this.queueName = queueName;
        this.logger = new StructuredLogger(SqsNotificationSink.class, coordinatorId);
    }
    
    /**
     * Creates a sink with an SQS client pointed at the configured endpoint.
     */
    public static SqsNotificationSink fromConfig(ConsensusConfig config) {
        SqsClient client = SqsClient.builder()
            .endpointOverride(URI.create(config.getSqsEndpoint()))
            .httpClientBuilder(UrlConnectionHttpClient.builder()
                .connectionTimeout(CONNECTION_TIMEOUT)
                .socketTimeout(READ_TIMEOUT))
            .build();
        return new SqsNotificationSink(client, config.getNotificationQueueName(), config.getCoordinatorId());
    }
    
    /**
     * Sends the event as a JSON message body.
     * 
     * @throws software.amazon.awssdk.core.exception.SdkException if SQS rejects the request
     */
    @Override
    public void publish(String topic, NotificationEvent event) {
        String body = JsonPayloadSerializer.serialize(event);
        
        SendMessageRequest request = SendMessageRequest.builder()
            .queueUrl(resolveQueueUrl())
            .messageBody(body)
            .messageAttributes(Map.of(
                TOPIC_ATTRIBUTE, MessageAttributeValue.builder()
                    .stringValue(topic)
                    .dataType("String")
                    .build(),
                EVENT_TYPE_ATTRIBUTE, MessageAttributeValue.builder()
                    .stringValue(event.getEventType().getWireName())
                    .dataType("String")
                    .build()
            ))
            .build();
        
        SendMessageResponse response = sqsClient.sendMessage(request);
        messagesSent.incrementAndGet();
        
        logger.getLogger().debug("Sent {} to {} as SQS message {}",
            event.getEventType().getWireName(), topic, response.messageId());
    }
    
    /**
     * Resolves the queue URL once, creating the queue if it does not exist yet.
     */
    String resolveQueueUrl() {
        String url = queueUrl;
        if (url != null) {
            return url;
        }
        synchronized (this) {
            if (queueUrl == null) {
                queueUrl = lookupOrCreateQueue();
            }
            return queueUrl;
        }
    }
    
    private String lookupOrCreateQueue() {
        try {
            return sqsClient.getQueueUrl(GetQueueUrlRequest.builder()
                .queueName(queueName)
                .build())
                .queueUrl();
        } catch (QueueDoesNotExistException e) {
            logger.getLogger().info("Notification queue {} does not exist, creating it", queueName);
            return sqsClient.createQueue(CreateQueueRequest.builder()
                .queueName(queueName)
                .attributes(Map.of(
                    QueueAttributeName.VISIBILITY_TIMEOUT, "30",
                    QueueAttributeName.MESSAGE_RETENTION_PERIOD, "1209600" // 14 days
                ))
                .build())
                .queueUrl();
        }
    }
    
    public int getMessagesSent() {
        return messagesSent.get();
    }
    
    public void close() {
        try {
            sqsClient.close();
        } catch (RuntimeException e) {
            logger.logError("close", "Error closing SQS client", e, 0, 0, Map.of("queue", queueName));
        }
    }
}
