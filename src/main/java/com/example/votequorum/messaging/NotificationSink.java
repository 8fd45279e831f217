package com.example.votequorum.messaging;

import com.example.votequorum.model.NotificationEvent;

/**
 * Push-notification channel the consensus core publishes to. Implementations own the transport.
 */
public interface NotificationSink {
    
    /**
     * Publishes an event to a topic.
     * 
     * @param topic Topic name, see {@link NotificationTopics}
     * @param event The event to deliver
     */
    void publish(String topic, NotificationEvent event);
}
