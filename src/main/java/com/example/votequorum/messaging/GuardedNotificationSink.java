package com.example.votequorum.messaging;

import com.example.votequorum.logging.StructuredLogger;
import com.example.votequorum.model.NotificationEvent;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delivers on the caller's thread but keeps transport failures away from it. The consensus core
 * publishes through this wrapper, so a state change that already happened is never reported as
 * a failed step.
 */
public class GuardedNotificationSink implements NotificationSink {

    private final NotificationSink delegate;
    private final StructuredLogger logger;
    private final AtomicInteger failed = new AtomicInteger(0);

    GuardedNotificationSink(NotificationSink delegate, String coordinatorId) {
        this.delegate = delegate;
        this.logger = new StructuredLogger(GuardedNotificationSink.class, coordinatorId);
    }

    /**
     * Wraps a sink unless it already keeps failures from its callers.
     */
    public static NotificationSink guard(NotificationSink sink, String coordinatorId) {
        if (sink instanceof GuardedNotificationSink || sink instanceof AsyncNotificationDispatcher) {
            return sink;
        }
        return new GuardedNotificationSink(sink, coordinatorId);
    }

    @Override
    public void publish(String topic, NotificationEvent event) {
        try {
            delegate.publish(topic, event);
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            Map<String, Object> context = new HashMap<>();
            context.put("errorType", e.getClass().getSimpleName());
            context.put("error", String.valueOf(e.getMessage()));
            logger.logNotification(StructuredLogger.DeliveryResult.FAILED, topic,
                event != null ? event.getEventType().getWireName() : null,
                event != null ? event.getVoteId() : null, context);
        }
    }

    public int getFailedCount() {
        return failed.get();
    }
}
