package com.example.votequorum.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON conversion for notification events, handler requests and query views.
 */
public class JsonPayloadSerializer {
    
    private static final Logger logger = LoggerFactory.getLogger(JsonPayloadSerializer.class);
    private static final ObjectMapper objectMapper;
    
    static {
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
    
    private JsonPayloadSerializer() {
    }
    
    /**
     * Serializes a notification event for delivery over a transport.
     * 
     * @param event the event to serialize
     * @return JSON string representation
     * @throws PayloadSerializationException if serialization fails
     */
    public static String serialize(NotificationEvent event) {
        return serializeObject(event);
    }
    
    /**
     * Deserializes a notification event previously produced by {@link #serialize(NotificationEvent)}.
     * 
     * @param json the JSON string to deserialize
     * @return NotificationEvent object
     * @throws PayloadSerializationException if deserialization fails
     */
    public static NotificationEvent deserializeEvent(String json) {
        return deserialize(json, NotificationEvent.class);
    }
    
    public static VoteRequest deserializeRequest(String json) {
        return deserialize(json, VoteRequest.class);
    }
    
    public static VoteStatusView deserializeStatusView(String json) {
        return deserialize(json, VoteStatusView.class);
    }
    
    /**
     * Serializes any model object to JSON.
     * 
     * @param object the object to serialize
     * @return JSON string representation
     * @throws PayloadSerializationException if serialization fails
     */
    public static String serializeObject(Object object) {
        try {
            String json = objectMapper.writeValueAsString(object);
            logger.debug("Serialized {}: {}", object != null ? object.getClass().getSimpleName() : "null", json);
            return json;
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize object: {}", object, e);
            throw new PayloadSerializationException("Failed to serialize object", e);
        }
    }
    
    private static <T> T deserialize(String json, Class<T> type) {
        if (json == null) {
            throw new PayloadSerializationException("JSON string cannot be null");
        }
        try {
            T value = objectMapper.readValue(json, type);
            logger.debug("Deserialized {} from: {}", type.getSimpleName(), json);
            return value;
        } catch (JsonProcessingException e) {
            logger.error("Failed to deserialize {} from JSON: {}", type.getSimpleName(), json, e);
            throw new PayloadSerializationException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
    
    /**
     * Gets the configured ObjectMapper instance for advanced usage.
     * 
     * @return the ObjectMapper instance
     */
    public static ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
