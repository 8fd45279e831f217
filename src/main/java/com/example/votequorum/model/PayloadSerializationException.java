package com.example.votequorum.model;

/**
 * Exception thrown when a payload cannot be converted to or from JSON.
 */
public class PayloadSerializationException extends RuntimeException {
    
    /**
     * Constructs a new PayloadSerializationException with the specified detail message.
     * 
     * @param message the detail message
     */
    public PayloadSerializationException(String message) {
        super(message);
    }
    
    /**
     * Constructs a new PayloadSerializationException with the specified detail message and cause.
     * 
     * @param message the detail message
     * @param cause the cause
     */
    public PayloadSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
