package com.example.votequorum.exception;

/**
 * Base class for failures raised by the vote consensus core.
 */
public class ConsensusException extends RuntimeException {
    
    public ConsensusException(String message) {
        super(message);
    }
    
    public ConsensusException(String message, Throwable cause) {
        super(message, cause);
    }
    
    /**
     * Whether a background unit of work that failed with this exception should be retried.
     * 
     * @return true if the condition may clear up on its own
     */
    public boolean isRetryable() {
        return false;
    }
}
