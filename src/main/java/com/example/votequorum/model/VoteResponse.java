package com.example.votequorum.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Response returned by the Lambda entry point.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VoteResponse {
    
    private final boolean success;
    private final String message;
    private final String coordinatorId;
    private final String errorType;
    private final Object data;
    
    @JsonCreator
    public VoteResponse(
            @JsonProperty("success") boolean success,
            @JsonProperty("message") String message,
            @JsonProperty("coordinatorId") String coordinatorId,
            @JsonProperty("errorType") String errorType,
            @JsonProperty("data") Object data) {
        this.success = success;
        this.message = message;
        this.coordinatorId = coordinatorId;
        this.errorType = errorType;
        this.data = data;
    }
    
    public boolean isSuccess() {
        return success;
    }
    
    public String getMessage() {
        return message;
    }
    
    public String getCoordinatorId() {
        return coordinatorId;
    }
    
    /**
     * Simple name of the exception that caused a failure, null on success.
     */
    public String getErrorType() {
        return errorType;
    }
    
    public Object getData() {
        return data;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VoteResponse that = (VoteResponse) o;
        return success == that.success &&
               Objects.equals(message, that.message) &&
               Objects.equals(coordinatorId, that.coordinatorId) &&
               Objects.equals(errorType, that.errorType) &&
               Objects.equals(data, that.data);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(success, message, coordinatorId, errorType, data);
    }
    
    @Override
    public String toString() {
        return "VoteResponse{" +
               "success=" + success +
               ", message='" + message + '\'' +
               ", coordinatorId='" + coordinatorId + '\'' +
               ", errorType='" + errorType + '\'' +
               '}';
    }
}
