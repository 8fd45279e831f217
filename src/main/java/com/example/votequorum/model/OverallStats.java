package com.example.votequorum.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counters across all elections, as shown on the public landing page.
 */
public class OverallStats {
    
    private final long totalElections;
    private final long activeElections;
    private final long finalizedVotes;
    
    @JsonCreator
    public OverallStats(
            @JsonProperty("totalElections") long totalElections,
            @JsonProperty("activeElections") long activeElections,
            @JsonProperty("finalizedVotes") long finalizedVotes) {
        this.totalElections = totalElections;
        this.activeElections = activeElections;
        this.finalizedVotes = finalizedVotes;
    }
    
    public long getTotalElections() {
        return totalElections;
    }
    
    public long getActiveElections() {
        return activeElections;
    }
    
    public long getFinalizedVotes() {
        return finalizedVotes;
    }
    
    @Override
    public String toString() {
        return "OverallStats{" +
               "totalElections=" + totalElections +
               ", activeElections=" + activeElections +
               ", finalizedVotes=" + finalizedVotes +
               '}';
    }
}
