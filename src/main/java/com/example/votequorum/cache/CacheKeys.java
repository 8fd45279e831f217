package com.example.votequorum.cache;

/**
 * Cache key formats shared by the consensus core and the query side.
 */
public final class CacheKeys {
    
    public static final String ALL_ELECTION_STATS = "election_stats";
    
    private CacheKeys() {
    }
    
    public static String voteStatus(String voteId) {
        return "vote_status_" + voteId;
    }
    
    public static String electionStats(String electionId) {
        return "election_stats_" + electionId;
    }
}
