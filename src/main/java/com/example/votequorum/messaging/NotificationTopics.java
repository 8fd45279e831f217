package com.example.votequorum.messaging;

/**
 * Topic naming for vote, election and admin channels.
 */
public final class NotificationTopics {
    
    public static final String ADMIN_DASHBOARD = "admin_dashboard";
    
    private NotificationTopics() {
    }
    
    public static String vote(String voteId) {
        return "vote_" + voteId;
    }
    
    public static String election(String electionId) {
        return "election_" + electionId;
    }
}
