package com.example.votequorum.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One verification attempt for a vote: the participating nodes and the round's state.
 */
public class ConsensusRound {
    
    private final String voteId;
    private final int roundNumber;
    private final List<String> participantNodeIds;
    private final RoundState state;
    private final Instant openedAt;
    private final Instant closedAt;
    
    @JsonCreator
    public ConsensusRound(
            @JsonProperty("voteId") String voteId,
            @JsonProperty("roundNumber") int roundNumber,
            @JsonProperty("participantNodeIds") List<String> participantNodeIds,
            @JsonProperty("state") RoundState state,
            @JsonProperty("openedAt") Instant openedAt,
            @JsonProperty("closedAt") Instant closedAt) {
        this.voteId = voteId;
        this.roundNumber = roundNumber;
        this.participantNodeIds = participantNodeIds != null ? List.copyOf(participantNodeIds) : List.of();
        this.state = state;
        this.openedAt = openedAt;
        this.closedAt = closedAt;
    }
    
    public String getVoteId() {
        return voteId;
    }
    
    public int getRoundNumber() {
        return roundNumber;
    }
    
    public List<String> getParticipantNodeIds() {
        return participantNodeIds;
    }
    
    public RoundState getState() {
        return state;
    }
    
    public Instant getOpenedAt() {
        return openedAt;
    }
    
    public Instant getClosedAt() {
        return closedAt;
    }
    
    public ConsensusRound close(RoundState finalState, Instant at) {
        return new ConsensusRound(voteId, roundNumber, participantNodeIds, finalState, openedAt, at);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConsensusRound that = (ConsensusRound) o;
        return roundNumber == that.roundNumber &&
               Objects.equals(voteId, that.voteId) &&
               Objects.equals(participantNodeIds, that.participantNodeIds) &&
               state == that.state &&
               Objects.equals(openedAt, that.openedAt) &&
               Objects.equals(closedAt, that.closedAt);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(voteId, roundNumber, participantNodeIds, state, openedAt, closedAt);
    }
    
    @Override
    public String toString() {
        return "ConsensusRound{" +
               "voteId='" + voteId + '\'' +
               ", roundNumber=" + roundNumber +
               ", participants=" + participantNodeIds +
               ", state=" + state +
               '}';
    }
}
