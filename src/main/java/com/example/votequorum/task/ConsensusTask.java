package com.example.votequorum.task;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * A deferred unit of consensus work for one vote, such as opening a round or evaluating it.
 */
public final class ConsensusTask {
    
    private final String name;
    private final String voteId;
    private final Integer round;
    private final Runnable action;
    private final Consumer<Throwable> onExhausted;
    
    private ConsensusTask(String name, String voteId, Integer round, Runnable action, Consumer<Throwable> onExhausted) {
        this.name = Objects.requireNonNull(name, "name");
        this.voteId = voteId;
        this.round = round;
        this.action = Objects.requireNonNull(action, "action");
        this.onExhausted = onExhausted;
    }
    
    public static ConsensusTask of(String name, String voteId, Integer round, Runnable action) {
        return new ConsensusTask(name, voteId, round, action, null);
    }
    
    /**
     * Returns a copy that runs {@code handler} once the task is dead-lettered.
     */
    public ConsensusTask onExhausted(Consumer<Throwable> handler) {
        return new ConsensusTask(name, voteId, round, action, handler);
    }
    
    public String getName() {
        return name;
    }
    
    public String getVoteId() {
        return voteId;
    }
    
    public Integer getRound() {
        return round;
    }
    
    void run() {
        action.run();
    }
    
    Consumer<Throwable> getExhaustedHandler() {
        return onExhausted;
    }
    
    @Override
    public String toString() {
        return "ConsensusTask{name='" + name + "', voteId='" + voteId + "', round=" + round + '}';
    }
}
