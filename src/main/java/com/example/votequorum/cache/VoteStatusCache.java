package com.example.votequorum.cache;

import com.example.votequorum.model.ElectionStats;
import com.example.votequorum.model.OverallStats;
import com.example.votequorum.model.VoteStatusView;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalListener;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * In-process caches for vote status views and election statistics. Each view type has its own
 * cache; {@link #invalidate(String)} takes the {@link CacheKeys} format and drops the key from
 * whichever cache holds it.
 */
public class VoteStatusCache implements CacheInvalidator {
    
    private static final Logger logger = LoggerFactory.getLogger(VoteStatusCache.class);
    
    static final long MAXIMUM_SIZE = 10_000;
    
    private final Cache<String, VoteStatusView> voteStatuses;
    private final Cache<String, ElectionStats> electionStats;
    private final Cache<String, OverallStats> overallStats;
    
    public VoteStatusCache(Duration ttl) {
        this.voteStatuses = newCache(ttl, MAXIMUM_SIZE);
        this.electionStats = newCache(ttl, MAXIMUM_SIZE);
        this.overallStats = newCache(ttl, 1);
    }
    
    private static <V> Cache<String, V> newCache(Duration ttl, long maximumSize) {
        return Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfterWrite(ttl)
            .recordStats()
            .removalListener((RemovalListener<String, V>) (key, value, cause) ->
                logger.debug("Cache entry removed: key={}, cause={}", key, cause))
            .build();
    }
    
    public Optional<VoteStatusView> getVoteStatus(String voteId) {
        return Optional.ofNullable(voteStatuses.getIfPresent(CacheKeys.voteStatus(voteId)));
    }
    
    public void putVoteStatus(String voteId, VoteStatusView view) {
        voteStatuses.put(CacheKeys.voteStatus(voteId), view);
    }
    
    /**
     * Returns the cached statistics of an election, computing and caching them on a miss.
     * Loader failures propagate and leave nothing cached.
     */
    public ElectionStats getElectionStats(String electionId, Supplier<ElectionStats> loader) {
        return electionStats.get(CacheKeys.electionStats(electionId), k -> loader.get());
    }
    
    public OverallStats getOverallStats(Supplier<OverallStats> loader) {
        return overallStats.get(CacheKeys.ALL_ELECTION_STATS, k -> loader.get());
    }
    
    @Override
    public void invalidate(String key) {
        voteStatuses.invalidate(key);
        electionStats.invalidate(key);
        overallStats.invalidate(key);
    }
    
    public void invalidateAll() {
        voteStatuses.invalidateAll();
        electionStats.invalidateAll();
        overallStats.invalidateAll();
    }
    
    /**
     * Combined hit and miss counts of all three caches.
     */
    public CacheStats stats() {
        return voteStatuses.stats().plus(electionStats.stats()).plus(overallStats.stats());
    }
    
    public long estimatedSize() {
        return voteStatuses.estimatedSize() + electionStats.estimatedSize() + overallStats.estimatedSize();
    }
}
