package com.example.votequorum.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Append-only, hash-chained record of consensus decisions. Each entry's hash is SHA-256 over its
 * canonical JSON, which includes the previous entry's hash, so editing or removing any entry
 * breaks every hash after it.
 */
public class AuditTrail {
    
    private static final Logger logger = LoggerFactory.getLogger(AuditTrail.class);
    
    static final String GENESIS_HASH = "";
    
    private static final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    
    private final Clock clock;
    private final List<AuditEntry> entries = new ArrayList<>();
    
    public AuditTrail() {
        this(Clock.systemUTC());
    }
    
    public AuditTrail(Clock clock) {
        this.clock = clock;
    }
    
    public synchronized AuditEntry append(AuditEventType type, String electionId, String voteId,
                                          Map<String, Object> details) {
        long sequence = entries.size() + 1L;
        String previousHash = entries.isEmpty() ? GENESIS_HASH : entries.get(entries.size() - 1).getHash();
        
        AuditEntry unsigned = new AuditEntry(sequence, type, electionId, voteId, details,
            clock.instant(), previousHash, null);
        AuditEntry entry = new AuditEntry(sequence, type, electionId, voteId, unsigned.getDetails(),
            unsigned.getTimestamp(), previousHash, computeHash(unsigned));
        entries.add(entry);
        
        logger.debug("Audit entry {} {} for vote {} in election {}", sequence, type, voteId, electionId);
        return entry;
    }
    
    public synchronized List<AuditEntry> entries() {
        return List.copyOf(entries);
    }
    
    public synchronized List<AuditEntry> entriesFor(String electionId) {
        return entries.stream()
            .filter(e -> electionId.equals(e.getElectionId()))
            .collect(Collectors.toList());
    }
    
    public synchronized boolean verifyChain() {
        return verifyChain(entries);
    }
    
    /**
     * Checks sequence numbers, hash links and each entry's own hash.
     */
    public static boolean verifyChain(List<AuditEntry> chain) {
        String expectedPrevious = GENESIS_HASH;
        long expectedSequence = 1;
        for (AuditEntry entry : chain) {
            if (entry.getSequence() != expectedSequence
                    || !expectedPrevious.equals(entry.getPreviousHash())
                    || !computeHash(entry).equals(entry.getHash())) {
                logger.warn("Audit chain broken at entry {}", entry.getSequence());
                return false;
            }
            expectedPrevious = entry.getHash();
            expectedSequence++;
        }
        return true;
    }
    
    static String computeHash(AuditEntry entry) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("sequence", entry.getSequence());
        node.put("type", entry.getType().name());
        node.put("electionId", entry.getElectionId());
        node.put("voteId", entry.getVoteId());
        node.set("details", objectMapper.valueToTree(entry.getDetails()));
        node.put("timestamp", entry.getTimestamp().toString());
        node.put("previousHash", entry.getPreviousHash());
        try {
            byte[] canonical = objectMapper.writeValueAsString(node).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit entry " + entry.getSequence(), e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
