package com.example.votequorum.state;

import com.example.votequorum.exception.ElectionNotActiveException;
import com.example.votequorum.model.Election;
import com.example.votequorum.model.ElectionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ElectionRegistryImplTest {

    private ElectionRegistryImpl registry;

    @BeforeEach
    void setUp() {
        registry = new ElectionRegistryImpl("test-coordinator");
    }

    @Test
    @DisplayName("Should walk an election from upcoming through active to completed")
    void shouldFollowLifecycle() {
        Election registered = registry.register("e-1", "Student Council", 5);
        assertEquals(ElectionStatus.UPCOMING, registered.getStatus());
        assertFalse(registry.isActive("e-1"));

        assertEquals(ElectionStatus.ACTIVE, registry.start("e-1").getStatus());
        assertTrue(registry.isActive("e-1"));
        assertEquals(5, registry.requireActive("e-1").getReplicationFactor());

        assertEquals(ElectionStatus.COMPLETED, registry.end("e-1").getStatus());
        assertFalse(registry.isActive("e-1"));
        assertEquals(1, registry.findByStatus(ElectionStatus.COMPLETED).size());
    }

    @Test
    @DisplayName("Should refuse out-of-order transitions")
    void shouldRefuseInvalidTransitions() {
        registry.register("e-1", "Student Council", 3);

        assertThrows(ElectionNotActiveException.class, () -> registry.end("e-1"));
        registry.start("e-1");
        assertThrows(ElectionNotActiveException.class, () -> registry.start("e-1"));
        registry.end("e-1");
        assertThrows(ElectionNotActiveException.class, () -> registry.end("e-1"));
        assertThrows(ElectionNotActiveException.class, () -> registry.requireActive("e-1"));
    }

    @Test
    @DisplayName("Should reject unknown and duplicate elections")
    void shouldRejectUnknownAndDuplicate() {
        registry.register("e-1", "Student Council", 3);

        assertThrows(IllegalArgumentException.class, () -> registry.register("e-1", "Again", 3));
        assertThrows(IllegalArgumentException.class, () -> registry.register("e-2", "Bad", 0));
        assertThrows(ElectionNotActiveException.class, () -> registry.start("missing"));
        assertThrows(ElectionNotActiveException.class, () -> registry.requireActive("missing"));
        assertTrue(registry.get("missing").isEmpty());
    }
}
