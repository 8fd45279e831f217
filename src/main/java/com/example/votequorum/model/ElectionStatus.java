package com.example.votequorum.model;

/**
 * Lifecycle of an election as far as consensus cares.
 */
public enum ElectionStatus {
    UPCOMING,
    ACTIVE,
    COMPLETED
}
