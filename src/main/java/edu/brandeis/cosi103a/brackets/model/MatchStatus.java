package edu.brandeis.cosi103a.brackets.model;

/**
 * Lifecycle of a match. {@link #PENDING} matches still have at least one
 * placeholder slot; they become {@link #SCHEDULED} once both participants are known.
 */
public enum MatchStatus {
    PENDING,
    SCHEDULED,
    ACTIVE,
    COMPLETED,
    CANCELLED
}
