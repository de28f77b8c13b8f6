package edu.brandeis.cosi103a.brackets.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where a team goes after a match: the successor match and which of its slots (1 or 2).
 */
public record Advancement(
    @JsonProperty("matchId") String matchId,
    @JsonProperty("slot") int slot
) {
    public Advancement {
        if (slot != 1 && slot != 2) {
            throw new IllegalArgumentException("Slot must be 1 or 2, got " + slot);
        }
    }
}
