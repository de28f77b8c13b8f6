package edu.brandeis.cosi103a.brackets.standings;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Match counts behind a standings snapshot. Pending counts every match neither
 * completed nor cancelled.
 */
public record StandingsMetadata(
    @JsonProperty("totalMatches") int totalMatches,
    @JsonProperty("completedMatches") int completedMatches,
    @JsonProperty("pendingMatches") int pendingMatches,
    @JsonProperty("complete") boolean complete
) {
}
