package edu.brandeis.cosi103a.brackets.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Final score of a match. {@code score1} belongs to slot 1.
 */
public record MatchResult(
    @JsonProperty("score1") int score1,
    @JsonProperty("score2") int score2,
    @JsonProperty("winnerId") String winnerId
) {
    public static MatchResult of(int score1, int score2, String winnerId) {
        return new MatchResult(score1, score2, winnerId);
    }
}
