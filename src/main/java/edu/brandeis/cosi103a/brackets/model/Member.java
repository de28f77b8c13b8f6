package edu.brandeis.cosi103a.brackets.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One player on a team. {@code ranking} is null for unranked players; lower is better.
 */
public record Member(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("ranking") Integer ranking,
    @JsonProperty("club") String club,
    @JsonProperty("winPercentage") double winPercentage,
    @JsonProperty("pointsDifferential") int pointsDifferential
) {
    /** Ranking used for members with no ranking. */
    public static final int UNRANKED = 9999;

    /**
     * Constructor for a member with a ranking and no recorded history.
     */
    public Member(String id, String name, Integer ranking) {
        this(id, name, ranking, null, 0.0, 0);
    }

    public Member(String id, String name, Integer ranking, String club) {
        this(id, name, ranking, club, 0.0, 0);
    }

    public int effectiveRanking() {
        return ranking == null ? UNRANKED : ranking;
    }

    public Member withRanking(int newRanking) {
        return new Member(id, name, newRanking, club, winPercentage, pointsDifferential);
    }
}
