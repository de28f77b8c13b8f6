package edu.brandeis.cosi103a.brackets.seeding;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.brackets.model.Team;

import java.util.List;

/**
 * Split of a seeded field into teams that start in round 2 and teams that play round 1.
 */
public record ByeAssignment(
    @JsonProperty("byeTeams") List<Team> byeTeams,
    @JsonProperty("playingTeams") List<Team> playingTeams
) {
    public ByeAssignment {
        byeTeams = ImmutableList.copyOf(byeTeams);
        playingTeams = ImmutableList.copyOf(playingTeams);
    }
}
