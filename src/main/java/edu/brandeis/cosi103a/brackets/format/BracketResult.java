package edu.brandeis.cosi103a.brackets.format;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.brackets.model.Match;
import edu.brandeis.cosi103a.brackets.model.Team;

import java.util.List;

/**
 * Everything produced by generating a bracket: the initial matches, their
 * topology, summary metadata, the field in seed order and the teams given byes.
 */
public record BracketResult(
    @JsonProperty("matches") List<Match> matches,
    @JsonProperty("structure") BracketStructure structure,
    @JsonProperty("metadata") BracketMetadata metadata,
    @JsonProperty("seededTeams") List<Team> seededTeams,
    @JsonProperty("byeTeams") List<Team> byeTeams
) {
    public BracketResult {
        matches = ImmutableList.copyOf(matches);
        seededTeams = ImmutableList.copyOf(seededTeams);
        byeTeams = ImmutableList.copyOf(byeTeams);
    }
}
