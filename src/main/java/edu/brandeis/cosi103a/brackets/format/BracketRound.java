package edu.brandeis.cosi103a.brackets.format;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.brackets.model.BracketBranch;

import java.util.List;

/**
 * Matches of one round of one branch, plus teams sitting the round out.
 */
public record BracketRound(
    @JsonProperty("branch") BracketBranch branch,
    @JsonProperty("round") int round,
    @JsonProperty("name") String name,
    @JsonProperty("matchIds") List<String> matchIds,
    @JsonProperty("byeTeamIds") List<String> byeTeamIds
) {
    public BracketRound {
        matchIds = ImmutableList.copyOf(matchIds);
        byeTeamIds = ImmutableList.copyOf(byeTeamIds);
    }
}
