package edu.brandeis.cosi103a.brackets.format;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.brackets.model.Match;
import edu.brandeis.cosi103a.brackets.standings.Standings;

import java.util.List;

/**
 * Output of one progression step, shaped for both the store and live observers.
 *
 * @param affectedMatches existing matches whose slots or status changed
 * @param newMatches      matches that did not exist before this step
 * @param finalStandings  set once the step completes the tournament, otherwise null
 */
public record ProgressionResult(
    @JsonProperty("affectedMatches") List<Match> affectedMatches,
    @JsonProperty("newMatches") List<Match> newMatches,
    @JsonProperty("structure") BracketStructure structure,
    @JsonProperty("complete") boolean complete,
    @JsonProperty("finalStandings") Standings finalStandings
) {
    public ProgressionResult {
        affectedMatches = ImmutableList.copyOf(affectedMatches);
        newMatches = ImmutableList.copyOf(newMatches);
    }

    public ProgressionResult withFinalStandings(Standings standings) {
        return new ProgressionResult(affectedMatches, newMatches, structure, complete, standings);
    }
}
