package edu.brandeis.cosi103a.brackets.standings;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import edu.brandeis.cosi103a.brackets.model.TieBreakMethod;
import edu.brandeis.cosi103a.brackets.model.Team;

import java.util.List;
import java.util.Map;

/**
 * One team's line in the standings. Teams still level after every tie-break
 * share a rank.
 *
 * @param recentResults  most recent results, oldest first
 * @param tieBreakValues value of each configured tie-break for this team
 */
public record Standing(
    @JsonProperty("rank") int rank,
    @JsonProperty("team") Team team,
    @JsonProperty("matchesPlayed") int matchesPlayed,
    @JsonProperty("wins") int wins,
    @JsonProperty("losses") int losses,
    @JsonProperty("pointsFor") int pointsFor,
    @JsonProperty("pointsAgainst") int pointsAgainst,
    @JsonProperty("pointsDifferential") int pointsDifferential,
    @JsonProperty("recentResults") List<ResultMark> recentResults,
    @JsonProperty("status") StandingStatus status,
    @JsonProperty("tieBreakValues") Map<TieBreakMethod, Double> tieBreakValues
) {
    public Standing {
        if (wins + losses != matchesPlayed) {
            throw new IllegalArgumentException("wins + losses must equal matches played for " + team.id());
        }
        if (pointsDifferential != pointsFor - pointsAgainst) {
            throw new IllegalArgumentException("points differential must equal for - against for " + team.id());
        }
        recentResults = ImmutableList.copyOf(recentResults);
        tieBreakValues = ImmutableMap.copyOf(tieBreakValues);
    }
}
