package edu.brandeis.cosi103a.brackets.standings;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.brackets.model.TieBreakMethod;
import edu.brandeis.cosi103a.brackets.model.Team;
import edu.brandeis.cosi103a.brackets.model.TournamentType;

import java.util.List;
import java.util.Optional;

/**
 * Ranked view of a tournament at one point in time.
 *
 * @param tieBreaks the chain that was applied, in order
 */
public record Standings(
    @JsonProperty("type") TournamentType type,
    @JsonProperty("entries") List<Standing> entries,
    @JsonProperty("tieBreaks") List<TieBreakMethod> tieBreaks,
    @JsonProperty("metadata") StandingsMetadata metadata
) {
    public Standings {
        entries = ImmutableList.copyOf(entries);
        tieBreaks = ImmutableList.copyOf(tieBreaks);
    }

    public Optional<Standing> standingOf(String teamId) {
        return entries.stream().filter(s -> s.team().id().equals(teamId)).findFirst();
    }

    /**
     * Teams sharing the rank that straddles a qualification cut, for a barrage.
     * Empty when the cut falls cleanly between two ranks.
     *
     * @param places how many teams qualify
     * @return every team holding the rank at the cut, in standings order
     */
    public List<Team> tiedAcrossBoundary(int places) {
        if (places <= 0 || places >= entries.size()) {
            return List.of();
        }
        int lastInRank = entries.get(places - 1).rank();
        int firstOutRank = entries.get(places).rank();
        if (lastInRank != firstOutRank) {
            return List.of();
        }
        return entries.stream()
            .filter(s -> s.rank() == lastInRank)
            .map(Standing::team)
            .toList();
    }
}
