package edu.brandeis.cosi103a.brackets.validation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Legality bounds a format declares for its field.
 *
 * @param maxTeams  null when unbounded
 * @param maxRounds null when unbounded
 */
public record FormatConstraints(
    @JsonProperty("minTeams") int minTeams,
    @JsonProperty("maxTeams") Integer maxTeams,
    @JsonProperty("preferredTeamCounts") List<Integer> preferredTeamCounts,
    @JsonProperty("supportsOddTeamCount") boolean supportsOddTeamCount,
    @JsonProperty("supportsByes") boolean supportsByes,
    @JsonProperty("maxRounds") Integer maxRounds
) {
    public FormatConstraints {
        preferredTeamCounts = preferredTeamCounts == null
            ? ImmutableList.of() : ImmutableList.copyOf(preferredTeamCounts);
    }
}
