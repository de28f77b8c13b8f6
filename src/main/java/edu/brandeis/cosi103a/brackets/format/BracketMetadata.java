package edu.brandeis.cosi103a.brackets.format;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.brackets.model.TournamentType;

/**
 * Summary numbers for a generated bracket.
 *
 * @param totalRounds              rounds across all branches, excluding a grand-final reset
 *                                 that has not been triggered
 * @param estimatedDurationMinutes rough wall-clock estimate for the whole tournament
 */
public record BracketMetadata(
    @JsonProperty("format") TournamentType format,
    @JsonProperty("formatName") String formatName,
    @JsonProperty("totalRounds") int totalRounds,
    @JsonProperty("totalMatches") int totalMatches,
    @JsonProperty("estimatedDurationMinutes") long estimatedDurationMinutes,
    @JsonProperty("minTeams") int minTeams,
    @JsonProperty("maxTeams") Integer maxTeams,
    @JsonProperty("supportsByes") boolean supportsByes,
    @JsonProperty("supportsConsolation") boolean supportsConsolation
) {
}
