package edu.brandeis.cosi103a.brackets.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Per-tournament knobs.
 *
 * @param swissRounds       rounds to play in Swiss; null means ceil(log2(teams))
 * @param tieBreaks         tie-break chain override; empty means the format default
 * @param qualifyingPlaces  places that qualify onward; enables mathematical
 *                          elimination and qualification in Swiss and round-robin
 * @param bracketReset      whether a grand-final loss by the winner's-bracket
 *                          champion forces a reset match in double elimination
 * @param roundRobinLegs    1 for a single round-robin, 2 for home and away legs
 * @param groupStage        round-robin fields above twelve teams play in groups
 *                          of about six, followed by a knockout playoff
 */
public record TournamentSettings(
    @JsonProperty("scoringMode") ScoringMode scoringMode,
    @JsonProperty("courtAssignmentMode") CourtAssignmentMode courtAssignmentMode,
    @JsonProperty("swissRounds") Integer swissRounds,
    @JsonProperty("tieBreaks") List<TieBreakMethod> tieBreaks,
    @JsonProperty("qualifyingPlaces") Integer qualifyingPlaces,
    @JsonProperty("bracketReset") boolean bracketReset,
    @JsonProperty("roundRobinLegs") int roundRobinLegs,
    @JsonProperty("groupStage") boolean groupStage
) {
    public TournamentSettings {
        scoringMode = scoringMode == null ? ScoringMode.OFFICIAL : scoringMode;
        courtAssignmentMode = courtAssignmentMode == null ? CourtAssignmentMode.AUTOMATIC : courtAssignmentMode;
        tieBreaks = tieBreaks == null ? ImmutableList.of() : ImmutableList.copyOf(tieBreaks);
        roundRobinLegs = roundRobinLegs < 1 ? 1 : roundRobinLegs;
    }

    public static TournamentSettings defaults() {
        return new TournamentSettings(ScoringMode.OFFICIAL, CourtAssignmentMode.AUTOMATIC,
            null, List.of(), null, true, 1, false);
    }

    public TournamentSettings withSwissRounds(int rounds) {
        return new TournamentSettings(scoringMode, courtAssignmentMode, rounds, tieBreaks,
            qualifyingPlaces, bracketReset, roundRobinLegs, groupStage);
    }

    public TournamentSettings withTieBreaks(List<TieBreakMethod> chain) {
        return new TournamentSettings(scoringMode, courtAssignmentMode, swissRounds, chain,
            qualifyingPlaces, bracketReset, roundRobinLegs, groupStage);
    }

    public TournamentSettings withQualifyingPlaces(int places) {
        return new TournamentSettings(scoringMode, courtAssignmentMode, swissRounds, tieBreaks,
            places, bracketReset, roundRobinLegs, groupStage);
    }

    public TournamentSettings withBracketReset(boolean reset) {
        return new TournamentSettings(scoringMode, courtAssignmentMode, swissRounds, tieBreaks,
            qualifyingPlaces, reset, roundRobinLegs, groupStage);
    }

    public TournamentSettings withRoundRobinLegs(int legs) {
        return new TournamentSettings(scoringMode, courtAssignmentMode, swissRounds, tieBreaks,
            qualifyingPlaces, bracketReset, legs, groupStage);
    }

    public TournamentSettings withScoring(ScoringMode scoring, CourtAssignmentMode courts) {
        return new TournamentSettings(scoring, courts, swissRounds, tieBreaks,
            qualifyingPlaces, bracketReset, roundRobinLegs, groupStage);
    }

    public TournamentSettings withGroupStage(boolean groups) {
        return new TournamentSettings(scoringMode, courtAssignmentMode, swissRounds, tieBreaks,
            qualifyingPlaces, bracketReset, roundRobinLegs, groups);
    }
}
