package edu.brandeis.cosi103a.brackets.format;

import edu.brandeis.cosi103a.brackets.config.EngineConfig;
import edu.brandeis.cosi103a.brackets.model.BracketBranch;
import edu.brandeis.cosi103a.brackets.model.Match;
import edu.brandeis.cosi103a.brackets.model.TieBreakMethod;
import edu.brandeis.cosi103a.brackets.model.Team;
import edu.brandeis.cosi103a.brackets.model.Tournament;
import edu.brandeis.cosi103a.brackets.model.TournamentType;
import edu.brandeis.cosi103a.brackets.seeding.Seeder;
import edu.brandeis.cosi103a.brackets.seeding.SeedingOptions;
import edu.brandeis.cosi103a.brackets.validation.FormatConstraints;
import edu.brandeis.cosi103a.brackets.validation.ValidatorResult;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Placement knockout for teams knocked out early in a main bracket, played on
 * the {@link BracketBranch#CONSOLATION} branch.
 */
public final class ConsolationFormat implements FormatEngine {

    static final FormatConstraints CONSTRAINTS = new FormatConstraints(
        2, 512, List.of(2, 4, 8, 16, 32, 64), true, true, 9);

    private final KnockoutFormat knockout;

    public ConsolationFormat(EngineConfig config, Seeder seeder) {
        this.knockout = new KnockoutFormat(TournamentType.CONSOLATION, BracketBranch.CONSOLATION, "Consolation",
            CONSTRAINTS, false, config, seeder);
    }

    /**
     * Teams that lost the first main-bracket match they actually played. Bye
     * holders count from their first real match. Returned in original seed order.
     *
     * @param mainMatches matches of the main (winner's) bracket
     * @return the consolation field
     */
    public static List<Team> eligibleTeams(List<Match> mainMatches) {
        Map<String, Match> firstMatch = new HashMap<>();
        List<Match> ordered = mainMatches.stream()
            .filter(m -> m.branch() == BracketBranch.WINNER && !m.isBye())
            .sorted(Comparator.comparingInt(Match::round).thenComparingInt(Match::position))
            .toList();
        for (Match m : ordered) {
            for (String id : m.participantIds()) {
                firstMatch.putIfAbsent(id, m);
            }
        }
        return firstMatch.entrySet().stream()
            .filter(e -> e.getValue().isCompleted())
            .map(e -> e.getValue().loser().filter(t -> t.id().equals(e.getKey())))
            .flatMap(Optional::stream)
            .sorted(Comparator.comparing((Team t) -> t.seed() == null ? Integer.MAX_VALUE : t.seed())
                .thenComparing(Team::id))
            .toList();
    }

    @Override
    public TournamentType type() {
        return TournamentType.CONSOLATION;
    }

    @Override
    public FormatConstraints constraints() {
        return CONSTRAINTS;
    }

    @Override
    public String description() {
        return "Knockout for teams eliminated in their first match of the main bracket";
    }

    @Override
    public List<TieBreakMethod> defaultTieBreaks() {
        return List.of(TieBreakMethod.POINTS_DIFFERENTIAL, TieBreakMethod.POINTS_AGAINST);
    }

    @Override
    public ValidatorResult validate(Tournament tournament, List<Team> teams) {
        return knockout.validate(tournament, teams);
    }

    @Override
    public BracketResult generate(Tournament tournament, List<Team> teams, SeedingOptions options) {
        return knockout.generate(tournament, teams, options);
    }

    @Override
    public ProgressionResult advance(Match completedMatch, Tournament tournament, List<Match> allMatches) {
        return knockout.advance(completedMatch, allMatches);
    }

    @Override
    public boolean isComplete(Tournament tournament, List<Match> matches) {
        return knockout.isComplete(matches);
    }

    @Override
    public boolean isEliminated(Tournament tournament, int losses, boolean lostFinalStageMatch) {
        return losses >= 1;
    }
}
