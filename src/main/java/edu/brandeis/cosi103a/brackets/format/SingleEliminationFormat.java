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

import java.util.List;

/**
 * Knockout bracket padded to the next power of two. Seed 1 meets the last seed,
 * seed 2 the second-to-last and so on; the top seeds take the byes into round 2.
 * Every match is created up front, later rounds with placeholder slots.
 */
public final class SingleEliminationFormat implements FormatEngine {

    static final FormatConstraints CONSTRAINTS = new FormatConstraints(
        2, 1024, List.of(4, 8, 16, 32, 64, 128, 256), true, true, 10);

    private final KnockoutFormat knockout;

    public SingleEliminationFormat(EngineConfig config, Seeder seeder) {
        this.knockout = new KnockoutFormat(TournamentType.SINGLE_ELIMINATION, BracketBranch.WINNER, null,
            CONSTRAINTS, true, config, seeder);
    }

    @Override
    public TournamentType type() {
        return TournamentType.SINGLE_ELIMINATION;
    }

    @Override
    public FormatConstraints constraints() {
        return CONSTRAINTS;
    }

    @Override
    public String description() {
        return "Teams are eliminated after one loss; the last team standing wins";
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
