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
 * Play-off between teams level across a qualification boundary, run as a
 * knockout on the {@link BracketBranch#BARRAGE} branch. The field usually comes
 * from {@link edu.brandeis.cosi103a.brackets.standings.Standings#tiedAcrossBoundary(int)}.
 */
public final class BarrageFormat implements FormatEngine {

    static final FormatConstraints CONSTRAINTS = new FormatConstraints(2, 100, List.of(), true, true, 7);

    private final KnockoutFormat knockout;

    public BarrageFormat(EngineConfig config, Seeder seeder) {
        this.knockout = new KnockoutFormat(TournamentType.BARRAGE, BracketBranch.BARRAGE, "Barrage",
            CONSTRAINTS, false, config, seeder);
    }

    @Override
    public TournamentType type() {
        return TournamentType.BARRAGE;
    }

    @Override
    public FormatConstraints constraints() {
        return CONSTRAINTS;
    }

    @Override
    public String description() {
        return "Knockout play-off that settles ties at a qualification boundary";
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
