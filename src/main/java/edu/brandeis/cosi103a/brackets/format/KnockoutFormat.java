package edu.brandeis.cosi103a.brackets.format;

import edu.brandeis.cosi103a.brackets.config.EngineConfig;
import edu.brandeis.cosi103a.brackets.model.BracketBranch;
import edu.brandeis.cosi103a.brackets.model.Match;
import edu.brandeis.cosi103a.brackets.model.Slot;
import edu.brandeis.cosi103a.brackets.model.Team;
import edu.brandeis.cosi103a.brackets.model.Tournament;
import edu.brandeis.cosi103a.brackets.model.TournamentType;
import edu.brandeis.cosi103a.brackets.seeding.ByeAssignment;
import edu.brandeis.cosi103a.brackets.seeding.Seeder;
import edu.brandeis.cosi103a.brackets.seeding.SeedingOptions;
import edu.brandeis.cosi103a.brackets.validation.ConstraintValidator;
import edu.brandeis.cosi103a.brackets.validation.FormatConstraints;
import edu.brandeis.cosi103a.brackets.validation.ValidatorResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * A single knockout bracket, shared by single elimination and the barrage and
 * consolation brackets, which differ only in branch and labels.
 */
final class KnockoutFormat {

    private static final Logger logger = LoggerFactory.getLogger(KnockoutFormat.class);

    private final TournamentType type;
    private final BracketBranch branch;
    private final String labelPrefix;
    private final FormatConstraints constraints;
    private final boolean supportsConsolation;
    private final EngineConfig config;
    private final Seeder seeder;

    KnockoutFormat(TournamentType type, BracketBranch branch, String labelPrefix, FormatConstraints constraints,
                   boolean supportsConsolation, EngineConfig config, Seeder seeder) {
        this.type = type;
        this.branch = branch;
        this.labelPrefix = labelPrefix;
        this.constraints = constraints;
        this.supportsConsolation = supportsConsolation;
        this.config = config;
        this.seeder = seeder;
    }

    FormatConstraints constraints() {
        return constraints;
    }

    ValidatorResult validate(Tournament tournament, List<Team> teams) {
        return withByeWarning(ConstraintValidator.validate(tournament, teams, constraints, type.displayName()),
            teams.size());
    }

    /**
     * Adds a warning when the field does not fill a power-of-two bracket.
     */
    static ValidatorResult withByeWarning(ValidatorResult result, int teamCount) {
        if (teamCount < 2) {
            return result;
        }
        int size = KnockoutBuilder.bracketSize(teamCount);
        if (size == teamCount) {
            return result;
        }
        return result.withWarning(teamCount + " teams require " + (size - teamCount)
            + " byes to fill a bracket of " + size);
    }

    BracketResult generate(Tournament tournament, List<Team> teams, SeedingOptions options) {
        ValidatorResult validation = validate(tournament, teams);
        if (!validation.valid()) {
            throw new InvalidTournamentInputException(validation);
        }
        List<Team> seeded = seeder.seed(teams, options).stream()
            .map(t -> t.withBranch(branch))
            .toList();
        int size = KnockoutBuilder.bracketSize(seeded.size());
        int rounds = KnockoutBuilder.roundsFor(size);
        ByeAssignment byes = Seeder.assignByes(seeded, size);

        KnockoutBuilder builder = new KnockoutBuilder(tournament.id());
        List<Slot> entrants = KnockoutBuilder.seededEntrants(seeded, size);
        for (int round = 1; round <= rounds; round++) {
            entrants = builder.playRound(entrants, branch, round,
                RoundNames.knockout(labelPrefix, round, rounds)).winners();
        }
        List<Match> matches = builder.build();

        logger.debug("Generated {} bracket for {}: {} teams, size {}, {} byes, {} matches",
            type, tournament.id(), seeded.size(), size, byes.byeTeams().size(), matches.size());

        BracketMetadata metadata = new BracketMetadata(type, type.displayName(), rounds, matches.size(),
            DurationEstimator.estimateMinutes(tournament, matches.size(), config),
            constraints.minTeams(), constraints.maxTeams(), constraints.supportsByes(), supportsConsolation);
        return new BracketResult(matches, BracketStructure.of(type, matches), metadata, seeded, byes.byeTeams());
    }

    ProgressionResult advance(Match completedMatch, List<Match> allMatches) {
        KnockoutProgression.Step step = KnockoutProgression.advance(completedMatch, allMatches);
        boolean complete = isComplete(step.matches());
        return new ProgressionResult(step.affected(), List.of(), BracketStructure.of(type, step.matches()),
            complete, null);
    }

    /**
     * Complete once the final, the only match with no successor, is completed.
     */
    boolean isComplete(List<Match> matches) {
        List<Match> finals = matches.stream()
            .filter(m -> m.branch() == branch && m.winnerTo() == null)
            .toList();
        return !finals.isEmpty() && finals.stream().allMatch(Match::isCompleted);
    }
}
