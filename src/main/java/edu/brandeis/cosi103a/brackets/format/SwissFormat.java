package edu.brandeis.cosi103a.brackets.format;

import com.google.common.math.IntMath;
import edu.brandeis.cosi103a.brackets.config.EngineConfig;
import edu.brandeis.cosi103a.brackets.model.Match;
import edu.brandeis.cosi103a.brackets.model.TieBreakMethod;
import edu.brandeis.cosi103a.brackets.model.Team;
import edu.brandeis.cosi103a.brackets.model.Tournament;
import edu.brandeis.cosi103a.brackets.model.TournamentType;
import edu.brandeis.cosi103a.brackets.seeding.Seeder;
import edu.brandeis.cosi103a.brackets.seeding.SeedingOptions;
import edu.brandeis.cosi103a.brackets.validation.ConstraintValidator;
import edu.brandeis.cosi103a.brackets.validation.FormatConstraints;
import edu.brandeis.cosi103a.brackets.validation.ValidatorResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed number of rounds, each paired only once the previous round is finished.
 * The round count is {@code settings.swissRounds} or ceil(log2(teams)).
 */
public final class SwissFormat implements FormatEngine {

    private static final Logger logger = LoggerFactory.getLogger(SwissFormat.class);

    static final FormatConstraints CONSTRAINTS = new FormatConstraints(4, 200, List.of(), true, true, 15);

    private final EngineConfig config;
    private final Seeder seeder;
    private final SwissPairer pairer;

    public SwissFormat(EngineConfig config, Seeder seeder) {
        this.config = config;
        this.seeder = seeder;
        this.pairer = new SwissPairer(config.pairingSearchBudget());
    }

    /**
     * Rounds a Swiss tournament of the given size will play.
     */
    public static int plannedRounds(Tournament tournament, int teamCount) {
        Integer configured = tournament.settings().swissRounds();
        if (configured != null) {
            return configured;
        }
        return teamCount < 2 ? 1 : IntMath.log2(teamCount, RoundingMode.CEILING);
    }

    @Override
    public TournamentType type() {
        return TournamentType.SWISS;
    }

    @Override
    public FormatConstraints constraints() {
        return CONSTRAINTS;
    }

    @Override
    public String description() {
        return "Teams on similar records meet each round; nobody is eliminated";
    }

    @Override
    public List<TieBreakMethod> defaultTieBreaks() {
        return List.of(TieBreakMethod.BUCHHOLZ, TieBreakMethod.SONNEBORN_BERGER, TieBreakMethod.POINTS_DIFFERENTIAL);
    }

    @Override
    public ValidatorResult validate(Tournament tournament, List<Team> teams) {
        ValidatorResult result = ConstraintValidator.validate(tournament, teams, CONSTRAINTS, type().displayName());
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        int n = teams.size();
        int rounds = plannedRounds(tournament, n);
        if (rounds < 1) {
            errors.add("Swiss needs at least one round, got " + rounds);
        } else if (rounds > CONSTRAINTS.maxRounds()) {
            errors.add("Swiss supports at most " + CONSTRAINTS.maxRounds() + " rounds, got " + rounds);
        } else if (n >= 2 && rounds > n - 1) {
            warnings.add(rounds + " rounds with " + n + " teams will force rematches");
        }
        if (n % 2 == 1) {
            warnings.add("Odd team count (" + n + ") gives one team a bye each round");
        }
        return result.merge(ValidatorResult.of(errors, warnings, List.of()));
    }

    @Override
    public BracketResult generate(Tournament tournament, List<Team> teams, SeedingOptions options) {
        ValidatorResult validation = validate(tournament, teams);
        if (!validation.valid()) {
            throw new InvalidTournamentInputException(validation);
        }
        List<Team> seeded = seeder.seed(teams, options);
        int rounds = plannedRounds(tournament, seeded.size());
        List<Match> matches = pairer.firstRound(tournament, seeded);
        List<Team> byeTeams = matches.stream()
            .filter(Match::isBye)
            .map(m -> m.slot1().occupant().orElseThrow())
            .toList();

        logger.debug("Generated Swiss round 1 for {}: {} teams, {} rounds planned", tournament.id(),
            seeded.size(), rounds);

        int gamesPerRound = seeded.size() / 2;
        int slotsPerRound = (seeded.size() + 1) / 2;
        BracketMetadata metadata = new BracketMetadata(type(), type().displayName(), rounds, rounds * slotsPerRound,
            DurationEstimator.estimateMinutes(tournament, rounds * gamesPerRound, config),
            CONSTRAINTS.minTeams(), CONSTRAINTS.maxTeams(), CONSTRAINTS.supportsByes(), false);
        return new BracketResult(matches, BracketStructure.of(type(), matches), metadata, seeded, byeTeams);
    }

    /**
     * Pairs the next round when the completed match finishes its round. Does nothing
     * if the round is still in progress, the next round already exists or all
     * rounds are played.
     */
    @Override
    public ProgressionResult advance(Match completedMatch, Tournament tournament, List<Match> allMatches) {
        MatchLists.requireCompleted(completedMatch, allMatches);
        List<Match> matches = MatchLists.merge(allMatches, List.of(completedMatch));
        int round = completedMatch.round();
        int planned = plannedRounds(tournament, fieldSize(matches));

        List<Match> created = new ArrayList<>();
        boolean roundDone = matches.stream()
            .filter(m -> m.round() == round)
            .allMatch(MatchLists::isSettled);
        boolean nextExists = matches.stream().anyMatch(m -> m.round() == round + 1);
        if (roundDone && round < planned && !nextExists) {
            created.addAll(pairer.nextRound(tournament, matches, round + 1));
            matches = MatchLists.merge(matches, created);
            logger.debug("Paired Swiss round {} of {}: {} matches", round + 1, tournament.id(), created.size());
        }
        return new ProgressionResult(List.of(), created, BracketStructure.of(type(), matches),
            isComplete(tournament, matches), null);
    }

    @Override
    public boolean isComplete(Tournament tournament, List<Match> matches) {
        if (matches.isEmpty()) {
            return false;
        }
        int planned = plannedRounds(tournament, fieldSize(matches));
        boolean lastRoundExists = matches.stream().anyMatch(m -> m.round() == planned);
        return lastRoundExists && matches.stream().allMatch(MatchLists::isSettled);
    }

    @Override
    public boolean isEliminated(Tournament tournament, int losses, boolean lostFinalStageMatch) {
        return false;
    }

    private static int fieldSize(List<Match> matches) {
        return MatchLists.teamsIn(matches.stream().filter(m -> m.round() == 1).toList()).size();
    }
}
