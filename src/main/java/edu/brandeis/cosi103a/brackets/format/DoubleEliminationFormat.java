package edu.brandeis.cosi103a.brackets.format;

import edu.brandeis.cosi103a.brackets.config.EngineConfig;
import edu.brandeis.cosi103a.brackets.model.BracketBranch;
import edu.brandeis.cosi103a.brackets.model.Match;
import edu.brandeis.cosi103a.brackets.model.MatchStatus;
import edu.brandeis.cosi103a.brackets.model.Slot;
import edu.brandeis.cosi103a.brackets.model.TieBreakMethod;
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Winner's bracket as in single elimination plus a loser's bracket that takes
 * every first loss. A second loss eliminates.
 *
 * <p>For a bracket of size 2^k the loser's bracket has 2(k - 1) rounds. Odd
 * rounds pair loser's-bracket survivors; even rounds bring in the losers of the
 * next winner's round, in reversed order every other time so early opponents do
 * not meet again straight away. The grand final puts the winner's-bracket
 * champion in slot 1 against the loser's-bracket champion in slot 2.
 *
 * <p>If the slot-2 team wins the grand final and the tournament's
 * {@code bracketReset} setting is on, progression creates a reset match between
 * the same two teams. That match exists only once triggered.
 */
public final class DoubleEliminationFormat implements FormatEngine {

    private static final Logger logger = LoggerFactory.getLogger(DoubleEliminationFormat.class);

    static final FormatConstraints CONSTRAINTS = new FormatConstraints(
        2, 512, List.of(4, 8, 16, 32, 64, 128, 256), true, true, 20);

    static final int GRAND_FINAL_ROUND = 1;
    static final int RESET_ROUND = 2;

    private final EngineConfig config;
    private final Seeder seeder;

    public DoubleEliminationFormat(EngineConfig config, Seeder seeder) {
        this.config = config;
        this.seeder = seeder;
    }

    @Override
    public TournamentType type() {
        return TournamentType.DOUBLE_ELIMINATION;
    }

    @Override
    public FormatConstraints constraints() {
        return CONSTRAINTS;
    }

    @Override
    public String description() {
        return "Teams are eliminated after two losses; losers drop into a second bracket";
    }

    @Override
    public List<TieBreakMethod> defaultTieBreaks() {
        return List.of(TieBreakMethod.POINTS_DIFFERENTIAL, TieBreakMethod.POINTS_AGAINST);
    }

    @Override
    public ValidatorResult validate(Tournament tournament, List<Team> teams) {
        return KnockoutFormat.withByeWarning(
            ConstraintValidator.validate(tournament, teams, CONSTRAINTS, type().displayName()), teams.size());
    }

    @Override
    public BracketResult generate(Tournament tournament, List<Team> teams, SeedingOptions options) {
        ValidatorResult validation = validate(tournament, teams);
        if (!validation.valid()) {
            throw new InvalidTournamentInputException(validation);
        }
        List<Team> seeded = seeder.seed(teams, options).stream()
            .map(t -> t.withBranch(BracketBranch.WINNER))
            .toList();
        int size = KnockoutBuilder.bracketSize(seeded.size());
        int k = KnockoutBuilder.roundsFor(size);
        ByeAssignment byes = Seeder.assignByes(seeded, size);

        KnockoutBuilder builder = new KnockoutBuilder(tournament.id());
        List<List<Slot>> droppedByRound = new ArrayList<>();
        List<Slot> entrants = KnockoutBuilder.seededEntrants(seeded, size);
        for (int round = 1; round <= k; round++) {
            KnockoutBuilder.RoundOutcome outcome = builder.playRound(entrants, BracketBranch.WINNER, round,
                "Winners " + RoundNames.knockout(round, k));
            droppedByRound.add(outcome.losers());
            entrants = outcome.winners();
        }
        Slot winnersChampion = entrants.get(0);

        int loserRounds = 2 * (k - 1);
        Slot losersChampion;
        if (k == 1) {
            losersChampion = droppedByRound.get(0).get(0);
        } else {
            List<Slot> survivors = builder.playRound(droppedByRound.get(0), BracketBranch.LOSER, 1,
                RoundNames.losers(1, loserRounds)).winners();
            for (int j = 1; j <= k - 1; j++) {
                List<Slot> dropped = new ArrayList<>(droppedByRound.get(j));
                if (j % 2 == 1) {
                    Collections.reverse(dropped);
                }
                int lbRound = 2 * j;
                survivors = builder.playRound(interleave(survivors, dropped), BracketBranch.LOSER, lbRound,
                    RoundNames.losers(lbRound, loserRounds)).winners();
                if (j < k - 1) {
                    survivors = builder.playRound(survivors, BracketBranch.LOSER, lbRound + 1,
                        RoundNames.losers(lbRound + 1, loserRounds)).winners();
                }
            }
            losersChampion = survivors.get(0);
        }

        builder.add(BracketBranch.GRAND_FINAL, GRAND_FINAL_ROUND, 1, RoundNames.grandFinal(false),
            winnersChampion, losersChampion);
        List<Match> matches = builder.build();

        logger.debug("Generated double elimination bracket for {}: {} teams, size {}, {} loser rounds, {} matches",
            tournament.id(), seeded.size(), size, loserRounds, matches.size());

        int totalRounds = k + loserRounds + 1;
        BracketMetadata metadata = new BracketMetadata(type(), type().displayName(), totalRounds, matches.size(),
            DurationEstimator.estimateMinutes(tournament, matches.size(), config),
            CONSTRAINTS.minTeams(), CONSTRAINTS.maxTeams(), CONSTRAINTS.supportsByes(), false);
        return new BracketResult(matches, BracketStructure.of(type(), matches), metadata, seeded, byes.byeTeams());
    }

    private static List<Slot> interleave(List<Slot> survivors, List<Slot> dropped) {
        if (survivors.size() != dropped.size()) {
            throw new IllegalStateException("Loser's bracket round expects " + survivors.size()
                + " drop-downs, got " + dropped.size());
        }
        List<Slot> entrants = new ArrayList<>(survivors.size() * 2);
        for (int i = 0; i < survivors.size(); i++) {
            entrants.add(survivors.get(i));
            entrants.add(dropped.get(i));
        }
        return entrants;
    }

    @Override
    public ProgressionResult advance(Match completedMatch, Tournament tournament, List<Match> allMatches) {
        KnockoutProgression.Step step = KnockoutProgression.advance(completedMatch, allMatches);
        List<Match> matches = step.matches();
        List<Match> created = new ArrayList<>();

        if (isGrandFinal(completedMatch) && resetTriggered(tournament, completedMatch)) {
            String resetId = KnockoutBuilder.matchId(tournament.id(), BracketBranch.GRAND_FINAL, RESET_ROUND, 1);
            if (matches.stream().anyMatch(m -> m.id().equals(resetId))) {
                throw new BracketIntegrityException(completedMatch.id(), "bracket reset " + resetId + " already exists");
            }
            Match reset = new Match(resetId, tournament.id(), RESET_ROUND, RoundNames.grandFinal(true),
                BracketBranch.GRAND_FINAL, 1, completedMatch.slot1(), completedMatch.slot2(), null,
                MatchStatus.SCHEDULED, null, null);
            created.add(reset);
            matches = MatchLists.merge(matches, created);
            logger.debug("Grand final {} won from the loser's bracket; created reset {}", completedMatch.id(), resetId);
        }

        return new ProgressionResult(step.affected(), created, BracketStructure.of(type(), matches),
            isComplete(tournament, matches), null);
    }

    /**
     * Complete when the grand final is won by the winner's-bracket champion (or
     * resets are disabled), or when the reset match is completed.
     */
    @Override
    public boolean isComplete(Tournament tournament, List<Match> matches) {
        Optional<Match> grandFinal = matches.stream()
            .filter(m -> isGrandFinal(m))
            .findFirst();
        if (grandFinal.isEmpty() || !grandFinal.get().isCompleted()) {
            return false;
        }
        if (!resetTriggered(tournament, grandFinal.get())) {
            return true;
        }
        return matches.stream()
            .filter(m -> m.branch() == BracketBranch.GRAND_FINAL && m.round() == RESET_ROUND)
            .anyMatch(Match::isCompleted);
    }

    /**
     * A second loss eliminates. When resets are disabled, the winner's-bracket
     * champion is also out after losing the grand final with one loss.
     */
    @Override
    public boolean isEliminated(Tournament tournament, int losses, boolean lostFinalStageMatch) {
        return losses >= 2 || (lostFinalStageMatch && !tournament.settings().bracketReset());
    }

    private static boolean isGrandFinal(Match m) {
        return m.branch() == BracketBranch.GRAND_FINAL && m.round() == GRAND_FINAL_ROUND;
    }

    private static boolean resetTriggered(Tournament tournament, Match grandFinal) {
        return tournament.settings().bracketReset()
            && grandFinal.result() != null
            && grandFinal.slotOf(grandFinal.result().winnerId()) == 2;
    }
}
