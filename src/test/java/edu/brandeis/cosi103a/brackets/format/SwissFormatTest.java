package edu.brandeis.cosi103a.brackets.format;

import edu.brandeis.cosi103a.brackets.BracketDriver;
import edu.brandeis.cosi103a.brackets.Fixtures;
import edu.brandeis.cosi103a.brackets.config.EngineConfig;
import edu.brandeis.cosi103a.brackets.model.Match;
import edu.brandeis.cosi103a.brackets.model.Team;
import edu.brandeis.cosi103a.brackets.model.Tournament;
import edu.brandeis.cosi103a.brackets.model.TournamentSettings;
import edu.brandeis.cosi103a.brackets.model.TournamentType;
import edu.brandeis.cosi103a.brackets.seeding.Seeder;
import edu.brandeis.cosi103a.brackets.seeding.SeedingOptions;
import edu.brandeis.cosi103a.brackets.validation.ValidatorResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SwissFormatTest {

    private SwissFormat format;
    private Tournament tournament;

    @BeforeEach
    void setUp() {
        format = new SwissFormat(EngineConfig.defaults(), new Seeder());
        tournament = Fixtures.tournament(TournamentType.SWISS);
    }

    private BracketDriver start(Tournament t, int teams) {
        return new BracketDriver(format, t, format.generate(t, Fixtures.teams(teams), SeedingOptions.ranked()).matches());
    }

    private static List<Match> round(BracketDriver driver, int round) {
        return driver.matches().stream().filter(m -> m.round() == round).toList();
    }

    private static String pairKey(Match m) {
        return String.join("-", new TreeSet<>(m.participantIds()));
    }

    @Test
    void plannedRounds_defaultsToCeilingLog2() {
        assertEquals(3, SwissFormat.plannedRounds(tournament, 8));
        assertEquals(4, SwissFormat.plannedRounds(tournament, 9));
        assertEquals(5, SwissFormat.plannedRounds(tournament.withSettings(
            TournamentSettings.defaults().withSwissRounds(5)), 8));
    }

    @Test
    void generate_createsOnlyRoundOne() {
        BracketResult bracket = format.generate(tournament, Fixtures.teams(8), SeedingOptions.ranked());

        assertEquals(4, bracket.matches().size());
        assertEquals(3, bracket.metadata().totalRounds());
        assertEquals(List.of("T1", "T5"), bracket.matches().get(0).participantIds());
        assertEquals(List.of("T2", "T6"), bracket.matches().get(1).participantIds());
        assertEquals(List.of("T3", "T7"), bracket.matches().get(2).participantIds());
        assertEquals(List.of("T4", "T8"), bracket.matches().get(3).participantIds());
        assertEquals("t1-S1-1", bracket.matches().get(0).id());
        assertEquals("Swiss Round 1", bracket.matches().get(0).roundName());
    }

    @Test
    void advance_pairsNextRoundOnlyWhenRoundIsFinished() {
        BracketDriver driver = start(tournament, 8);

        for (int p = 1; p <= 3; p++) {
            ProgressionResult partial = driver.play("t1-S1-" + p, "T" + p);
            assertTrue(partial.newMatches().isEmpty(), "Round 2 must wait for the whole of round 1");
        }
        ProgressionResult last = driver.play("t1-S1-4", "T4");

        assertEquals(4, last.newMatches().size());
        List<Match> roundTwo = round(driver, 2);
        assertEquals(List.of("T1", "T2"), roundTwo.get(0).participantIds(), "Winners meet winners");
        assertEquals(List.of("T3", "T4"), roundTwo.get(1).participantIds());
        assertEquals(List.of("T5", "T6"), roundTwo.get(2).participantIds(), "Losers meet losers");
        assertEquals(List.of("T7", "T8"), roundTwo.get(3).participantIds());
    }

    @Test
    void advance_eightTeamsPlayThreeRoundsWithoutRematches() {
        BracketDriver driver = start(tournament, 8);

        driver.playAll(BracketDriver.BETTER_SEED_WINS);

        assertTrue(driver.lastResult().complete());
        assertEquals(12, driver.matches().size());
        Set<String> pairs = new HashSet<>();
        for (Match m : driver.matches()) {
            assertTrue(pairs.add(pairKey(m)), "Rematch found: " + pairKey(m));
        }
        assertTrue(round(driver, 4).isEmpty(), "No round beyond the planned three");
    }

    @Test
    void advance_pairsWithinScoreGroupsBeforeCrossingThem() {
        BracketDriver driver = start(tournament, 8);
        for (int p = 1; p <= 4; p++) {
            driver.play("t1-S1-" + p, "T" + p);
        }
        driver.play("t1-S2-1", "T1");
        // T4 wins big so T3 drops to the bottom of the one-win group, under T7 whom it already beat
        driver.submit(Fixtures.complete(driver.match("t1-S2-2"), 0, 13));
        driver.play("t1-S2-3", "T5");
        driver.play("t1-S2-4", "T7");

        Set<String> roundThree = new HashSet<>();
        round(driver, 3).forEach(m -> roundThree.add(pairKey(m)));

        assertEquals(Set.of("T1-T4", "T2-T7", "T3-T5", "T6-T8"), roundThree,
            "Every team stays inside its score group when a fresh pairing exists there");
    }

    @Test
    void advance_fourTeamsMeetEveryOpponentOnce() {
        Tournament threeRounds = tournament.withSettings(TournamentSettings.defaults().withSwissRounds(3));
        BracketDriver driver = start(threeRounds, 4);

        driver.playAll(BracketDriver.BETTER_SEED_WINS);

        Set<String> pairs = new HashSet<>();
        driver.matches().forEach(m -> pairs.add(pairKey(m)));
        assertEquals(6, pairs.size(), "Three rounds of four teams cover all six pairings");
    }

    @Test
    void advance_allowsRematchesWhenNoFreshPairingExists() {
        Tournament fourRounds = tournament.withSettings(TournamentSettings.defaults().withSwissRounds(4));
        BracketDriver driver = start(fourRounds, 4);

        driver.playAll(BracketDriver.BETTER_SEED_WINS);

        assertEquals(2, round(driver, 4).size());
        assertTrue(format.isComplete(fourRounds, driver.matches()));
    }

    @Test
    void generate_oddFieldGivesLastSeedABye() {
        BracketResult bracket = format.generate(tournament, Fixtures.teams(7), SeedingOptions.ranked());

        assertEquals(List.of("T7"), bracket.byeTeams().stream().map(Team::id).toList());
        Match bye = bracket.matches().stream().filter(Match::isBye).findFirst().orElseThrow();
        assertTrue(bye.isCompleted());
        assertEquals(tournament.maxPoints(), bye.result().score1());
        assertEquals(0, bye.result().score2());
        assertEquals("T7", bye.result().winnerId());
    }

    @Test
    void advance_byeRotatesToTeamWithoutOne() {
        BracketDriver driver = start(tournament, 7);
        for (int p = 1; p <= 3; p++) {
            driver.play("t1-S1-" + p, "T" + p);
        }

        Match roundTwoBye = round(driver, 2).stream().filter(Match::isBye).findFirst().orElseThrow();
        String byeTeam = roundTwoBye.participantIds().get(0);
        assertNotEquals("T7", byeTeam, "No team gets a second bye while others have none");
        assertEquals("T6", byeTeam);
    }

    @Test
    void isComplete_falseUntilLastRoundIsPlayed() {
        BracketDriver driver = start(tournament, 8);
        for (int p = 1; p <= 4; p++) {
            driver.play("t1-S1-" + p, "T" + p);
        }

        assertFalse(format.isComplete(tournament, driver.matches()));
        assertFalse(format.isEliminated(tournament, 3, false), "Swiss never eliminates");
    }

    @Test
    void validate_flagsRoundCounts() {
        Tournament tooMany = tournament.withSettings(TournamentSettings.defaults().withSwissRounds(16));
        ValidatorResult rejected = format.validate(tooMany, Fixtures.teams(32));
        assertFalse(rejected.valid());

        Tournament rematches = tournament.withSettings(TournamentSettings.defaults().withSwissRounds(5));
        ValidatorResult warned = format.validate(rematches, Fixtures.teams(4));
        assertTrue(warned.valid());
        assertTrue(warned.warnings().contains("5 rounds with 4 teams will force rematches"));

        ValidatorResult tooSmall = format.validate(tournament, Fixtures.teams(3));
        assertFalse(tooSmall.valid(), "Swiss needs at least four teams");
    }
}
