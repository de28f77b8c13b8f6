package edu.brandeis.cosi103a.brackets.standings;

import edu.brandeis.cosi103a.brackets.BracketDriver;
import edu.brandeis.cosi103a.brackets.Fixtures;
import edu.brandeis.cosi103a.brackets.config.EngineConfig;
import edu.brandeis.cosi103a.brackets.format.DoubleEliminationFormat;
import edu.brandeis.cosi103a.brackets.format.FormatEngine;
import edu.brandeis.cosi103a.brackets.format.RoundRobinFormat;
import edu.brandeis.cosi103a.brackets.format.SingleEliminationFormat;
import edu.brandeis.cosi103a.brackets.format.SwissFormat;
import edu.brandeis.cosi103a.brackets.model.Match;
import edu.brandeis.cosi103a.brackets.model.MatchResult;
import edu.brandeis.cosi103a.brackets.model.Team;
import edu.brandeis.cosi103a.brackets.model.TieBreakMethod;
import edu.brandeis.cosi103a.brackets.model.Tournament;
import edu.brandeis.cosi103a.brackets.model.TournamentSettings;
import edu.brandeis.cosi103a.brackets.model.TournamentType;
import edu.brandeis.cosi103a.brackets.seeding.Seeder;
import edu.brandeis.cosi103a.brackets.seeding.SeedingOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StandingsResolverTest {

    private EngineConfig config;
    private StandingsResolver resolver;

    @BeforeEach
    void setUp() {
        config = EngineConfig.defaults();
        resolver = new StandingsResolver(config);
    }

    private BracketDriver start(FormatEngine format, Tournament tournament, int teams) {
        return new BracketDriver(format, tournament,
            format.generate(tournament, Fixtures.teams(teams), SeedingOptions.ranked()).matches());
    }

    /**
     * Completes the match between two teams with the first team scoring {@code winnerScore}.
     */
    private static void result(BracketDriver driver, String winnerId, String loserId, int winnerScore, int loserScore) {
        Match m = driver.matches().stream()
            .filter(x -> x.involves(winnerId) && x.involves(loserId) && !x.isCompleted())
            .findFirst()
            .orElseThrow();
        boolean winnerFirst = m.slotOf(winnerId) == 1;
        MatchResult r = MatchResult.of(winnerFirst ? winnerScore : loserScore,
            winnerFirst ? loserScore : winnerScore, winnerId);
        driver.submit(m.withResult(r));
    }

    private static Map<String, Integer> ranks(Standings standings) {
        Map<String, Integer> ranks = new HashMap<>();
        standings.entries().forEach(s -> ranks.put(s.team().id(), s.rank()));
        return ranks;
    }

    @Test
    void compute_roundRobinRanksByWins() {
        Tournament tournament = Fixtures.tournament(TournamentType.ROUND_ROBIN);
        RoundRobinFormat format = new RoundRobinFormat(config, new Seeder());
        BracketDriver driver = start(format, tournament, 4);
        driver.playAll(BracketDriver.BETTER_SEED_WINS);

        Standings standings = resolver.compute(tournament, driver.matches(), format);

        assertEquals(List.of("T1", "T2", "T3", "T4"),
            standings.entries().stream().map(s -> s.team().id()).toList());
        Standing top = standings.entries().get(0);
        assertEquals(3, top.wins());
        assertEquals(0, top.losses());
        assertEquals(39, top.pointsFor());
        assertEquals(21, top.pointsAgainst());
        assertEquals(18, top.pointsDifferential());
        assertEquals(StandingStatus.CHAMPION, top.status());
        assertTrue(standings.metadata().complete());
        assertEquals(6, standings.metadata().completedMatches());
        assertEquals(0, standings.metadata().pendingMatches());
        for (Standing s : standings.entries()) {
            assertEquals(s.matchesPlayed(), s.wins() + s.losses(), "Played must equal wins plus losses");
            assertEquals(s.pointsFor() - s.pointsAgainst(), s.pointsDifferential());
        }
    }

    @Test
    void compute_headToHeadOutranksPointsDifferential() {
        Tournament tournament = Fixtures.tournament(TournamentType.ROUND_ROBIN);
        RoundRobinFormat format = new RoundRobinFormat(config, new Seeder());
        BracketDriver driver = start(format, tournament, 4);
        result(driver, "T1", "T2", 13, 12);
        result(driver, "T1", "T3", 13, 7);
        result(driver, "T4", "T1", 13, 7);
        result(driver, "T2", "T3", 13, 0);
        result(driver, "T2", "T4", 13, 0);
        result(driver, "T3", "T4", 13, 7);

        Standings standings = resolver.compute(tournament, driver.matches(), format);
        assertEquals(1, ranks(standings).get("T1"), "T1 beat T2 head to head");
        assertEquals(2, ranks(standings).get("T2"));
        assertEquals(3, ranks(standings).get("T3"), "T3 beat T4 head to head");

        Tournament pdOnly = tournament.withSettings(
            TournamentSettings.defaults().withTieBreaks(List.of(TieBreakMethod.POINTS_DIFFERENTIAL)));
        Standings byDifferential = resolver.compute(pdOnly, driver.matches(), format);
        assertEquals(1, ranks(byDifferential).get("T2"), "T2 has the better differential");
        assertEquals(List.of(TieBreakMethod.POINTS_DIFFERENTIAL), byDifferential.tieBreaks());
    }

    private static double tieBreak(Standings standings, String teamId, TieBreakMethod method) {
        return standings.standingOf(teamId).orElseThrow().tieBreakValues().get(method);
    }

    private static Tournament roundRobinWith(TieBreakMethod method) {
        return Fixtures.tournament(TournamentType.ROUND_ROBIN)
            .withSettings(TournamentSettings.defaults().withTieBreaks(List.of(method)));
    }

    @Test
    void compute_pointsAgainstFavoursTheTighterDefence() {
        RoundRobinFormat format = new RoundRobinFormat(config, new Seeder());
        Tournament tournament = roundRobinWith(TieBreakMethod.POINTS_AGAINST);
        BracketDriver driver = start(format, tournament, 4);
        // T1, T2 and T3 beat each other in a cycle and all finish on +5
        result(driver, "T1", "T3", 13, 0);
        result(driver, "T2", "T1", 13, 4);
        result(driver, "T3", "T2", 13, 8);
        result(driver, "T1", "T4", 13, 12);
        result(driver, "T2", "T4", 13, 12);
        result(driver, "T3", "T4", 13, 0);

        Standings standings = resolver.compute(tournament, driver.matches(), format);

        assertEquals(List.of("T3", "T1", "T2", "T4"),
            standings.entries().stream().map(s -> s.team().id()).toList());
        assertEquals(List.of(1, 2, 3, 4), standings.entries().stream().map(Standing::rank).toList());
        assertEquals(21.0, tieBreak(standings, "T3", TieBreakMethod.POINTS_AGAINST), 1e-9);
        assertEquals(25.0, tieBreak(standings, "T1", TieBreakMethod.POINTS_AGAINST), 1e-9);
        assertEquals(29.0, tieBreak(standings, "T2", TieBreakMethod.POINTS_AGAINST), 1e-9);

        Tournament byDifferential = roundRobinWith(TieBreakMethod.POINTS_DIFFERENTIAL);
        Map<String, Integer> level = ranks(resolver.compute(byDifferential, driver.matches(), format));
        assertEquals(1, level.get("T1"));
        assertEquals(1, level.get("T2"));
        assertEquals(1, level.get("T3"), "Differential alone cannot split the cycle");
    }

    @Test
    void compute_sonnebornBergerRewardsBeatingStrongerTeams() {
        RoundRobinFormat format = new RoundRobinFormat(config, new Seeder());
        Tournament tournament = roundRobinWith(TieBreakMethod.SONNEBORN_BERGER);
        BracketDriver driver = start(format, tournament, 4);
        result(driver, "T1", "T2", 13, 7);
        result(driver, "T1", "T3", 13, 7);
        result(driver, "T2", "T3", 13, 7);
        result(driver, "T2", "T4", 13, 7);
        result(driver, "T3", "T4", 13, 7);
        result(driver, "T4", "T1", 13, 7);

        Standings standings = resolver.compute(tournament, driver.matches(), format);

        assertEquals(List.of("T1", "T2", "T4", "T3"),
            standings.entries().stream().map(s -> s.team().id()).toList());
        assertEquals(3.0, tieBreak(standings, "T1", TieBreakMethod.SONNEBORN_BERGER), 1e-9);
        assertEquals(2.0, tieBreak(standings, "T2", TieBreakMethod.SONNEBORN_BERGER), 1e-9);
        assertEquals(2.0, tieBreak(standings, "T4", TieBreakMethod.SONNEBORN_BERGER), 1e-9);
        assertEquals(1.0, tieBreak(standings, "T3", TieBreakMethod.SONNEBORN_BERGER), 1e-9);

        // In a full round robin every team on the same wins has the same Buchholz
        Map<String, Integer> byBuchholz = ranks(resolver.compute(roundRobinWith(TieBreakMethod.BUCHHOLZ),
            driver.matches(), format));
        assertEquals(byBuchholz.get("T1"), byBuchholz.get("T2"));
        assertEquals(byBuchholz.get("T3"), byBuchholz.get("T4"));
    }

    @Test
    void compute_strengthOfScheduleUsesOpponentWinPercentage() {
        RoundRobinFormat format = new RoundRobinFormat(config, new Seeder());
        Tournament tournament = roundRobinWith(TieBreakMethod.STRENGTH_OF_SCHEDULE);
        BracketDriver driver = start(format, tournament, 6);
        // T1 and T2 are 1-0; T1's victim is 1-1, T2's victim is 1-2
        result(driver, "T1", "T3", 13, 7);
        result(driver, "T3", "T5", 13, 7);
        result(driver, "T2", "T4", 13, 7);
        result(driver, "T4", "T6", 13, 7);
        result(driver, "T5", "T4", 13, 7);

        Standings standings = resolver.compute(tournament, driver.matches(), format);
        Standing t1 = standings.standingOf("T1").orElseThrow();
        Standing t2 = standings.standingOf("T2").orElseThrow();

        assertEquals(0.5, t1.tieBreakValues().get(TieBreakMethod.STRENGTH_OF_SCHEDULE), 1e-9);
        assertEquals(1.0 / 3, t2.tieBreakValues().get(TieBreakMethod.STRENGTH_OF_SCHEDULE), 1e-9);
        assertTrue(t1.rank() < t2.rank(), "T1 beat the stronger opponent");
        assertEquals(1, standings.standingOf("T3").orElseThrow().rank(), "T3 faced T1 and T5");

        Map<String, Integer> byBuchholz = ranks(resolver.compute(roundRobinWith(TieBreakMethod.BUCHHOLZ),
            driver.matches(), format));
        assertEquals(byBuchholz.get("T1"), byBuchholz.get("T2"), "Both victims have one win");
    }

    @Test
    void compute_teamsLevelOnEveryTieBreakShareRank() {
        Tournament tournament = Fixtures.tournament(TournamentType.ROUND_ROBIN);
        RoundRobinFormat format = new RoundRobinFormat(config, new Seeder());
        BracketDriver driver = start(format, tournament, 3);
        result(driver, "T1", "T2", 13, 7);
        result(driver, "T2", "T3", 13, 7);
        result(driver, "T3", "T1", 13, 7);

        Standings standings = resolver.compute(tournament, driver.matches(), format);

        assertTrue(standings.entries().stream().allMatch(s -> s.rank() == 1), "A three-way cycle stays level");
        assertTrue(standings.entries().stream().allMatch(s -> s.status() == StandingStatus.CHAMPION));
        assertEquals(3, standings.tiedAcrossBoundary(1).size());
    }

    @Test
    void compute_groupStagePlayoffDecidesTheTopPlaces() {
        Tournament tournament = Fixtures.tournament(TournamentType.ROUND_ROBIN)
            .withSettings(TournamentSettings.defaults().withGroupStage(true));
        RoundRobinFormat format = new RoundRobinFormat(config, new Seeder());
        BracketDriver driver = start(format, tournament, 13);
        driver.playAll(BracketDriver.BETTER_SEED_WINS);

        Standings standings = resolver.compute(tournament, driver.matches(), format);
        Map<String, Integer> ranks = ranks(standings);

        assertEquals(1, ranks.get("T1"));
        assertEquals(2, ranks.get("T2"), "Beaten finalist");
        assertEquals(3, ranks.get("T3"));
        assertEquals(4, ranks.get("T4"));
        assertEquals(5, ranks.get("T6"), "Quarterfinal losers follow, by wins");
        assertEquals(6, ranks.get("T5"));
        assertEquals(7, ranks.get("T7"), "Best team outside the playoff");
        assertEquals(StandingStatus.CHAMPION, standings.standingOf("T1").orElseThrow().status());
        assertEquals(StandingStatus.ELIMINATED, standings.standingOf("T2").orElseThrow().status());
        assertEquals(StandingStatus.ELIMINATED, standings.standingOf("T7").orElseThrow().status());
    }

    @Test
    void compute_singleEliminationRanksByHowFarTeamsGot() {
        Tournament tournament = Fixtures.tournament(TournamentType.SINGLE_ELIMINATION);
        SingleEliminationFormat format = new SingleEliminationFormat(config, new Seeder());
        BracketDriver driver = start(format, tournament, 8);
        driver.playAll(BracketDriver.BETTER_SEED_WINS);

        Standings standings = resolver.compute(tournament, driver.matches(), format);
        Map<String, Integer> ranks = ranks(standings);

        assertEquals(1, ranks.get("T1"));
        assertEquals(2, ranks.get("T2"));
        assertEquals(3, ranks.get("T3"));
        assertEquals(3, ranks.get("T4"), "Losing semifinalists are level");
        assertEquals(5, ranks.get("T5"));
        assertEquals(5, ranks.get("T8"));
        assertEquals(StandingStatus.CHAMPION, standings.standingOf("T1").orElseThrow().status());
        assertEquals(StandingStatus.ELIMINATED, standings.standingOf("T2").orElseThrow().status());
        assertEquals(List.of("T3", "T4"),
            standings.tiedAcrossBoundary(3).stream().map(Team::id).toList());
        assertTrue(standings.tiedAcrossBoundary(2).isEmpty());
    }

    @Test
    void compute_doubleEliminationKeepsOneLossTeamsActive() {
        Tournament tournament = Fixtures.tournament(TournamentType.DOUBLE_ELIMINATION);
        DoubleEliminationFormat format = new DoubleEliminationFormat(config, new Seeder());
        BracketDriver driver = start(format, tournament, 4);
        driver.play("t1-W1-1", "T1");
        driver.play("t1-W1-2", "T2");
        driver.play("t1-L1-1", "T3");

        Standings standings = resolver.compute(tournament, driver.matches(), format);

        assertEquals(StandingStatus.ACTIVE, standings.standingOf("T3").orElseThrow().status());
        assertEquals(StandingStatus.ELIMINATED, standings.standingOf("T4").orElseThrow().status());
        assertEquals(4, standings.standingOf("T4").orElseThrow().rank());
        assertFalse(standings.metadata().complete());
    }

    @Test
    void compute_swissReportsBuchholz() {
        Tournament tournament = Fixtures.tournament(TournamentType.SWISS);
        SwissFormat format = new SwissFormat(config, new Seeder());
        BracketDriver driver = start(format, tournament, 8);
        driver.playAll(BracketDriver.BETTER_SEED_WINS);

        Standings standings = resolver.compute(tournament, driver.matches(), format);
        Map<String, Integer> wins = new HashMap<>();
        standings.entries().forEach(s -> wins.put(s.team().id(), s.wins()));

        for (Standing s : standings.entries()) {
            double expected = driver.matches().stream()
                .filter(m -> m.involves(s.team().id()))
                .mapToInt(m -> wins.get(m.opponentOf(s.team().id()).orElseThrow()))
                .sum();
            assertEquals(expected, s.tieBreakValues().get(TieBreakMethod.BUCHHOLZ), 1e-9,
                "Buchholz of " + s.team().id());
        }
        assertEquals("T1", standings.entries().get(0).team().id());
        assertEquals(3, standings.entries().get(0).wins());
    }

    @Test
    void compute_swissByeCountsAsWinWithoutPoints() {
        Tournament tournament = Fixtures.tournament(TournamentType.SWISS);
        SwissFormat format = new SwissFormat(config, new Seeder());
        BracketDriver driver = start(format, tournament, 5);

        Standings standings = resolver.compute(tournament, driver.matches(), format);
        Standing bye = standings.standingOf("T5").orElseThrow();

        assertEquals(1, bye.wins());
        assertEquals(1, bye.matchesPlayed());
        assertEquals(0, bye.pointsFor());
        assertEquals(List.of(ResultMark.W), bye.recentResults());
    }

    @Test
    void compute_qualificationDecidedBeforeLastRound() {
        Tournament tournament = Fixtures.tournament(TournamentType.ROUND_ROBIN)
            .withSettings(TournamentSettings.defaults().withQualifyingPlaces(2));
        RoundRobinFormat format = new RoundRobinFormat(config, new Seeder());
        BracketDriver driver = start(format, tournament, 4);
        for (String id : List.of("t1-R1-1", "t1-R1-2", "t1-R2-1", "t1-R2-2")) {
            driver.play(id, BracketDriver.BETTER_SEED_WINS.apply(driver.match(id)));
        }

        Standings standings = resolver.compute(tournament, driver.matches(), format);

        assertEquals(StandingStatus.QUALIFIED, standings.standingOf("T1").orElseThrow().status());
        assertEquals(StandingStatus.QUALIFIED, standings.standingOf("T2").orElseThrow().status());
        assertEquals(StandingStatus.ELIMINATED, standings.standingOf("T3").orElseThrow().status());
        assertEquals(StandingStatus.ELIMINATED, standings.standingOf("T4").orElseThrow().status());
    }

    @Test
    void compute_recentResultsKeepConfiguredWindow() {
        EngineConfig narrow = new EngineConfig(45, 0.7, 1.1, 1.2, 2, 100_000);
        Tournament tournament = Fixtures.tournament(TournamentType.ROUND_ROBIN);
        RoundRobinFormat format = new RoundRobinFormat(config, new Seeder());
        BracketDriver driver = start(format, tournament, 4);
        result(driver, "T4", "T1", 13, 7);
        result(driver, "T1", "T3", 13, 7);
        result(driver, "T1", "T2", 13, 7);

        Standing t1 = new StandingsResolver(narrow).compute(tournament, driver.matches(), format)
            .standingOf("T1").orElseThrow();

        assertEquals(3, t1.matchesPlayed());
        assertEquals(List.of(ResultMark.W, ResultMark.W), t1.recentResults());
    }

    @Test
    void standing_rejectsInconsistentTotals() {
        Team team = Fixtures.team("X", 1);
        assertThrows(IllegalArgumentException.class, () ->
            new Standing(1, team, 3, 1, 1, 10, 5, 5, List.of(), StandingStatus.ACTIVE, Map.of()));
        assertThrows(IllegalArgumentException.class, () ->
            new Standing(1, team, 2, 1, 1, 10, 5, 4, List.of(), StandingStatus.ACTIVE, Map.of()));
    }
}
