package edu.brandeis.cosi103a.brackets.standings;

import edu.brandeis.cosi103a.brackets.config.EngineConfig;
import edu.brandeis.cosi103a.brackets.format.FormatEngine;
import edu.brandeis.cosi103a.brackets.format.SwissFormat;
import edu.brandeis.cosi103a.brackets.model.BracketBranch;
import edu.brandeis.cosi103a.brackets.model.Match;
import edu.brandeis.cosi103a.brackets.model.MatchStatus;
import edu.brandeis.cosi103a.brackets.model.TieBreakMethod;
import edu.brandeis.cosi103a.brackets.model.Tournament;
import edu.brandeis.cosi103a.brackets.model.TournamentType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Builds standings from scratch out of a match list. Nothing is carried over
 * between calls, so corrected or replayed results never leave stale totals.
 *
 * <p>Only completed matches count. Ordering is by wins, then the tie-break chain
 * (the tournament's own, or the format default). Elimination formats first
 * rank teams still alive above eliminated ones, and eliminated teams by how late
 * they went out, so the champion always ranks first. A round robin that has
 * reached its playoff ranks playoff teams first, by how far they got, and marks
 * playoff losers and teams left out of the playoff as eliminated.
 */
public final class StandingsResolver {

    private final EngineConfig config;

    public StandingsResolver(EngineConfig config) {
        this.config = config;
    }

    /**
     * @param tournament the tournament descriptor
     * @param matches    every match of the tournament, in any state
     * @param format     the tournament's format, for completion and elimination rules
     * @return the ranked standings
     */
    public Standings compute(Tournament tournament, List<Match> matches, FormatEngine format) {
        List<TieBreakMethod> chain = tournament.settings().tieBreaks().isEmpty()
            ? format.defaultTieBreaks()
            : tournament.settings().tieBreaks();

        Map<String, TeamTally> tallies = tally(matches);
        boolean complete = format.isComplete(tournament, matches);
        boolean elimination = format.type().isElimination();

        boolean playoff = matches.stream().anyMatch(m -> m.branch() == BracketBranch.PLAYOFF);
        Set<String> playoffField = new HashSet<>();
        matches.stream()
            .filter(m -> m.branch() == BracketBranch.PLAYOFF)
            .forEach(m -> playoffField.addAll(m.participantIds()));

        Map<String, Boolean> eliminated = new LinkedHashMap<>();
        for (TeamTally t : tallies.values()) {
            boolean out = format.isEliminated(tournament, t.losses, t.lostFinalStageMatch);
            if (playoff) {
                out = out || t.playoffLossRound != Integer.MAX_VALUE || !playoffField.contains(t.team.id());
            }
            eliminated.put(t.team.id(), out);
        }

        Comparator<TeamTally> primary = Comparator.comparingInt((TeamTally t) -> t.wins).reversed();
        if (elimination) {
            primary = Comparator
                .comparing((TeamTally t) -> eliminated.get(t.team.id()))
                .thenComparing(Comparator.comparingInt((TeamTally t) ->
                    eliminated.get(t.team.id()) ? t.lastLossDepth : Integer.MAX_VALUE).reversed())
                .thenComparing(primary);
        } else if (playoff) {
            // Teams left out of the playoff sit below every playoff team
            primary = Comparator.comparingInt((TeamTally t) ->
                    playoffField.contains(t.team.id()) ? t.playoffLossRound : -1)
                .reversed()
                .thenComparing(primary);
        }

        List<TeamTally> ordered = new ArrayList<>(tallies.values());
        ordered.sort(primary.thenComparingInt(TeamTally::seed).thenComparing(t -> t.team.id()));

        List<List<TeamTally>> tiers = new ArrayList<>();
        int i = 0;
        while (i < ordered.size()) {
            int j = i + 1;
            while (j < ordered.size() && primary.compare(ordered.get(i), ordered.get(j)) == 0) {
                j++;
            }
            tiers.addAll(breakTies(ordered.subList(i, j), chain, 0, tallies));
            i = j;
        }

        Map<String, Integer> remaining = remainingGames(format.type(), tournament, matches, tallies);
        Integer places = tournament.settings().qualifyingPlaces();

        List<Standing> entries = new ArrayList<>();
        int position = 0;
        for (List<TeamTally> tier : tiers) {
            int rank = position + 1;
            for (TeamTally t : tier) {
                StandingStatus status = status(t, rank, complete, eliminated.get(t.team.id()),
                    elimination, places, tallies, remaining);
                entries.add(toStanding(t, rank, status, chain, tallies));
            }
            position += tier.size();
        }

        int total = matches.size();
        int completed = (int) matches.stream().filter(Match::isCompleted).count();
        int cancelled = (int) matches.stream().filter(m -> m.status() == MatchStatus.CANCELLED).count();
        return new Standings(format.type(), entries, chain,
            new StandingsMetadata(total, completed, total - completed - cancelled, complete));
    }

    private static Map<String, TeamTally> tally(List<Match> matches) {
        Map<String, TeamTally> tallies = new LinkedHashMap<>();
        for (Match m : matches) {
            m.slot1().occupant().ifPresent(t -> tallies.putIfAbsent(t.id(), new TeamTally(t)));
            m.slot2().occupant().ifPresent(t -> tallies.putIfAbsent(t.id(), new TeamTally(t)));
        }

        List<Match> played = matches.stream()
            .filter(Match::isCompleted)
            .filter(m -> m.result() != null && m.result().winnerId() != null)
            .sorted(Comparator.comparingInt(StandingsResolver::depth).thenComparingInt(Match::position))
            .toList();

        for (Match m : played) {
            String winnerId = m.result().winnerId();
            if (m.isBye()) {
                TeamTally t = tallies.get(winnerId);
                if (t != null) {
                    t.recordBye();
                }
                continue;
            }
            String id1 = m.slot1().occupant().orElseThrow().id();
            String id2 = m.slot2().occupant().orElseThrow().id();
            boolean finalStage = m.branch() == BracketBranch.GRAND_FINAL;
            tallies.get(id1).recordGame(id2, m.result().score1(), m.result().score2(),
                winnerId.equals(id1), depth(m), finalStage);
            tallies.get(id2).recordGame(id1, m.result().score2(), m.result().score1(),
                winnerId.equals(id2), depth(m), finalStage);
            if (m.branch() == BracketBranch.PLAYOFF) {
                tallies.get(id1).recordPlayoff(winnerId.equals(id1), m.round());
                tallies.get(id2).recordPlayoff(winnerId.equals(id2), m.round());
            }
        }
        return tallies;
    }

    /**
     * Orders matches roughly by when they are played: by round, with a
     * grand final after every other round.
     */
    private static int depth(Match m) {
        return (m.branch() == BracketBranch.GRAND_FINAL ? 1000 : 0) + m.round();
    }

    /**
     * Splits a group level on the primary key into ordered tiers using the chain
     * from {@code index} on. Teams left in one tier share a rank.
     */
    private List<List<TeamTally>> breakTies(List<TeamTally> group, List<TieBreakMethod> chain, int index,
                                            Map<String, TeamTally> tallies) {
        List<List<TeamTally>> tiers = new ArrayList<>();
        if (group.size() == 1 || index >= chain.size()) {
            tiers.add(new ArrayList<>(group));
            return tiers;
        }
        TieBreakMethod method = chain.get(index);
        if (method == TieBreakMethod.HEAD_TO_HEAD) {
            if (group.size() == 2) {
                TeamTally a = group.get(0);
                TeamTally b = group.get(1);
                int net = a.headToHead.getOrDefault(b.team.id(), 0);
                if (net > 0) {
                    tiers.add(List.of(a));
                    tiers.add(List.of(b));
                    return tiers;
                }
                if (net < 0) {
                    tiers.add(List.of(b));
                    tiers.add(List.of(a));
                    return tiers;
                }
            }
            return breakTies(group, chain, index + 1, tallies);
        }

        ToDoubleFunction<TeamTally> metric = metric(method, tallies);
        List<TeamTally> sorted = new ArrayList<>(group);
        sorted.sort(Comparator.comparingDouble(metric).reversed()
            .thenComparingInt(TeamTally::seed)
            .thenComparing(t -> t.team.id()));
        int i = 0;
        while (i < sorted.size()) {
            double value = metric.applyAsDouble(sorted.get(i));
            int j = i + 1;
            while (j < sorted.size() && Double.compare(metric.applyAsDouble(sorted.get(j)), value) == 0) {
                j++;
            }
            tiers.addAll(breakTies(sorted.subList(i, j), chain, index + 1, tallies));
            i = j;
        }
        return tiers;
    }

    /**
     * Tie-break value where larger is better. Head-to-head is handled separately
     * and reports 0.
     */
    private static ToDoubleFunction<TeamTally> metric(TieBreakMethod method, Map<String, TeamTally> tallies) {
        return switch (method) {
            case HEAD_TO_HEAD -> t -> 0.0;
            case POINTS_DIFFERENTIAL -> t -> t.pointsDifferential();
            case POINTS_AGAINST -> t -> -t.pointsAgainst;
            case BUCHHOLZ -> t -> t.opponents.stream().mapToInt(o -> tallies.get(o).wins).sum();
            case SONNEBORN_BERGER -> t -> t.beaten.stream().mapToInt(o -> tallies.get(o).wins).sum();
            case STRENGTH_OF_SCHEDULE -> t -> t.opponents.stream()
                .mapToDouble(o -> winPercentage(tallies.get(o)))
                .average()
                .orElse(0.0);
        };
    }

    private static double winPercentage(TeamTally t) {
        return t.played == 0 ? 0.0 : (double) t.wins / t.played;
    }

    /**
     * Games each team can still play: Swiss counts rounds not yet settled for the
     * team; other formats count the team's unsettled matches.
     */
    private static Map<String, Integer> remainingGames(TournamentType type, Tournament tournament,
                                                       List<Match> matches, Map<String, TeamTally> tallies) {
        Map<String, Integer> remaining = new LinkedHashMap<>();
        if (type == TournamentType.SWISS) {
            int fieldSize = (int) matches.stream()
                .filter(m -> m.round() == 1)
                .flatMap(m -> m.participantIds().stream())
                .distinct()
                .count();
            int planned = SwissFormat.plannedRounds(tournament, fieldSize);
            for (String id : tallies.keySet()) {
                Set<Integer> settledRounds = new HashSet<>();
                for (Match m : matches) {
                    if (m.involves(id) && (m.isCompleted() || m.status() == MatchStatus.CANCELLED)) {
                        settledRounds.add(m.round());
                    }
                }
                remaining.put(id, Math.max(0, planned - settledRounds.size()));
            }
        } else {
            for (String id : tallies.keySet()) {
                int open = (int) matches.stream()
                    .filter(m -> m.involves(id))
                    .filter(m -> !m.isCompleted() && m.status() != MatchStatus.CANCELLED)
                    .count();
                remaining.put(id, open);
            }
        }
        return remaining;
    }

    private static StandingStatus status(TeamTally t, int rank, boolean complete, boolean eliminated,
                                         boolean elimination, Integer places, Map<String, TeamTally> tallies,
                                         Map<String, Integer> remaining) {
        if (complete && rank == 1) {
            return StandingStatus.CHAMPION;
        }
        if (eliminated) {
            return StandingStatus.ELIMINATED;
        }
        if (elimination || places == null || places <= 0) {
            return StandingStatus.ACTIVE;
        }
        int ceiling = t.wins + remaining.getOrDefault(t.team.id(), 0);
        int surelyAhead = 0;
        int possiblyAhead = 0;
        for (TeamTally other : tallies.values()) {
            if (other == t) {
                continue;
            }
            if (other.wins > ceiling) {
                surelyAhead++;
            }
            if (other.wins + remaining.getOrDefault(other.team.id(), 0) >= t.wins) {
                possiblyAhead++;
            }
        }
        if (surelyAhead >= places) {
            return StandingStatus.ELIMINATED;
        }
        if (possiblyAhead < places) {
            return StandingStatus.QUALIFIED;
        }
        return StandingStatus.ACTIVE;
    }

    private Standing toStanding(TeamTally t, int rank, StandingStatus status, List<TieBreakMethod> chain,
                                Map<String, TeamTally> tallies) {
        Map<TieBreakMethod, Double> values = new EnumMap<>(TieBreakMethod.class);
        for (TieBreakMethod method : chain) {
            if (method != TieBreakMethod.HEAD_TO_HEAD) {
                values.put(method, metricValue(method, t, tallies));
            }
        }
        int window = config.recentResultsWindow();
        List<ResultMark> recent = t.results.subList(Math.max(0, t.results.size() - window), t.results.size());
        return new Standing(rank, t.team, t.played, t.wins, t.losses, t.pointsFor, t.pointsAgainst,
            t.pointsDifferential(), recent, status, values);
    }

    private static double metricValue(TieBreakMethod method, TeamTally t, Map<String, TeamTally> tallies) {
        if (method == TieBreakMethod.POINTS_AGAINST) {
            return t.pointsAgainst;
        }
        return metric(method, tallies).applyAsDouble(t);
    }
}
