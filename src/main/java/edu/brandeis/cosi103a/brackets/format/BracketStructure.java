package edu.brandeis.cosi103a.brackets.format;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.brackets.model.BracketBranch;
import edu.brandeis.cosi103a.brackets.model.Match;
import edu.brandeis.cosi103a.brackets.model.Slot;
import edu.brandeis.cosi103a.brackets.model.TournamentType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Topology of a tournament's matches: a node per match carrying its advancement
 * links, and the matches grouped by branch and round.
 *
 * <p>The structure is always derived from the match list, so rebuilding it after a
 * progression step yields the updated structure.
 */
public record BracketStructure(
    @JsonProperty("type") TournamentType type,
    @JsonProperty("nodes") List<BracketNode> nodes,
    @JsonProperty("rounds") List<BracketRound> rounds
) {
    private static final Comparator<Match> ORDER = Comparator
        .comparing(Match::branch)
        .thenComparingInt(Match::round)
        .thenComparingInt(Match::position);

    public BracketStructure {
        nodes = ImmutableList.copyOf(nodes);
        rounds = ImmutableList.copyOf(rounds);
    }

    /**
     * Derives the structure from a match list.
     *
     * <p>Elimination formats and the round-robin playoff list opening-round byes as
     * the teams of the branch that skip that round. Swiss and round-robin list, per round, teams with a bye match or
     * with no match at all.
     */
    public static BracketStructure of(TournamentType type, List<Match> matches) {
        List<Match> sorted = new ArrayList<>(matches);
        sorted.sort(ORDER);

        Map<String, List<String>> feeders = new LinkedHashMap<>();
        for (Match m : sorted) {
            for (Slot s : List.of(m.slot1(), m.slot2())) {
                if (s instanceof Slot.WinnerOf w) {
                    feeders.computeIfAbsent(m.id(), k -> new ArrayList<>()).add(w.matchId());
                } else if (s instanceof Slot.LoserOf l) {
                    feeders.computeIfAbsent(m.id(), k -> new ArrayList<>()).add(l.matchId());
                }
            }
        }
        // A resolved slot no longer names its feeder, so recover those from the links
        for (Match m : sorted) {
            addFeeder(feeders, m.winnerTo() == null ? null : m.winnerTo().matchId(), m.id());
            addFeeder(feeders, m.loserTo() == null ? null : m.loserTo().matchId(), m.id());
        }

        List<BracketNode> nodes = new ArrayList<>();
        for (Match m : sorted) {
            nodes.add(new BracketNode(m.id(), m.round(), m.position(), m.branch(),
                feeders.getOrDefault(m.id(), List.of()),
                m.winnerTo() == null ? null : m.winnerTo().matchId()));
        }

        Map<BracketBranch, Set<String>> fieldByBranch = new LinkedHashMap<>();
        for (Match m : sorted) {
            fieldByBranch.computeIfAbsent(m.branch(), k -> new LinkedHashSet<>()).addAll(m.participantIds());
        }

        Map<BracketBranch, Integer> firstRound = new LinkedHashMap<>();
        for (Match m : sorted) {
            firstRound.merge(m.branch(), m.round(), Math::min);
        }

        Map<String, List<Match>> byRound = new LinkedHashMap<>();
        for (Match m : sorted) {
            byRound.computeIfAbsent(m.branch() + "/" + m.round(), k -> new ArrayList<>()).add(m);
        }

        List<BracketRound> rounds = new ArrayList<>();
        for (List<Match> roundMatches : byRound.values()) {
            Match first = roundMatches.get(0);
            List<String> ids = roundMatches.stream().map(Match::id).toList();
            boolean opening = first.round() == firstRound.get(first.branch());
            List<String> byes = byeTeams(type, first, opening, roundMatches,
                fieldByBranch.getOrDefault(first.branch(), Set.of()));
            rounds.add(new BracketRound(first.branch(), first.round(), first.roundName(), ids, byes));
        }
        return new BracketStructure(type, nodes, rounds);
    }

    private static void addFeeder(Map<String, List<String>> feeders, String target, String source) {
        if (target == null) {
            return;
        }
        List<String> list = feeders.computeIfAbsent(target, k -> new ArrayList<>());
        if (!list.contains(source)) {
            list.add(source);
        }
    }

    private static List<String> byeTeams(TournamentType type, Match first, boolean opening,
                                         List<Match> roundMatches, Set<String> branchField) {
        Set<String> playing = new LinkedHashSet<>();
        List<String> byes = new ArrayList<>();
        for (Match m : roundMatches) {
            if (m.isBye()) {
                m.participantIds().forEach(byes::add);
            } else {
                playing.addAll(m.participantIds());
            }
        }
        boolean knockout = type.isElimination() || first.branch() == BracketBranch.PLAYOFF;
        boolean tracksAbsentees = !knockout || opening;
        if (tracksAbsentees && first.branch() != BracketBranch.LOSER && first.branch() != BracketBranch.GRAND_FINAL) {
            for (String teamId : branchField) {
                if (!playing.contains(teamId) && !byes.contains(teamId)) {
                    byes.add(teamId);
                }
            }
        }
        return byes;
    }

    /**
     * The node for a match id, or null.
     */
    public BracketNode node(String matchId) {
        return nodes.stream().filter(n -> Objects.equals(n.matchId(), matchId)).findFirst().orElse(null);
    }
}
