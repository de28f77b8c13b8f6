package edu.brandeis.cosi103a.brackets.format;

import edu.brandeis.cosi103a.brackets.model.BracketBranch;
import edu.brandeis.cosi103a.brackets.model.Match;
import edu.brandeis.cosi103a.brackets.model.MatchResult;
import edu.brandeis.cosi103a.brackets.model.MatchStatus;
import edu.brandeis.cosi103a.brackets.model.Slot;
import edu.brandeis.cosi103a.brackets.model.Team;
import edu.brandeis.cosi103a.brackets.model.Tournament;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pairs one Swiss round from the results so far.
 *
 * <p>Teams are ordered by wins, then points differential, then seed, and split
 * into score groups. Each group is paired within itself, top team first with the
 * nearest team it has not met. An odd group floats its lowest team that cannot be
 * paired down into the next group; a group with no rematch-free pairing floats two
 * more, and so on. The search backtracks across groups within a step budget. If
 * no rematch-free pairing is found the nearest available opponents are used and
 * a warning is logged.
 *
 * <p>With an odd field the lowest-ranked team that has not yet had a bye gets one:
 * a completed match against a bye marker, scored {@code maxPoints}-0.
 */
final class SwissPairer {

    private static final Logger logger = LoggerFactory.getLogger(SwissPairer.class);

    /** Running record of one team across the rounds played so far. */
    private static final class Record {
        final Team team;
        int wins;
        int pointsDifferential;
        boolean hadBye;
        final Set<String> opponents = new HashSet<>();

        Record(Team team) {
            this.team = team;
        }

        int seed() {
            return team.seed() == null ? Integer.MAX_VALUE : team.seed();
        }
    }

    private static final Comparator<Record> STANDING_ORDER = Comparator
        .comparingInt((Record r) -> r.wins).reversed()
        .thenComparing(Comparator.comparingInt((Record r) -> r.pointsDifferential).reversed())
        .thenComparingInt(Record::seed)
        .thenComparing(r -> r.team.id());

    private final int searchBudget;

    SwissPairer(int searchBudget) {
        this.searchBudget = searchBudget;
    }

    /**
     * Round one: the top half of the seed order plays the bottom half
     * (1 vs n/2+1, 2 vs n/2+2, ...). An odd field gives the last seed a bye.
     */
    List<Match> firstRound(Tournament tournament, List<Team> seeded) {
        List<Team> playing = new ArrayList<>(seeded);
        Team byeTeam = null;
        if (playing.size() % 2 == 1) {
            byeTeam = playing.remove(playing.size() - 1);
        }
        int half = playing.size() / 2;
        List<Team[]> pairs = new ArrayList<>();
        for (int i = 0; i < half; i++) {
            pairs.add(new Team[] {playing.get(i), playing.get(i + half)});
        }
        return toMatches(tournament, 1, pairs, byeTeam);
    }

    /**
     * Pairs the given round from every earlier completed match.
     */
    List<Match> nextRound(Tournament tournament, List<Match> matches, int round) {
        Map<String, Record> records = new HashMap<>();
        for (Team t : MatchLists.teamsIn(matches)) {
            records.put(t.id(), new Record(t));
        }
        for (Match m : matches) {
            if (!m.isCompleted() || m.round() >= round) {
                continue;
            }
            String winnerId = m.result().winnerId();
            if (m.isBye()) {
                Record r = records.get(winnerId);
                r.wins++;
                r.hadBye = true;
                continue;
            }
            String id1 = m.slot1().occupant().orElseThrow().id();
            String id2 = m.slot2().occupant().orElseThrow().id();
            Record r1 = records.get(id1);
            Record r2 = records.get(id2);
            r1.opponents.add(id2);
            r2.opponents.add(id1);
            r1.pointsDifferential += m.result().score1() - m.result().score2();
            r2.pointsDifferential += m.result().score2() - m.result().score1();
            if (winnerId.equals(id1)) {
                r1.wins++;
            } else {
                r2.wins++;
            }
        }

        List<Record> ordered = new ArrayList<>(records.values());
        ordered.sort(STANDING_ORDER);

        Team byeTeam = null;
        if (ordered.size() % 2 == 1) {
            int byeIndex = ordered.size() - 1;
            for (int i = ordered.size() - 1; i >= 0; i--) {
                if (!ordered.get(i).hadBye) {
                    byeIndex = i;
                    break;
                }
            }
            byeTeam = ordered.remove(byeIndex).team;
        }

        List<Team[]> pairs = new ArrayList<>();
        int[] budget = {searchBudget};
        if (!pairGroup(scoreGroups(ordered), 0, new ArrayList<>(), pairs, budget)) {
            logger.warn("Swiss round {} of {}: no rematch-free pairing found, allowing rematches",
                round, tournament.id());
            pairs = nearestAvailable(ordered);
        }
        return toMatches(tournament, round, pairs, byeTeam);
    }

    private static List<List<Record>> scoreGroups(List<Record> ordered) {
        List<List<Record>> groups = new ArrayList<>();
        List<Record> current = null;
        for (Record r : ordered) {
            if (current == null || current.get(0).wins != r.wins) {
                current = new ArrayList<>();
                groups.add(current);
            }
            current.add(r);
        }
        return groups;
    }

    /**
     * Pairs group {@code g} together with the teams floated down into it, trying the
     * fewest floaters first. The last group may not float anyone.
     */
    private static boolean pairGroup(List<List<Record>> groups, int g, List<Record> floatedIn,
                                     List<Team[]> pairs, int[] budget) {
        if (g == groups.size()) {
            return floatedIn.isEmpty();
        }
        List<Record> pool = new ArrayList<>(floatedIn);
        pool.addAll(groups.get(g));
        int maxFloats = g == groups.size() - 1 ? 0 : pool.size();
        for (int floats = pool.size() % 2; floats <= maxFloats; floats += 2) {
            if (pairWithin(groups, g, pool, floats, new ArrayList<>(), pairs, budget)) {
                return true;
            }
            if (budget[0] < 0) {
                return false;
            }
        }
        return false;
    }

    private static boolean pairWithin(List<List<Record>> groups, int g, List<Record> pool, int floats,
                                      List<Record> floatingOut, List<Team[]> pairs, int[] budget) {
        if (--budget[0] < 0) {
            return false;
        }
        if (pool.isEmpty()) {
            return floats == 0 && pairGroup(groups, g + 1, floatingOut, pairs, budget);
        }
        Record first = pool.get(0);
        for (int i = 1; i < pool.size(); i++) {
            Record candidate = pool.get(i);
            if (first.opponents.contains(candidate.team.id())) {
                continue;
            }
            List<Record> rest = new ArrayList<>(pool);
            rest.remove(i);
            rest.remove(0);
            pairs.add(new Team[] {first.team, candidate.team});
            if (pairWithin(groups, g, rest, floats, floatingOut, pairs, budget)) {
                return true;
            }
            pairs.remove(pairs.size() - 1);
            if (budget[0] < 0) {
                return false;
            }
        }
        if (floats > 0) {
            floatingOut.add(first);
            if (pairWithin(groups, g, pool.subList(1, pool.size()), floats - 1, floatingOut, pairs, budget)) {
                return true;
            }
            floatingOut.remove(floatingOut.size() - 1);
        }
        return false;
    }

    private static List<Team[]> nearestAvailable(List<Record> ordered) {
        List<Record> remaining = new ArrayList<>(ordered);
        List<Team[]> pairs = new ArrayList<>();
        while (!remaining.isEmpty()) {
            Record first = remaining.remove(0);
            int pick = 0;
            for (int i = 0; i < remaining.size(); i++) {
                if (!first.opponents.contains(remaining.get(i).team.id())) {
                    pick = i;
                    break;
                }
            }
            pairs.add(new Team[] {first.team, remaining.remove(pick).team});
        }
        return pairs;
    }

    private static List<Match> toMatches(Tournament tournament, int round, List<Team[]> pairs, Team byeTeam) {
        List<Match> matches = new ArrayList<>();
        String roundName = RoundNames.swiss(round);
        int position = 1;
        for (Team[] pair : pairs) {
            matches.add(new Match(matchId(tournament, round, position), tournament.id(), round, roundName,
                BracketBranch.WINNER, position, Slot.of(pair[0]), Slot.of(pair[1]), null,
                MatchStatus.SCHEDULED, null, null));
            position++;
        }
        if (byeTeam != null) {
            matches.add(new Match(matchId(tournament, round, position), tournament.id(), round, roundName,
                BracketBranch.WINNER, position, Slot.of(byeTeam), Slot.bye(),
                MatchResult.of(tournament.maxPoints(), 0, byeTeam.id()), MatchStatus.COMPLETED, null, null));
        }
        return matches;
    }

    static String matchId(Tournament tournament, int round, int position) {
        return tournament.id() + "-S" + round + "-" + position;
    }
}
