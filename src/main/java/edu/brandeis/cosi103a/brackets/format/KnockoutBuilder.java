package edu.brandeis.cosi103a.brackets.format;

import com.google.common.math.IntMath;
import edu.brandeis.cosi103a.brackets.model.Advancement;
import edu.brandeis.cosi103a.brackets.model.BracketBranch;
import edu.brandeis.cosi103a.brackets.model.Match;
import edu.brandeis.cosi103a.brackets.model.MatchStatus;
import edu.brandeis.cosi103a.brackets.model.Slot;
import edu.brandeis.cosi103a.brackets.model.Team;

import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles elimination brackets round by round.
 *
 * <p>Each round pairs a list of entrants two at a time. An entrant is a slot: a
 * seeded team, the winner or loser of an earlier match, or {@link Slot.Bye} when
 * the position is empty. A pairing with an empty side creates no match; the other
 * entrant passes straight into the next round. This keeps byes out of the match
 * list, so a field of n always produces n - 1 knockout matches.
 */
final class KnockoutBuilder {

    /** Entrants moving on from a round: winners, and losers for a loser's bracket. */
    record RoundOutcome(List<Slot> winners, List<Slot> losers) {}

    private final String tournamentId;
    private final List<Match> matches = new ArrayList<>();

    KnockoutBuilder(String tournamentId) {
        this.tournamentId = tournamentId;
    }

    static int bracketSize(int teamCount) {
        return IntMath.ceilingPowerOfTwo(Math.max(teamCount, 2));
    }

    static int roundsFor(int bracketSize) {
        return IntMath.log2(bracketSize, RoundingMode.UNNECESSARY);
    }

    static String matchId(String tournamentId, BracketBranch branch, int round, int position) {
        return tournamentId + "-" + branch.code() + round + "-" + position;
    }

    /**
     * Standard seed placement for a bracket of the given size: seed 1 meets seed
     * {@code size}, and the top two seeds can only meet in the final.
     * For 8 this is [1, 8, 4, 5, 2, 7, 3, 6].
     */
    static List<Integer> seedOrder(int size) {
        List<Integer> order = new ArrayList<>(List.of(1));
        while (order.size() < size) {
            int next = order.size() * 2;
            List<Integer> expanded = new ArrayList<>(next);
            for (int seed : order) {
                expanded.add(seed);
                expanded.add(next + 1 - seed);
            }
            order = expanded;
        }
        return order;
    }

    /**
     * Round-one entrants in bracket order; seeds beyond the field are empty.
     */
    static List<Slot> seededEntrants(List<Team> seededTeams, int size) {
        List<Slot> entrants = new ArrayList<>(size);
        for (int seed : seedOrder(size)) {
            entrants.add(seed <= seededTeams.size() ? Slot.of(seededTeams.get(seed - 1)) : Slot.bye());
        }
        return entrants;
    }

    /**
     * Pairs entrants (0,1), (2,3), ... into matches of one round.
     */
    RoundOutcome playRound(List<Slot> entrants, BracketBranch branch, int round, String roundName) {
        List<Slot> winners = new ArrayList<>();
        List<Slot> losers = new ArrayList<>();
        for (int p = 0; p < entrants.size() / 2; p++) {
            Slot a = entrants.get(2 * p);
            Slot b = entrants.get(2 * p + 1);
            if (a instanceof Slot.Bye) {
                winners.add(b);
                losers.add(Slot.bye());
            } else if (b instanceof Slot.Bye) {
                winners.add(a);
                losers.add(Slot.bye());
            } else {
                Match m = add(branch, round, p + 1, roundName, a, b);
                winners.add(Slot.winnerOf(m.id()));
                losers.add(Slot.loserOf(m.id()));
            }
        }
        return new RoundOutcome(winners, losers);
    }

    Match add(BracketBranch branch, int round, int position, String roundName, Slot a, Slot b) {
        MatchStatus status = a.isResolved() && b.isResolved() ? MatchStatus.SCHEDULED : MatchStatus.PENDING;
        Match m = new Match(matchId(tournamentId, branch, round, position), tournamentId, round, roundName,
            branch, position, a, b, null, status, null, null);
        matches.add(m);
        return m;
    }

    /**
     * Returns the matches with winner/loser links pointing at the slots that
     * reference them.
     */
    List<Match> build() {
        Map<String, Advancement> winnerLinks = new LinkedHashMap<>();
        Map<String, Advancement> loserLinks = new LinkedHashMap<>();
        for (Match m : matches) {
            for (int idx = 1; idx <= 2; idx++) {
                Slot s = m.slot(idx);
                if (s instanceof Slot.WinnerOf w) {
                    winnerLinks.put(w.matchId(), new Advancement(m.id(), idx));
                } else if (s instanceof Slot.LoserOf l) {
                    loserLinks.put(l.matchId(), new Advancement(m.id(), idx));
                }
            }
        }
        List<Match> linked = new ArrayList<>(matches.size());
        for (Match m : matches) {
            linked.add(m.withLinks(winnerLinks.get(m.id()), loserLinks.get(m.id())));
        }
        return linked;
    }
}
