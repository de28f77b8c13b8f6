package edu.brandeis.cosi103a.brackets.format;

import edu.brandeis.cosi103a.brackets.model.Advancement;
import edu.brandeis.cosi103a.brackets.model.BracketBranch;
import edu.brandeis.cosi103a.brackets.model.Match;
import edu.brandeis.cosi103a.brackets.model.Slot;
import edu.brandeis.cosi103a.brackets.model.Team;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Moves the winner (and, in double elimination, the loser) of a completed match
 * into the placeholder slots that reference it.
 */
final class KnockoutProgression {

    /** Match list after the step, and the successors that changed. */
    record Step(List<Match> matches, List<Match> affected) {}

    private KnockoutProgression() {}

    static Step advance(Match completed, List<Match> allMatches) {
        Match stored = MatchLists.requireCompleted(completed, allMatches);
        Map<String, Match> byId = MatchLists.byId(allMatches);
        byId.put(completed.id(), completed);

        List<Match> affected = new ArrayList<>();
        Advancement winnerTo = stored.winnerTo();
        Advancement loserTo = stored.loserTo();
        if (winnerTo != null) {
            Team winner = completed.winner()
                .orElseThrow(() -> new BracketIntegrityException(completed.id(), "winner cannot be resolved"));
            affected.add(place(byId, completed.id(), winnerTo, winner, false));
        }
        if (loserTo != null) {
            Team loser = completed.loser()
                .orElseThrow(() -> new BracketIntegrityException(completed.id(), "loser cannot be resolved"));
            affected.add(place(byId, completed.id(), loserTo, loser.withBranch(BracketBranch.LOSER), true));
        }
        return new Step(new ArrayList<>(byId.values()), dedupe(affected));
    }

    private static Match place(Map<String, Match> byId, String sourceId, Advancement link, Team team, boolean loser) {
        Match target = byId.get(link.matchId());
        if (target == null) {
            throw new BracketIntegrityException(sourceId, "successor " + link.matchId() + " is missing");
        }
        Slot slot = target.slot(link.slot());
        boolean expected = loser
            ? slot instanceof Slot.LoserOf l && l.matchId().equals(sourceId)
            : slot instanceof Slot.WinnerOf w && w.matchId().equals(sourceId);
        if (!expected) {
            throw new BracketIntegrityException(sourceId, "slot " + link.slot() + " of " + target.id()
                + " is no longer waiting on this match");
        }
        Match updated = target.withSlot(link.slot(), Slot.of(team));
        byId.put(updated.id(), updated);
        return updated;
    }

    // Both links can point at the same match (a two-team double elimination grand final)
    private static List<Match> dedupe(List<Match> affected) {
        List<Match> result = new ArrayList<>();
        for (Match m : affected) {
            result.removeIf(existing -> existing.id().equals(m.id()));
            result.add(m);
        }
        return result;
    }
}
