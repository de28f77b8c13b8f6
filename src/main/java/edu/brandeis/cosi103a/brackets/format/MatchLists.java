package edu.brandeis.cosi103a.brackets.format;

import edu.brandeis.cosi103a.brackets.model.Match;
import edu.brandeis.cosi103a.brackets.model.MatchStatus;
import edu.brandeis.cosi103a.brackets.model.Team;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lookups and integrity checks over a tournament's match list.
 */
final class MatchLists {

    private MatchLists() {}

    static Map<String, Match> byId(List<Match> matches) {
        Map<String, Match> map = new LinkedHashMap<>();
        for (Match m : matches) {
            map.put(m.id(), m);
        }
        return map;
    }

    /**
     * Distinct teams placed anywhere in the matches, in first-seen order.
     */
    static List<Team> teamsIn(List<Match> matches) {
        Map<String, Team> teams = new LinkedHashMap<>();
        for (Match m : matches) {
            m.slot1().occupant().ifPresent(t -> teams.putIfAbsent(t.id(), t));
            m.slot2().occupant().ifPresent(t -> teams.putIfAbsent(t.id(), t));
        }
        return new ArrayList<>(teams.values());
    }

    static boolean isSettled(Match m) {
        return m.status() == MatchStatus.COMPLETED || m.status() == MatchStatus.CANCELLED;
    }

    /**
     * Checks that a match handed to a progression step really completed and
     * agrees with the stored copy.
     *
     * @return the stored copy from {@code allMatches}
     * @throws BracketIntegrityException if any check fails
     */
    static Match requireCompleted(Match completed, List<Match> allMatches) {
        String id = completed.id();
        if (completed.status() != MatchStatus.COMPLETED) {
            throw new BracketIntegrityException(id, "is not completed (status " + completed.status() + ")");
        }
        if (completed.result() == null || completed.result().winnerId() == null) {
            throw new BracketIntegrityException(id, "has no declared winner");
        }
        if (!completed.isBye() && !(completed.slot1().isResolved() && completed.slot2().isResolved())) {
            throw new BracketIntegrityException(id, "still has unresolved participants");
        }
        if (completed.slotOf(completed.result().winnerId()) == 0) {
            throw new BracketIntegrityException(id,
                "winner " + completed.result().winnerId() + " is not one of its participants");
        }
        Match stored = allMatches.stream()
            .filter(m -> m.id().equals(id))
            .findFirst()
            .orElseThrow(() -> new BracketIntegrityException(id, "is not part of the supplied match list"));
        if (!new HashSet<>(stored.participantIds()).equals(new HashSet<>(completed.participantIds()))) {
            throw new BracketIntegrityException(id, "participants differ from the stored match");
        }
        return stored;
    }

    /**
     * Replaces matches by id and appends any that are new.
     */
    static List<Match> merge(List<Match> allMatches, List<Match> updates) {
        Map<String, Match> map = byId(allMatches);
        for (Match m : updates) {
            map.put(m.id(), m);
        }
        return new ArrayList<>(map.values());
    }
}
