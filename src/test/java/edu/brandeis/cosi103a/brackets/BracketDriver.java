package edu.brandeis.cosi103a.brackets;

import edu.brandeis.cosi103a.brackets.format.FormatEngine;
import edu.brandeis.cosi103a.brackets.format.ProgressionResult;
import edu.brandeis.cosi103a.brackets.model.Match;
import edu.brandeis.cosi103a.brackets.model.MatchStatus;
import edu.brandeis.cosi103a.brackets.model.Team;
import edu.brandeis.cosi103a.brackets.model.Tournament;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Plays a bracket the way the orchestration layer would: complete a match, hand
 * it to the format, store whatever comes back.
 */
public class BracketDriver {

    /** The team with the better (lower) seed wins. */
    public static final Function<Match, String> BETTER_SEED_WINS = m -> {
        Team a = m.slot1().occupant().orElseThrow();
        Team b = m.slot2().occupant().orElseThrow();
        return a.seed() <= b.seed() ? a.id() : b.id();
    };

    private final FormatEngine format;
    private final Tournament tournament;
    private final Map<String, Match> matches = new LinkedHashMap<>();
    private ProgressionResult lastResult;

    public BracketDriver(FormatEngine format, Tournament tournament, List<Match> initial) {
        this.format = format;
        this.tournament = tournament;
        initial.forEach(m -> matches.put(m.id(), m));
    }

    public List<Match> matches() {
        return new ArrayList<>(matches.values());
    }

    public Match match(String id) {
        return matches.get(id);
    }

    public ProgressionResult lastResult() {
        return lastResult;
    }

    public Optional<Match> nextPlayable() {
        return matches.values().stream().filter(m -> m.status() == MatchStatus.SCHEDULED).findFirst();
    }

    public ProgressionResult play(String matchId, String winnerId) {
        return submit(Fixtures.complete(matches.get(matchId), winnerId));
    }

    public ProgressionResult submit(Match completed) {
        ProgressionResult result = format.advance(completed, tournament, matches());
        matches.put(completed.id(), completed);
        result.affectedMatches().forEach(m -> matches.put(m.id(), m));
        result.newMatches().forEach(m -> matches.put(m.id(), m));
        lastResult = result;
        return result;
    }

    /**
     * Plays scheduled matches until none are left.
     */
    public void playAll(Function<Match, String> winnerChooser) {
        Optional<Match> next = nextPlayable();
        while (next.isPresent()) {
            play(next.get().id(), winnerChooser.apply(next.get()));
            next = nextPlayable();
        }
    }
}
