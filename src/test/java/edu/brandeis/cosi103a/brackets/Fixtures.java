package edu.brandeis.cosi103a.brackets;

import edu.brandeis.cosi103a.brackets.model.GameFormat;
import edu.brandeis.cosi103a.brackets.model.Match;
import edu.brandeis.cosi103a.brackets.model.MatchResult;
import edu.brandeis.cosi103a.brackets.model.Member;
import edu.brandeis.cosi103a.brackets.model.Team;
import edu.brandeis.cosi103a.brackets.model.Tournament;
import edu.brandeis.cosi103a.brackets.model.TournamentType;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared builders for teams, tournaments and match results.
 */
public final class Fixtures {

    public static final int WINNING_SCORE = 13;
    public static final int LOSING_SCORE = 7;

    private Fixtures() {}

    /**
     * Singles teams T1..Tn whose only member is ranked 1..n, so T1 is the favourite.
     */
    public static List<Team> teams(int n) {
        List<Team> teams = new ArrayList<>();
        for (int i = 1; i <= n; i++) {
            teams.add(team("T" + i, i));
        }
        return teams;
    }

    public static Team team(String id, int ranking) {
        return new Team(id, "Team " + id, List.of(new Member(id + "-p", "Player " + id, ranking)));
    }

    public static Team team(String id, int ranking, String club) {
        return new Team(id, "Team " + id, List.of(new Member(id + "-p", "Player " + id, ranking, club)));
    }

    public static Tournament tournament(TournamentType type) {
        return new Tournament("t1", "Test Open", type, GameFormat.SINGLES);
    }

    /**
     * Completes a match 13-7 for the given team.
     */
    public static Match complete(Match match, String winnerId) {
        boolean firstWins = match.slotOf(winnerId) == 1;
        return complete(match, firstWins ? WINNING_SCORE : LOSING_SCORE, firstWins ? LOSING_SCORE : WINNING_SCORE);
    }

    /**
     * Completes a match with explicit scores; the higher score wins.
     */
    public static Match complete(Match match, int score1, int score2) {
        int winnerSlot = score1 > score2 ? 1 : 2;
        String winnerId = match.slot(winnerSlot).occupant().orElseThrow().id();
        return match.withResult(MatchResult.of(score1, score2, winnerId));
    }
}
