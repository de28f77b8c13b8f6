package edu.brandeis.cosi103a.brackets.standings;

import edu.brandeis.cosi103a.brackets.model.Team;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable per-team accumulator, filled from completed matches and thrown away
 * once the standings are built.
 */
final class TeamTally {
    final Team team;
    int played;
    int wins;
    int losses;
    int pointsFor;
    int pointsAgainst;
    boolean lostFinalStageMatch;
    /** Depth of the match that produced the team's latest loss, -1 if unbeaten. */
    int lastLossDepth = -1;
    /** Round of the team's playoff loss; unbeaten playoff teams keep the maximum. */
    int playoffLossRound = Integer.MAX_VALUE;
    final List<ResultMark> results = new ArrayList<>();
    /** One entry per game played, so repeat meetings count twice. */
    final List<String> opponents = new ArrayList<>();
    final List<String> beaten = new ArrayList<>();
    /** Net wins against each opponent. */
    final Map<String, Integer> headToHead = new HashMap<>();

    TeamTally(Team team) {
        this.team = team;
    }

    int pointsDifferential() {
        return pointsFor - pointsAgainst;
    }

    int seed() {
        return team.seed() == null ? Integer.MAX_VALUE : team.seed();
    }

    void recordBye() {
        played++;
        wins++;
        results.add(ResultMark.W);
    }

    void recordGame(String opponentId, int scored, int conceded, boolean won, int depth, boolean finalStage) {
        played++;
        pointsFor += scored;
        pointsAgainst += conceded;
        opponents.add(opponentId);
        if (won) {
            wins++;
            beaten.add(opponentId);
            headToHead.merge(opponentId, 1, Integer::sum);
            results.add(ResultMark.W);
        } else {
            losses++;
            headToHead.merge(opponentId, -1, Integer::sum);
            results.add(ResultMark.L);
            lastLossDepth = depth;
            if (finalStage) {
                lostFinalStageMatch = true;
            }
        }
    }

    void recordPlayoff(boolean won, int round) {
        if (!won) {
            playoffLossRound = round;
        }
    }
}
