package edu.brandeis.cosi103a.brackets.rating;

import de.gesundkrank.jskills.GameInfo;
import de.gesundkrank.jskills.Rating;
import edu.brandeis.cosi103a.brackets.model.BracketBranch;
import edu.brandeis.cosi103a.brackets.model.Match;
import edu.brandeis.cosi103a.brackets.model.Member;
import edu.brandeis.cosi103a.brackets.model.Team;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks TrueSkill ratings of individual members across matches and turns them
 * back into member rankings, so the next event can be seeded from results.
 */
public class SkillRatingTracker {
    private final Map<String, Rating> ratings = new HashMap<>();
    private final GameInfo gameInfo;

    /**
     * @param gameInfo TrueSkill parameters
     */
    public SkillRatingTracker(GameInfo gameInfo) {
        this.gameInfo = gameInfo;
    }

    /**
     * Tracker using JSkills' default parameters (mu 25, sigma 25/3).
     */
    public static SkillRatingTracker withDefaultParameters() {
        return new SkillRatingTracker(GameInfo.getDefaultGameInfo());
    }

    /**
     * Process one match. Byes and matches without a result are skipped.
     */
    public void processMatch(Match match) {
        if (!match.isCompleted() || match.isBye() || match.result() == null) {
            return;
        }
        ratings.putAll(SkillRatingCalculator.update(ratings, match, gameInfo));
    }

    /**
     * Process matches in playing order (round, grand final last, then position).
     */
    public void processMatches(List<Match> matches) {
        List<Match> ordered = new ArrayList<>(matches);
        ordered.sort(Comparator
            .comparingInt((Match m) -> (m.branch() == BracketBranch.GRAND_FINAL ? 1000 : 0) + m.round())
            .thenComparing(Match::branch)
            .thenComparingInt(Match::position));
        ordered.forEach(this::processMatch);
    }

    /**
     * Get current ratings for all members seen so far.
     *
     * @return snapshot of current ratings
     */
    public Map<String, Rating> getCurrentRatings() {
        return new HashMap<>(ratings);
    }

    /**
     * Get the conservative rating for a member (mu - 3*sigma); unseen members get
     * the default rating's value.
     *
     * @param memberId member to query
     * @return conservative rating estimate
     */
    public double getConservativeRating(String memberId) {
        return SkillRatingCalculator.conservativeRating(ratings.getOrDefault(memberId, gameInfo.getDefaultRating()));
    }

    /**
     * Average conservative rating of a team's members.
     */
    public double teamSkill(Team team) {
        return team.members().stream()
            .mapToDouble(m -> getConservativeRating(m.id()))
            .average()
            .orElse(SkillRatingCalculator.conservativeRating(gameInfo.getDefaultRating()));
    }

    /**
     * Rewrites every member's ranking as 1..M by conservative rating, best first.
     * Ties keep member id order.
     *
     * @param teams the field to rerank
     * @return the same teams, in order, with refreshed member rankings
     */
    public List<Team> rerank(List<Team> teams) {
        List<Member> all = new ArrayList<>();
        teams.forEach(t -> all.addAll(t.members()));
        all.sort(Comparator.comparingDouble((Member m) -> getConservativeRating(m.id())).reversed()
            .thenComparing(Member::id));
        Map<String, Integer> rankings = new HashMap<>();
        for (int i = 0; i < all.size(); i++) {
            rankings.putIfAbsent(all.get(i).id(), i + 1);
        }
        List<Team> result = new ArrayList<>(teams.size());
        for (Team t : teams) {
            List<Member> members = t.members().stream()
                .map(m -> m.withRanking(rankings.get(m.id())))
                .toList();
            result.add(t.withMembers(members));
        }
        return result;
    }
}
