package edu.brandeis.cosi103a.brackets.rating;

import de.gesundkrank.jskills.GameInfo;
import de.gesundkrank.jskills.IPlayer;
import de.gesundkrank.jskills.ITeam;
import de.gesundkrank.jskills.Player;
import de.gesundkrank.jskills.Rating;
import de.gesundkrank.jskills.TrueSkillCalculator;
import edu.brandeis.cosi103a.brackets.model.Match;
import edu.brandeis.cosi103a.brackets.model.Member;
import edu.brandeis.cosi103a.brackets.model.Team;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Two-team TrueSkill update using JSkills. Each match is one game between the
 * members of slot 1 and the members of slot 2; the declared winner ranks first.
 * The displayed rating is the conservative estimate: mu - 3*sigma.
 */
public final class SkillRatingCalculator {

    private static final Logger logger = LoggerFactory.getLogger(SkillRatingCalculator.class);

    private SkillRatingCalculator() {}

    /**
     * Update member ratings after one completed match.
     *
     * @param ratings  current (mu, sigma) by member id; members missing get the default rating
     * @param match    a completed match between two concrete teams
     * @param gameInfo TrueSkill parameters
     * @return updated ratings for every member (non-participants unchanged), or the
     *         input unchanged if TrueSkill fails to converge
     * @throws IllegalArgumentException if the match is not a completed game between two teams
     */
    public static Map<String, Rating> update(Map<String, Rating> ratings, Match match, GameInfo gameInfo) {
        if (!match.isCompleted() || match.isBye() || match.result() == null) {
            throw new IllegalArgumentException("Match " + match.id() + " is not a completed game between two teams");
        }
        Team first = match.slot1().occupant()
            .orElseThrow(() -> new IllegalArgumentException("Match " + match.id() + " has no team in slot 1"));
        Team second = match.slot2().occupant()
            .orElseThrow(() -> new IllegalArgumentException("Match " + match.id() + " has no team in slot 2"));

        Map<String, Rating> result = new HashMap<>(ratings);
        Map<String, Player<String>> players = new HashMap<>();
        ITeam side1 = toSkillTeam(first, ratings, players, gameInfo);
        ITeam side2 = toSkillTeam(second, ratings, players, gameInfo);

        boolean firstWon = first.id().equals(match.result().winnerId());
        int[] ranks = firstWon ? new int[] {1, 2} : new int[] {2, 1};

        try {
            Map<IPlayer, Rating> updated = TrueSkillCalculator.calculateNewRatings(
                gameInfo, List.of(side1, side2), ranks);
            for (Map.Entry<String, Player<String>> e : players.entrySet()) {
                result.put(e.getKey(), updated.get(e.getValue()));
            }
        } catch (RuntimeException e) {
            // JSkills can fail to converge on lopsided inputs; keep the old ratings
            logger.warn("TrueSkill failed to converge for match {}, keeping existing ratings", match.id(), e);
            return new HashMap<>(ratings);
        }
        return result;
    }

    /**
     * Get the conservative display rating: mu - 3*sigma.
     */
    public static double conservativeRating(Rating rating) {
        return rating.getMean() - 3.0 * rating.getStandardDeviation();
    }

    private static ITeam toSkillTeam(Team team, Map<String, Rating> ratings, Map<String, Player<String>> players,
                                     GameInfo gameInfo) {
        de.gesundkrank.jskills.Team skillTeam = new de.gesundkrank.jskills.Team();
        for (Member m : team.members()) {
            Player<String> player = new Player<>(m.id());
            players.put(m.id(), player);
            skillTeam.addPlayer(player, ratings.getOrDefault(m.id(), gameInfo.getDefaultRating()));
        }
        return skillTeam;
    }
}
