package edu.brandeis.cosi103a.brackets.seeding;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.brackets.model.Team;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Orders a field of teams before bracket construction and assigns seeds 1..n.
 *
 * <p>Every strategy returns a permutation of its input. Random strategies draw from
 * a {@link ParkMillerRandomSource} when {@link SeedingOptions#randomSeed()} is set,
 * otherwise from the source this seeder was built with.
 */
public final class Seeder {

    /**
     * Best team first: lower composite ranking, then higher win percentage, then
     * higher points differential.
     */
    public static final Comparator<Team> RANKING_ORDER = Comparator
        .comparingDouble(Team::compositeRanking)
        .thenComparing(Comparator.comparingDouble(Team::averageWinPercentage).reversed())
        .thenComparing(Comparator.comparingDouble(Team::averagePointsDifferential).reversed());

    private static final int SKILL_TIERS = 4;

    private final RandomSource randomSource;

    public Seeder() {
        this(new LocalRandomSource());
    }

    public Seeder(RandomSource randomSource) {
        this.randomSource = Objects.requireNonNull(randomSource, "randomSource");
    }

    /**
     * Orders the teams by the chosen strategy and stamps each with its seed number.
     *
     * @param teams   the field; must not be empty
     * @param options strategy and parameters
     * @return the seeded teams, seed 1 first
     */
    public List<Team> seed(List<Team> teams, SeedingOptions options) {
        Objects.requireNonNull(options, "options");
        if (teams == null || teams.isEmpty()) {
            throw new IllegalArgumentException("Cannot seed an empty field");
        }
        List<Team> ordered = switch (options.method()) {
            case RANKED -> ranked(teams);
            case RANDOM -> shuffle(new ArrayList<>(teams), sourceFor(options));
            case CLUB_BALANCED -> interleaveGroups(teams, Team::effectiveClub);
            case GEOGRAPHIC -> interleaveGroups(teams, Team::effectiveRegion);
            case SKILL_BALANCED -> skillBalanced(teams, options);
        };

        ImmutableList.Builder<Team> seeded = ImmutableList.builder();
        for (int i = 0; i < ordered.size(); i++) {
            seeded.add(ordered.get(i).withSeed(i + 1));
        }
        return seeded.build();
    }

    /**
     * Gives the top {@code targetBracketSize - n} seeds a bye into round 2.
     *
     * @param orderedTeams teams in seed order
     * @param targetBracketSize bracket size the field is padded to
     * @return the bye holders and the teams that play round 1
     */
    public static ByeAssignment assignByes(List<Team> orderedTeams, int targetBracketSize) {
        if (targetBracketSize < orderedTeams.size()) {
            throw new IllegalArgumentException("Bracket size " + targetBracketSize
                + " is smaller than the field of " + orderedTeams.size());
        }
        int byeCount = targetBracketSize - orderedTeams.size();
        // Byes cannot outnumber the teams that actually play round 1
        if (byeCount > orderedTeams.size()) {
            throw new IllegalArgumentException("Bracket size " + targetBracketSize
                + " needs more byes than there are teams");
        }
        return new ByeAssignment(orderedTeams.subList(0, byeCount),
            orderedTeams.subList(byeCount, orderedTeams.size()));
    }

    private static List<Team> ranked(List<Team> teams) {
        List<Team> sorted = new ArrayList<>(teams);
        sorted.sort(RANKING_ORDER);
        return sorted;
    }

    private RandomSource sourceFor(SeedingOptions options) {
        return options.randomSeed() != null
            ? new ParkMillerRandomSource(options.randomSeed())
            : randomSource;
    }

    /**
     * Fisher-Yates, walking down from the last index.
     */
    private static List<Team> shuffle(List<Team> teams, RandomSource random) {
        for (int i = teams.size() - 1; i > 0; i--) {
            int j = random.nextIndex(i + 1);
            Team tmp = teams.get(i);
            teams.set(i, teams.get(j));
            teams.set(j, tmp);
        }
        return teams;
    }

    /**
     * Groups teams by key, ranks each group, then deals one team per group per pass
     * so teams sharing a key sit as far apart as possible. Groups are visited in
     * order of their best team. Teams without a key go last, in ranking order.
     */
    private static List<Team> interleaveGroups(List<Team> teams, Function<Team, String> key) {
        Map<String, List<Team>> groups = new LinkedHashMap<>();
        List<Team> ungrouped = new ArrayList<>();
        for (Team t : ranked(teams)) {
            String k = key.apply(t);
            if (k == null) {
                ungrouped.add(t);
            } else {
                groups.computeIfAbsent(k, unused -> new ArrayList<>()).add(t);
            }
        }

        List<Deque<Team>> queues = new ArrayList<>();
        for (List<Team> group : groups.values()) {
            queues.add(new ArrayDeque<>(group));
        }

        List<Team> result = new ArrayList<>(teams.size());
        boolean added = true;
        while (added) {
            added = false;
            for (Deque<Team> queue : queues) {
                if (!queue.isEmpty()) {
                    result.add(queue.poll());
                    added = true;
                }
            }
        }
        result.addAll(ungrouped);
        return result;
    }

    private List<Team> skillBalanced(List<Team> teams, SeedingOptions options) {
        List<Team> rankedTeams = ranked(teams);
        return switch (options.skillDistribution()) {
            case SNAKE -> snake(rankedTeams);
            case EVEN -> even(rankedTeams);
            case RANDOM -> shuffleWithinTiers(rankedTeams, sourceFor(options));
        };
    }

    private static List<Team> snake(List<Team> rankedTeams) {
        int width = (int) Math.ceil(Math.sqrt(rankedTeams.size()));
        List<List<Team>> columns = new ArrayList<>();
        for (int i = 0; i < width; i++) {
            columns.add(new ArrayList<>());
        }
        int column = 0;
        int direction = 1;
        for (Team t : rankedTeams) {
            columns.get(column).add(t);
            column += direction;
            if (column >= width || column < 0) {
                direction = -direction;
                column += direction;
            }
        }
        List<Team> result = new ArrayList<>(rankedTeams.size());
        columns.forEach(result::addAll);
        return result;
    }

    private static List<Team> even(List<Team> rankedTeams) {
        int groupCount = (rankedTeams.size() + SKILL_TIERS - 1) / SKILL_TIERS;
        List<List<Team>> groups = new ArrayList<>();
        for (int i = 0; i < groupCount; i++) {
            groups.add(new ArrayList<>());
        }
        for (int i = 0; i < rankedTeams.size(); i++) {
            groups.get(i % groupCount).add(rankedTeams.get(i));
        }
        List<Team> result = new ArrayList<>(rankedTeams.size());
        groups.forEach(result::addAll);
        return result;
    }

    private static List<Team> shuffleWithinTiers(List<Team> rankedTeams, RandomSource random) {
        int tierSize = (rankedTeams.size() + SKILL_TIERS - 1) / SKILL_TIERS;
        List<Team> result = new ArrayList<>(rankedTeams.size());
        for (int start = 0; start < rankedTeams.size(); start += tierSize) {
            int end = Math.min(start + tierSize, rankedTeams.size());
            result.addAll(shuffle(new ArrayList<>(rankedTeams.subList(start, end)), random));
        }
        return result;
    }
}
