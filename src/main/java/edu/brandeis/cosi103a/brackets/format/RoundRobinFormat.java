package edu.brandeis.cosi103a.brackets.format;

import edu.brandeis.cosi103a.brackets.config.EngineConfig;
import edu.brandeis.cosi103a.brackets.model.BracketBranch;
import edu.brandeis.cosi103a.brackets.model.Match;
import edu.brandeis.cosi103a.brackets.model.MatchStatus;
import edu.brandeis.cosi103a.brackets.model.Slot;
import edu.brandeis.cosi103a.brackets.model.TieBreakMethod;
import edu.brandeis.cosi103a.brackets.model.Team;
import edu.brandeis.cosi103a.brackets.model.Tournament;
import edu.brandeis.cosi103a.brackets.model.TournamentType;
import edu.brandeis.cosi103a.brackets.seeding.Seeder;
import edu.brandeis.cosi103a.brackets.seeding.SeedingOptions;
import edu.brandeis.cosi103a.brackets.standings.Standing;
import edu.brandeis.cosi103a.brackets.standings.StandingsResolver;
import edu.brandeis.cosi103a.brackets.validation.ConstraintValidator;
import edu.brandeis.cosi103a.brackets.validation.FormatConstraints;
import edu.brandeis.cosi103a.brackets.validation.ValidatorResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everyone plays everyone, scheduled with the circle method: seed 1 stays put and
 * the rest rotate one place per round. An odd field adds an empty seat; whoever
 * draws it sits the round out. With {@code roundRobinLegs = 2} a second leg
 * repeats the schedule with the slots swapped.
 *
 * <p>With {@code groupStage} set, a field of more than twelve teams is dealt into
 * groups of about six in snake order. Each group plays its own round robin. Once
 * every group match is settled the top two of each group, at most eight teams,
 * go into a single-elimination playoff: group winners seeded first in group
 * order, then the runners-up.
 */
public final class RoundRobinFormat implements FormatEngine {

    private static final Logger logger = LoggerFactory.getLogger(RoundRobinFormat.class);

    static final FormatConstraints CONSTRAINTS = new FormatConstraints(3, 20, List.of(), true, true, 38);
    static final FormatConstraints GROUP_CONSTRAINTS = new FormatConstraints(3, 48, List.of(), true, true, 38);

    static final int GROUP_THRESHOLD = 12;
    static final int TARGET_GROUP_SIZE = 6;
    static final int MAX_PLAYOFF_TEAMS = 8;
    private static final String PLAYOFF_LABEL = "Playoff";

    private final EngineConfig config;
    private final Seeder seeder;

    public RoundRobinFormat(EngineConfig config, Seeder seeder) {
        this.config = config;
        this.seeder = seeder;
    }

    @Override
    public TournamentType type() {
        return TournamentType.ROUND_ROBIN;
    }

    @Override
    public FormatConstraints constraints() {
        return CONSTRAINTS;
    }

    @Override
    public String description() {
        return "Every team plays every other team";
    }

    @Override
    public List<TieBreakMethod> defaultTieBreaks() {
        return List.of(TieBreakMethod.HEAD_TO_HEAD, TieBreakMethod.POINTS_DIFFERENTIAL, TieBreakMethod.POINTS_AGAINST);
    }

    @Override
    public ValidatorResult validate(Tournament tournament, List<Team> teams) {
        FormatConstraints constraints = usesGroups(tournament, teams.size()) ? GROUP_CONSTRAINTS : CONSTRAINTS;
        ValidatorResult result = ConstraintValidator.validate(tournament, teams, constraints, type().displayName());
        if (teams.size() > CONSTRAINTS.maxTeams() && !tournament.settings().groupStage()) {
            result = result.merge(ValidatorResult.of(List.of(), List.of(),
                List.of("Enable the group stage to run " + teams.size() + " teams as a round robin")));
        }
        if (teams.size() % 2 == 1) {
            result = result.withWarning("Odd team count (" + teams.size() + ") means one team sits out each round");
        }
        return result;
    }

    @Override
    public BracketResult generate(Tournament tournament, List<Team> teams, SeedingOptions options) {
        ValidatorResult validation = validate(tournament, teams);
        if (!validation.valid()) {
            throw new InvalidTournamentInputException(validation);
        }
        List<Team> seeded = seeder.seed(teams, options);
        if (usesGroups(tournament, seeded.size())) {
            return generateGroups(tournament, seeded);
        }
        int legs = tournament.settings().roundRobinLegs();
        List<Match> matches = schedule(tournament, seeded, legs, null);
        int roundsPerLeg = roundsPerLeg(seeded.size());

        logger.debug("Generated round robin for {}: {} teams, {} legs, {} matches", tournament.id(),
            seeded.size(), legs, matches.size());

        BracketMetadata metadata = new BracketMetadata(type(), type().displayName(), roundsPerLeg * legs,
            matches.size(), DurationEstimator.estimateMinutes(tournament, matches.size(), config),
            CONSTRAINTS.minTeams(), CONSTRAINTS.maxTeams(), CONSTRAINTS.supportsByes(), false);
        return new BracketResult(matches, BracketStructure.of(type(), matches), metadata, seeded, List.of());
    }

    private BracketResult generateGroups(Tournament tournament, List<Team> seeded) {
        List<List<Team>> groups = dealGroups(seeded);
        int legs = tournament.settings().roundRobinLegs();
        List<Match> matches = new ArrayList<>();
        int groupRounds = 0;
        for (int g = 0; g < groups.size(); g++) {
            matches.addAll(schedule(tournament, groups.get(g), legs, groupLabel(g)));
            groupRounds = Math.max(groupRounds, roundsPerLeg(groups.get(g).size()) * legs);
        }
        int qualifiers = Math.min(groups.size() * 2, MAX_PLAYOFF_TEAMS);
        int playoffRounds = KnockoutBuilder.roundsFor(KnockoutBuilder.bracketSize(qualifiers));
        int totalMatches = matches.size() + qualifiers - 1;

        logger.debug("Generated group stage for {}: {} teams in {} groups, {} group matches, {} playoff places",
            tournament.id(), seeded.size(), groups.size(), matches.size(), qualifiers);

        BracketMetadata metadata = new BracketMetadata(type(), type().displayName() + " with Playoffs",
            groupRounds + playoffRounds, totalMatches,
            DurationEstimator.estimateMinutes(tournament, totalMatches, config),
            GROUP_CONSTRAINTS.minTeams(), GROUP_CONSTRAINTS.maxTeams(), GROUP_CONSTRAINTS.supportsByes(), false);
        return new BracketResult(matches, BracketStructure.of(type(), matches), metadata, seeded, List.of());
    }

    /**
     * Whether a field of this size plays a group stage and playoff.
     */
    public static boolean usesGroups(Tournament tournament, int teamCount) {
        return tournament.settings().groupStage() && teamCount > GROUP_THRESHOLD;
    }

    /**
     * Deals seeds into ceil(n / 6) groups in snake order, so group A holds seed 1,
     * group B seed 2, and the last group takes the next seed as well.
     */
    static List<List<Team>> dealGroups(List<Team> seeded) {
        int count = (seeded.size() + TARGET_GROUP_SIZE - 1) / TARGET_GROUP_SIZE;
        List<List<Team>> groups = new ArrayList<>();
        for (int g = 0; g < count; g++) {
            groups.add(new ArrayList<>());
        }
        for (int i = 0; i < seeded.size(); i++) {
            int row = i / count;
            int col = i % count;
            groups.get(row % 2 == 0 ? col : count - 1 - col).add(seeded.get(i));
        }
        return groups;
    }

    static String groupLabel(int index) {
        return String.valueOf((char) ('A' + index));
    }

    private static int roundsPerLeg(int teamCount) {
        return teamCount % 2 == 0 ? teamCount - 1 : teamCount;
    }

    /**
     * Circle-method schedule for one field. A non-null group label prefixes ids
     * and round names.
     */
    private static List<Match> schedule(Tournament tournament, List<Team> seeded, int legs, String group) {
        List<Team> rotation = new ArrayList<>(seeded);
        if (rotation.size() % 2 == 1) {
            rotation.add(null);
        }
        int n = rotation.size();
        int roundsPerLeg = n - 1;
        Team fixed = rotation.remove(0);

        List<List<Team[]>> firstLeg = new ArrayList<>();
        for (int round = 0; round < roundsPerLeg; round++) {
            List<Team> left = new ArrayList<>();
            left.add(fixed);
            left.addAll(rotation.subList(0, n / 2 - 1));
            List<Team> right = new ArrayList<>(rotation.subList(n / 2 - 1, rotation.size()));
            Collections.reverse(right);

            List<Team[]> pairings = new ArrayList<>();
            for (int i = 0; i < n / 2; i++) {
                Team a = left.get(i);
                Team b = right.get(i);
                if (a == null || b == null) {
                    continue;
                }
                boolean flip = round % 2 == 1;
                pairings.add(flip ? new Team[] {b, a} : new Team[] {a, b});
            }
            firstLeg.add(pairings);

            Team last = rotation.remove(rotation.size() - 1);
            rotation.add(0, last);
        }

        List<Match> matches = new ArrayList<>();
        for (int leg = 0; leg < legs; leg++) {
            for (int r = 0; r < roundsPerLeg; r++) {
                int round = leg * roundsPerLeg + r + 1;
                String roundName = group == null
                    ? RoundNames.roundRobin(round, roundsPerLeg)
                    : RoundNames.group(group, round, roundsPerLeg);
                String idPrefix = tournament.id() + (group == null ? "-R" : "-" + group + "-R");
                int position = 1;
                for (Team[] pair : firstLeg.get(r)) {
                    Team home = leg == 0 ? pair[0] : pair[1];
                    Team away = leg == 0 ? pair[1] : pair[0];
                    matches.add(new Match(idPrefix + round + "-" + position, tournament.id(), round,
                        roundName, BracketBranch.WINNER, position, Slot.of(home), Slot.of(away), null,
                        MatchStatus.SCHEDULED, null, null));
                    position++;
                }
            }
        }
        return matches;
    }

    /**
     * Group and league matches create nothing, except that the match settling the
     * last open group match seeds the playoff. Playoff matches advance like any
     * knockout.
     */
    @Override
    public ProgressionResult advance(Match completedMatch, Tournament tournament, List<Match> allMatches) {
        if (completedMatch.branch() == BracketBranch.PLAYOFF) {
            KnockoutProgression.Step step = KnockoutProgression.advance(completedMatch, allMatches);
            return new ProgressionResult(step.affected(), List.of(), BracketStructure.of(type(), step.matches()),
                isComplete(tournament, step.matches()), null);
        }
        MatchLists.requireCompleted(completedMatch, allMatches);
        List<Match> matches = MatchLists.merge(allMatches, List.of(completedMatch));

        List<Match> created = List.of();
        List<Match> groupMatches = groupStage(matches);
        boolean groupsSettled = groupMatches.stream().allMatch(MatchLists::isSettled);
        boolean playoffExists = matches.stream().anyMatch(m -> m.branch() == BracketBranch.PLAYOFF);
        if (usesGroups(tournament, MatchLists.teamsIn(groupMatches).size()) && groupsSettled && !playoffExists) {
            created = playoff(tournament, groupMatches);
            matches = MatchLists.merge(matches, created);
        }
        return new ProgressionResult(List.of(), created, BracketStructure.of(type(), matches),
            isComplete(tournament, matches), null);
    }

    private List<Match> playoff(Tournament tournament, List<Match> groupMatches) {
        StandingsResolver resolver = new StandingsResolver(config);
        List<Team> winners = new ArrayList<>();
        List<Team> runnersUp = new ArrayList<>();
        for (List<Match> group : splitGroups(groupMatches)) {
            List<Standing> table = resolver.compute(tournament, group, this).entries();
            winners.add(table.get(0).team());
            if (table.size() > 1) {
                runnersUp.add(table.get(1).team());
            }
        }
        // Odd group counts reverse the runners-up so group mates miss each other in the opening round
        if (winners.size() % 2 == 1) {
            Collections.reverse(runnersUp);
        }
        List<Team> qualifiers = new ArrayList<>(winners);
        qualifiers.addAll(runnersUp);
        qualifiers = qualifiers.subList(0, Math.min(qualifiers.size(), MAX_PLAYOFF_TEAMS)).stream()
            .map(t -> t.withBranch(BracketBranch.PLAYOFF))
            .toList();

        int offset = groupMatches.stream().mapToInt(Match::round).max().orElse(0);
        int size = KnockoutBuilder.bracketSize(qualifiers.size());
        int rounds = KnockoutBuilder.roundsFor(size);
        KnockoutBuilder builder = new KnockoutBuilder(tournament.id());
        List<Slot> entrants = KnockoutBuilder.seededEntrants(qualifiers, size);
        for (int r = 1; r <= rounds; r++) {
            entrants = builder.playRound(entrants, BracketBranch.PLAYOFF, offset + r,
                RoundNames.knockout(PLAYOFF_LABEL, r, rounds)).winners();
        }
        List<Match> created = builder.build();
        logger.info("Group stage of {} settled; playoff seeded with {}", tournament.id(),
            qualifiers.stream().map(Team::id).toList());
        return created;
    }

    /**
     * Group matches split by group: teams that played each other share a group.
     * Groups come back ordered by their best seed, which is group order.
     */
    static List<List<Match>> splitGroups(List<Match> groupMatches) {
        Map<String, Set<String>> groupOf = new LinkedHashMap<>();
        for (Match m : groupMatches) {
            List<String> ids = m.participantIds();
            Set<String> merged = new LinkedHashSet<>();
            for (String id : ids) {
                merged.addAll(groupOf.getOrDefault(id, Set.of(id)));
            }
            for (String id : merged) {
                groupOf.put(id, merged);
            }
        }
        Map<Set<String>, List<Match>> byGroup = new LinkedHashMap<>();
        for (Match m : groupMatches) {
            if (!m.participantIds().isEmpty()) {
                byGroup.computeIfAbsent(groupOf.get(m.participantIds().get(0)), k -> new ArrayList<>()).add(m);
            }
        }
        List<List<Match>> groups = new ArrayList<>(byGroup.values());
        groups.sort(Comparator.comparingInt(RoundRobinFormat::bestSeed));
        return groups;
    }

    private static int bestSeed(List<Match> group) {
        return MatchLists.teamsIn(group).stream()
            .mapToInt(t -> t.seed() == null ? Integer.MAX_VALUE : t.seed())
            .min()
            .orElse(Integer.MAX_VALUE);
    }

    private static List<Match> groupStage(List<Match> matches) {
        return matches.stream().filter(m -> m.branch() != BracketBranch.PLAYOFF).toList();
    }

    @Override
    public boolean isComplete(Tournament tournament, List<Match> matches) {
        if (matches.isEmpty() || !matches.stream().allMatch(MatchLists::isSettled)) {
            return false;
        }
        if (!usesGroups(tournament, MatchLists.teamsIn(groupStage(matches)).size())) {
            return true;
        }
        return matches.stream().anyMatch(m -> m.branch() == BracketBranch.PLAYOFF && m.winnerTo() == null);
    }

    @Override
    public boolean isEliminated(Tournament tournament, int losses, boolean lostFinalStageMatch) {
        return false;
    }
}
