package edu.brandeis.cosi103a.brackets.engine;

import edu.brandeis.cosi103a.brackets.config.EngineConfig;
import edu.brandeis.cosi103a.brackets.format.ConsolationFormat;
import edu.brandeis.cosi103a.brackets.format.FormatEngine;
import edu.brandeis.cosi103a.brackets.format.FormatEngines;
import edu.brandeis.cosi103a.brackets.format.ProgressionResult;
import edu.brandeis.cosi103a.brackets.model.Match;
import edu.brandeis.cosi103a.brackets.model.Team;
import edu.brandeis.cosi103a.brackets.model.Tournament;
import edu.brandeis.cosi103a.brackets.rating.SkillRatingTracker;
import edu.brandeis.cosi103a.brackets.seeding.RandomSource;
import edu.brandeis.cosi103a.brackets.seeding.Seeder;
import edu.brandeis.cosi103a.brackets.seeding.SeedingOptions;
import edu.brandeis.cosi103a.brackets.standings.Standings;
import edu.brandeis.cosi103a.brackets.standings.StandingsResolver;
import edu.brandeis.cosi103a.brackets.validation.ValidatorResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for the orchestration layer: validate a field, generate a bracket,
 * advance it one completed match at a time and compute standings.
 *
 * <p>Holds no tournament state. Callers pass the current descriptor, teams and
 * matches each time and persist what comes back. Writes for one tournament must
 * be serialized by the caller (a lock or a version check around each
 * {@link #advance} and the store that follows it); the engine only guarantees that
 * the same inputs give the same outputs.
 */
public class TournamentFormatEngine {

    private static final Logger logger = LoggerFactory.getLogger(TournamentFormatEngine.class);

    private final EngineConfig config;
    private final Seeder seeder;
    private final StandingsResolver standingsResolver;

    public TournamentFormatEngine() {
        this(EngineConfig.defaults());
    }

    public TournamentFormatEngine(EngineConfig config) {
        this(config, new Seeder());
    }

    /**
     * @param config tuning values
     * @param randomSource randomness for unseeded shuffles
     */
    public TournamentFormatEngine(EngineConfig config, RandomSource randomSource) {
        this(config, new Seeder(randomSource));
    }

    private TournamentFormatEngine(EngineConfig config, Seeder seeder) {
        this.config = Objects.requireNonNull(config, "config");
        this.seeder = seeder;
        this.standingsResolver = new StandingsResolver(config);
    }

    public FormatEngine formatFor(Tournament tournament) {
        return FormatEngines.forType(tournament.type(), config, seeder);
    }

    /**
     * Checks whether the field is legal for the tournament's format.
     */
    public ValidatorResult validate(Tournament tournament, List<Team> teams) {
        return formatFor(tournament).validate(tournament, teams);
    }

    /**
     * Validates, then seeds and builds the initial bracket. Never throws for an
     * illegal field; the returned result carries the errors instead.
     */
    public GenerationResult generate(Tournament tournament, List<Team> teams, SeedingOptions options) {
        FormatEngine format = formatFor(tournament);
        ValidatorResult validation = format.validate(tournament, teams);
        if (!validation.valid()) {
            logger.debug("Rejected {} field for {}: {}", tournament.type(), tournament.id(), validation.errors());
            return GenerationResult.rejected(validation);
        }
        return GenerationResult.generated(validation, format.generate(tournament, teams, options));
    }

    /**
     * Applies one completed match. When the step completes the tournament the
     * result also carries the final standings.
     *
     * @throws edu.brandeis.cosi103a.brackets.format.BracketIntegrityException if
     *         the supplied state is inconsistent
     */
    public ProgressionResult advance(Match completedMatch, Tournament tournament, List<Match> allMatches) {
        FormatEngine format = formatFor(tournament);
        ProgressionResult result = format.advance(completedMatch, tournament, allMatches);
        logger.debug("Advanced {} in {}: {} affected, {} new", completedMatch.id(), tournament.id(),
            result.affectedMatches().size(), result.newMatches().size());
        if (!result.complete()) {
            return result;
        }
        List<Match> merged = merge(allMatches, completedMatch, result);
        Standings standings = standingsResolver.compute(tournament, merged, format);
        logger.info("Tournament {} complete after match {}", tournament.id(), completedMatch.id());
        return result.withFinalStandings(standings);
    }

    public Standings computeStandings(Tournament tournament, List<Match> matches) {
        return standingsResolver.compute(tournament, matches, formatFor(tournament));
    }

    public boolean isComplete(Tournament tournament, List<Match> matches) {
        return formatFor(tournament).isComplete(tournament, matches);
    }

    /**
     * Teams level across the tournament's qualifying cut, ready for a barrage.
     * Empty when no qualifying places are configured or the cut is clean.
     */
    public List<Team> barrageCandidates(Tournament tournament, List<Match> matches) {
        Integer places = tournament.settings().qualifyingPlaces();
        if (places == null) {
            return List.of();
        }
        return computeStandings(tournament, matches).tiedAcrossBoundary(places);
    }

    /**
     * Teams knocked out in their first main-bracket match, ready for a consolation bracket.
     */
    public List<Team> consolationCandidates(List<Match> mainMatches) {
        return ConsolationFormat.eligibleTeams(mainMatches);
    }

    /**
     * Replays the completed matches through TrueSkill and rewrites member rankings
     * from the resulting skill, so ranked or skill-balanced seeding of the next
     * event reflects these results.
     *
     * @param teams   the field whose members should be reranked
     * @param matches matches of one or more finished tournaments
     * @return the same teams, in order, with refreshed member rankings
     */
    public List<Team> refreshRankings(List<Team> teams, List<Match> matches) {
        SkillRatingTracker tracker = SkillRatingTracker.withDefaultParameters();
        tracker.processMatches(matches);
        logger.debug("Refreshed rankings of {} teams from {} matches", teams.size(), matches.size());
        return tracker.rerank(teams);
    }

    private static List<Match> merge(List<Match> allMatches, Match completed, ProgressionResult result) {
        Map<String, Match> byId = new LinkedHashMap<>();
        allMatches.forEach(m -> byId.put(m.id(), m));
        byId.put(completed.id(), completed);
        result.affectedMatches().forEach(m -> byId.put(m.id(), m));
        result.newMatches().forEach(m -> byId.put(m.id(), m));
        return new ArrayList<>(byId.values());
    }
}
