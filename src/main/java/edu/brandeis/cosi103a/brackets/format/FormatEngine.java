package edu.brandeis.cosi103a.brackets.format;

import edu.brandeis.cosi103a.brackets.model.Match;
import edu.brandeis.cosi103a.brackets.model.TieBreakMethod;
import edu.brandeis.cosi103a.brackets.model.Team;
import edu.brandeis.cosi103a.brackets.model.Tournament;
import edu.brandeis.cosi103a.brackets.model.TournamentType;
import edu.brandeis.cosi103a.brackets.seeding.SeedingOptions;
import edu.brandeis.cosi103a.brackets.validation.FormatConstraints;
import edu.brandeis.cosi103a.brackets.validation.ValidatorResult;

import java.util.List;

/**
 * One tournament format. The set of formats is closed; {@link FormatEngines#forType}
 * dispatches over it.
 *
 * <p>Implementations hold no per-tournament state. Every call is a pure function of
 * its arguments and may run concurrently with any other call.
 */
public sealed interface FormatEngine
    permits SingleEliminationFormat, DoubleEliminationFormat, SwissFormat,
            RoundRobinFormat, BarrageFormat, ConsolationFormat {

    TournamentType type();

    FormatConstraints constraints();

    /**
     * One-line description for format pickers.
     */
    String description();

    /**
     * Tie-break chain used when the tournament does not configure its own.
     */
    List<TieBreakMethod> defaultTieBreaks();

    /**
     * Checks the field against this format's constraints.
     *
     * @param tournament the tournament descriptor
     * @param teams      the registered teams
     * @return errors, warnings and suggestions; never throws for an illegal field
     */
    ValidatorResult validate(Tournament tournament, List<Team> teams);

    /**
     * Seeds the field and builds the initial matches.
     *
     * @param tournament the tournament descriptor
     * @param teams      the registered teams
     * @param options    seeding strategy
     * @return the initial bracket
     * @throws InvalidTournamentInputException if {@link #validate} reports errors
     */
    BracketResult generate(Tournament tournament, List<Team> teams, SeedingOptions options);

    /**
     * Consumes one match that has just completed. Call exactly once per completion.
     *
     * @param completedMatch the match, carrying its result and COMPLETED status
     * @param tournament     the tournament descriptor
     * @param allMatches     every stored match of the tournament
     * @return changed and newly created matches, the updated structure and completion
     * @throws BracketIntegrityException if the match or the bracket state is inconsistent
     */
    ProgressionResult advance(Match completedMatch, Tournament tournament, List<Match> allMatches);

    boolean isComplete(Tournament tournament, List<Match> matches);

    /**
     * Whether a team with the given record is out of this format. Formats that never
     * knock teams out return false.
     *
     * @param losses               losses the team has taken
     * @param lostFinalStageMatch  whether one of those losses was in the deciding match
     *                             of the format (the grand final in double elimination)
     */
    boolean isEliminated(Tournament tournament, int losses, boolean lostFinalStageMatch);
}
