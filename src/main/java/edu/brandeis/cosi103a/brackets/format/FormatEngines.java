package edu.brandeis.cosi103a.brackets.format;

import edu.brandeis.cosi103a.brackets.config.EngineConfig;
import edu.brandeis.cosi103a.brackets.model.TournamentType;
import edu.brandeis.cosi103a.brackets.seeding.Seeder;

import java.util.Arrays;
import java.util.List;

/**
 * Maps each {@link TournamentType} to its format. The switch has no default
 * branch, so adding a type fails compilation until it has a format.
 */
public final class FormatEngines {

    private FormatEngines() {}

    public static FormatEngine forType(TournamentType type, EngineConfig config, Seeder seeder) {
        return switch (type) {
            case SINGLE_ELIMINATION -> new SingleEliminationFormat(config, seeder);
            case DOUBLE_ELIMINATION -> new DoubleEliminationFormat(config, seeder);
            case SWISS -> new SwissFormat(config, seeder);
            case ROUND_ROBIN -> new RoundRobinFormat(config, seeder);
            case BARRAGE -> new BarrageFormat(config, seeder);
            case CONSOLATION -> new ConsolationFormat(config, seeder);
        };
    }

    /**
     * Every format, in {@link TournamentType} order.
     */
    public static List<FormatEngine> all(EngineConfig config, Seeder seeder) {
        return Arrays.stream(TournamentType.values())
            .map(t -> forType(t, config, seeder))
            .toList();
    }

    /**
     * Suggests a main format for a field size and an optional time budget.
     * Small fields play everyone; a tight budget favours single elimination;
     * larger fields go Swiss.
     *
     * @param teamCount         registered teams
     * @param timeBudgetMinutes available time, or null if open-ended
     */
    public static TournamentType recommend(int teamCount, Integer timeBudgetMinutes) {
        if (teamCount <= 4) {
            return TournamentType.ROUND_ROBIN;
        }
        if (teamCount <= 8) {
            return timeBudgetMinutes != null && timeBudgetMinutes < 120
                ? TournamentType.SINGLE_ELIMINATION : TournamentType.ROUND_ROBIN;
        }
        if (teamCount <= 16) {
            return timeBudgetMinutes != null && timeBudgetMinutes < 180
                ? TournamentType.SINGLE_ELIMINATION : TournamentType.SWISS;
        }
        return TournamentType.SWISS;
    }
}
