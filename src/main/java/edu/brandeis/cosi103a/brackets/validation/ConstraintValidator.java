package edu.brandeis.cosi103a.brackets.validation;

import edu.brandeis.cosi103a.brackets.model.Team;
import edu.brandeis.cosi103a.brackets.model.Tournament;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Checks a team list against a format's {@link FormatConstraints} and the
 * tournament's team format before any bracket is built.
 */
public final class ConstraintValidator {

    private ConstraintValidator() {}

    /**
     * Runs the shared legality checks.
     *
     * <p>Errors: team count outside [min, max], count above the tournament's
     * registration cap, odd count when the format supports neither odd counts nor
     * byes, duplicate team ids, member count not matching the team format.
     * Warnings: count not among the preferred counts (with the nearest preferred
     * count as a suggestion), odd count that will need byes, duplicate team names.
     *
     * @param tournament  descriptor carrying the team format and registration cap
     * @param teams       the field
     * @param constraints bounds declared by the format
     * @param formatName  used in messages
     * @return the collected errors, warnings and suggestions
     */
    public static ValidatorResult validate(Tournament tournament, List<Team> teams,
                                           FormatConstraints constraints, String formatName) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();
        int count = teams.size();

        if (count < constraints.minTeams()) {
            errors.add(formatName + " requires at least " + constraints.minTeams() + " teams, got " + count);
        }
        if (constraints.maxTeams() != null && count > constraints.maxTeams()) {
            errors.add(formatName + " supports at most " + constraints.maxTeams() + " teams, got " + count);
        }
        if (tournament.maxPlayers() != null && count > tournament.maxPlayers()) {
            errors.add("Tournament is capped at " + tournament.maxPlayers() + " teams, got " + count);
        }

        List<Integer> preferred = constraints.preferredTeamCounts();
        if (!preferred.isEmpty() && !preferred.contains(count)) {
            warnings.add(count + " teams is not optimal for " + formatName);
            suggestions.add("Consider " + closestPreferredCount(preferred, count) + " teams for better bracket balance");
        }

        if (count % 2 != 0 && !constraints.supportsOddTeamCount()) {
            if (constraints.supportsByes()) {
                warnings.add("Odd team count (" + count + ") will require bye assignments");
            } else {
                errors.add(formatName + " does not support odd team counts");
            }
        }

        Set<String> ids = new HashSet<>();
        Set<String> names = new HashSet<>();
        boolean duplicateNames = false;
        for (Team t : teams) {
            if (!ids.add(t.id())) {
                errors.add("Duplicate team detected: " + t.id());
            }
            if (t.name() != null && !names.add(t.name().trim().toLowerCase(Locale.ROOT))) {
                duplicateNames = true;
            }
        }
        if (duplicateNames) {
            warnings.add("Some teams share a name; results may be hard to tell apart");
        }

        int expectedMembers = tournament.format().membersPerTeam();
        long incompatible = teams.stream().filter(t -> t.members().size() != expectedMembers).count();
        if (incompatible > 0) {
            errors.add(incompatible + " teams have incorrect player count for "
                + tournament.format().name().toLowerCase(Locale.ROOT) + " format (expected "
                + expectedMembers + " per team)");
        }

        return ValidatorResult.of(errors, warnings, suggestions);
    }

    /**
     * Nearest preferred count; the earlier entry wins when two are equally close.
     */
    static int closestPreferredCount(List<Integer> preferred, int count) {
        int closest = preferred.get(0);
        for (int candidate : preferred) {
            if (Math.abs(candidate - count) < Math.abs(closest - count)) {
                closest = candidate;
            }
        }
        return closest;
    }
}
