package edu.brandeis.cosi103a.brackets.format;

/**
 * Human-readable round labels.
 */
final class RoundNames {

    private RoundNames() {}

    /**
     * Knockout label counted back from the last round: Final, Semifinal,
     * Quarterfinal, Round of 16, Round of 32, then "Round n".
     */
    static String knockout(int round, int totalRounds) {
        return switch (totalRounds - round + 1) {
            case 1 -> "Final";
            case 2 -> "Semifinal";
            case 3 -> "Quarterfinal";
            case 4 -> "Round of 16";
            case 5 -> "Round of 32";
            default -> "Round " + round;
        };
    }

    static String knockout(String prefix, int round, int totalRounds) {
        String base = knockout(round, totalRounds);
        return prefix == null ? base : prefix + " " + base;
    }

    static String losers(int round, int totalLoserRounds) {
        return round == totalLoserRounds ? "Losers Final" : "Losers Round " + round;
    }

    static String grandFinal(boolean reset) {
        return reset ? "Grand Final Reset" : "Grand Final";
    }

    static String swiss(int round) {
        return "Swiss Round " + round;
    }

    static String roundRobin(int round, int roundsPerLeg) {
        if (round <= roundsPerLeg) {
            return "Round " + round;
        }
        return "Leg 2 - Round " + (round - roundsPerLeg);
    }

    static String group(String group, int round, int roundsPerLeg) {
        return "Group " + group + " - " + roundRobin(round, roundsPerLeg);
    }
}
