package edu.brandeis.cosi103a.brackets.model;

/**
 * The pairing topology a tournament is played under.
 */
public enum TournamentType {
    SINGLE_ELIMINATION("Single Elimination"),
    DOUBLE_ELIMINATION("Double Elimination"),
    SWISS("Swiss System"),
    ROUND_ROBIN("Round Robin"),
    BARRAGE("Barrage"),
    CONSOLATION("Consolation");

    private final String displayName;

    TournamentType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Whether losing a match can knock a team out of this format.
     */
    public boolean isElimination() {
        return this != SWISS && this != ROUND_ROBIN;
    }
}
