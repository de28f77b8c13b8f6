package edu.brandeis.cosi103a.brackets.model;

/**
 * Sub-bracket a match or team belongs to. Swiss and round-robin play
 * everything in {@link #WINNER}.
 */
public enum BracketBranch {
    WINNER("W"),
    LOSER("L"),
    GRAND_FINAL("G"),
    CONSOLATION("C"),
    BARRAGE("B"),
    /** Knockout played after a round-robin group stage. */
    PLAYOFF("P");

    private final String code;

    BracketBranch(String code) {
        this.code = code;
    }

    /**
     * Short code used when building match identifiers.
     */
    public String code() {
        return code;
    }
}
